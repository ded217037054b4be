package info.isaksson.erland.gmlindex.extract;

import info.isaksson.erland.gmlindex.model.CacheStats;
import info.isaksson.erland.gmlindex.model.MetricsSummary;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;

/**
 * Collects timings, counters, cache outcomes and metadata for one build.
 *
 * <p>Safe to use from the source-analysis workers; every method synchronizes on the tracker.</p>
 */
public final class IndexMetrics {

    public static final String CATEGORY = "project-index";

    /** A unit of work that may fail with an {@link IOException}. */
    @FunctionalInterface
    public interface IoWork<T> {
        T run() throws IOException;
    }

    /** Handle returned by {@link #startTimer(String)}; closing it records the elapsed time. */
    public interface Timer extends AutoCloseable {
        @Override void close();
    }

    private final String category;
    private final long startedNanos = System.nanoTime();
    private final Map<String, Double> timings = new HashMap<>();
    private final Map<String, Long> counters = new HashMap<>();
    private final Map<String, long[]> caches = new HashMap<>();
    private final Map<String, Object> metadata = new HashMap<>();

    public IndexMetrics() {
        this(CATEGORY);
    }

    public IndexMetrics(String category) {
        this.category = category;
    }

    public Timer startTimer(String name) {
        long start = System.nanoTime();
        return () -> addTiming(name, (System.nanoTime() - start) / 1_000_000.0);
    }

    public <T> T time(String name, IoWork<T> work) throws IOException {
        try (Timer ignored = startTimer(name)) {
            return work.run();
        }
    }

    public synchronized void addTiming(String name, double millis) {
        timings.merge(name, millis, Double::sum);
    }

    public void incrementCounter(String name) {
        incrementCounter(name, 1L);
    }

    public synchronized void incrementCounter(String name, long delta) {
        counters.merge(name, delta, Long::sum);
    }

    public synchronized long counter(String name) {
        Long v = counters.get(name);
        return v == null ? 0L : v;
    }

    public void recordCacheHit(String cacheName) {
        recordCache(cacheName, 0);
    }

    public void recordCacheMiss(String cacheName) {
        recordCache(cacheName, 1);
    }

    public void recordCacheStale(String cacheName) {
        recordCache(cacheName, 2);
    }

    private synchronized void recordCache(String cacheName, int slot) {
        caches.computeIfAbsent(cacheName, k -> new long[3])[slot]++;
    }

    public synchronized void setMetadata(String key, Object value) {
        metadata.put(key, value);
    }

    /** Snapshot of everything recorded so far; {@code totalTimeMs} runs from construction. */
    public synchronized MetricsSummary summary() {
        Map<String, CacheStats> cacheStats = new HashMap<>();
        for (Map.Entry<String, long[]> e : caches.entrySet()) {
            long[] v = e.getValue();
            cacheStats.put(e.getKey(), new CacheStats(v[0], v[1], v[2]));
        }
        double total = (System.nanoTime() - startedNanos) / 1_000_000.0;
        return new MetricsSummary(category, total, timings, counters, cacheStats, metadata);
    }
}
