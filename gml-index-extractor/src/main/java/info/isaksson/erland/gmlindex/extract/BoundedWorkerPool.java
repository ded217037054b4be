package info.isaksson.erland.gmlindex.extract;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs one task per item with at most {@code concurrency} items in flight.
 *
 * <p>Workers pull the next index from a shared cursor. The first failure stops every worker
 * from taking new items and is rethrown from {@link #forEach}.</p>
 */
public final class BoundedWorkerPool {

    private static final Logger log = LoggerFactory.getLogger(BoundedWorkerPool.class);

    public static final int MIN_CONCURRENCY = 1;
    public static final int MAX_CONCURRENCY = 16;
    public static final int DEFAULT_CONCURRENCY = 4;

    /** Per-item work; {@code index} is the item's position in the input list. */
    @FunctionalInterface
    public interface Worker<T> {
        void process(int index, T item) throws IOException;
    }

    private final int concurrency;

    public BoundedWorkerPool(Integer concurrency) {
        this.concurrency = clampConcurrency(concurrency);
    }

    public int concurrency() {
        return concurrency;
    }

    /** Null means the default; anything else is clamped into [1, 16]. */
    public static int clampConcurrency(Integer requested) {
        if (requested == null) return DEFAULT_CONCURRENCY;
        return Math.max(MIN_CONCURRENCY, Math.min(MAX_CONCURRENCY, requested));
    }

    public <T> void forEach(List<T> items, Worker<T> worker) throws IOException {
        if (items == null || items.isEmpty()) return;
        int threads = Math.min(concurrency, items.size());

        AtomicInteger cursor = new AtomicInteger();
        AtomicReference<Throwable> failure = new AtomicReference<>();

        if (threads == 1) {
            runWorker(items, worker, cursor, failure);
            rethrow(failure.get());
            return;
        }

        ExecutorService executor = Executors.newFixedThreadPool(threads, namedDaemonThreads("gml-index-worker-"));
        try {
            List<Future<?>> futures = new ArrayList<>(threads);
            for (int i = 0; i < threads; i++) {
                futures.add(executor.submit(() -> runWorker(items, worker, cursor, failure)));
            }
            for (Future<?> f : futures) {
                try {
                    f.get();
                } catch (ExecutionException e) {
                    failure.compareAndSet(null, e.getCause());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    failure.compareAndSet(null, e);
                    futures.forEach(other -> other.cancel(true));
                    break;
                }
            }
        } finally {
            executor.shutdownNow();
        }
        rethrow(failure.get());
    }

    private static <T> void runWorker(List<T> items, Worker<T> worker, AtomicInteger cursor, AtomicReference<Throwable> failure) {
        while (failure.get() == null && !Thread.currentThread().isInterrupted()) {
            int index = cursor.getAndIncrement();
            if (index >= items.size()) return;
            try {
                worker.process(index, items.get(index));
            } catch (Throwable t) {
                if (failure.compareAndSet(null, t)) {
                    log.debug("Worker failed on item {}; cancelling remaining items", index, t);
                }
                return;
            }
        }
    }

    private static void rethrow(Throwable t) throws IOException {
        if (t == null) return;
        if (t instanceof IOException) throw (IOException) t;
        if (t instanceof RuntimeException) throw (RuntimeException) t;
        if (t instanceof Error) throw (Error) t;
        if (t instanceof InterruptedException) throw new IOException("Interrupted while analysing sources", t);
        throw new IllegalStateException(t);
    }

    private static ThreadFactory namedDaemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory delegate = Executors.defaultThreadFactory();
        return r -> {
            Thread t = delegate.newThread(r);
            t.setName(prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
