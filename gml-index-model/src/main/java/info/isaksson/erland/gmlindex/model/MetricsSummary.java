package info.isaksson.erland.gmlindex.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Snapshot of one index build: phase timings (ms), counters, cache statistics and metadata
 * such as file counts and the effective concurrency.
 */
@JsonPropertyOrder({"category","totalTimeMs","timings","counters","caches","metadata"})
public final class MetricsSummary {
    public final String category;
    public final double totalTimeMs;
    public final SortedMap<String, Double> timings;
    public final SortedMap<String, Long> counters;
    public final SortedMap<String, CacheStats> caches;
    public final SortedMap<String, Object> metadata;

    @JsonCreator
    public MetricsSummary(
            @JsonProperty("category") String category,
            @JsonProperty("totalTimeMs") double totalTimeMs,
            @JsonProperty("timings") Map<String, Double> timings,
            @JsonProperty("counters") Map<String, Long> counters,
            @JsonProperty("caches") Map<String, CacheStats> caches,
            @JsonProperty("metadata") Map<String, Object> metadata
    ) {
        this.category = category;
        this.totalTimeMs = totalTimeMs;
        this.timings = sorted(timings);
        this.counters = sorted(counters);
        this.caches = sorted(caches);
        this.metadata = sorted(metadata);
    }

    private static <V> SortedMap<String, V> sorted(Map<String, V> in) {
        return Collections.unmodifiableSortedMap(in == null ? new TreeMap<>() : new TreeMap<>(in));
    }

    public long counter(String name) {
        Long v = counters.get(name);
        return v == null ? 0L : v;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MetricsSummary)) return false;
        MetricsSummary that = (MetricsSummary) o;
        return Double.compare(totalTimeMs, that.totalTimeMs) == 0
                && Objects.equals(category, that.category)
                && timings.equals(that.timings)
                && counters.equals(that.counters)
                && caches.equals(that.caches)
                && metadata.equals(that.metadata);
    }

    @Override public int hashCode() {
        return Objects.hash(category, totalTimeMs, timings, counters, caches, metadata);
    }
}
