package info.isaksson.erland.gmlindex.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

@JsonPropertyOrder({"hits","misses","stale"})
public final class CacheStats {
    public final long hits;
    public final long misses;
    public final long stale;

    @JsonCreator
    public CacheStats(
            @JsonProperty("hits") long hits,
            @JsonProperty("misses") long misses,
            @JsonProperty("stale") long stale
    ) {
        this.hits = hits;
        this.misses = misses;
        this.stale = stale;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CacheStats)) return false;
        CacheStats that = (CacheStats) o;
        return hits == that.hits && misses == that.misses && stale == that.stale;
    }

    @Override public int hashCode() {
        return Objects.hash(hits, misses, stale);
    }

    @Override public String toString() {
        return "hits=" + hits + " misses=" + misses + " stale=" + stale;
    }
}
