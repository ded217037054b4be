package info.isaksson.erland.gmlindex.cache;

import info.isaksson.erland.gmlindex.model.ProjectIndex;

import java.nio.file.Path;

/** Outcome of {@link ProjectIndexCache#load(CacheDescriptor)}: a hit with the index, or a miss with its reason. */
public final class CacheLoadResult {
    public enum Status { HIT, MISS }

    public final Status status;
    public final Path cacheFilePath;

    /** Set on a hit. */
    public final CachePayload payload;
    /** Set on a hit; carries the cached metrics summary. */
    public final ProjectIndex projectIndex;

    /** Set on a miss. */
    public final CacheMissReason missReason;
    /** Parse or mapping failure behind an {@code invalid-json}/{@code invalid-schema} miss, if any. */
    public final Exception error;

    private CacheLoadResult(Status status, Path cacheFilePath, CachePayload payload, ProjectIndex projectIndex,
                            CacheMissReason missReason, Exception error) {
        this.status = status;
        this.cacheFilePath = cacheFilePath;
        this.payload = payload;
        this.projectIndex = projectIndex;
        this.missReason = missReason;
        this.error = error;
    }

    static CacheLoadResult hit(Path cacheFilePath, CachePayload payload) {
        return new CacheLoadResult(Status.HIT, cacheFilePath, payload, payload.indexWithMetrics(), null, null);
    }

    static CacheLoadResult miss(Path cacheFilePath, CacheMissReason reason, Exception error) {
        return new CacheLoadResult(Status.MISS, cacheFilePath, null, null, reason, error);
    }

    public boolean isHit() {
        return status == Status.HIT;
    }

    @Override
    public String toString() {
        return isHit() ? "hit(" + cacheFilePath + ")" : "miss(" + missReason + ", " + cacheFilePath + ")";
    }
}
