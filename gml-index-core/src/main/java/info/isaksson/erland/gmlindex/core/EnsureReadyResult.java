package info.isaksson.erland.gmlindex.core;

import info.isaksson.erland.gmlindex.cache.CacheLoadResult;
import info.isaksson.erland.gmlindex.cache.CacheSaveResult;
import info.isaksson.erland.gmlindex.model.ProjectIndex;

import java.nio.file.Path;

/** Result of ensuring a project index is available. */
public final class EnsureReadyResult {
    public enum Source {
        CACHE("cache"),
        BUILD("build");

        private final String label;

        Source(String label) {
            this.label = label;
        }

        @Override
        public String toString() {
            return label;
        }
    }

    public final Source source;
    public final Path projectRoot;
    public final ProjectIndex projectIndex;

    /** Null when the cache was disabled for the request. */
    public final CacheLoadResult loadResult;

    /** Null on a cache hit or when the cache was disabled. */
    public final CacheSaveResult saveResult;

    EnsureReadyResult(Source source, Path projectRoot, ProjectIndex projectIndex,
                      CacheLoadResult loadResult, CacheSaveResult saveResult) {
        this.source = source;
        this.projectRoot = projectRoot;
        this.projectIndex = projectIndex;
        this.loadResult = loadResult;
        this.saveResult = saveResult;
    }
}
