package info.isaksson.erland.gmlindex.cache;

import info.isaksson.erland.gmlindex.io.ProjectFingerprints;

import java.nio.file.Path;
import java.util.Map;

/**
 * Identifies a cache file and the expectations a cached index must meet.
 *
 * <p>Version fields are only compared when set. A null mtime map is not checked; an empty map
 * is compared like any other.</p>
 */
public final class CacheDescriptor {
    /** Absolute project root. */
    public Path projectRoot;

    /** Explicit cache file; null selects {@link ProjectIndexCache#defaultCacheFile(Path)}. */
    public Path cacheFilePath;

    public String formatterVersion;
    public String pluginVersion;

    public Map<String, Double> manifestMtimes;
    public Map<String, Double> sourceMtimes;

    /** Largest payload {@code save} will write; null or non-positive disables the limit. */
    public Long maxSizeBytes = ProjectIndexCache.DEFAULT_MAX_SIZE_BYTES;

    public static CacheDescriptor forRoot(Path projectRoot) {
        CacheDescriptor d = new CacheDescriptor();
        d.projectRoot = projectRoot;
        return d;
    }

    public CacheDescriptor withFingerprints(ProjectFingerprints fingerprints) {
        if (fingerprints != null) {
            this.manifestMtimes = fingerprints.manifestMtimes;
            this.sourceMtimes = fingerprints.sourceMtimes;
        }
        return this;
    }
}
