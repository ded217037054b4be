package info.isaksson.erland.gmlindex.core;

import info.isaksson.erland.gmlindex.extract.BuildOptions;
import info.isaksson.erland.gmlindex.io.ProjectFingerprints;

import java.nio.file.Path;

/** Input to {@link ProjectIndexCoordinator#ensureReady(EnsureReadyRequest)}. */
public final class EnsureReadyRequest {
    public Path projectRoot;

    public Path cacheFilePath;
    public String formatterVersion;
    public String pluginVersion;

    /** Expected mtimes for cache validation; null makes the coordinator collect them. */
    public ProjectFingerprints fingerprints;

    /** Cache size limit for this request; null uses the coordinator's default, 0 or less disables it. */
    public Long maxSizeBytes;

    /** When false the cache is neither read nor written. */
    public boolean useCache = true;

    public BuildOptions buildOptions = BuildOptions.defaults();

    public static EnsureReadyRequest forRoot(Path projectRoot) {
        EnsureReadyRequest r = new EnsureReadyRequest();
        r.projectRoot = projectRoot;
        return r;
    }

    /** Request carrying the cache and build settings of {@code options}. */
    public static EnsureReadyRequest from(Path projectRoot, ProjectIndexOptions options) {
        ProjectIndexOptions opts = options == null ? new ProjectIndexOptions() : options;
        EnsureReadyRequest r = forRoot(projectRoot);
        r.cacheFilePath = opts.cacheFilePath;
        r.formatterVersion = opts.formatterVersion;
        r.pluginVersion = opts.pluginVersion;
        r.maxSizeBytes = opts.cacheMaxSizeBytes;
        r.useCache = opts.useCache;
        r.buildOptions = new BuildOptions();
        r.buildOptions.concurrency = opts.concurrency;
        r.buildOptions.logMetrics = opts.logMetrics;
        return r;
    }
}
