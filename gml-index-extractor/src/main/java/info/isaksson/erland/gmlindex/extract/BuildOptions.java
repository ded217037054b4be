package info.isaksson.erland.gmlindex.extract;

import java.util.function.BooleanSupplier;

/** Knobs for a single {@link ProjectIndexBuilder#build} call. */
public final class BuildOptions {
    /** Source-analysis workers; null means {@link BoundedWorkerPool#DEFAULT_CONCURRENCY}. Clamped to [1, 16]. */
    public Integer concurrency;

    /** Log the metrics summary at info once the build finishes. */
    public boolean logMetrics = false;

    /**
     * Polled between stages and between files; when it returns true the build stops with a
     * {@link java.util.concurrent.CancellationException}.
     */
    public BooleanSupplier cancelled = () -> false;

    public static BuildOptions defaults() {
        return new BuildOptions();
    }
}
