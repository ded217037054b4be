package info.isaksson.erland.gmlindex.core;

import info.isaksson.erland.gmlindex.cache.ProjectIndexCache;
import info.isaksson.erland.gmlindex.extract.BoundedWorkerPool;

import java.nio.file.Path;

/**
 * Core (server-friendly) options for building a project index.
 *
 * <p>This mirrors the CLI flags in a structured form.</p>
 */
public final class ProjectIndexOptions {
    /** Source files analysed in parallel. Clamped to [1, 16] by the worker pool. */
    public int concurrency = BoundedWorkerPool.DEFAULT_CONCURRENCY;

    /** Largest cache file written, in bytes. 0 disables the limit. */
    public long cacheMaxSizeBytes = ProjectIndexCache.DEFAULT_MAX_SIZE_BYTES;

    /** Explicit cache file; null uses {@code <projectRoot>/.tool-cache/project-index-cache.json}. */
    public Path cacheFilePath;

    /** Stored in the cache; a cache written by another version is rebuilt. */
    public String formatterVersion;
    public String pluginVersion;

    /** Built-in identifier data file; null uses the bundled list. */
    public Path builtInIdentifiersPath;

    public boolean useCache = true;

    /** Log the metrics summary at info after each build. */
    public boolean logMetrics = false;

    /**
     * Parses a worker count given as a number or a string.
     *
     * @return the count, or null when {@code raw} is null or blank
     * @throws IllegalArgumentException for non-numbers and values below 1
     */
    public static Integer normalizeConcurrency(Object raw, String optionName) {
        Double numeric = toNumber(raw, optionName, "a positive integer");
        if (numeric == null) return null;
        long value = (long) numeric.doubleValue();
        if (value < 1) {
            throw new IllegalArgumentException(optionName + " must be provided as a positive integer (received "
                    + describe(raw) + ").");
        }
        return (int) Math.min(value, Integer.MAX_VALUE);
    }

    /**
     * Parses a cache size limit given as a number or a string. 0 means no limit.
     *
     * @return the limit, or null when {@code raw} is null or blank
     * @throws IllegalArgumentException for non-numbers and negative values
     */
    public static Long normalizeCacheMaxSizeBytes(Object raw, String optionName) {
        Double numeric = toNumber(raw, optionName, "a non-negative integer");
        if (numeric == null) return null;
        long value = (long) numeric.doubleValue();
        if (value < 0) {
            throw new IllegalArgumentException(optionName + " must be provided as a non-negative integer (received "
                    + describe(raw) + "). Set to 0 to disable the size limit.");
        }
        return value;
    }

    private static Double toNumber(Object raw, String optionName, String expected) {
        if (raw == null) return null;
        double numeric;
        if (raw instanceof Number) {
            numeric = ((Number) raw).doubleValue();
        } else if (raw instanceof String) {
            String trimmed = ((String) raw).trim();
            if (trimmed.isEmpty()) return null;
            try {
                numeric = Double.parseDouble(trimmed);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(optionName + " must be provided as " + expected + " (received "
                        + describe(raw) + ").", e);
            }
        } else {
            throw new IllegalArgumentException(optionName + " must be provided as " + expected
                    + " (received type '" + raw.getClass().getSimpleName() + "').");
        }
        if (!Double.isFinite(numeric)) {
            throw new IllegalArgumentException(optionName + " must be provided as " + expected + " (received "
                    + describe(raw) + ").");
        }
        return numeric;
    }

    private static String describe(Object raw) {
        return raw instanceof String ? "'" + raw + "'" : String.valueOf(raw);
    }
}
