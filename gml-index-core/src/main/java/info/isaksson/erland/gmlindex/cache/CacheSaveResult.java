package info.isaksson.erland.gmlindex.cache;

import java.nio.file.Path;

/** Outcome of writing a cache file. */
public final class CacheSaveResult {
    public enum Status { WRITTEN, SKIPPED, FAILED }

    public static final String PAYLOAD_TOO_LARGE = "payload-too-large";

    public final Status status;
    public final Path cacheFilePath;
    /** Serialized payload size in bytes; -1 when unknown. */
    public final long size;
    /** Why the write was skipped. */
    public final String reason;
    public final Throwable error;

    private CacheSaveResult(Status status, Path cacheFilePath, long size, String reason, Throwable error) {
        this.status = status;
        this.cacheFilePath = cacheFilePath;
        this.size = size;
        this.reason = reason;
        this.error = error;
    }

    public static CacheSaveResult written(Path cacheFilePath, long size) {
        return new CacheSaveResult(Status.WRITTEN, cacheFilePath, size, null, null);
    }

    public static CacheSaveResult skipped(Path cacheFilePath, String reason, long size) {
        return new CacheSaveResult(Status.SKIPPED, cacheFilePath, size, reason, null);
    }

    public static CacheSaveResult failed(Path cacheFilePath, Throwable error) {
        return new CacheSaveResult(Status.FAILED, cacheFilePath, -1, null, error);
    }

    @Override
    public String toString() {
        switch (status) {
            case WRITTEN: return "written(" + size + " bytes)";
            case SKIPPED: return "skipped(" + reason + ", " + size + " bytes)";
            default: return "failed(" + (error == null ? "unknown" : error.getMessage()) + ")";
        }
    }
}
