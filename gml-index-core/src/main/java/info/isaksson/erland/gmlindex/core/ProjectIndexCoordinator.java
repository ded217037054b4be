package info.isaksson.erland.gmlindex.core;

import info.isaksson.erland.gmlindex.cache.CacheDescriptor;
import info.isaksson.erland.gmlindex.cache.CacheLoadResult;
import info.isaksson.erland.gmlindex.cache.CacheSaveResult;
import info.isaksson.erland.gmlindex.cache.ProjectIndexCache;
import info.isaksson.erland.gmlindex.extract.BuildOptions;
import info.isaksson.erland.gmlindex.io.FingerprintCollector;
import info.isaksson.erland.gmlindex.io.FsFacade;
import info.isaksson.erland.gmlindex.io.ProjectFingerprints;
import info.isaksson.erland.gmlindex.model.ProjectIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

/**
 * Makes a project index available for a project root, from the cache when it is still valid and
 * by building it otherwise.
 *
 * <p>Concurrent requests for the same root share one operation: at most one load/build/save runs
 * per root at a time. The entry is dropped when the operation finishes, so a later request starts
 * over and revalidates the cache.</p>
 */
public final class ProjectIndexCoordinator implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ProjectIndexCoordinator.class);

    /** Builds an index for an absolute, normalized root. */
    @FunctionalInterface
    public interface IndexBuildFunction {
        ProjectIndex build(Path projectRoot, BuildOptions options) throws IOException;
    }

    private final FsFacade fs;
    private final ProjectIndexCache cache;
    private final IndexBuildFunction buildFunction;
    private final Long defaultCacheMaxSizeBytes;
    private final ExecutorService executor;

    private final ConcurrentHashMap<Path, CompletableFuture<EnsureReadyResult>> inFlight = new ConcurrentHashMap<>();
    private final AtomicBoolean disposed = new AtomicBoolean(false);

    public ProjectIndexCoordinator(FsFacade fs, IndexBuildFunction buildFunction) {
        this(fs, buildFunction, ProjectIndexCache.DEFAULT_MAX_SIZE_BYTES);
    }

    public ProjectIndexCoordinator(FsFacade fs, IndexBuildFunction buildFunction, Long defaultCacheMaxSizeBytes) {
        this(fs, new ProjectIndexCache(fs), buildFunction, defaultCacheMaxSizeBytes, newExecutor());
    }

    /**
     * @param defaultCacheMaxSizeBytes limit used when a request carries none; null or non-positive disables it
     * @param executor runs the operations; shut down by {@link #dispose()}
     */
    public ProjectIndexCoordinator(FsFacade fs, ProjectIndexCache cache, IndexBuildFunction buildFunction,
                                   Long defaultCacheMaxSizeBytes, ExecutorService executor) {
        this.fs = Objects.requireNonNull(fs, "fs");
        this.cache = Objects.requireNonNull(cache, "cache");
        this.buildFunction = Objects.requireNonNull(buildFunction, "buildFunction");
        this.defaultCacheMaxSizeBytes = defaultCacheMaxSizeBytes;
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    /**
     * Starts (or joins) the operation for the request's root.
     *
     * @throws IllegalStateException after {@link #dispose()}
     */
    public CompletableFuture<EnsureReadyResult> ensureReady(EnsureReadyRequest request) {
        if (disposed.get()) throw new IllegalStateException("ProjectIndexCoordinator has been disposed");
        if (request == null) throw new IllegalArgumentException("request must not be null");
        if (request.projectRoot == null) throw new IllegalArgumentException("projectRoot must not be null");

        Path root = request.projectRoot.toAbsolutePath().normalize();
        CompletableFuture<EnsureReadyResult> promise = new CompletableFuture<>();
        CompletableFuture<EnsureReadyResult> existing = inFlight.putIfAbsent(root, promise);
        if (existing != null) {
            log.debug("Joining in-flight project index operation for {}", root);
            return existing;
        }

        try {
            executor.execute(() -> runOperation(root, request, promise));
        } catch (RejectedExecutionException e) {
            inFlight.remove(root, promise);
            promise.completeExceptionally(disposed.get()
                    ? new CancellationException("ProjectIndexCoordinator has been disposed")
                    : e);
        }
        return promise;
    }

    /** Blocking form of {@link #ensureReady(EnsureReadyRequest)}. */
    public EnsureReadyResult ensureReadyAndWait(EnsureReadyRequest request) throws IOException {
        CompletableFuture<EnsureReadyResult> future = ensureReady(request);
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            InterruptedIOException io = new InterruptedIOException("Interrupted while waiting for project index");
            io.initCause(e);
            throw io;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IOException) throw (IOException) cause;
            if (cause instanceof RuntimeException) throw (RuntimeException) cause;
            if (cause instanceof Error) throw (Error) cause;
            throw new IOException(cause);
        }
    }

    /** Roots with an operation currently running. */
    public List<Path> inFlightRoots() {
        return new ArrayList<>(inFlight.keySet());
    }

    public boolean isDisposed() {
        return disposed.get();
    }

    /**
     * Cancels pending operations and releases the executor. A running build stops at its next
     * stage boundary. Idempotent.
     */
    public void dispose() {
        if (!disposed.compareAndSet(false, true)) return;
        for (CompletableFuture<EnsureReadyResult> pending : inFlight.values()) {
            pending.cancel(true);
        }
        inFlight.clear();
        executor.shutdownNow();
    }

    @Override
    public void close() {
        dispose();
    }

    private void runOperation(Path root, EnsureReadyRequest request, CompletableFuture<EnsureReadyResult> promise) {
        EnsureReadyResult result = null;
        Throwable failure = null;
        try {
            result = execute(root, request);
        } catch (Throwable t) {
            failure = t;
        }
        inFlight.remove(root, promise);
        if (failure != null) {
            promise.completeExceptionally(failure);
        } else {
            promise.complete(result);
        }
    }

    private EnsureReadyResult execute(Path root, EnsureReadyRequest request) throws IOException {
        BuildOptions buildOptions = effectiveBuildOptions(request.buildOptions);

        if (!request.useCache) {
            ProjectIndex index = build(root, buildOptions);
            return new EnsureReadyResult(EnsureReadyResult.Source.BUILD, root, index, null, null);
        }

        ProjectFingerprints fingerprints = request.fingerprints != null
                ? request.fingerprints
                : new FingerprintCollector(fs).collect(root);
        CacheDescriptor descriptor = CacheDescriptor.forRoot(root).withFingerprints(fingerprints);
        descriptor.cacheFilePath = request.cacheFilePath;
        descriptor.formatterVersion = request.formatterVersion;
        descriptor.pluginVersion = request.pluginVersion;
        descriptor.maxSizeBytes = request.maxSizeBytes != null ? request.maxSizeBytes : defaultCacheMaxSizeBytes;

        CacheLoadResult loadResult = cache.load(descriptor);
        if (loadResult.isHit()) {
            log.info("Project index cache hit for {}", root);
            return new EnsureReadyResult(EnsureReadyResult.Source.CACHE, root, loadResult.projectIndex, loadResult, null);
        }
        log.info("Project index cache miss for {} ({}), building", root, loadResult.missReason);
        checkNotDisposed();

        ProjectIndex index = build(root, buildOptions);
        checkNotDisposed();

        CacheSaveResult saveResult;
        try {
            saveResult = cache.save(descriptor, index);
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to write project index cache {}: {}", loadResult.cacheFilePath, e.toString());
            saveResult = CacheSaveResult.failed(loadResult.cacheFilePath, e);
        }
        if (saveResult.status == CacheSaveResult.Status.SKIPPED) {
            log.info("Project index cache not written for {}: {}", root, saveResult);
        }
        return new EnsureReadyResult(EnsureReadyResult.Source.BUILD, root, index, loadResult, saveResult);
    }

    private ProjectIndex build(Path root, BuildOptions options) throws IOException {
        checkNotDisposed();
        ProjectIndex index = buildFunction.build(root, options);
        if (index == null) throw new IllegalStateException("build function returned no index for " + root);
        return index;
    }

    private BuildOptions effectiveBuildOptions(BuildOptions requested) {
        BuildOptions src = requested == null ? BuildOptions.defaults() : requested;
        BuildOptions out = new BuildOptions();
        out.concurrency = src.concurrency;
        out.logMetrics = src.logMetrics;
        BooleanSupplier callerCancelled = src.cancelled;
        out.cancelled = () -> disposed.get() || (callerCancelled != null && callerCancelled.getAsBoolean());
        return out;
    }

    private void checkNotDisposed() {
        if (disposed.get()) throw new CancellationException("ProjectIndexCoordinator has been disposed");
    }

    private static ExecutorService newExecutor() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "gml-index-coordinator-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}
