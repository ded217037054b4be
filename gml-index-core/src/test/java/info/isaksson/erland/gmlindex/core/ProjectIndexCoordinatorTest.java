package info.isaksson.erland.gmlindex.core;

import info.isaksson.erland.gmlindex.cache.CacheMissReason;
import info.isaksson.erland.gmlindex.cache.CacheSaveResult;
import info.isaksson.erland.gmlindex.cache.ProjectIndexCache;
import info.isaksson.erland.gmlindex.extract.BuiltInIdentifierRegistry;
import info.isaksson.erland.gmlindex.extract.ProjectIndexBuilder;
import info.isaksson.erland.gmlindex.io.FileStat;
import info.isaksson.erland.gmlindex.io.FsFacade;
import info.isaksson.erland.gmlindex.io.NioFsFacade;
import info.isaksson.erland.gmlindex.model.ProjectIndex;
import info.isaksson.erland.gmlindex.syntax.LightweightGmlParser;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class ProjectIndexCoordinatorTest {

    private final AtomicInteger builds = new AtomicInteger();
    private final ProjectIndexBuilder realBuilder = new ProjectIndexBuilder(
            NioFsFacade.INSTANCE, new LightweightGmlParser(), new BuiltInIdentifierRegistry());
    private ProjectIndexCoordinator coordinator;

    @AfterEach
    void tearDown() {
        if (coordinator != null) coordinator.dispose();
    }

    private ProjectIndexCoordinator countingCoordinator() {
        return new ProjectIndexCoordinator(NioFsFacade.INSTANCE, (root, options) -> {
            builds.incrementAndGet();
            return realBuilder.build(root, options);
        });
    }

    @Test
    void buildsOnceThenServesFromCache() throws Exception {
        Path root = TestPaths.copySample("mini-game");
        coordinator = countingCoordinator();

        EnsureReadyResult first = coordinator.ensureReadyAndWait(EnsureReadyRequest.forRoot(root));
        assertEquals(EnsureReadyResult.Source.BUILD, first.source);
        assertEquals(CacheMissReason.NOT_FOUND, first.loadResult.missReason);
        assertEquals(CacheSaveResult.Status.WRITTEN, first.saveResult.status);
        assertTrue(Files.isRegularFile(root.resolve(".tool-cache/project-index-cache.json")));

        EnsureReadyResult second = coordinator.ensureReadyAndWait(EnsureReadyRequest.forRoot(root));
        assertEquals(EnsureReadyResult.Source.CACHE, second.source);
        assertNull(second.saveResult);
        assertEquals(first.projectIndex, second.projectIndex);
        assertNotNull(second.projectIndex.metrics, "cached metrics are re-attached");
        assertEquals(1, builds.get());
    }

    @Test
    void touchingASourceFileInvalidatesTheCache() throws Exception {
        Path root = TestPaths.copySample("mini-game");
        coordinator = countingCoordinator();
        coordinator.ensureReadyAndWait(EnsureReadyRequest.forRoot(root));

        Path source = root.resolve("scripts/scr_move/scr_move.gml");
        FileTime before = Files.getLastModifiedTime(source);
        Files.setLastModifiedTime(source, FileTime.fromMillis(before.toMillis() + 5_000));

        EnsureReadyResult again = coordinator.ensureReadyAndWait(EnsureReadyRequest.forRoot(root));
        assertEquals(EnsureReadyResult.Source.BUILD, again.source);
        assertEquals(CacheMissReason.SOURCE_MTIME_MISMATCH, again.loadResult.missReason);
        assertEquals(2, builds.get());
    }

    @Test
    void addingAManifestInvalidatesTheCache() throws Exception {
        Path root = TestPaths.copySample("mini-game");
        coordinator = countingCoordinator();
        coordinator.ensureReadyAndWait(EnsureReadyRequest.forRoot(root));

        TestPaths.write(root, "scripts/scr_new/scr_new.yy", "{\"resourceType\": \"GMScript\", \"name\": \"scr_new\"}");

        EnsureReadyResult again = coordinator.ensureReadyAndWait(EnsureReadyRequest.forRoot(root));
        assertEquals(CacheMissReason.MANIFEST_MTIME_MISMATCH, again.loadResult.missReason);
        assertTrue(again.projectIndex.resources.containsKey("scripts/scr_new/scr_new.yy"));
    }

    @Test
    void formatterVersionChangeForcesRebuild() throws Exception {
        Path root = TestPaths.copySample("mini-game");
        coordinator = countingCoordinator();
        EnsureReadyRequest v1 = EnsureReadyRequest.forRoot(root);
        v1.formatterVersion = "1.0";
        coordinator.ensureReadyAndWait(v1);

        EnsureReadyRequest v2 = EnsureReadyRequest.forRoot(root);
        v2.formatterVersion = "2.0";
        EnsureReadyResult r = coordinator.ensureReadyAndWait(v2);
        assertEquals(CacheMissReason.FORMATTER_VERSION_MISMATCH, r.loadResult.missReason);
        assertEquals(2, builds.get());
    }

    @Test
    void concurrentRequestsShareOneBuild() throws Exception {
        Path root = Files.createTempDirectory("gmlidx-shared-").toRealPath();
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        coordinator = new ProjectIndexCoordinator(NioFsFacade.INSTANCE, (r, options) -> {
            builds.incrementAndGet();
            started.countDown();
            try {
                assertTrue(release.await(10, TimeUnit.SECONDS));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IOException(e);
            }
            return emptyIndex(r);
        });

        CompletableFuture<EnsureReadyResult> a = coordinator.ensureReady(EnsureReadyRequest.forRoot(root));
        assertTrue(started.await(10, TimeUnit.SECONDS));
        CompletableFuture<EnsureReadyResult> b = coordinator.ensureReady(EnsureReadyRequest.forRoot(root.resolve(".")));
        assertSame(a, b, "same normalized root joins the in-flight operation");
        assertEquals(1, coordinator.inFlightRoots().size());

        release.countDown();
        assertEquals(a.get(10, TimeUnit.SECONDS).projectIndex, b.get(10, TimeUnit.SECONDS).projectIndex);
        assertEquals(1, builds.get());
        assertTrue(coordinator.inFlightRoots().isEmpty(), "entry removed once finished");
    }

    @Test
    void cacheWriteFailureStillReturnsTheIndex() throws Exception {
        Path root = Files.createTempDirectory("gmlidx-savefail-").toRealPath();
        coordinator = new ProjectIndexCoordinator(NioFsFacade.INSTANCE, new ProjectIndexCache(new WriteFailingFs()),
                (r, options) -> emptyIndex(r), null, Executors.newSingleThreadExecutor());

        EnsureReadyResult result = coordinator.ensureReadyAndWait(EnsureReadyRequest.forRoot(root));

        assertEquals(EnsureReadyResult.Source.BUILD, result.source);
        assertNotNull(result.projectIndex);
        assertEquals(CacheSaveResult.Status.FAILED, result.saveResult.status);
        assertEquals("read-only volume", result.saveResult.error.getMessage());
    }

    @Test
    void buildFailurePropagates() throws Exception {
        Path root = Files.createTempDirectory("gmlidx-buildfail-").toRealPath();
        coordinator = new ProjectIndexCoordinator(NioFsFacade.INSTANCE, (r, options) -> {
            throw new IOException("disk on fire");
        });

        IOException e = assertThrows(IOException.class,
                () -> coordinator.ensureReadyAndWait(EnsureReadyRequest.forRoot(root)));
        assertEquals("disk on fire", e.getMessage());
        assertTrue(coordinator.inFlightRoots().isEmpty());

        ExecutionException wrapped = assertThrows(ExecutionException.class,
                () -> coordinator.ensureReady(EnsureReadyRequest.forRoot(root)).get());
        assertInstanceOf(IOException.class, wrapped.getCause());
    }

    @Test
    void cacheCanBeBypassed() throws Exception {
        Path root = TestPaths.copySample("mini-game");
        coordinator = countingCoordinator();

        EnsureReadyRequest request = EnsureReadyRequest.forRoot(root);
        request.useCache = false;
        EnsureReadyResult r = coordinator.ensureReadyAndWait(request);

        assertEquals(EnsureReadyResult.Source.BUILD, r.source);
        assertNull(r.loadResult);
        assertNull(r.saveResult);
        assertFalse(Files.exists(root.resolve(".tool-cache")));
    }

    @Test
    void disposeCancelsPendingWorkAndRejectsNewRequests() throws Exception {
        Path root = Files.createTempDirectory("gmlidx-dispose-").toRealPath();
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        coordinator = new ProjectIndexCoordinator(NioFsFacade.INSTANCE, (r, options) -> {
            started.countDown();
            try {
                release.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return emptyIndex(r);
        });

        CompletableFuture<EnsureReadyResult> pending = coordinator.ensureReady(EnsureReadyRequest.forRoot(root));
        assertTrue(started.await(10, TimeUnit.SECONDS));

        coordinator.dispose();
        release.countDown();

        assertTrue(pending.isCancelled());
        assertThrows(CancellationException.class, pending::join);
        assertThrows(IllegalStateException.class, () -> coordinator.ensureReady(EnsureReadyRequest.forRoot(root)));
        assertTrue(coordinator.isDisposed());
        coordinator.dispose();
    }

    @Test
    void missingRootIsRejected() {
        coordinator = countingCoordinator();
        assertThrows(IllegalArgumentException.class, () -> coordinator.ensureReady(new EnsureReadyRequest()));
        assertThrows(IllegalArgumentException.class, () -> coordinator.ensureReady(null));
    }

    private static ProjectIndex emptyIndex(Path root) {
        return new ProjectIndex(root.toString(), null, null, null, null, null, null);
    }

    private static final class WriteFailingFs implements FsFacade {
        private final FsFacade delegate = NioFsFacade.INSTANCE;

        @Override public List<String> readDir(Path dir) throws IOException { return delegate.readDir(dir); }
        @Override public FileStat stat(Path path) throws IOException { return delegate.stat(path); }
        @Override public String readFile(Path path) throws IOException { return delegate.readFile(path); }
        @Override public void writeFile(Path path, String contents) throws IOException { throw new IOException("read-only volume"); }
        @Override public void rename(Path source, Path target) throws IOException { delegate.rename(source, target); }
        @Override public void mkdirs(Path dir) throws IOException { delegate.mkdirs(dir); }
        @Override public void unlink(Path path) throws IOException { delegate.unlink(path); }
    }
}
