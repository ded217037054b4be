package info.isaksson.erland.gmlindex.io;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class ProjectTreeScannerTest {

    private static void write(Path root, String rel, String text) throws IOException {
        Path p = root.resolve(rel);
        Files.createDirectories(p.getParent());
        Files.writeString(p, text, StandardCharsets.UTF_8);
    }

    private static List<String> rel(List<ScannedFile> files) {
        return files.stream().map(f -> f.relativePath).collect(Collectors.toList());
    }

    @Test
    void findsManifestsAndSourcesInSortedOrder() throws Exception {
        Path root = Files.createTempDirectory("gmlidx-scan-");
        write(root, "game.yyp", "{}");
        write(root, "scripts/zeta/zeta.yy", "{}");
        write(root, "scripts/zeta/zeta.gml", "");
        write(root, "scripts/alpha/alpha.yy", "{}");
        write(root, "scripts/alpha/alpha.GML", "");
        write(root, "notes/readme.txt", "ignored");

        ProjectScan scan = new ProjectTreeScanner(NioFsFacade.INSTANCE).scan(root);

        assertEquals(List.of("game.yyp", "scripts/alpha/alpha.yy", "scripts/zeta/zeta.yy"), rel(scan.manifestFiles));
        assertEquals(List.of("scripts/alpha/alpha.GML", "scripts/zeta/zeta.gml"), rel(scan.sourceFiles));
        assertEquals(5, scan.directoriesScanned, "root, scripts, alpha, zeta, notes");
        assertEquals(0, scan.skippedMissingEntries);
        assertEquals(root.resolve("game.yyp"), scan.manifestFiles.get(0).absolutePath);
    }

    @Test
    void missingRootYieldsEmptyScan() throws Exception {
        Path root = Files.createTempDirectory("gmlidx-scan-").resolve("does-not-exist");
        ProjectScan scan = new ProjectTreeScanner(NioFsFacade.INSTANCE).scan(root);
        assertTrue(scan.manifestFiles.isEmpty());
        assertTrue(scan.sourceFiles.isEmpty());
    }

    @Test
    void entriesThatVanishBetweenListAndStatAreCounted() throws Exception {
        Path root = Files.createTempDirectory("gmlidx-scan-");
        write(root, "scripts/a/a.gml", "x = 1;");

        FsFacade phantom = new DelegatingFs(NioFsFacade.INSTANCE) {
            @Override public List<String> readDir(Path dir) throws IOException {
                List<String> names = new ArrayList<>(super.readDir(dir));
                if (dir.equals(root)) names.add("ghost.gml");
                return names;
            }
        };

        ProjectScan scan = new ProjectTreeScanner(phantom).scan(root);
        assertEquals(1, scan.skippedMissingEntries);
        assertEquals(List.of("scripts/a/a.gml"), rel(scan.sourceFiles));
    }

    @Test
    void otherStatFailuresPropagate() throws Exception {
        Path root = Files.createTempDirectory("gmlidx-scan-");
        write(root, "a.gml", "");

        FsFacade broken = new DelegatingFs(NioFsFacade.INSTANCE) {
            @Override public FileStat stat(Path path) throws IOException {
                throw new IOException("permission denied");
            }
        };

        IOException e = assertThrows(IOException.class, () -> new ProjectTreeScanner(broken).scan(root));
        assertEquals("permission denied", e.getMessage());
    }

    @Test
    void fingerprintsCoverEveryScannedFile() throws Exception {
        Path root = Files.createTempDirectory("gmlidx-scan-");
        write(root, "game.yyp", "{}");
        write(root, "scripts/a/a.gml", "x = 1;");

        ProjectFingerprints fp = new FingerprintCollector(NioFsFacade.INSTANCE).collect(root);
        assertEquals(List.of("game.yyp"), new ArrayList<>(fp.manifestMtimes.keySet()));
        assertEquals(List.of("scripts/a/a.gml"), new ArrayList<>(fp.sourceMtimes.keySet()));
        assertTrue(fp.sourceMtimes.get("scripts/a/a.gml") > 0);
    }

    /** Forwards everything to another facade; tests override single operations. */
    static class DelegatingFs implements FsFacade {
        private final FsFacade inner;

        DelegatingFs(FsFacade inner) {
            this.inner = inner;
        }

        @Override public List<String> readDir(Path dir) throws IOException { return inner.readDir(dir); }
        @Override public FileStat stat(Path path) throws IOException { return inner.stat(path); }
        @Override public String readFile(Path path) throws IOException { return inner.readFile(path); }
        @Override public void writeFile(Path path, String contents) throws IOException { inner.writeFile(path, contents); }
        @Override public void rename(Path source, Path target) throws IOException { inner.rename(source, target); }
        @Override public void mkdirs(Path dir) throws IOException { inner.mkdirs(dir); }
        @Override public void unlink(Path path) throws IOException { inner.unlink(path); }
    }
}
