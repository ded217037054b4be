package info.isaksson.erland.gmlindex.io;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/** Stats every scanned file to build the mtime maps used for cache validation. */
public final class FingerprintCollector {

    private final FsFacade fs;

    public FingerprintCollector(FsFacade fs) {
        this.fs = Objects.requireNonNull(fs, "fs");
    }

    public ProjectFingerprints collect(Path projectRoot) throws IOException {
        return collect(new ProjectTreeScanner(fs).scan(projectRoot));
    }

    public ProjectFingerprints collect(ProjectScan scan) throws IOException {
        return new ProjectFingerprints(mtimes(scan.manifestFiles), mtimes(scan.sourceFiles));
    }

    private Map<String, Double> mtimes(List<ScannedFile> files) throws IOException {
        Map<String, Double> out = new TreeMap<>();
        for (ScannedFile f : files) {
            Double mtime = FsUtils.mtimeOrNull(fs, f.absolutePath);
            if (mtime != null) out.put(f.relativePath, mtime);
        }
        return out;
    }
}
