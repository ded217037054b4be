package info.isaksson.erland.gmlindex.io;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Deterministic discovery of resource manifests and GML sources under a project root.
 *
 * <p>The walk is iterative (explicit stack), so deeply nested trees cannot overflow the call
 * stack. Entries that disappear between listing and stat are skipped and counted; any other
 * I/O failure propagates.</p>
 */
public final class ProjectTreeScanner {

    private static final Logger log = LoggerFactory.getLogger(ProjectTreeScanner.class);

    private final FsFacade fs;

    public ProjectTreeScanner(FsFacade fs) {
        this.fs = Objects.requireNonNull(fs, "fs");
    }

    public ProjectScan scan(Path projectRoot) throws IOException {
        Objects.requireNonNull(projectRoot, "projectRoot");

        List<ScannedFile> manifests = new ArrayList<>();
        List<ScannedFile> sources = new ArrayList<>();
        int directories = 0;
        int skipped = 0;

        Deque<Path> pending = new ArrayDeque<>();
        pending.push(projectRoot);
        while (!pending.isEmpty()) {
            Path dir = pending.pop();
            List<String> entries = FsUtils.listDirectory(fs, dir);
            directories++;

            for (String entry : entries) {
                Path absolute = dir.resolve(entry);
                FileStat stat;
                try {
                    stat = fs.stat(absolute);
                } catch (IOException e) {
                    if (FsErrors.isNotFound(e)) {
                        skipped++;
                        log.debug("Entry vanished during scan: {}", absolute);
                        continue;
                    }
                    throw e;
                }

                if (stat.directory) {
                    pending.push(absolute);
                    continue;
                }

                String relative = FsUtils.relativePosix(projectRoot, absolute);
                if (ProjectFileTypes.isManifest(relative)) {
                    manifests.add(new ScannedFile(absolute, relative));
                } else if (ProjectFileTypes.isSource(relative)) {
                    sources.add(new ScannedFile(absolute, relative));
                }
            }
        }

        // Stable deterministic ordering (relative path)
        manifests.sort(Comparator.comparing(f -> f.relativePath));
        sources.sort(Comparator.comparing(f -> f.relativePath));

        log.debug("Scanned {} directories under {}: {} manifests, {} sources, {} vanished entries",
                directories, projectRoot, manifests.size(), sources.size(), skipped);
        return new ProjectScan(manifests, sources, directories, skipped);
    }
}
