package info.isaksson.erland.gmlindex.io;

import java.util.List;

/** Result of {@link ProjectTreeScanner#scan}: both lists sorted by relative path. */
public final class ProjectScan {
    public final List<ScannedFile> manifestFiles;
    public final List<ScannedFile> sourceFiles;
    public final int directoriesScanned;
    public final int skippedMissingEntries;

    public ProjectScan(List<ScannedFile> manifestFiles, List<ScannedFile> sourceFiles, int directoriesScanned, int skippedMissingEntries) {
        this.manifestFiles = List.copyOf(manifestFiles);
        this.sourceFiles = List.copyOf(sourceFiles);
        this.directoriesScanned = directoriesScanned;
        this.skippedMissingEntries = skippedMissingEntries;
    }
}
