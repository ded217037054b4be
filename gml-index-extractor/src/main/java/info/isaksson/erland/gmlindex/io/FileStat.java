package info.isaksson.erland.gmlindex.io;

/** Subset of file attributes the indexer cares about. */
public final class FileStat {
    public final double mtimeMs;
    public final boolean directory;
    public final boolean file;
    public final long size;

    public FileStat(double mtimeMs, boolean directory, boolean file, long size) {
        this.mtimeMs = mtimeMs;
        this.directory = directory;
        this.file = file;
        this.size = size;
    }

    @Override public String toString() {
        return "FileStat{mtimeMs=" + mtimeMs + ", directory=" + directory + ", size=" + size + "}";
    }
}
