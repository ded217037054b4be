package info.isaksson.erland.gmlindex.io;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Filesystem operations used by the indexer and its cache.
 *
 * <p>Implementations report a missing path as {@link java.nio.file.NoSuchFileException}
 * (see {@link FsErrors#isNotFound(Throwable)}); every other failure propagates as-is.</p>
 */
public interface FsFacade {

    /** Names (not paths) of the entries directly inside {@code dir}. */
    List<String> readDir(Path dir) throws IOException;

    FileStat stat(Path path) throws IOException;

    String readFile(Path path) throws IOException;

    void writeFile(Path path, String contents) throws IOException;

    /** Replaces {@code target} with {@code source}, atomically where the filesystem allows it. */
    void rename(Path source, Path target) throws IOException;

    void mkdirs(Path dir) throws IOException;

    void unlink(Path path) throws IOException;
}
