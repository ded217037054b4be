package info.isaksson.erland.gmlindex.io;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/** Not-found tolerant helpers on top of {@link FsFacade}. */
public final class FsUtils {

    private FsUtils() {}

    /** Entries of {@code dir}; empty when the directory does not exist. */
    public static List<String> listDirectory(FsFacade fs, Path dir) throws IOException {
        try {
            return fs.readDir(dir);
        } catch (IOException e) {
            if (FsErrors.isNotFound(e)) return List.of();
            throw e;
        }
    }

    /** Modification time in ms, or null when the file does not exist. */
    public static Double mtimeOrNull(FsFacade fs, Path path) throws IOException {
        try {
            return fs.stat(path).mtimeMs;
        } catch (IOException e) {
            if (FsErrors.isNotFound(e)) return null;
            throw e;
        }
    }

    /** File contents, or null when the file does not exist. */
    public static String readOrNull(FsFacade fs, Path path) throws IOException {
        try {
            return fs.readFile(path);
        } catch (IOException e) {
            if (FsErrors.isNotFound(e)) return null;
            throw e;
        }
    }

    /** {@code path} relative to {@code root}, with '/' separators. */
    public static String relativePosix(Path root, Path path) {
        return toPosix(root.relativize(path).toString());
    }

    public static String toPosix(String p) {
        return p == null ? null : p.replace('\\', '/');
    }
}
