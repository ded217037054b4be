package info.isaksson.erland.gmlindex.io;

import java.io.FileNotFoundException;
import java.nio.file.NoSuchFileException;

/** Classification of filesystem failures. */
public final class FsErrors {

    private FsErrors() {}

    /** True when {@code error} (or one of its causes) says the path does not exist. */
    public static boolean isNotFound(Throwable error) {
        Throwable t = error;
        while (t != null) {
            if (t instanceof NoSuchFileException || t instanceof FileNotFoundException) return true;
            if (t.getCause() == t) break;
            t = t.getCause();
        }
        return false;
    }
}
