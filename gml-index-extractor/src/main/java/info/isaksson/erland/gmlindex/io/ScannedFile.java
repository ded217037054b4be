package info.isaksson.erland.gmlindex.io;

import java.nio.file.Path;
import java.util.Objects;

/** A discovered file: absolute location plus its project-relative POSIX path. */
public final class ScannedFile {
    public final Path absolutePath;
    public final String relativePath;

    public ScannedFile(Path absolutePath, String relativePath) {
        this.absolutePath = Objects.requireNonNull(absolutePath, "absolutePath");
        this.relativePath = Objects.requireNonNull(relativePath, "relativePath");
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ScannedFile)) return false;
        ScannedFile that = (ScannedFile) o;
        return absolutePath.equals(that.absolutePath) && relativePath.equals(that.relativePath);
    }

    @Override public int hashCode() {
        return Objects.hash(absolutePath, relativePath);
    }

    @Override public String toString() {
        return relativePath;
    }
}
