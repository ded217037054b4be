package info.isaksson.erland.gmlindex.io;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** {@link FsFacade} backed by {@link java.nio.file.Files}. Text is read and written as UTF-8. */
public final class NioFsFacade implements FsFacade {

    public static final NioFsFacade INSTANCE = new NioFsFacade();

    @Override
    public List<String> readDir(Path dir) throws IOException {
        List<String> out = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir)) {
            for (Path p : stream) {
                out.add(p.getFileName().toString());
            }
        }
        Collections.sort(out);
        return out;
    }

    @Override
    public FileStat stat(Path path) throws IOException {
        BasicFileAttributes attrs = Files.readAttributes(path, BasicFileAttributes.class);
        return new FileStat(
                toEpochMillis(attrs.lastModifiedTime()),
                attrs.isDirectory(),
                attrs.isRegularFile(),
                attrs.size()
        );
    }

    /** Fractional epoch milliseconds; the sub-millisecond part survives. */
    static double toEpochMillis(FileTime time) {
        Instant instant = time.toInstant();
        return instant.getEpochSecond() * 1e3 + instant.getNano() / 1e6;
    }

    @Override
    public String readFile(Path path) throws IOException {
        return Files.readString(path, StandardCharsets.UTF_8);
    }

    @Override
    public void writeFile(Path path, String contents) throws IOException {
        Files.writeString(path, contents, StandardCharsets.UTF_8);
    }

    @Override
    public void rename(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    @Override
    public void mkdirs(Path dir) throws IOException {
        Files.createDirectories(dir);
    }

    @Override
    public void unlink(Path path) throws IOException {
        Files.delete(path);
    }
}
