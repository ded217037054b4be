package info.isaksson.erland.gmlindex.core;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.stream.Stream;

/** Locates the shared sample projects and makes writable copies of them. */
final class TestPaths {

    private TestPaths() {}

    static Path resolveSampleDir(String name) {
        // Tests run per-module in Maven, so the working directory may be the module base dir.
        Path[] candidates = new Path[] {
                Paths.get("samples", name),
                Paths.get("..", "samples", name),
                Paths.get("..", "..", "samples", name)
        };
        for (Path p : candidates) {
            Path abs = p.toAbsolutePath().normalize();
            if (Files.isDirectory(abs)) return abs;
        }
        throw new IllegalStateException("Could not locate samples/" + name + " from " + Paths.get("").toAbsolutePath());
    }

    /** Copies a sample into a fresh temp directory so tests can write caches and touch files. */
    static Path copySample(String name) throws IOException {
        Path source = resolveSampleDir(name);
        Path target = Files.createTempDirectory("gmlidx-" + name + "-");
        try (Stream<Path> walk = Files.walk(source)) {
            walk.forEach(p -> {
                Path dest = target.resolve(source.relativize(p).toString());
                try {
                    if (Files.isDirectory(p)) {
                        Files.createDirectories(dest);
                    } else {
                        Files.copy(p, dest);
                    }
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            });
        }
        return target.toRealPath();
    }

    static void write(Path root, String rel, String text) throws IOException {
        Path p = root.resolve(rel);
        Files.createDirectories(p.getParent());
        Files.writeString(p, text, StandardCharsets.UTF_8);
    }
}
