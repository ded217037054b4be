package info.isaksson.erland.gmlindex;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

/** Test helper for resolving paths when running from Maven submodules. */
final class TestRepoPaths {
    private TestRepoPaths() {}

    /** Find repo root by walking upwards until a 'samples' directory exists. */
    static Path repoRoot() {
        Path p = Path.of("").toAbsolutePath().normalize();
        for (int i = 0; i < 10 && p != null; i++) {
            if (Files.isDirectory(p.resolve("samples"))) {
                return p;
            }
            p = p.getParent();
        }
        throw new IllegalStateException("Could not locate repo root (no 'samples' directory found in parents).");
    }

    /** Copy of {@code samples/<name>} in a temp directory, so runs can write caches next to it. */
    static Path copySample(String name) throws IOException {
        Path source = repoRoot().resolve("samples").resolve(name);
        Path target = Files.createTempDirectory("gmlidx-cli-" + name + "-");
        try (Stream<Path> walk = Files.walk(source)) {
            walk.forEach(p -> {
                Path dest = target.resolve(source.relativize(p).toString());
                try {
                    if (Files.isDirectory(p)) Files.createDirectories(dest);
                    else Files.copy(p, dest);
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            });
        }
        return target.toRealPath();
    }
}
