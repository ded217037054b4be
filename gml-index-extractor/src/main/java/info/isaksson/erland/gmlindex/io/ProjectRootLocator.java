package info.isaksson.erland.gmlindex.io;

import java.io.IOException;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/** Finds the project root that owns a file: the nearest ancestor directory holding a {@code .yyp}. */
public final class ProjectRootLocator {

    private final FsFacade fs;

    public ProjectRootLocator(FsFacade fs) {
        this.fs = Objects.requireNonNull(fs, "fs");
    }

    public Optional<Path> findProjectRoot(Path file) throws IOException {
        if (file == null) return Optional.empty();

        Path current = file.toAbsolutePath().normalize().getParent();
        Set<Path> visited = new HashSet<>();
        while (current != null && visited.add(current)) {
            List<String> entries = FsUtils.listDirectory(fs, current);
            for (String entry : entries) {
                if (ProjectFileTypes.isProjectManifest(entry)) return Optional.of(current);
            }
            current = current.getParent();
        }
        return Optional.empty();
    }
}
