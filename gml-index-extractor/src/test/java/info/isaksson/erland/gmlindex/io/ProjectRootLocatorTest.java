package info.isaksson.erland.gmlindex.io;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class ProjectRootLocatorTest {

    @Test
    void findsNearestAncestorWithProjectManifest() throws Exception {
        Path root = Files.createTempDirectory("gmlidx-root-");
        Files.writeString(root.resolve("Game.yyp"), "{}", StandardCharsets.UTF_8);
        Path script = root.resolve("scripts/player/player.gml");
        Files.createDirectories(script.getParent());
        Files.writeString(script, "", StandardCharsets.UTF_8);

        Optional<Path> found = new ProjectRootLocator(NioFsFacade.INSTANCE).findProjectRoot(script);
        assertEquals(Optional.of(root.toAbsolutePath().normalize()), found);
    }

    @Test
    void plainResourceManifestsDoNotMarkARoot() throws Exception {
        Path dir = Files.createTempDirectory("gmlidx-root-");
        Files.writeString(dir.resolve("player.yy"), "{}", StandardCharsets.UTF_8);

        Optional<Path> found = new ProjectRootLocator(NioFsFacade.INSTANCE).findProjectRoot(dir.resolve("player.gml"));
        // The temp directory's ancestors do not hold a .yyp either.
        assertTrue(found.isEmpty() || !found.get().equals(dir), "found: " + found);
    }

    @Test
    void nullFileHasNoRoot() throws Exception {
        assertEquals(Optional.empty(), new ProjectRootLocator(NioFsFacade.INSTANCE).findProjectRoot(null));
    }
}
