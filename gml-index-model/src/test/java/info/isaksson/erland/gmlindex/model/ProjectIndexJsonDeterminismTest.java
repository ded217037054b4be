package info.isaksson.erland.gmlindex.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class ProjectIndexJsonDeterminismTest {

    @Test
    void writeMatchesGoldenMiniScript() throws Exception {
        assertGoldenRoundTrip("index/golden/mini-script.json");
    }

    @Test
    void readGoldenRestoresTypedModel() throws Exception {
        ProjectIndex index = ProjectIndexJson.read(golden("index/golden/mini-script.json"));

        ScopeRecord scope = index.scope("scope:script:scr_util").orElseThrow();
        assertEquals(ScopeKind.SCRIPT, scope.kind);
        assertEquals(2, scope.declarations.size());
        assertTrue(scope.declarations.get(0).synthetic);
        assertTrue(scope.declarations.get(1).hasRole(IdentifierRole.MACRO));
        assertEquals(new SourceLocation(1, 7, 7), scope.declarations.get(1).start);
        assertEquals(java.util.List.of(IdentifierRole.SCRIPT), index.identifiers.scripts.get("scope:script:scr_util").declarationKinds);
        assertNull(index.metrics);
    }

    private static void assertGoldenRoundTrip(String resourcePath) throws IOException, URISyntaxException {
        Path goldenPath = golden(resourcePath);
        String golden = Files.readString(goldenPath, StandardCharsets.UTF_8);

        ProjectIndex index = ProjectIndexJson.read(goldenPath);

        // Parse once so the test is resilient to whitespace/pretty-print differences.
        ObjectMapper om = new ObjectMapper();
        JsonNode goldenNode = om.readTree(golden);

        String rendered = ProjectIndexJson.toJsonString(index);
        assertEquals(goldenNode, om.readTree(rendered), "Rendered JSON must be semantically equal to golden fixture.");
        assertTrue(rendered.endsWith("}\n"), "Rendered JSON must end with a newline.");

        Path tmp = Files.createTempFile("index-", ".json");
        ProjectIndexJson.write(index, tmp);
        String written = Files.readString(tmp, StandardCharsets.UTF_8);
        assertEquals(goldenNode, om.readTree(written), "Written JSON must be semantically equal to golden fixture.");

        Path tmp2 = Files.createTempFile("index-", ".json");
        ProjectIndexJson.write(index, tmp2);
        assertEquals(written, Files.readString(tmp2, StandardCharsets.UTF_8), "Writing twice must produce identical output.");
    }

    private static Path golden(String resourcePath) throws URISyntaxException {
        return Path.of(ProjectIndexJsonDeterminismTest.class.getClassLoader().getResource(resourcePath).toURI());
    }
}
