package info.isaksson.erland.gmlindex.extract;

import info.isaksson.erland.gmlindex.io.FileStat;
import info.isaksson.erland.gmlindex.io.FsFacade;
import info.isaksson.erland.gmlindex.io.NioFsFacade;
import info.isaksson.erland.gmlindex.model.AssetReference;
import info.isaksson.erland.gmlindex.model.FileRecord;
import info.isaksson.erland.gmlindex.model.GlobalVariableEntry;
import info.isaksson.erland.gmlindex.model.InstanceVariableEntry;
import info.isaksson.erland.gmlindex.model.MetricsSummary;
import info.isaksson.erland.gmlindex.model.ProjectIndex;
import info.isaksson.erland.gmlindex.model.ProjectIndexJson;
import info.isaksson.erland.gmlindex.model.ResourceRecord;
import info.isaksson.erland.gmlindex.model.ScopeKind;
import info.isaksson.erland.gmlindex.model.ScopeRecord;
import info.isaksson.erland.gmlindex.model.ScriptCall;
import info.isaksson.erland.gmlindex.model.ScriptEntry;
import info.isaksson.erland.gmlindex.syntax.GmlParseException;
import info.isaksson.erland.gmlindex.syntax.LightweightGmlParser;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class ProjectIndexBuilderTest {

    private static final boolean DEBUG = Boolean.parseBoolean(System.getProperty("gmlIndex.debugTests", "false"));
    private static void debug(String s) { if (DEBUG) System.out.println(s); }

    @Test
    void indexesTheSampleProject() throws Exception {
        Path root = TestProjects.resolveSampleDir("mini-game");
        ProjectIndex index = TestProjects.build(root);
        debug(ProjectIndexJson.toJsonString(index));

        assertEquals(root.toString(), index.projectRoot);
        assertEquals(List.of(
                "MiniGame.yyp",
                "objects/o_player/o_player.yy",
                "scripts/scr_move/scr_move.yy",
                "scripts/scr_utils/scr_utils.yy",
                "sprites/spr_player/spr_player.yy"), List.copyOf(index.resources.keySet()));

        ResourceRecord player = index.resources.get("objects/o_player/o_player.yy");
        assertEquals("GMObject", player.resourceType);
        assertEquals(List.of("scope:object:o_player::0_0", "scope:object:o_player::3_0"), player.scopes);
        AssetReference sprite = player.assetReferences.get(0);
        assertEquals("spriteId", sprite.propertyPath);
        assertEquals("GMSprite", sprite.targetResourceType);
        assertEquals(5, index.relationships.assetReferences.size(), "four from the project file, one sprite");

        assertEquals(List.of(
                "scope:file:scripts/legacy_helper.gml",
                "scope:object:o_player::0_0",
                "scope:object:o_player::3_0",
                "scope:script:scr_move",
                "scope:script:scr_utils"), List.copyOf(index.scopes.keySet()));
        ScopeRecord step = index.scopes.get("scope:object:o_player::3_0");
        assertEquals(ScopeKind.OBJECT_EVENT, step.kind);
        assertEquals(List.of("objects/o_player/o_player_3_0.gml"), step.filePaths);
        assertEquals(Integer.valueOf(3), step.event.eventType);

        List<ScriptCall> calls = index.relationships.scriptCalls;
        assertEquals(2, calls.size(), "calls: " + calls);
        assertTrue(calls.stream().allMatch(c -> c.resolved));
        assertEquals("scr_move", calls.get(0).target.name, "sorted by calling file");
        assertEquals("scope:object:o_player::3_0", calls.get(0).from.scopeId);
        assertEquals("scr_utils", calls.get(1).target.name);

        ScriptEntry move = index.identifiers.scripts.get("scope:script:scr_move");
        assertEquals(1, move.declarations.size());
        assertFalse(move.declarations.get(0).synthetic, "function declaration replaces the synthetic one");
        assertEquals(1, move.references.size());
        assertEquals("objects/o_player/o_player_3_0.gml", move.references.get(0).filePath);

        FileRecord legacy = index.files.get("scripts/legacy_helper.gml");
        assertEquals("scope:file:scripts/legacy_helper.gml", legacy.scopeId);
        assertEquals(List.of("show_debug_message"),
                legacy.ignoredIdentifiers.stream().map(o -> o.name).collect(Collectors.toList()));

        assertEquals(1, index.identifiers.macros.size());
        assertEquals(1, index.identifiers.macros.get("MAX_SPEED").references.size());
        assertEquals(1, index.identifiers.enums.size());
        assertEquals(2, index.identifiers.enumMembers.size());

        GlobalVariableEntry score = index.identifiers.globalVariables.get("score");
        assertEquals(2, score.declarations.size(), "first assignment in each file declares");
        assertEquals(1, score.references.size());

        InstanceVariableEntry hp = index.identifiers.instanceVariables.get("scope:object:o_player::0_0:hp");
        assertNotNull(hp, "instances: " + index.identifiers.instanceVariables.keySet());
        assertEquals(1, hp.declarations.size());
        assertTrue(index.identifiers.instanceVariables.containsKey("scope:object:o_player::3_0:hp"));
        assertFalse(index.identifiers.instanceVariables.containsKey("scope:object:o_player::3_0:scr_move"),
                "call targets are not instance variables");

        MetricsSummary m = index.metrics;
        assertNotNull(m);
        assertEquals("project-index", m.category);
        assertEquals(5, m.counter("files.gmlDiscovered"));
        assertEquals(5, m.counter("files.yyDiscovered"));
        assertEquals(5, m.counter("files.gmlProcessed"));
        assertEquals(5, m.counter("resources.total"));
        assertEquals(2, m.counter("scriptCalls.total"));
        assertEquals(2, m.counter("scriptCalls.resolved"));
        assertEquals(0, m.counter("scriptCalls.unresolved"));
        assertEquals(1, m.counter("identifiers.instanceAssignments"));
        assertTrue(m.counter("io.gmlBytes") > 0);
        assertTrue(m.timings.keySet().containsAll(List.of(
                "total", "loadBuiltIns", "scanProjectTree", "analyseResourceFiles", "fs.readGml", "gml.parse", "gml.analyse")),
                "timings: " + m.timings.keySet());
        assertEquals(5, m.metadata.get("gmlFileCount"));
        assertEquals(BoundedWorkerPool.DEFAULT_CONCURRENCY, m.metadata.get("gmlParseConcurrency"));
        assertEquals(1, m.caches.get(BuiltInIdentifierRegistry.CACHE_NAME).misses);
    }

    @Test
    void rebuildingIsDeterministicRegardlessOfConcurrency() throws Exception {
        Path root = TestProjects.resolveSampleDir("mini-game");
        BuildOptions serial = new BuildOptions();
        serial.concurrency = 1;
        BuildOptions wide = new BuildOptions();
        wide.concurrency = 16;

        ProjectIndex a = TestProjects.build(root, serial).withoutMetrics();
        ProjectIndex b = TestProjects.build(root, wide).withoutMetrics();
        ProjectIndex c = TestProjects.build(root, wide).withoutMetrics();

        assertEquals(a, b);
        assertEquals(ProjectIndexJson.toJsonString(a), ProjectIndexJson.toJsonString(c));
    }

    @Test
    void emptyProjectYieldsEmptyIndex() throws Exception {
        Path root = TestProjects.newProject();
        ProjectIndex index = TestProjects.build(root);

        assertTrue(index.resources.isEmpty());
        assertTrue(index.scopes.isEmpty());
        assertTrue(index.files.isEmpty());
        assertTrue(index.relationships.scriptCalls.isEmpty());
        assertEquals(0, index.identifiers.scripts.size());
        assertEquals(0, index.metrics.counter("files.gmlDiscovered"));
    }

    @Test
    void scriptWithoutFunctionKeepsSyntheticDeclaration() throws Exception {
        Path root = TestProjects.newProject();
        TestProjects.script(root, "scr_legacy", "show_debug_message(\"hi\");\n");

        ProjectIndex index = TestProjects.build(root);
        ScriptEntry e = index.identifiers.scripts.get("scope:script:scr_legacy");
        assertEquals(1, e.declarations.size());
        assertTrue(e.declarations.get(0).synthetic);
        assertEquals("scr_legacy", e.declarations.get(0).name);
        assertTrue(index.relationships.scriptCalls.isEmpty(), "built-in call is not an edge");
    }

    @Test
    void unresolvedCallsAreCounted() throws Exception {
        Path root = TestProjects.newProject();
        TestProjects.script(root, "scr_a", "function scr_a() {\n  scr_b();\n  scr_missing();\n}\n");
        TestProjects.script(root, "scr_b", "function scr_b() {}\n");

        ProjectIndex index = TestProjects.build(root);
        assertEquals(2, index.metrics.counter("scriptCalls.total"));
        assertEquals(1, index.metrics.counter("scriptCalls.resolved"));
        assertEquals(1, index.metrics.counter("scriptCalls.unresolved"));
        assertEquals(1, index.identifiers.scripts.get("scope:script:scr_b").references.size());
        assertFalse(index.identifiers.scripts.containsKey("scope:script:scr_missing"));
    }

    @Test
    void sourcesThatVanishBeforeReadingAreSkipped() throws Exception {
        Path root = TestProjects.newProject();
        TestProjects.script(root, "scr_a", "function scr_a() {}\n");
        TestProjects.script(root, "scr_gone", "function scr_gone() {}\n");

        FsFacade flaky = new FsFacade() {
            @Override public List<String> readDir(Path dir) throws IOException { return NioFsFacade.INSTANCE.readDir(dir); }
            @Override public FileStat stat(Path path) throws IOException { return NioFsFacade.INSTANCE.stat(path); }
            @Override public String readFile(Path path) throws IOException {
                if (path.getFileName().toString().equals("scr_gone.gml")) throw new NoSuchFileException(path.toString());
                return NioFsFacade.INSTANCE.readFile(path);
            }
            @Override public void writeFile(Path path, String contents) throws IOException { NioFsFacade.INSTANCE.writeFile(path, contents); }
            @Override public void rename(Path source, Path target) throws IOException { NioFsFacade.INSTANCE.rename(source, target); }
            @Override public void mkdirs(Path dir) throws IOException { NioFsFacade.INSTANCE.mkdirs(dir); }
            @Override public void unlink(Path path) throws IOException { NioFsFacade.INSTANCE.unlink(path); }
        };

        ProjectIndex index = new ProjectIndexBuilder(flaky, new LightweightGmlParser(), new BuiltInIdentifierRegistry())
                .build(root, BuildOptions.defaults());
        assertEquals(List.of("scripts/scr_a/scr_a.gml"), List.copyOf(index.files.keySet()));
        assertEquals(1, index.metrics.counter("files.missingDuringRead"));
        assertTrue(index.resources.containsKey("scripts/scr_gone/scr_gone.yy"), "the manifest is still a resource");
    }

    @Test
    void parseErrorsFailTheBuild() throws Exception {
        Path root = TestProjects.newProject();
        TestProjects.script(root, "scr_broken", "function scr_broken( {\n");
        GmlParseException e = assertThrows(GmlParseException.class, () -> TestProjects.build(root));
        assertEquals("scripts/scr_broken/scr_broken.gml", e.getFilePath());
    }

    @Test
    void cancellationStopsTheBuild() throws Exception {
        Path root = TestProjects.newProject();
        TestProjects.script(root, "scr_a", "function scr_a() {}\n");
        BuildOptions options = new BuildOptions();
        options.cancelled = () -> true;
        assertThrows(CancellationException.class, () -> TestProjects.build(root, options));
    }

    @Test
    void nullRootIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> TestProjects.build(null));
    }
}
