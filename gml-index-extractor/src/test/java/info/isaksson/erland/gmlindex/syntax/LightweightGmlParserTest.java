package info.isaksson.erland.gmlindex.syntax;

import info.isaksson.erland.gmlindex.model.IdentifierRole;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class LightweightGmlParserTest {

    private final GmlParser parser = new LightweightGmlParser();

    private List<GmlNode> nodes(String src) {
        SyntaxTree tree = parser.parse(src, ParseOptions.forIndexing("scripts/test/test.gml"));
        List<GmlNode> out = new ArrayList<>();
        GmlTreeWalker.walk(tree.root, out::add);
        return out;
    }

    private static List<IdentifierNode> identifiers(List<GmlNode> nodes, String name) {
        List<IdentifierNode> out = new ArrayList<>();
        for (GmlNode n : nodes) {
            if (n instanceof IdentifierNode && ((IdentifierNode) n).name.equals(name)) out.add((IdentifierNode) n);
        }
        return out;
    }

    @Test
    void localVariableDeclarationAndReference() {
        List<GmlNode> all = nodes("var a = 1;\na += b;\n");
        List<IdentifierNode> as = identifiers(all, "a");
        assertEquals(2, as.size(), "a occurrences: " + as);

        IdentifierNode decl = as.get(0);
        assertTrue(decl.hasRole(IdentifierRole.DECLARATION));
        assertTrue(decl.hasRole(IdentifierRole.LOCAL));
        assertEquals("scope-0", decl.scopeId);
        assertEquals(4, decl.start.index);
        assertEquals(5, decl.end.index);
        assertNull(decl.declaration, "first declaration has no back-reference");

        IdentifierNode ref = as.get(1);
        assertTrue(ref.hasRole(IdentifierRole.REFERENCE));
        assertEquals(2, ref.start.line);
        assertEquals(0, ref.start.column);
        assertNotNull(ref.declaration);
        assertEquals(4, ref.declaration.start.index);

        IdentifierNode b = identifiers(all, "b").get(0);
        assertTrue(b.hasRole(IdentifierRole.REFERENCE));
        assertNull(b.declaration, "b is never declared");
        assertFalse(b.globalIdentifier);

        assertTrue(all.stream().anyMatch(n -> n instanceof AssignmentNode && ((AssignmentNode) n).operator.equals("+=")));
    }

    @Test
    void referencesResolveToFunctionsDeclaredLaterInTheFile() {
        List<GmlNode> all = nodes("function foo() {\n  return bar();\n}\nfunction bar() { return 1; }\n");
        List<IdentifierNode> bars = identifiers(all, "bar");
        assertEquals(2, bars.size());

        IdentifierNode call = bars.get(0);
        assertTrue(call.hasRole(IdentifierRole.REFERENCE));
        assertTrue(call.hasRole(IdentifierRole.SCRIPT));
        assertEquals("scope-1", call.scopeId);
        assertNotNull(call.declaration, "forward reference should resolve");
        assertEquals(bars.get(1).start, call.declaration.start);
        assertEquals("scope-0", call.declaration.scopeId);

        assertEquals(2, all.stream().filter(n -> n instanceof FunctionDeclarationNode).count());
        assertEquals(1, all.stream().filter(n -> n instanceof CallExpressionNode).count());
    }

    @Test
    void globalDotAssignmentDeclaresAndLaterUsesReference() {
        List<GmlNode> all = nodes("global.score = 0;\nfunction add() { global.score += 1; }\n");
        List<IdentifierNode> scores = identifiers(all, "score");
        assertEquals(2, scores.size());

        IdentifierNode decl = scores.get(0);
        assertTrue(decl.hasRole(IdentifierRole.DECLARATION));
        assertTrue(decl.hasRole(IdentifierRole.GLOBAL));
        assertTrue(decl.globalIdentifier);

        IdentifierNode ref = scores.get(1);
        assertTrue(ref.hasRole(IdentifierRole.REFERENCE));
        assertTrue(ref.globalIdentifier);
        assertEquals(decl.start, ref.declaration.start);
    }

    @Test
    void bareNameAfterGlobalDotAssignmentStaysUnresolved() {
        List<GmlNode> all = nodes("total = 1;\nglobal.total = 0;\ntotal = 5;\nshow(global.total);\n");
        List<IdentifierNode> totals = identifiers(all, "total");
        assertEquals(4, totals.size());

        for (IdentifierNode bare : List.of(totals.get(0), totals.get(2))) {
            assertTrue(bare.hasRole(IdentifierRole.REFERENCE));
            assertFalse(bare.hasRole(IdentifierRole.GLOBAL));
            assertFalse(bare.globalIdentifier);
            assertNull(bare.declaration);
        }

        assertTrue(totals.get(1).hasRole(IdentifierRole.DECLARATION));
        assertTrue(totals.get(3).globalIdentifier);
        assertEquals(totals.get(1).start, totals.get(3).declaration.start);
    }

    @Test
    void globalvarIsGlobal() {
        List<GmlNode> all = nodes("globalvar lives;\nlives = 3;\n");
        List<IdentifierNode> lives = identifiers(all, "lives");
        assertTrue(lives.get(0).hasRole(IdentifierRole.DECLARATION));
        assertTrue(lives.get(0).globalIdentifier);
        assertTrue(lives.get(1).globalIdentifier);
        assertNotNull(lives.get(1).declaration);
    }

    @Test
    void enumMembersResolveThroughMemberAccess() {
        List<GmlNode> all = nodes("enum Colour { Red, Green = 5 }\nvar c = Colour.Green;\n");

        EnumDeclarationNode decl = (EnumDeclarationNode) all.stream()
                .filter(n -> n instanceof EnumDeclarationNode).findFirst().orElseThrow();
        assertEquals("Colour", decl.name.name);
        assertEquals(2, decl.members.size());

        List<IdentifierNode> greens = identifiers(all, "Green");
        assertEquals(2, greens.size());
        assertTrue(greens.get(0).hasRole(IdentifierRole.ENUM_MEMBER));
        assertTrue(greens.get(0).hasRole(IdentifierRole.DECLARATION));
        IdentifierNode memberRef = greens.get(1);
        assertTrue(memberRef.hasRole(IdentifierRole.REFERENCE));
        assertTrue(memberRef.hasRole(IdentifierRole.ENUM_MEMBER));
        assertEquals(greens.get(0).start, memberRef.declaration.start);

        IdentifierNode enumRef = identifiers(all, "Colour").get(1);
        assertTrue(enumRef.hasRole(IdentifierRole.ENUM));
        assertTrue(enumRef.hasRole(IdentifierRole.REFERENCE));
    }

    @Test
    void macrosIncludingConfigurationMacros() {
        List<GmlNode> all = nodes("#macro MAX_HP 100\n#macro Debug:LOG_ENABLED true\nhp = MAX_HP;\n");

        IdentifierNode logEnabled = identifiers(all, "LOG_ENABLED").get(0);
        assertTrue(logEnabled.hasRole(IdentifierRole.MACRO));
        assertTrue(logEnabled.hasRole(IdentifierRole.DECLARATION));
        assertTrue(identifiers(all, "Debug").isEmpty(), "configuration name is not an identifier");

        List<IdentifierNode> maxHp = identifiers(all, "MAX_HP");
        assertEquals(2, maxHp.size());
        assertTrue(maxHp.get(1).hasRole(IdentifierRole.MACRO));
        assertTrue(maxHp.get(1).hasRole(IdentifierRole.REFERENCE));
        assertEquals(3, maxHp.get(1).start.line);
    }

    @Test
    void withBlockBodyIsParsed() {
        List<GmlNode> all = nodes("with (other) {\n  speed = 4;\n}\n");
        assertTrue(all.stream().anyMatch(n -> n instanceof ContainerNode && "WithStatement".equals(((ContainerNode) n).label)));

        IdentifierNode speed = identifiers(all, "speed").get(0);
        assertTrue(speed.hasRole(IdentifierRole.REFERENCE));
        assertNull(speed.declaration);
        assertTrue(identifiers(all, "other").isEmpty(), "keywords are not identifiers");
    }

    @Test
    void constructorsParametersAndNew() {
        List<GmlNode> all = nodes("function Vec(x, y) constructor {\n  self.x = x;\n}\nvar v = new Vec(1, 2);\n");

        IdentifierNode vecDecl = identifiers(all, "Vec").get(0);
        assertTrue(vecDecl.hasRole(IdentifierRole.CONSTRUCTOR));
        assertTrue(vecDecl.hasRole(IdentifierRole.SCRIPT));

        NewExpressionNode created = (NewExpressionNode) all.stream()
                .filter(n -> n instanceof NewExpressionNode).findFirst().orElseThrow();
        assertTrue(created.callee instanceof IdentifierNode);
        assertEquals("Vec", ((IdentifierNode) created.callee).name);
        assertEquals(2, created.arguments.size());

        List<IdentifierNode> xs = identifiers(all, "x");
        assertEquals(3, xs.size(), "parameter, self.x property, value reference: " + xs);
        assertTrue(xs.get(0).hasRole(IdentifierRole.PARAMETER));
        assertFalse(xs.get(1).isClassified(), "self.x property is left unclassified");
        assertEquals("scope-1", xs.get(2).declaration.scopeId);
    }

    @Test
    void redeclarationPointsBackToFirstSite() {
        List<GmlNode> all = nodes("var i = 0;\nvar i = 1;\n");
        List<IdentifierNode> is = identifiers(all, "i");
        assertTrue(is.get(1).hasRole(IdentifierRole.DECLARATION));
        assertNotNull(is.get(1).declaration);
        assertEquals(is.get(0).start, is.get(1).declaration.start);
    }

    @Test
    void comparisonInsideConditionIsNotAssignment() {
        List<GmlNode> all = nodes("if (a = 1) { b = 2; }\n");
        assertEquals(1, all.stream().filter(n -> n instanceof AssignmentNode).count());
    }

    @Test
    void rolesAreOmittedWhenNotRequested() {
        SyntaxTree tree = parser.parse("var a = 1; a = 2;", new ParseOptions("x.gml", true, false));
        List<GmlNode> all = new ArrayList<>();
        GmlTreeWalker.walk(tree.root, all::add);
        for (IdentifierNode id : identifiers(all, "a")) {
            assertNull(id.roles);
            assertNull(id.declaration);
        }
    }

    @Test
    void syntaxErrorCarriesFileAndLocation() {
        GmlParseException e = assertThrows(GmlParseException.class,
                () -> parser.parse("var a = 1;\nvar = ;", ParseOptions.forIndexing("scripts/bad/bad.gml")));
        assertEquals("scripts/bad/bad.gml", e.getFilePath());
        assertEquals(2, e.getLocation().line);
        assertTrue(e.getMessage().startsWith("scripts/bad/bad.gml:2:"), e.getMessage());
    }
}
