package info.isaksson.erland.gmlindex.model;

import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class ProjectIndexNormalizerTest {

    @Test
    void sortsOccurrencesCallsAndAssetReferences() {
        String scopeId = ScopeKind.SCRIPT.scopeId("scr_a");
        IdentifierOccurrence late = ref("b", 30);
        IdentifierOccurrence early = ref("a", 4);
        IdentifierOccurrence synthetic = IdentifierOccurrence.synthetic("scr_a", "scripts/scr_a/scr_a.gml", scopeId,
                EnumSet.of(IdentifierRole.DECLARATION, IdentifierRole.SCRIPT));

        ScriptCall second = call("scr_z", 20);
        ScriptCall first = call("scr_y", 2);

        AssetReference spriteRef = new AssetReference("objects/o/o.yy", "o", "spriteId", "sprites/s/s.yy", "s", null);
        AssetReference parentRef = new AssetReference("objects/o/o.yy", "o", "parentObjectId", "objects/p/p.yy", "p", null);

        ScopeRecord scope = new ScopeRecord(scopeId, ScopeKind.SCRIPT, "scr_a", "script.scr_a", null, null,
                List.of("scripts/scr_a/scr_a.gml"), List.of(late, synthetic), List.of(late, early), null, List.of(second, first));
        ProjectIndex in = new ProjectIndex("/p", null, Map.of(scopeId, scope), null,
                new Relationships(List.of(second, first), List.of(spriteRef, parentRef)), null, null);

        ProjectIndex out = ProjectIndexNormalizer.normalize(in);
        ScopeRecord normalized = out.scopes.get(scopeId);

        assertEquals(List.of(synthetic, late), normalized.declarations);
        assertEquals(List.of(early, late), normalized.references);
        assertEquals(List.of(first, second), normalized.scriptCalls);
        assertEquals(List.of(first, second), out.relationships.scriptCalls);
        assertEquals(List.of(parentRef, spriteRef), out.relationships.assetReferences);
    }

    @Test
    void normalizeIsIdempotent() {
        ProjectIndex once = ProjectIndexNormalizer.normalize(ProjectIndexTest.sample(null));
        assertEquals(once, ProjectIndexNormalizer.normalize(once));
        assertNull(ProjectIndexNormalizer.normalize(null));
    }

    private static IdentifierOccurrence ref(String name, int index) {
        return new IdentifierOccurrence(name, "scripts/scr_a/scr_a.gml", ScopeKind.SCRIPT.scopeId("scr_a"),
                new SourceLocation(1, index, index), new SourceLocation(1, index + name.length(), index + name.length()),
                EnumSet.of(IdentifierRole.REFERENCE, IdentifierRole.VARIABLE), null, false, false, false, null);
    }

    private static ScriptCall call(String target, int index) {
        return new ScriptCall(ScriptCall.KIND_SCRIPT,
                new CallSite("scripts/scr_a/scr_a.gml", ScopeKind.SCRIPT.scopeId("scr_a")),
                new CallTarget(target, null, null),
                false,
                new SourceSpan(new SourceLocation(1, index, index), new SourceLocation(1, index + target.length(), index + target.length())));
    }
}
