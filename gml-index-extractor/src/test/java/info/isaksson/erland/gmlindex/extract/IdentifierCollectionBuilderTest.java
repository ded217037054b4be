package info.isaksson.erland.gmlindex.extract;

import info.isaksson.erland.gmlindex.model.CallSite;
import info.isaksson.erland.gmlindex.model.CallTarget;
import info.isaksson.erland.gmlindex.model.IdentifierCollections;
import info.isaksson.erland.gmlindex.model.IdentifierOccurrence;
import info.isaksson.erland.gmlindex.model.IdentifierRole;
import info.isaksson.erland.gmlindex.model.InstanceVariableEntry;
import info.isaksson.erland.gmlindex.model.ScopeKind;
import info.isaksson.erland.gmlindex.model.ScriptCall;
import info.isaksson.erland.gmlindex.model.ScriptEntry;
import info.isaksson.erland.gmlindex.model.SourceLocation;
import info.isaksson.erland.gmlindex.model.SourceSpan;
import info.isaksson.erland.gmlindex.model.EventInfo;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class IdentifierCollectionBuilderTest {

    private static final ScopeDescriptor SCR_MOVE =
            ScopeDescriptor.script("scr_move", "scripts/scr_move/scr_move.yy", "scripts/scr_move/scr_move.gml");

    private static IdentifierOccurrence real(String name, String file, int index, IdentifierRole... kinds) {
        EnumSet<IdentifierRole> roles = EnumSet.of(IdentifierRole.DECLARATION);
        roles.addAll(List.of(kinds));
        return new IdentifierOccurrence(name, file, SCR_MOVE.id,
                new SourceLocation(1, index, index), new SourceLocation(1, index + name.length(), index + name.length()),
                roles, null, false, false, false, null);
    }

    private static IdentifierOccurrence synthetic(String name, String file) {
        return IdentifierOccurrence.synthetic(name, file, SCR_MOVE.id, EnumSet.of(IdentifierRole.DECLARATION, IdentifierRole.SCRIPT));
    }

    private static ScriptCall call(String target, String targetScope) {
        SourceLocation at = new SourceLocation(2, 0, 20);
        return new ScriptCall(ScriptCall.KIND_SCRIPT,
                new CallSite("objects/o_player/o_player_3_0.gml", "scope:object:o_player::3_0"),
                new CallTarget(target, targetScope, targetScope == null ? null : "scripts/" + target + "/" + target + ".yy"),
                targetScope != null,
                new SourceSpan(at, new SourceLocation(2, target.length(), 20 + target.length())));
    }

    @Test
    void realDeclarationEvictsSyntheticOnes() {
        IdentifierCollectionBuilder b = new IdentifierCollectionBuilder();
        b.add(IdentifierContribution.scriptDeclaration(synthetic("scr_move", "scripts/scr_move/scr_move.gml"), SCR_MOVE));
        b.add(IdentifierContribution.scriptDeclaration(
                real("move_helper", "scripts/scr_move/scr_move.gml", 9, IdentifierRole.SCRIPT), SCR_MOVE));
        // Late synthetic (another file) is ignored once a real declaration exists.
        b.add(IdentifierContribution.scriptDeclaration(synthetic("scr_move", "scripts/other.gml"), SCR_MOVE));

        ScriptEntry e = b.build().scripts.get("scope:script:scr_move");
        assertEquals(1, e.declarations.size());
        assertFalse(e.declarations.get(0).synthetic);
        assertEquals("move_helper", e.declarations.get(0).name);
        assertEquals("scr_move", e.name, "name comes from the owning scope");
        assertEquals("script.scr_move", e.displayName);
        assertEquals("scripts/scr_move/scr_move.yy", e.resourcePath);
        assertEquals(List.of(IdentifierRole.SCRIPT), e.declarationKinds);
        assertEquals("script:scope:script:scr_move", e.identifierId);
    }

    @Test
    void syntheticDeclarationsDeduplicatePerFile() {
        IdentifierCollectionBuilder b = new IdentifierCollectionBuilder();
        b.add(IdentifierContribution.scriptDeclaration(synthetic("scr_move", "a.gml"), SCR_MOVE));
        b.add(IdentifierContribution.scriptDeclaration(synthetic("scr_move", "a.gml"), SCR_MOVE));
        b.add(IdentifierContribution.scriptDeclaration(synthetic("scr_move", "b.gml"), SCR_MOVE));

        assertEquals(2, b.build().scripts.get(SCR_MOVE.id).declarations.size());
    }

    @Test
    void declarationsDeduplicateByLocation() {
        IdentifierCollectionBuilder b = new IdentifierCollectionBuilder();
        IdentifierOccurrence d = real("scr_move", "scripts/scr_move/scr_move.gml", 9, IdentifierRole.SCRIPT, IdentifierRole.CONSTRUCTOR);
        b.add(IdentifierContribution.scriptDeclaration(d, SCR_MOVE));
        b.add(IdentifierContribution.scriptDeclaration(d, SCR_MOVE));

        ScriptEntry e = b.build().scripts.get(SCR_MOVE.id);
        assertEquals(1, e.declarations.size());
        assertEquals(List.of(IdentifierRole.SCRIPT, IdentifierRole.CONSTRUCTOR), e.declarationKinds);
    }

    @Test
    void resolvedCallsBecomeScriptReferences() {
        IdentifierCollectionBuilder b = new IdentifierCollectionBuilder();
        b.addScriptCall(call("scr_jump", "scope:script:scr_jump"));
        b.addScriptCall(call("mystery", null));

        IdentifierCollections c = b.build();
        assertEquals(List.of("scope:script:scr_jump"), List.copyOf(c.scripts.keySet()));
        ScriptEntry jump = c.scripts.get("scope:script:scr_jump");
        assertEquals("scr_jump", jump.name);
        assertEquals("script.scr_jump", jump.displayName);
        assertEquals("scripts/scr_jump/scr_jump.yy", jump.resourcePath);
        assertTrue(jump.declarations.isEmpty());
        assertEquals(1, jump.references.size());
        assertEquals("scope:object:o_player::3_0", jump.references.get(0).scopeId);
    }

    @Test
    void instanceEntriesAreScopedToTheirEvent() {
        ScopeDescriptor create = ScopeDescriptor.objectEvent("o_player", new EventInfo("0_0", 0, 0),
                "objects/o_player/o_player.yy", "objects/o_player/o_player_0_0.gml");
        IdentifierOccurrence hp = new IdentifierOccurrence("hp", create.sourcePath, create.id,
                new SourceLocation(1, 0, 0), new SourceLocation(1, 2, 2),
                EnumSet.of(IdentifierRole.REFERENCE, IdentifierRole.VARIABLE), null, false, false, false, null);

        IdentifierCollectionBuilder b = new IdentifierCollectionBuilder();
        b.add(IdentifierContribution.instance(IdentifierRole.DECLARATION, hp, create));
        b.add(IdentifierContribution.instance(IdentifierRole.REFERENCE, hp, create));

        InstanceVariableEntry e = b.build().instanceVariables.get("scope:object:o_player::0_0:hp");
        assertNotNull(e);
        assertEquals(ScopeKind.OBJECT_EVENT, e.scopeKind);
        assertEquals(create.id, e.scopeId);
        assertEquals(1, e.declarations.size());
        assertEquals(1, e.references.size());
    }

    @Test
    void macrosMergeAcrossFiles() {
        IdentifierCollectionBuilder b = new IdentifierCollectionBuilder();
        IdentifierOccurrence inA = real("LIMIT", "a.gml", 7, IdentifierRole.MACRO);
        IdentifierOccurrence inB = real("LIMIT", "b.gml", 7, IdentifierRole.MACRO);
        b.add(IdentifierContribution.macro(IdentifierRole.DECLARATION, inA));
        b.add(IdentifierContribution.macro(IdentifierRole.DECLARATION, inB));

        assertEquals(2, b.build().macros.get("LIMIT").declarations.size());
    }
}
