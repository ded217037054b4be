package info.isaksson.erland.gmlindex.extract;

import info.isaksson.erland.gmlindex.model.EnumEntry;
import info.isaksson.erland.gmlindex.model.EnumMemberEntry;
import info.isaksson.erland.gmlindex.model.GlobalVariableEntry;
import info.isaksson.erland.gmlindex.model.IdentifierCategory;
import info.isaksson.erland.gmlindex.model.IdentifierCollections;
import info.isaksson.erland.gmlindex.model.IdentifierOccurrence;
import info.isaksson.erland.gmlindex.model.IdentifierRole;
import info.isaksson.erland.gmlindex.model.InstanceVariableEntry;
import info.isaksson.erland.gmlindex.model.LocationKey;
import info.isaksson.erland.gmlindex.model.MacroEntry;
import info.isaksson.erland.gmlindex.model.ScopeKind;
import info.isaksson.erland.gmlindex.model.ScriptCall;
import info.isaksson.erland.gmlindex.model.ScriptEntry;
import info.isaksson.erland.gmlindex.model.ScriptReference;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Folds {@link IdentifierContribution}s and script calls into the six identifier collections.
 *
 * <p>Rules:</p>
 * <ul>
 *   <li>An entry's descriptive fields come from its first observation; later observations only
 *       fill fields that are still empty.</li>
 *   <li>Declarations are de-duplicated by (file, start offset).</li>
 *   <li>A real script declaration evicts the synthetic ones; a synthetic declaration is not
 *       added to an entry that already has a real one.</li>
 *   <li>Every call with a resolved target scope adds a {@link ScriptReference} to that script,
 *       creating the entry when no declaration was seen.</li>
 * </ul>
 *
 * <p>Not thread-safe; the index builder feeds it after the worker pool has drained.</p>
 */
public final class IdentifierCollectionBuilder {

    private static final class Draft {
        final String key;
        String name;
        String displayName;
        String resourcePath;
        String filePath;
        String enumKey;
        String enumName;
        String scopeId;
        ScopeKind scopeKind;
        final Set<IdentifierRole> declarationKinds = new LinkedHashSet<>();
        final List<IdentifierOccurrence> declarations = new ArrayList<>();
        final Set<LocationKey> declarationKeys = new HashSet<>();
        final List<IdentifierOccurrence> references = new ArrayList<>();
        final List<ScriptReference> scriptReferences = new ArrayList<>();

        Draft(String key) {
            this.key = key;
        }

        void addDeclaration(IdentifierOccurrence occ) {
            if (occ.synthetic) {
                for (IdentifierOccurrence existing : declarations) {
                    if (!existing.synthetic || same(existing.filePath, occ.filePath)) return;
                }
                declarations.add(occ);
                return;
            }
            declarations.removeIf(d -> d.synthetic);
            LocationKey locationKey = occ.locationKey();
            if (locationKey != null && !declarationKeys.add(locationKey)) return;
            declarations.add(occ);
        }
    }

    private final Map<IdentifierCategory, Map<String, Draft>> drafts = new EnumMap<>(IdentifierCategory.class);

    public IdentifierCollectionBuilder() {
        for (IdentifierCategory c : IdentifierCategory.values()) drafts.put(c, new LinkedHashMap<>());
    }

    public void addAll(Collection<IdentifierContribution> contributions) {
        for (IdentifierContribution c : contributions) add(c);
    }

    public void add(IdentifierContribution c) {
        if (c.key == null || c.key.isEmpty()) return;
        Draft d = drafts.get(c.category).computeIfAbsent(c.key, Draft::new);
        d.name = firstNonEmpty(d.name, c.name);
        d.filePath = firstNonEmpty(d.filePath, c.filePath);
        d.enumKey = firstNonEmpty(d.enumKey, c.enumKey);
        d.enumName = firstNonEmpty(d.enumName, c.enumName);
        if (c.scope != null) {
            d.displayName = firstNonEmpty(d.displayName, c.scope.displayName);
            d.resourcePath = firstNonEmpty(d.resourcePath, c.scope.resourcePath);
            d.scopeId = firstNonEmpty(d.scopeId, c.scope.id);
            if (d.scopeKind == null) d.scopeKind = c.scope.kind;
        }

        if (c.isDeclaration()) {
            d.addDeclaration(c.occurrence);
            if (c.category == IdentifierCategory.SCRIPT) {
                for (IdentifierRole role : c.occurrence.roles) {
                    if (role.isKindTag()) d.declarationKinds.add(role);
                }
            }
        } else {
            d.references.add(c.occurrence);
        }
    }

    public void addScriptCall(ScriptCall call) {
        if (call == null || call.target == null || call.target.scopeId == null) return;
        Draft d = drafts.get(IdentifierCategory.SCRIPT).computeIfAbsent(call.target.scopeId, Draft::new);
        d.name = firstNonEmpty(d.name, call.target.name);
        d.displayName = firstNonEmpty(d.displayName, call.target.name == null ? null : "script." + call.target.name);
        d.resourcePath = firstNonEmpty(d.resourcePath, call.target.resourcePath);
        d.scriptReferences.add(ScriptReference.fromCall(call));
    }

    public IdentifierCollections build() {
        Map<String, ScriptEntry> scripts = new LinkedHashMap<>();
        for (Draft d : drafts.get(IdentifierCategory.SCRIPT).values()) {
            scripts.put(d.key, new ScriptEntry(
                    IdentifierCategory.SCRIPT.identifierId(d.key), d.key, d.name,
                    d.displayName != null ? d.displayName : d.key,
                    d.resourcePath, new ArrayList<>(d.declarationKinds), d.declarations, d.scriptReferences));
        }
        Map<String, MacroEntry> macros = new LinkedHashMap<>();
        for (Draft d : drafts.get(IdentifierCategory.MACRO).values()) {
            macros.put(d.key, new MacroEntry(IdentifierCategory.MACRO.identifierId(d.key), d.name, d.declarations, d.references));
        }
        Map<String, EnumEntry> enums = new LinkedHashMap<>();
        for (Draft d : drafts.get(IdentifierCategory.ENUM).values()) {
            enums.put(d.key, new EnumEntry(IdentifierCategory.ENUM.identifierId(d.key), d.key, d.name, d.filePath,
                    d.declarations, d.references));
        }
        Map<String, EnumMemberEntry> members = new LinkedHashMap<>();
        for (Draft d : drafts.get(IdentifierCategory.ENUM_MEMBER).values()) {
            members.put(d.key, new EnumMemberEntry(IdentifierCategory.ENUM_MEMBER.identifierId(d.key), d.key, d.name,
                    d.enumKey, d.enumName, d.filePath, d.declarations, d.references));
        }
        Map<String, GlobalVariableEntry> globals = new LinkedHashMap<>();
        for (Draft d : drafts.get(IdentifierCategory.GLOBAL).values()) {
            globals.put(d.key, new GlobalVariableEntry(IdentifierCategory.GLOBAL.identifierId(d.key), d.name,
                    d.declarations, d.references));
        }
        Map<String, InstanceVariableEntry> instances = new LinkedHashMap<>();
        for (Draft d : drafts.get(IdentifierCategory.INSTANCE).values()) {
            instances.put(d.key, new InstanceVariableEntry(IdentifierCategory.INSTANCE.identifierId(d.key), d.key, d.name,
                    d.scopeId, d.scopeKind, d.declarations, d.references));
        }
        return new IdentifierCollections(scripts, macros, enums, members, globals, instances);
    }

    private static String firstNonEmpty(String current, String candidate) {
        return current != null && !current.isEmpty() ? current : candidate;
    }

    private static boolean same(String a, String b) {
        return a == null ? b == null : a.equals(b);
    }
}
