package info.isaksson.erland.gmlindex.model;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Produces a stable, deterministic ordering of every list in a {@link ProjectIndex}.
 *
 * <p>Occurrences sort by (file, start offset, name) with synthetic occurrences first; calls by
 * (file, offset, target); asset references by (source resource, property path, target).
 * Maps are already sorted by key. Declaration kinds and role tags keep enum order.</p>
 */
public final class ProjectIndexNormalizer {

    private static final Comparator<IdentifierOccurrence> OCCURRENCE_ORDER = Comparator
            .comparing((IdentifierOccurrence o) -> safe(o.filePath))
            .thenComparingInt(o -> offset(o.start))
            .thenComparing(o -> safe(o.name))
            .thenComparing(o -> safe(o.scopeId));

    private static final Comparator<ScriptCall> CALL_ORDER = Comparator
            .comparing((ScriptCall c) -> c.from == null ? "" : safe(c.from.filePath))
            .thenComparingInt(c -> c.location == null ? -1 : offset(c.location.start))
            .thenComparing(c -> c.target == null ? "" : safe(c.target.name))
            .thenComparing(c -> safe(c.kind));

    private static final Comparator<AssetReference> ASSET_ORDER = Comparator
            .comparing((AssetReference a) -> safe(a.fromResourcePath))
            .thenComparing(a -> safe(a.propertyPath))
            .thenComparing(a -> safe(a.targetPath));

    private static final Comparator<ScriptReference> SCRIPT_REFERENCE_ORDER = Comparator
            .comparing((ScriptReference r) -> safe(r.filePath))
            .thenComparingInt(r -> r.location == null ? -1 : offset(r.location.start))
            .thenComparing(r -> safe(r.scopeId));

    private ProjectIndexNormalizer() {}

    public static ProjectIndex normalize(ProjectIndex in) {
        if (in == null) return null;

        Map<String, ResourceRecord> resources = mapValues(in.resources, ProjectIndexNormalizer::normalizeResource);
        Map<String, ScopeRecord> scopes = mapValues(in.scopes, ProjectIndexNormalizer::normalizeScope);
        Map<String, FileRecord> files = mapValues(in.files, ProjectIndexNormalizer::normalizeFile);
        Relationships rels = new Relationships(
                sorted(in.relationships.scriptCalls, CALL_ORDER),
                sorted(in.relationships.assetReferences, ASSET_ORDER)
        );

        return new ProjectIndex(in.projectRoot, resources, scopes, files, rels, normalizeIdentifiers(in.identifiers), in.metrics);
    }

    private static ResourceRecord normalizeResource(ResourceRecord r) {
        return new ResourceRecord(
                r.path,
                r.name,
                r.resourceType,
                sorted(r.scopes, Comparator.naturalOrder()),
                sorted(r.sourceFiles, Comparator.naturalOrder()),
                sorted(r.assetReferences, ASSET_ORDER)
        );
    }

    private static ScopeRecord normalizeScope(ScopeRecord s) {
        return new ScopeRecord(
                s.id,
                s.kind,
                s.name,
                s.displayName,
                s.resourcePath,
                s.event,
                sorted(s.filePaths, Comparator.naturalOrder()),
                sorted(s.declarations, OCCURRENCE_ORDER),
                sorted(s.references, OCCURRENCE_ORDER),
                sorted(s.ignoredIdentifiers, OCCURRENCE_ORDER),
                sorted(s.scriptCalls, CALL_ORDER)
        );
    }

    private static FileRecord normalizeFile(FileRecord f) {
        return new FileRecord(
                f.filePath,
                f.scopeId,
                sorted(f.declarations, OCCURRENCE_ORDER),
                sorted(f.references, OCCURRENCE_ORDER),
                sorted(f.ignoredIdentifiers, OCCURRENCE_ORDER),
                sorted(f.scriptCalls, CALL_ORDER)
        );
    }

    private static IdentifierCollections normalizeIdentifiers(IdentifierCollections in) {
        return new IdentifierCollections(
                mapValues(in.scripts, e -> new ScriptEntry(e.identifierId, e.id, e.name, e.displayName, e.resourcePath,
                        sorted(e.declarationKinds, Comparator.naturalOrder()),
                        sorted(e.declarations, OCCURRENCE_ORDER),
                        sorted(e.references, SCRIPT_REFERENCE_ORDER))),
                mapValues(in.macros, e -> new MacroEntry(e.identifierId, e.name,
                        sorted(e.declarations, OCCURRENCE_ORDER), sorted(e.references, OCCURRENCE_ORDER))),
                mapValues(in.enums, e -> new EnumEntry(e.identifierId, e.key, e.name, e.filePath,
                        sorted(e.declarations, OCCURRENCE_ORDER), sorted(e.references, OCCURRENCE_ORDER))),
                mapValues(in.enumMembers, e -> new EnumMemberEntry(e.identifierId, e.key, e.name, e.enumKey, e.enumName, e.filePath,
                        sorted(e.declarations, OCCURRENCE_ORDER), sorted(e.references, OCCURRENCE_ORDER))),
                mapValues(in.globalVariables, e -> new GlobalVariableEntry(e.identifierId, e.name,
                        sorted(e.declarations, OCCURRENCE_ORDER), sorted(e.references, OCCURRENCE_ORDER))),
                mapValues(in.instanceVariables, e -> new InstanceVariableEntry(e.identifierId, e.key, e.name, e.scopeId, e.scopeKind,
                        sorted(e.declarations, OCCURRENCE_ORDER), sorted(e.references, OCCURRENCE_ORDER)))
        );
    }

    private static <V> Map<String, V> mapValues(Map<String, V> in, Function<V, V> fn) {
        Map<String, V> out = new LinkedHashMap<>();
        for (Map.Entry<String, V> e : in.entrySet()) {
            if (e.getValue() == null) continue;
            out.put(e.getKey(), fn.apply(e.getValue()));
        }
        return out;
    }

    private static <T> List<T> sorted(List<T> in, Comparator<? super T> order) {
        if (in == null) return List.of();
        List<T> out = new ArrayList<>(in.size());
        for (T t : in) {
            if (t != null) out.add(t);
        }
        out.sort(order);
        return List.copyOf(out);
    }

    private static int offset(SourceLocation loc) {
        return loc == null ? -1 : loc.index;
    }

    private static String safe(String s) {
        return s == null ? "" : s;
    }
}
