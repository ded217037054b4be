package info.isaksson.erland.gmlindex.extract;

import com.fasterxml.jackson.core.JsonProcessingException;
import info.isaksson.erland.gmlindex.io.FsFacade;
import info.isaksson.erland.gmlindex.io.FsUtils;
import info.isaksson.erland.gmlindex.io.ProjectFileTypes;
import info.isaksson.erland.gmlindex.io.ScannedFile;
import info.isaksson.erland.gmlindex.model.AssetReference;
import info.isaksson.erland.gmlindex.model.EventInfo;
import info.isaksson.erland.gmlindex.model.ResourceRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Reads resource manifests ({@code .yy}, {@code .yyp}) and derives resources, source-file scopes
 * and asset references.
 *
 * <ul>
 *   <li>{@code GMScript} resources own one script scope backed by {@code <dir>/<name>.gml}.</li>
 *   <li>Each entry of a non-empty {@code eventList} owns one object-event scope.</li>
 *   <li>Every object with a string {@code path} field becomes an asset reference; targets are
 *       annotated with their resource type once all manifests are known.</li>
 * </ul>
 *
 * <p>Manifests that vanished or hold malformed JSON are skipped.</p>
 */
public final class ResourceManifestAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(ResourceManifestAnalyzer.class);

    public static final String TYPE_SCRIPT = "GMScript";

    private final FsFacade fs;

    public ResourceManifestAnalyzer(FsFacade fs) {
        this.fs = Objects.requireNonNull(fs, "fs");
    }

    /** Mutable resource record while manifests are being read. */
    private static final class Draft {
        final String path;
        String name;
        String resourceType;
        final Set<String> scopes = new LinkedHashSet<>();
        final Set<String> sourceFiles = new LinkedHashSet<>();
        final List<AssetReference> assetReferences = new ArrayList<>();

        Draft(String path, String name) {
            this.path = path;
            this.name = name;
            this.resourceType = ResourceRecord.TYPE_UNKNOWN;
        }
    }

    public ResourceAnalysis analyze(Path projectRoot, List<ScannedFile> manifests) throws IOException {
        Map<String, Draft> drafts = new LinkedHashMap<>();
        Map<String, ScopeDescriptor> descriptors = new HashMap<>();
        Map<String, String> scriptScopes = new HashMap<>();
        Map<String, String> scriptResources = new HashMap<>();

        for (ScannedFile file : manifests) {
            ManifestValue.ObjectValue doc = readManifest(file);
            if (doc == null) continue;

            Draft draft = drafts.computeIfAbsent(file.relativePath, p -> new Draft(p, defaultName(p)));
            String declaredName = doc.string("name");
            if (declaredName != null && !declaredName.isEmpty()) draft.name = declaredName;
            String declaredType = doc.string("resourceType");
            if (declaredType != null && !declaredType.isEmpty()) draft.resourceType = declaredType;

            String resourceDir = parentDir(file.relativePath);

            if (TYPE_SCRIPT.equals(declaredType)) {
                String sourcePath = join(resourceDir, draft.name + ProjectFileTypes.SOURCE_EXTENSION);
                ScopeDescriptor d = ScopeDescriptor.script(draft.name, draft.path, sourcePath);
                attach(draft, descriptors, d);
                scriptScopes.put(draft.name, d.id);
                scriptResources.put(draft.name, draft.path);
            }

            ManifestValue.ArrayValue events = doc.get("eventList").asArray();
            if (events != null) {
                for (ManifestValue item : events.items) {
                    ManifestValue.ObjectValue event = item.asObject();
                    if (event == null) continue;
                    EventInfo info = eventInfo(event);
                    String sourcePath = eventSourcePath(event, draft.name, info.name, resourceDir);
                    attach(draft, descriptors, ScopeDescriptor.objectEvent(draft.name, info, draft.path, sourcePath));
                }
            }

            for (ManifestAssetCollector.Hit hit : ManifestAssetCollector.collect(doc)) {
                String target = normalizeResourcePath(projectRoot, hit.targetPath);
                if (target == null) continue;
                draft.assetReferences.add(new AssetReference(draft.path, draft.name, hit.propertyPath, target, hit.targetName, null));
            }
        }

        // Second pass: attach target types now that every resource is known.
        Map<String, ResourceRecord> resources = new LinkedHashMap<>();
        List<AssetReference> allReferences = new ArrayList<>();
        for (Draft draft : drafts.values()) {
            List<AssetReference> resolved = new ArrayList<>(draft.assetReferences.size());
            for (AssetReference ref : draft.assetReferences) {
                Draft target = drafts.get(ref.targetPath);
                resolved.add(target == null ? ref : ref.resolvedAgainst(target.resourceType, target.name));
            }
            allReferences.addAll(resolved);
            resources.put(draft.path, new ResourceRecord(
                    draft.path,
                    draft.name,
                    draft.resourceType,
                    new ArrayList<>(draft.scopes),
                    new ArrayList<>(draft.sourceFiles),
                    resolved
            ));
        }

        log.debug("Analysed {} manifests: {} resources, {} scoped source files, {} asset references",
                manifests.size(), resources.size(), descriptors.size(), allReferences.size());
        return new ResourceAnalysis(resources, descriptors, allReferences, scriptScopes, scriptResources);
    }

    private ManifestValue.ObjectValue readManifest(ScannedFile file) throws IOException {
        String text = FsUtils.readOrNull(fs, file.absolutePath);
        if (text == null) {
            log.debug("Manifest vanished before it could be read: {}", file.relativePath);
            return null;
        }
        try {
            ManifestValue value = ManifestValue.parse(text);
            ManifestValue.ObjectValue doc = value.asObject();
            if (doc == null) log.debug("Manifest is not a JSON object, skipping: {}", file.relativePath);
            return doc;
        } catch (JsonProcessingException e) {
            log.debug("Malformed manifest JSON, skipping {}: {}", file.relativePath, e.getOriginalMessage());
            return null;
        }
    }

    private static void attach(Draft draft, Map<String, ScopeDescriptor> descriptors, ScopeDescriptor d) {
        draft.sourceFiles.add(d.sourcePath);
        draft.scopes.add(d.id);
        descriptors.put(d.sourcePath, d);
    }

    /** Event name, else {@code <type>_<num>}, else {@code <type>}, else {@code event}. */
    static EventInfo eventInfo(ManifestValue.ObjectValue event) {
        Integer type = event.integer("eventType");
        if (type == null) type = event.integer("eventtype");
        Integer num = event.integer("eventNum");
        if (num == null) num = event.integer("enumb");

        String name = event.string("name");
        String display;
        if (name != null && !name.trim().isEmpty()) {
            display = name;
        } else if (type == null && num == null) {
            display = "event";
        } else if (num == null) {
            display = String.valueOf(type);
        } else {
            display = type + "_" + num;
        }
        return new EventInfo(display, type, num);
    }

    private static String eventSourcePath(ManifestValue.ObjectValue event, String objectName, String displayName, String resourceDir) {
        List<String> candidates = new ArrayList<>();
        addIfPresent(candidates, event.string("eventContents"));
        addIfPresent(candidates, event.string("event"));
        ManifestValue.ObjectValue eventRef = event.get("event").asObject();
        if (eventRef != null) addIfPresent(candidates, eventRef.string("path"));
        ManifestValue.ObjectValue eventId = event.get("eventId").asObject();
        if (eventId != null) addIfPresent(candidates, eventId.string("path"));
        addIfPresent(candidates, event.string("code"));

        for (String candidate : candidates) {
            String normalized = normalizeRelative(candidate);
            if (normalized != null) return normalized;
        }
        return join(resourceDir, objectName + "_" + displayName + ProjectFileTypes.SOURCE_EXTENSION);
    }

    private static void addIfPresent(List<String> out, String value) {
        if (value != null) out.add(value);
    }

    /** POSIX separators, no leading {@code ./}; null for empty input. */
    static String normalizeRelative(String raw) {
        if (raw == null || raw.isEmpty()) return null;
        String p = FsUtils.toPosix(raw);
        while (p.startsWith("./")) p = p.substring(2);
        return p.isEmpty() ? null : p;
    }

    /** Project-relative POSIX form of a manifest {@code path} value. */
    static String normalizeResourcePath(Path projectRoot, String raw) {
        String relative = normalizeRelative(raw);
        if (relative == null) return null;
        if (projectRoot == null) return relative;
        Path resolved = projectRoot.resolve(relative).normalize();
        return FsUtils.relativePosix(projectRoot.normalize(), resolved);
    }

    private static String defaultName(String resourcePath) {
        String base = resourcePath.substring(resourcePath.lastIndexOf('/') + 1);
        return ProjectFileTypes.isManifest(base) ? ProjectFileTypes.manifestStem(base) : base;
    }

    private static String parentDir(String relativePath) {
        int slash = relativePath.lastIndexOf('/');
        return slash < 0 ? "" : relativePath.substring(0, slash);
    }

    private static String join(String dir, String name) {
        return dir.isEmpty() ? name : dir + "/" + name;
    }
}
