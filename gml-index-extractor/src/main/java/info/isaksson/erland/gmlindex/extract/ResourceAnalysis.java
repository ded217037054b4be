package info.isaksson.erland.gmlindex.extract;

import info.isaksson.erland.gmlindex.model.AssetReference;
import info.isaksson.erland.gmlindex.model.ResourceRecord;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/** Everything learned from the manifests. */
public final class ResourceAnalysis {
    public final SortedMap<String, ResourceRecord> resources;
    public final Map<String, ScopeDescriptor> scopeDescriptorsBySourcePath;
    public final List<AssetReference> assetReferences;
    public final Map<String, String> scriptNameToScopeId;
    public final Map<String, String> scriptNameToResourcePath;

    public ResourceAnalysis(Map<String, ResourceRecord> resources,
                            Map<String, ScopeDescriptor> scopeDescriptorsBySourcePath,
                            List<AssetReference> assetReferences,
                            Map<String, String> scriptNameToScopeId,
                            Map<String, String> scriptNameToResourcePath) {
        this.resources = Collections.unmodifiableSortedMap(new TreeMap<>(resources));
        this.scopeDescriptorsBySourcePath = Collections.unmodifiableMap(new TreeMap<>(scopeDescriptorsBySourcePath));
        this.assetReferences = List.copyOf(assetReferences);
        this.scriptNameToScopeId = Collections.unmodifiableMap(new TreeMap<>(scriptNameToScopeId));
        this.scriptNameToResourcePath = Collections.unmodifiableMap(new TreeMap<>(scriptNameToResourcePath));
    }

    public static ResourceAnalysis empty() {
        return new ResourceAnalysis(Map.of(), Map.of(), List.of(), Map.of(), Map.of());
    }

    /** The manifest-derived scope for {@code sourcePath}, or a synthetic file scope. */
    public ScopeDescriptor descriptorFor(String sourcePath) {
        ScopeDescriptor d = scopeDescriptorsBySourcePath.get(sourcePath);
        return d != null ? d : ScopeDescriptor.file(sourcePath);
    }
}
