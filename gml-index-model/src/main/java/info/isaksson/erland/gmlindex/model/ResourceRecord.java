package info.isaksson.erland.gmlindex.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/** One manifest-described resource (script, object, sprite, room, ...). */
@JsonPropertyOrder({"path","name","resourceType","scopes","sourceFiles","assetReferences"})
public final class ResourceRecord {
    public static final String TYPE_UNKNOWN = "unknown";

    public final String path;
    public final String name;
    public final String resourceType;
    public final List<String> scopes;
    public final List<String> sourceFiles;
    public final List<AssetReference> assetReferences;

    @JsonCreator
    public ResourceRecord(
            @JsonProperty("path") String path,
            @JsonProperty("name") String name,
            @JsonProperty("resourceType") String resourceType,
            @JsonProperty("scopes") List<String> scopes,
            @JsonProperty("sourceFiles") List<String> sourceFiles,
            @JsonProperty("assetReferences") List<AssetReference> assetReferences
    ) {
        this.path = path;
        this.name = name;
        this.resourceType = resourceType == null ? TYPE_UNKNOWN : resourceType;
        this.scopes = scopes == null ? List.of() : List.copyOf(scopes);
        this.sourceFiles = sourceFiles == null ? List.of() : List.copyOf(sourceFiles);
        this.assetReferences = assetReferences == null ? List.of() : List.copyOf(assetReferences);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ResourceRecord)) return false;
        ResourceRecord that = (ResourceRecord) o;
        return Objects.equals(path, that.path)
                && Objects.equals(name, that.name)
                && Objects.equals(resourceType, that.resourceType)
                && Objects.equals(scopes, that.scopes)
                && Objects.equals(sourceFiles, that.sourceFiles)
                && Objects.equals(assetReferences, that.assetReferences);
    }

    @Override public int hashCode() {
        return Objects.hash(path, name, resourceType, scopes, sourceFiles, assetReferences);
    }

    @Override public String toString() {
        return "ResourceRecord{" + path + " (" + resourceType + ")}";
    }
}
