package info.isaksson.erland.gmlindex.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * A manifest node that points at another resource through a {@code path} field.
 *
 * <p>{@code propertyPath} is the dotted location of that node inside the source manifest
 * (array positions appear as indices, e.g. {@code eventList.0.eventId}).</p>
 */
@JsonPropertyOrder({"fromResourcePath","fromResourceName","propertyPath","targetPath","targetName","targetResourceType"})
public final class AssetReference {
    public final String fromResourcePath;
    public final String fromResourceName;
    public final String propertyPath;
    public final String targetPath;
    public final String targetName;
    public final String targetResourceType;

    @JsonCreator
    public AssetReference(
            @JsonProperty("fromResourcePath") String fromResourcePath,
            @JsonProperty("fromResourceName") String fromResourceName,
            @JsonProperty("propertyPath") String propertyPath,
            @JsonProperty("targetPath") String targetPath,
            @JsonProperty("targetName") String targetName,
            @JsonProperty("targetResourceType") String targetResourceType
    ) {
        this.fromResourcePath = fromResourcePath;
        this.fromResourceName = fromResourceName;
        this.propertyPath = propertyPath;
        this.targetPath = targetPath;
        this.targetName = targetName;
        this.targetResourceType = targetResourceType;
    }

    /** Copy with the target's resolved type (and name, when this reference had none). */
    public AssetReference resolvedAgainst(String resourceType, String resourceName) {
        return new AssetReference(
                fromResourcePath,
                fromResourceName,
                propertyPath,
                targetPath,
                targetName != null ? targetName : resourceName,
                resourceType
        );
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AssetReference)) return false;
        AssetReference that = (AssetReference) o;
        return Objects.equals(fromResourcePath, that.fromResourcePath)
                && Objects.equals(fromResourceName, that.fromResourceName)
                && Objects.equals(propertyPath, that.propertyPath)
                && Objects.equals(targetPath, that.targetPath)
                && Objects.equals(targetName, that.targetName)
                && Objects.equals(targetResourceType, that.targetResourceType);
    }

    @Override public int hashCode() {
        return Objects.hash(fromResourcePath, fromResourceName, propertyPath, targetPath, targetName, targetResourceType);
    }

    @Override public String toString() {
        return "AssetReference{" + fromResourcePath + "#" + propertyPath + " -> " + targetPath + "}";
    }
}
