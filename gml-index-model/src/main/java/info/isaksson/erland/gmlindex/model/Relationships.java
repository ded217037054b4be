package info.isaksson.erland.gmlindex.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/** Project-wide edge lists. */
@JsonPropertyOrder({"scriptCalls","assetReferences"})
public final class Relationships {
    public final List<ScriptCall> scriptCalls;
    public final List<AssetReference> assetReferences;

    @JsonCreator
    public Relationships(
            @JsonProperty("scriptCalls") List<ScriptCall> scriptCalls,
            @JsonProperty("assetReferences") List<AssetReference> assetReferences
    ) {
        this.scriptCalls = scriptCalls == null ? List.of() : List.copyOf(scriptCalls);
        this.assetReferences = assetReferences == null ? List.of() : List.copyOf(assetReferences);
    }

    public static Relationships empty() {
        return new Relationships(List.of(), List.of());
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Relationships)) return false;
        Relationships that = (Relationships) o;
        return Objects.equals(scriptCalls, that.scriptCalls) && Objects.equals(assetReferences, that.assetReferences);
    }

    @Override public int hashCode() {
        return Objects.hash(scriptCalls, assetReferences);
    }
}
