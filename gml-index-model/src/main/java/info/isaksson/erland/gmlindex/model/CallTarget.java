package info.isaksson.erland.gmlindex.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/** Callee of a script call. {@code scopeId} and {@code resourcePath} are null when unresolved. */
@JsonPropertyOrder({"name","scopeId","resourcePath"})
public final class CallTarget {
    public final String name;
    public final String scopeId;
    public final String resourcePath;

    @JsonCreator
    public CallTarget(
            @JsonProperty("name") String name,
            @JsonProperty("scopeId") String scopeId,
            @JsonProperty("resourcePath") String resourcePath
    ) {
        this.name = name;
        this.scopeId = scopeId;
        this.resourcePath = resourcePath;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CallTarget)) return false;
        CallTarget that = (CallTarget) o;
        return Objects.equals(name, that.name) && Objects.equals(scopeId, that.scopeId) && Objects.equals(resourcePath, that.resourcePath);
    }

    @Override public int hashCode() {
        return Objects.hash(name, scopeId, resourcePath);
    }
}
