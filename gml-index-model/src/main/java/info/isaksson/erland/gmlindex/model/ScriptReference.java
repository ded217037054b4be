package info.isaksson.erland.gmlindex.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/** A call site recorded against the script it targets. */
@JsonPropertyOrder({"filePath","scopeId","targetName","targetResourcePath","location","isResolved"})
public final class ScriptReference {
    public final String filePath;
    public final String scopeId;
    public final String targetName;
    public final String targetResourcePath;
    public final SourceSpan location;

    @JsonProperty("isResolved")
    public final boolean resolved;

    @JsonCreator
    public ScriptReference(
            @JsonProperty("filePath") String filePath,
            @JsonProperty("scopeId") String scopeId,
            @JsonProperty("targetName") String targetName,
            @JsonProperty("targetResourcePath") String targetResourcePath,
            @JsonProperty("location") SourceSpan location,
            @JsonProperty("isResolved") boolean resolved
    ) {
        this.filePath = filePath;
        this.scopeId = scopeId;
        this.targetName = targetName;
        this.targetResourcePath = targetResourcePath;
        this.location = location;
        this.resolved = resolved;
    }

    public static ScriptReference fromCall(ScriptCall call) {
        return new ScriptReference(
                call.from == null ? null : call.from.filePath,
                call.from == null ? null : call.from.scopeId,
                call.target == null ? null : call.target.name,
                call.target == null ? null : call.target.resourcePath,
                call.location,
                call.resolved
        );
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ScriptReference)) return false;
        ScriptReference that = (ScriptReference) o;
        return resolved == that.resolved
                && Objects.equals(filePath, that.filePath)
                && Objects.equals(scopeId, that.scopeId)
                && Objects.equals(targetName, that.targetName)
                && Objects.equals(targetResourcePath, that.targetResourcePath)
                && Objects.equals(location, that.location);
    }

    @Override public int hashCode() {
        return Objects.hash(filePath, scopeId, targetName, targetResourcePath, location, resolved);
    }
}
