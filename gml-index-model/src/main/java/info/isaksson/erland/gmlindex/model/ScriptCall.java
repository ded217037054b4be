package info.isaksson.erland.gmlindex.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * A call edge from a scope to a (possibly unknown) script.
 *
 * <p>Unresolved calls are kept on purpose: downstream tooling uses them to spot calls into
 * missing or external code.</p>
 */
@JsonPropertyOrder({"kind","from","target","isResolved","location"})
public final class ScriptCall {
    public static final String KIND_SCRIPT = "script";
    public static final String KIND_CONSTRUCTOR = "constructor";

    public final String kind;
    public final CallSite from;
    public final CallTarget target;

    @JsonProperty("isResolved")
    public final boolean resolved;

    public final SourceSpan location;

    @JsonCreator
    public ScriptCall(
            @JsonProperty("kind") String kind,
            @JsonProperty("from") CallSite from,
            @JsonProperty("target") CallTarget target,
            @JsonProperty("isResolved") boolean resolved,
            @JsonProperty("location") SourceSpan location
    ) {
        this.kind = kind == null ? KIND_SCRIPT : kind;
        this.from = from;
        this.target = target;
        this.resolved = resolved;
        this.location = location;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ScriptCall)) return false;
        ScriptCall that = (ScriptCall) o;
        return resolved == that.resolved
                && Objects.equals(kind, that.kind)
                && Objects.equals(from, that.from)
                && Objects.equals(target, that.target)
                && Objects.equals(location, that.location);
    }

    @Override public int hashCode() {
        return Objects.hash(kind, from, target, resolved, location);
    }

    @Override public String toString() {
        return "ScriptCall{" + (from == null ? "?" : from.scopeId) + " -> " + (target == null ? "?" : target.name)
                + (resolved ? "" : " (unresolved)") + "}";
    }
}
