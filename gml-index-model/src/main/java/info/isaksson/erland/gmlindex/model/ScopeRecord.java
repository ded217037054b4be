package info.isaksson.erland.gmlindex.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/**
 * A unit of identifier visibility: one per script resource, one per object event, or one per
 * source file that no manifest claims.
 */
@JsonPropertyOrder({"id","kind","name","displayName","resourcePath","event","filePaths",
        "declarations","references","ignoredIdentifiers","scriptCalls"})
public final class ScopeRecord {
    public final String id;
    public final ScopeKind kind;
    public final String name;
    public final String displayName;
    public final String resourcePath;
    public final EventInfo event;
    public final List<String> filePaths;
    public final List<IdentifierOccurrence> declarations;
    public final List<IdentifierOccurrence> references;
    public final List<IdentifierOccurrence> ignoredIdentifiers;
    public final List<ScriptCall> scriptCalls;

    @JsonCreator
    public ScopeRecord(
            @JsonProperty("id") String id,
            @JsonProperty("kind") ScopeKind kind,
            @JsonProperty("name") String name,
            @JsonProperty("displayName") String displayName,
            @JsonProperty("resourcePath") String resourcePath,
            @JsonProperty("event") EventInfo event,
            @JsonProperty("filePaths") List<String> filePaths,
            @JsonProperty("declarations") List<IdentifierOccurrence> declarations,
            @JsonProperty("references") List<IdentifierOccurrence> references,
            @JsonProperty("ignoredIdentifiers") List<IdentifierOccurrence> ignoredIdentifiers,
            @JsonProperty("scriptCalls") List<ScriptCall> scriptCalls
    ) {
        this.id = id;
        this.kind = kind;
        this.name = name;
        this.displayName = displayName;
        this.resourcePath = resourcePath;
        this.event = event;
        this.filePaths = filePaths == null ? List.of() : List.copyOf(filePaths);
        this.declarations = declarations == null ? List.of() : List.copyOf(declarations);
        this.references = references == null ? List.of() : List.copyOf(references);
        this.ignoredIdentifiers = ignoredIdentifiers == null ? List.of() : List.copyOf(ignoredIdentifiers);
        this.scriptCalls = scriptCalls == null ? List.of() : List.copyOf(scriptCalls);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ScopeRecord)) return false;
        ScopeRecord that = (ScopeRecord) o;
        return Objects.equals(id, that.id)
                && kind == that.kind
                && Objects.equals(name, that.name)
                && Objects.equals(displayName, that.displayName)
                && Objects.equals(resourcePath, that.resourcePath)
                && Objects.equals(event, that.event)
                && Objects.equals(filePaths, that.filePaths)
                && Objects.equals(declarations, that.declarations)
                && Objects.equals(references, that.references)
                && Objects.equals(ignoredIdentifiers, that.ignoredIdentifiers)
                && Objects.equals(scriptCalls, that.scriptCalls);
    }

    @Override public int hashCode() {
        return Objects.hash(id, kind, name, displayName, resourcePath, event, filePaths, declarations, references, ignoredIdentifiers, scriptCalls);
    }

    @Override public String toString() {
        return "ScopeRecord{" + id + "}";
    }
}
