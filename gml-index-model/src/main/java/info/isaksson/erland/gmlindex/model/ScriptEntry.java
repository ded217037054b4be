package info.isaksson.erland.gmlindex.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/** A script (or function/constructor declared as one), keyed by its scope id. */
@JsonPropertyOrder({"identifierId","id","name","displayName","resourcePath","declarationKinds","declarations","references"})
public final class ScriptEntry implements IdentifierEntry {
    public final String identifierId;
    /** Scope id of the script. */
    public final String id;
    public final String name;
    public final String displayName;
    public final String resourcePath;
    public final List<IdentifierRole> declarationKinds;
    public final List<IdentifierOccurrence> declarations;
    public final List<ScriptReference> references;

    @JsonCreator
    public ScriptEntry(
            @JsonProperty("identifierId") String identifierId,
            @JsonProperty("id") String id,
            @JsonProperty("name") String name,
            @JsonProperty("displayName") String displayName,
            @JsonProperty("resourcePath") String resourcePath,
            @JsonProperty("declarationKinds") List<IdentifierRole> declarationKinds,
            @JsonProperty("declarations") List<IdentifierOccurrence> declarations,
            @JsonProperty("references") List<ScriptReference> references
    ) {
        this.identifierId = identifierId != null ? identifierId : IdentifierCategory.SCRIPT.identifierId(id);
        this.id = id;
        this.name = name;
        this.displayName = displayName;
        this.resourcePath = resourcePath;
        this.declarationKinds = declarationKinds == null ? List.of() : List.copyOf(declarationKinds);
        this.declarations = declarations == null ? List.of() : List.copyOf(declarations);
        this.references = references == null ? List.of() : List.copyOf(references);
    }

    @Override public IdentifierCategory category() { return IdentifierCategory.SCRIPT; }
    @Override public String identifierId() { return identifierId; }
    @Override public String name() { return name; }
    @Override public List<IdentifierOccurrence> declarations() { return declarations; }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ScriptEntry)) return false;
        ScriptEntry that = (ScriptEntry) o;
        return Objects.equals(identifierId, that.identifierId)
                && Objects.equals(id, that.id)
                && Objects.equals(name, that.name)
                && Objects.equals(displayName, that.displayName)
                && Objects.equals(resourcePath, that.resourcePath)
                && Objects.equals(declarationKinds, that.declarationKinds)
                && Objects.equals(declarations, that.declarations)
                && Objects.equals(references, that.references);
    }

    @Override public int hashCode() {
        return Objects.hash(identifierId, id, name, displayName, resourcePath, declarationKinds, declarations, references);
    }

    @Override public String toString() {
        return "ScriptEntry{" + identifierId + "}";
    }
}
