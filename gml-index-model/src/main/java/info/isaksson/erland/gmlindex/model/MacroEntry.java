package info.isaksson.erland.gmlindex.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

@JsonPropertyOrder({"identifierId","name","declarations","references"})
public final class MacroEntry implements IdentifierEntry {
    public final String identifierId;
    public final String name;
    public final List<IdentifierOccurrence> declarations;
    public final List<IdentifierOccurrence> references;

    @JsonCreator
    public MacroEntry(
            @JsonProperty("identifierId") String identifierId,
            @JsonProperty("name") String name,
            @JsonProperty("declarations") List<IdentifierOccurrence> declarations,
            @JsonProperty("references") List<IdentifierOccurrence> references
    ) {
        this.identifierId = identifierId != null ? identifierId : IdentifierCategory.MACRO.identifierId(name);
        this.name = name;
        this.declarations = declarations == null ? List.of() : List.copyOf(declarations);
        this.references = references == null ? List.of() : List.copyOf(references);
    }

    @Override public IdentifierCategory category() { return IdentifierCategory.MACRO; }
    @Override public String identifierId() { return identifierId; }
    @Override public String name() { return name; }
    @Override public List<IdentifierOccurrence> declarations() { return declarations; }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MacroEntry)) return false;
        MacroEntry that = (MacroEntry) o;
        return Objects.equals(identifierId, that.identifierId)
                && Objects.equals(name, that.name)
                && Objects.equals(declarations, that.declarations)
                && Objects.equals(references, that.references);
    }

    @Override public int hashCode() {
        return Objects.hash(identifierId, name, declarations, references);
    }
}
