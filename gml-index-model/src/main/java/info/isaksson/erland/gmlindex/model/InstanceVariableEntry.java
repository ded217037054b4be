package info.isaksson.erland.gmlindex.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/**
 * An implicit instance field of an object, keyed by {@code <scopeId>:<name>}.
 *
 * <p>Instance variables are inferred from unqualified assignments and references inside object
 * events; the same field name used by two events of one object yields two entries.</p>
 */
@JsonPropertyOrder({"identifierId","key","name","scopeId","scopeKind","declarations","references"})
public final class InstanceVariableEntry implements IdentifierEntry {
    public final String identifierId;
    public final String key;
    public final String name;
    public final String scopeId;
    public final ScopeKind scopeKind;
    public final List<IdentifierOccurrence> declarations;
    public final List<IdentifierOccurrence> references;

    @JsonCreator
    public InstanceVariableEntry(
            @JsonProperty("identifierId") String identifierId,
            @JsonProperty("key") String key,
            @JsonProperty("name") String name,
            @JsonProperty("scopeId") String scopeId,
            @JsonProperty("scopeKind") ScopeKind scopeKind,
            @JsonProperty("declarations") List<IdentifierOccurrence> declarations,
            @JsonProperty("references") List<IdentifierOccurrence> references
    ) {
        this.identifierId = identifierId != null ? identifierId : IdentifierCategory.INSTANCE.identifierId(key);
        this.key = key;
        this.name = name;
        this.scopeId = scopeId;
        this.scopeKind = scopeKind;
        this.declarations = declarations == null ? List.of() : List.copyOf(declarations);
        this.references = references == null ? List.of() : List.copyOf(references);
    }

    public static String keyFor(String scopeId, String name) {
        return (scopeId == null ? "instance" : scopeId) + ":" + name;
    }

    @Override public IdentifierCategory category() { return IdentifierCategory.INSTANCE; }
    @Override public String identifierId() { return identifierId; }
    @Override public String name() { return name; }
    @Override public List<IdentifierOccurrence> declarations() { return declarations; }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof InstanceVariableEntry)) return false;
        InstanceVariableEntry that = (InstanceVariableEntry) o;
        return Objects.equals(identifierId, that.identifierId)
                && Objects.equals(key, that.key)
                && Objects.equals(name, that.name)
                && Objects.equals(scopeId, that.scopeId)
                && scopeKind == that.scopeKind
                && Objects.equals(declarations, that.declarations)
                && Objects.equals(references, that.references);
    }

    @Override public int hashCode() {
        return Objects.hash(identifierId, key, name, scopeId, scopeKind, declarations, references);
    }
}
