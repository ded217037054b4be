package info.isaksson.erland.gmlindex.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/** An enum member, keyed by its own declaration location and linked to the owning enum's key. */
@JsonPropertyOrder({"identifierId","key","name","enumKey","enumName","filePath","declarations","references"})
public final class EnumMemberEntry implements IdentifierEntry {
    public final String identifierId;
    public final String key;
    public final String name;
    public final String enumKey;
    public final String enumName;
    public final String filePath;
    public final List<IdentifierOccurrence> declarations;
    public final List<IdentifierOccurrence> references;

    @JsonCreator
    public EnumMemberEntry(
            @JsonProperty("identifierId") String identifierId,
            @JsonProperty("key") String key,
            @JsonProperty("name") String name,
            @JsonProperty("enumKey") String enumKey,
            @JsonProperty("enumName") String enumName,
            @JsonProperty("filePath") String filePath,
            @JsonProperty("declarations") List<IdentifierOccurrence> declarations,
            @JsonProperty("references") List<IdentifierOccurrence> references
    ) {
        this.identifierId = identifierId != null ? identifierId : IdentifierCategory.ENUM_MEMBER.identifierId(key);
        this.key = key;
        this.name = name;
        this.enumKey = enumKey;
        this.enumName = enumName;
        this.filePath = filePath;
        this.declarations = declarations == null ? List.of() : List.copyOf(declarations);
        this.references = references == null ? List.of() : List.copyOf(references);
    }

    @Override public IdentifierCategory category() { return IdentifierCategory.ENUM_MEMBER; }
    @Override public String identifierId() { return identifierId; }
    @Override public String name() { return name; }
    @Override public List<IdentifierOccurrence> declarations() { return declarations; }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EnumMemberEntry)) return false;
        EnumMemberEntry that = (EnumMemberEntry) o;
        return Objects.equals(identifierId, that.identifierId)
                && Objects.equals(key, that.key)
                && Objects.equals(name, that.name)
                && Objects.equals(enumKey, that.enumKey)
                && Objects.equals(enumName, that.enumName)
                && Objects.equals(filePath, that.filePath)
                && Objects.equals(declarations, that.declarations)
                && Objects.equals(references, that.references);
    }

    @Override public int hashCode() {
        return Objects.hash(identifierId, key, name, enumKey, enumName, filePath, declarations, references);
    }
}
