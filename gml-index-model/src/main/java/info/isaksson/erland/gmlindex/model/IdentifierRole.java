package info.isaksson.erland.gmlindex.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Role tags carried by identifier occurrences. The parser assigns them; the indexer reads them
 * (and adds {@link #SCRIPT} to the synthetic script-name declarations it creates itself).
 */
public enum IdentifierRole {
    @JsonProperty("declaration") DECLARATION,
    @JsonProperty("reference") REFERENCE,
    @JsonProperty("variable") VARIABLE,
    @JsonProperty("macro") MACRO,
    @JsonProperty("enum") ENUM,
    @JsonProperty("enum-member") ENUM_MEMBER,
    @JsonProperty("global") GLOBAL,
    @JsonProperty("instance") INSTANCE,
    @JsonProperty("script") SCRIPT,
    @JsonProperty("constructor") CONSTRUCTOR,
    @JsonProperty("struct") STRUCT,
    @JsonProperty("parameter") PARAMETER,
    @JsonProperty("local") LOCAL;

    /** Tags that describe what kind of thing was declared (everything except declaration/reference). */
    public boolean isKindTag() {
        return this != DECLARATION && this != REFERENCE;
    }

    public String wireName() {
        return name().toLowerCase(java.util.Locale.ROOT).replace('_', '-');
    }
}
