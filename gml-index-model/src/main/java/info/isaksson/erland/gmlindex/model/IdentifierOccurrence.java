package info.isaksson.erland.gmlindex.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * One textual appearance of a name, as seen by the indexer.
 *
 * <p>{@code start}/{@code end} are null for synthetic occurrences (names the indexer invents,
 * such as the implicit declaration of a script's own name).</p>
 */
@JsonPropertyOrder({"name","filePath","scopeId","start","end","roles","declaration","isBuiltIn","isSynthetic","isGlobalIdentifier","reason"})
public final class IdentifierOccurrence {
    public static final String REASON_BUILT_IN = "built-in";

    public final String name;
    public final String filePath;
    public final String scopeId;
    public final SourceLocation start;
    public final SourceLocation end;
    public final Set<IdentifierRole> roles;
    public final DeclarationRef declaration;

    @JsonProperty("isBuiltIn")
    public final boolean builtIn;

    @JsonProperty("isSynthetic")
    public final boolean synthetic;

    @JsonProperty("isGlobalIdentifier")
    public final boolean globalIdentifier;

    /** Why the occurrence was set aside (e.g. {@value #REASON_BUILT_IN}); null otherwise. */
    public final String reason;

    @JsonCreator
    public IdentifierOccurrence(
            @JsonProperty("name") String name,
            @JsonProperty("filePath") String filePath,
            @JsonProperty("scopeId") String scopeId,
            @JsonProperty("start") SourceLocation start,
            @JsonProperty("end") SourceLocation end,
            @JsonProperty("roles") Collection<IdentifierRole> roles,
            @JsonProperty("declaration") DeclarationRef declaration,
            @JsonProperty("isBuiltIn") boolean builtIn,
            @JsonProperty("isSynthetic") boolean synthetic,
            @JsonProperty("isGlobalIdentifier") boolean globalIdentifier,
            @JsonProperty("reason") String reason
    ) {
        this.name = name;
        this.filePath = filePath;
        this.scopeId = scopeId;
        this.start = start;
        this.end = end;
        this.roles = roles == null || roles.isEmpty()
                ? Collections.unmodifiableSet(EnumSet.noneOf(IdentifierRole.class))
                : Collections.unmodifiableSet(EnumSet.copyOf(roles));
        this.declaration = declaration;
        this.builtIn = builtIn;
        this.synthetic = synthetic;
        this.globalIdentifier = globalIdentifier;
        this.reason = reason;
    }

    /** Synthetic declaration with no source location. */
    public static IdentifierOccurrence synthetic(String name, String filePath, String scopeId, Collection<IdentifierRole> roles) {
        return new IdentifierOccurrence(name, filePath, scopeId, null, null, roles, null, false, true, false, null);
    }

    public boolean hasRole(IdentifierRole role) {
        return roles.contains(role);
    }

    /** True when the parser resolved this occurrence to a declaration site. */
    @JsonIgnore
    public boolean hasResolvedDeclaration() {
        return declaration != null && declaration.scopeId != null;
    }

    /** Key used for declaration de-duplication; null for synthetic occurrences. */
    @JsonIgnore
    public LocationKey locationKey() {
        return LocationKey.of(filePath, start);
    }

    public IdentifierOccurrence withBuiltIn(String newReason) {
        return new IdentifierOccurrence(name, filePath, scopeId, start, end, roles, declaration, true, synthetic, globalIdentifier, newReason);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IdentifierOccurrence)) return false;
        IdentifierOccurrence that = (IdentifierOccurrence) o;
        return builtIn == that.builtIn
                && synthetic == that.synthetic
                && globalIdentifier == that.globalIdentifier
                && Objects.equals(name, that.name)
                && Objects.equals(filePath, that.filePath)
                && Objects.equals(scopeId, that.scopeId)
                && Objects.equals(start, that.start)
                && Objects.equals(end, that.end)
                && Objects.equals(roles, that.roles)
                && Objects.equals(declaration, that.declaration)
                && Objects.equals(reason, that.reason);
    }

    @Override public int hashCode() {
        return Objects.hash(name, filePath, scopeId, start, end, roles, declaration, builtIn, synthetic, globalIdentifier, reason);
    }

    @Override public String toString() {
        return "IdentifierOccurrence{" + name + " " + filePath + (start == null ? "" : " " + start) + " " + roles + "}";
    }
}
