package info.isaksson.erland.gmlindex.extract;

import info.isaksson.erland.gmlindex.model.IdentifierCategory;
import info.isaksson.erland.gmlindex.model.IdentifierOccurrence;
import info.isaksson.erland.gmlindex.model.IdentifierRole;
import info.isaksson.erland.gmlindex.model.InstanceVariableEntry;

/**
 * One occurrence destined for an identifier collection, with everything the collection builder
 * needs to key and describe the entry. Produced per file by {@link SourceFileAnalyzer}; consumed
 * single-threaded by {@link IdentifierCollectionBuilder}.
 */
public final class IdentifierContribution {
    public final IdentifierCategory category;
    /** {@link IdentifierRole#DECLARATION} or {@link IdentifierRole#REFERENCE}. */
    public final IdentifierRole role;
    public final IdentifierOccurrence occurrence;
    /** Collection key: scope id, name, location key or instance key depending on category. */
    public final String key;
    public final String name;
    public final String filePath;
    public final ScopeDescriptor scope;
    public final String enumKey;
    public final String enumName;

    private IdentifierContribution(IdentifierCategory category, IdentifierRole role, IdentifierOccurrence occurrence,
                                   String key, String name, String filePath, ScopeDescriptor scope,
                                   String enumKey, String enumName) {
        if (role != IdentifierRole.DECLARATION && role != IdentifierRole.REFERENCE) {
            throw new IllegalArgumentException("role must be DECLARATION or REFERENCE: " + role);
        }
        this.category = category;
        this.role = role;
        this.occurrence = occurrence;
        this.key = key;
        this.name = name;
        this.filePath = filePath;
        this.scope = scope;
        this.enumKey = enumKey;
        this.enumName = enumName;
    }

    public boolean isDeclaration() {
        return role == IdentifierRole.DECLARATION;
    }

    /** Declaration of the script that owns {@code scope} (the occurrence may be synthetic). */
    public static IdentifierContribution scriptDeclaration(IdentifierOccurrence occurrence, ScopeDescriptor scope) {
        return new IdentifierContribution(IdentifierCategory.SCRIPT, IdentifierRole.DECLARATION, occurrence,
                scope.id, scope.name, occurrence.filePath, scope, null, null);
    }

    public static IdentifierContribution macro(IdentifierRole role, IdentifierOccurrence occurrence) {
        return new IdentifierContribution(IdentifierCategory.MACRO, role, occurrence,
                occurrence.name, occurrence.name, occurrence.filePath, null, null, null);
    }

    public static IdentifierContribution enumType(IdentifierRole role, IdentifierOccurrence occurrence, String key, String name) {
        return new IdentifierContribution(IdentifierCategory.ENUM, role, occurrence,
                key, name, occurrence.filePath, null, null, null);
    }

    public static IdentifierContribution enumMember(IdentifierRole role, IdentifierOccurrence occurrence, String key, String name,
                                                    String enumKey, String enumName) {
        return new IdentifierContribution(IdentifierCategory.ENUM_MEMBER, role, occurrence,
                key, name, occurrence.filePath, null, enumKey, enumName);
    }

    public static IdentifierContribution global(IdentifierRole role, IdentifierOccurrence occurrence) {
        return new IdentifierContribution(IdentifierCategory.GLOBAL, role, occurrence,
                occurrence.name, occurrence.name, occurrence.filePath, null, null, null);
    }

    public static IdentifierContribution instance(IdentifierRole role, IdentifierOccurrence occurrence, ScopeDescriptor scope) {
        return new IdentifierContribution(IdentifierCategory.INSTANCE, role, occurrence,
                InstanceVariableEntry.keyFor(scope == null ? null : scope.id, occurrence.name),
                occurrence.name, occurrence.filePath, scope, null, null);
    }

    @Override public String toString() {
        return category.prefix + " " + role.wireName() + " " + key;
    }
}
