package info.isaksson.erland.gmlindex.syntax;

import info.isaksson.erland.gmlindex.model.DeclarationRef;
import info.isaksson.erland.gmlindex.model.IdentifierRole;
import info.isaksson.erland.gmlindex.model.SourceLocation;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * A name in the source.
 *
 * <p>{@code roles} is null for names the parser did not classify (for example the property in
 * {@code other.speed}); the indexer ignores such nodes. {@code scopeId} is the parser's own scope
 * id, local to one parse.</p>
 */
public final class IdentifierNode extends GmlNode {
    public final String name;
    public final String scopeId;
    public final Set<IdentifierRole> roles;
    public final DeclarationRef declaration;
    public final boolean globalIdentifier;

    public IdentifierNode(String name, SourceLocation start, SourceLocation end, String scopeId,
                          Collection<IdentifierRole> roles, DeclarationRef declaration, boolean globalIdentifier) {
        super(NodeKind.IDENTIFIER, start, end);
        this.name = name;
        this.scopeId = scopeId;
        this.roles = roles == null ? null
                : roles.isEmpty() ? Collections.unmodifiableSet(EnumSet.noneOf(IdentifierRole.class))
                : Collections.unmodifiableSet(EnumSet.copyOf(roles));
        this.declaration = declaration;
        this.globalIdentifier = globalIdentifier;
    }

    public boolean isClassified() {
        return roles != null;
    }

    public boolean hasRole(IdentifierRole role) {
        return roles != null && roles.contains(role);
    }

    @Override public List<GmlNode> children() {
        return List.of();
    }

    @Override public String toString() {
        return "Identifier(" + name + " " + start + " " + roles + ")";
    }
}
