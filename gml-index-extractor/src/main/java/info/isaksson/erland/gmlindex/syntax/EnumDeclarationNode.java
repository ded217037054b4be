package info.isaksson.erland.gmlindex.syntax;

import info.isaksson.erland.gmlindex.model.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class EnumDeclarationNode extends GmlNode {
    public final IdentifierNode name;
    public final List<EnumMemberNode> members;

    public EnumDeclarationNode(IdentifierNode name, List<EnumMemberNode> members, SourceLocation start, SourceLocation end) {
        super(NodeKind.ENUM_DECLARATION, start, end);
        this.name = name;
        this.members = members == null ? List.of() : List.copyOf(members);
    }

    @Override public List<GmlNode> children() {
        List<GmlNode> out = new ArrayList<>(members.size() + 1);
        out.add(name);
        out.addAll(members);
        return Collections.unmodifiableList(out);
    }
}
