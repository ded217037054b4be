package info.isaksson.erland.gmlindex.syntax;

import info.isaksson.erland.gmlindex.model.SourceLocation;

import java.util.List;

/** {@code NAME} or {@code NAME = initializer} inside an enum body. */
public final class EnumMemberNode extends GmlNode {
    public final IdentifierNode name;
    public final GmlNode initializer;

    public EnumMemberNode(IdentifierNode name, GmlNode initializer, SourceLocation start, SourceLocation end) {
        super(NodeKind.ENUM_MEMBER, start, end);
        this.name = name;
        this.initializer = initializer;
    }

    @Override public List<GmlNode> children() {
        return nonNull(name, initializer);
    }
}
