package info.isaksson.erland.gmlindex.syntax;

import info.isaksson.erland.gmlindex.model.SourceLocation;

import java.util.List;

/** {@code object.property} or, when {@code computed}, {@code object[property]}. */
public final class MemberExpressionNode extends GmlNode {
    public final GmlNode object;
    public final GmlNode property;
    public final boolean computed;

    public MemberExpressionNode(GmlNode object, GmlNode property, boolean computed, SourceLocation start, SourceLocation end) {
        super(NodeKind.MEMBER_EXPRESSION, start, end);
        this.object = object;
        this.property = property;
        this.computed = computed;
    }

    @Override public List<GmlNode> children() {
        return nonNull(object, property);
    }
}
