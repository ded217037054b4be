package info.isaksson.erland.gmlindex.syntax;

import info.isaksson.erland.gmlindex.model.SourceLocation;

import java.util.List;

/** {@code left op right} for {@code =} and the compound assignment operators. */
public final class AssignmentNode extends GmlNode {
    public final String operator;
    public final GmlNode left;
    public final GmlNode right;

    public AssignmentNode(String operator, GmlNode left, GmlNode right, SourceLocation start, SourceLocation end) {
        super(NodeKind.ASSIGNMENT, start, end);
        this.operator = operator;
        this.left = left;
        this.right = right;
    }

    @Override public List<GmlNode> children() {
        return nonNull(left, right);
    }
}
