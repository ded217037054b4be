package info.isaksson.erland.gmlindex.syntax;

import info.isaksson.erland.gmlindex.model.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** {@code callee(arguments...)}. */
public final class CallExpressionNode extends GmlNode {
    public final GmlNode callee;
    public final List<GmlNode> arguments;

    public CallExpressionNode(GmlNode callee, List<GmlNode> arguments, SourceLocation start, SourceLocation end) {
        super(NodeKind.CALL_EXPRESSION, start, end);
        this.callee = callee;
        this.arguments = arguments == null ? List.of() : List.copyOf(arguments);
    }

    @Override public List<GmlNode> children() {
        List<GmlNode> out = new ArrayList<>(arguments.size() + 1);
        out.add(callee);
        out.addAll(arguments);
        return Collections.unmodifiableList(out);
    }
}
