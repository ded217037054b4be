package info.isaksson.erland.gmlindex.syntax;

import info.isaksson.erland.gmlindex.model.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * {@code function name(params) [constructor] { body }}. {@code name} is null for function
 * expressions such as {@code var f = function() {}}.
 */
public final class FunctionDeclarationNode extends GmlNode {
    public final IdentifierNode name;
    public final List<IdentifierNode> parameters;
    public final GmlNode body;
    public final boolean constructor;

    public FunctionDeclarationNode(IdentifierNode name, List<IdentifierNode> parameters, GmlNode body, boolean constructor,
                                   SourceLocation start, SourceLocation end) {
        super(NodeKind.FUNCTION_DECLARATION, start, end);
        this.name = name;
        this.parameters = parameters == null ? List.of() : List.copyOf(parameters);
        this.body = body;
        this.constructor = constructor;
    }

    @Override public List<GmlNode> children() {
        List<GmlNode> out = new ArrayList<>(parameters.size() + 2);
        if (name != null) out.add(name);
        out.addAll(parameters);
        if (body != null) out.add(body);
        return Collections.unmodifiableList(out);
    }
}
