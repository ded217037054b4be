package info.isaksson.erland.gmlindex.syntax;

import info.isaksson.erland.gmlindex.model.SourceLocation;

import java.util.List;

/**
 * Generic node for syntax the indexer does not inspect by shape. {@code label} names the
 * construct ({@code Program}, {@code Block}, {@code WithStatement}, {@code Literal}, ...).
 */
public final class ContainerNode extends GmlNode {
    public static final String PROGRAM = "Program";

    public final String label;
    public final List<GmlNode> children;

    public ContainerNode(String label, List<GmlNode> children, SourceLocation start, SourceLocation end) {
        super(NodeKind.CONTAINER, start, end);
        this.label = label;
        this.children = children == null ? List.of() : List.copyOf(children);
    }

    @Override public List<GmlNode> children() {
        return children;
    }

    @Override public String toString() {
        return label + children;
    }
}
