package info.isaksson.erland.gmlindex.syntax;

import info.isaksson.erland.gmlindex.model.SourceLocation;

import java.util.List;

/**
 * Base of the syntax-tree variants. Nodes are immutable once the parser returns the tree.
 *
 * <p>{@link #children()} lists direct children in source order; {@link GmlTreeWalker} relies on
 * it to visit every node.</p>
 */
public abstract class GmlNode {
    public final NodeKind kind;
    public final SourceLocation start;
    public final SourceLocation end;

    protected GmlNode(NodeKind kind, SourceLocation start, SourceLocation end) {
        this.kind = kind;
        this.start = start;
        this.end = end;
    }

    public abstract List<GmlNode> children();

    static List<GmlNode> nonNull(GmlNode... nodes) {
        java.util.ArrayList<GmlNode> out = new java.util.ArrayList<>(nodes.length);
        for (GmlNode n : nodes) {
            if (n != null) out.add(n);
        }
        return java.util.Collections.unmodifiableList(out);
    }
}
