package info.isaksson.erland.gmlindex.syntax;

import java.util.Objects;

/** Parser output for one source file. */
public final class SyntaxTree {
    public final String filePath;
    public final ContainerNode root;

    public SyntaxTree(String filePath, ContainerNode root) {
        this.filePath = filePath;
        this.root = Objects.requireNonNull(root, "root");
    }
}
