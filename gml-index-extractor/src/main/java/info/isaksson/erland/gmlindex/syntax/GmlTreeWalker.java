package info.isaksson.erland.gmlindex.syntax;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.function.Consumer;

/** Pre-order traversal in source order. Iterative, so tree depth is not bounded by the call stack. */
public final class GmlTreeWalker {

    private GmlTreeWalker() {}

    public static void walk(GmlNode root, Consumer<GmlNode> visitor) {
        if (root == null) return;
        Deque<GmlNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            GmlNode node = stack.pop();
            visitor.accept(node);
            List<GmlNode> children = node.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                GmlNode child = children.get(i);
                if (child != null) stack.push(child);
            }
        }
    }
}
