package work.lcod.markup.tree;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.function.Consumer;

/**
 * Iterative tree walks shared by the builder and the verifiers.
 */
public final class TreeMetrics {
    private TreeMetrics() {}

    /**
     * Node count and maximum depth in one walk; a lone root has depth 1.
     */
    public static Summary summarize(TreeNode root) {
        if (root == null) {
            return new Summary(0, 0);
        }
        int count = 0;
        int maxDepth = 0;
        Deque<Frame> pending = new ArrayDeque<>();
        pending.push(new Frame(root, 1));
        while (!pending.isEmpty()) {
            Frame frame = pending.pop();
            count++;
            maxDepth = Math.max(maxDepth, frame.depth());
            for (TreeNode child : frame.node().children()) {
                pending.push(new Frame(child, frame.depth() + 1));
            }
        }
        return new Summary(count, maxDepth);
    }

    /**
     * Visits {@code root} and its descendants in document (pre-)order.
     */
    public static void preOrder(TreeNode root, Consumer<TreeNode> visitor) {
        if (root == null) {
            return;
        }
        Deque<TreeNode> pending = new ArrayDeque<>();
        pending.push(root);
        while (!pending.isEmpty()) {
            TreeNode node = pending.pop();
            visitor.accept(node);
            var children = node.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                pending.push(children.get(i));
            }
        }
    }

    public record Summary(int nodeCount, int maxDepth) {}

    private record Frame(TreeNode node, int depth) {}
}
