package work.lcod.markup.verify;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import work.lcod.markup.tree.TreeMetrics;
import work.lcod.markup.tree.TreeNode;

/**
 * Read-only lookups over a parsed tree, in document order.
 */
public final class Selector {
    private Selector() {}

    public static Optional<TreeNode> selectById(TreeNode root, String id) {
        Objects.requireNonNull(id, "id");
        if (root == null) {
            return Optional.empty();
        }
        Deque<TreeNode> pending = new ArrayDeque<>();
        pending.push(root);
        while (!pending.isEmpty()) {
            TreeNode node = pending.pop();
            if (id.equals(node.attributes().get("id"))) {
                return Optional.of(node);
            }
            var children = node.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                pending.push(children.get(i));
            }
        }
        return Optional.empty();
    }

    public static List<TreeNode> selectByTag(TreeNode root, String name) {
        Objects.requireNonNull(name, "name");
        List<TreeNode> matches = new ArrayList<>();
        TreeMetrics.preOrder(root, node -> {
            if (node.name().equals(name)) {
                matches.add(node);
            }
        });
        return matches;
    }
}
