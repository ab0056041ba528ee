package work.lcod.markup.tree;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Detached, serializable copy of a {@link TreeNode} subtree: {@code {name, attributes, text_content, children}}.
 * Conversions to and from {@link TreeNode} and JSON ({@link SerializedNodeJson}) are iterative.
 */
@JsonSerialize(using = SerializedNodeJson.Writer.class)
@JsonDeserialize(using = SerializedNodeJson.Reader.class)
public record SerializedNode(
    String name,
    Map<String, String> attributes,
    String textContent,
    List<SerializedNode> children
) {
    public SerializedNode {
        Objects.requireNonNull(name, "name");
        attributes = attributes == null || attributes.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        textContent = textContent == null ? "" : textContent;
        children = children == null ? List.of() : List.copyOf(children);
    }

    public static SerializedNode of(TreeNode root) {
        Objects.requireNonNull(root, "root");
        Map<TreeNode, SerializedNode> done = new IdentityHashMap<>();
        Deque<TreeNode> pending = new ArrayDeque<>();
        pending.push(root);
        while (!pending.isEmpty()) {
            TreeNode node = pending.peek();
            boolean ready = true;
            List<TreeNode> nodeChildren = node.children();
            for (int i = nodeChildren.size() - 1; i >= 0; i--) {
                TreeNode child = nodeChildren.get(i);
                if (!done.containsKey(child)) {
                    pending.push(child);
                    ready = false;
                }
            }
            if (!ready) {
                continue;
            }
            pending.pop();
            List<SerializedNode> serializedChildren = new ArrayList<>(nodeChildren.size());
            for (TreeNode child : nodeChildren) {
                serializedChildren.add(done.remove(child));
            }
            done.put(node, new SerializedNode(node.name(), node.attributes(), node.textContent(), serializedChildren));
        }
        return done.get(root);
    }

    /**
     * Rebuilds a mutable {@link TreeNode} graph from this record.
     */
    public TreeNode toTree() {
        TreeNode root = new TreeNode(name, attributes).appendText(textContent);
        Deque<Map.Entry<SerializedNode, TreeNode>> pending = new ArrayDeque<>();
        pending.push(Map.entry(this, root));
        while (!pending.isEmpty()) {
            var entry = pending.pop();
            TreeNode parent = entry.getValue();
            for (SerializedNode child : entry.getKey().children()) {
                TreeNode node = parent.appendChild(new TreeNode(child.name(), child.attributes()).appendText(child.textContent()));
                pending.push(Map.entry(child, node));
            }
        }
        return root;
    }
}
