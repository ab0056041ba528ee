package work.lcod.markup.tree;

import java.lang.ref.WeakReference;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Element node of a parsed document.
 *
 * <p>Children are owned by their parent; the link back to the parent is a {@link WeakReference} so that a node never
 * keeps its ancestors alive. Trees returned by {@link TreeBuilder} are frozen: every mutator throws
 * {@link IllegalStateException} afterwards.
 */
public final class TreeNode {
    public static final String ROOT_NAME = "html";

    private final String name;
    private final Map<String, String> attributes;
    private final List<TreeNode> children = new ArrayList<>();
    private final StringBuilder text = new StringBuilder();
    private WeakReference<TreeNode> parent;
    private boolean frozen;

    public TreeNode(String name) {
        this(name, Map.of());
    }

    public TreeNode(String name, Map<String, String> attributes) {
        this.name = Objects.requireNonNull(name, "name");
        this.attributes = attributes == null || attributes.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public static TreeNode root() {
        return new TreeNode(ROOT_NAME);
    }

    public String name() {
        return name;
    }

    public Map<String, String> attributes() {
        return attributes;
    }

    public Optional<String> attribute(String key) {
        return Optional.ofNullable(attributes.get(key));
    }

    public List<TreeNode> children() {
        return Collections.unmodifiableList(children);
    }

    public String textContent() {
        return text.toString();
    }

    public Optional<TreeNode> parent() {
        return parent == null ? Optional.empty() : Optional.ofNullable(parent.get());
    }

    public boolean isFrozen() {
        return frozen;
    }

    /**
     * Appends {@code child} and returns it; a node may only be attached once.
     */
    public TreeNode appendChild(TreeNode child) {
        ensureMutable();
        Objects.requireNonNull(child, "child");
        if (child == this) {
            throw new IllegalArgumentException("A node cannot be its own child");
        }
        if (child.parent != null) {
            throw new IllegalArgumentException("Node <" + child.name + "> already has a parent");
        }
        child.parent = new WeakReference<>(this);
        children.add(child);
        return child;
    }

    public TreeNode appendText(CharSequence data) {
        ensureMutable();
        text.append(data);
        return this;
    }

    /**
     * Freezes this node and its whole subtree.
     */
    public TreeNode freeze() {
        Deque<TreeNode> pending = new ArrayDeque<>();
        pending.push(this);
        while (!pending.isEmpty()) {
            TreeNode node = pending.pop();
            node.frozen = true;
            for (TreeNode child : node.children) {
                pending.push(child);
            }
        }
        return this;
    }

    public SerializedNode serialize() {
        return SerializedNode.of(this);
    }

    private void ensureMutable() {
        if (frozen) {
            throw new IllegalStateException("Tree node <" + name + "> is frozen");
        }
    }

    @Override
    public String toString() {
        return name;
    }
}
