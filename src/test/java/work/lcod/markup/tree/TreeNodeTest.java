package work.lcod.markup.tree;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class TreeNodeTest {
    @Test
    void nodeCannotBeAttachedTwice() {
        TreeNode first = new TreeNode("div");
        TreeNode second = new TreeNode("div");
        TreeNode child = first.appendChild(new TreeNode("span"));
        assertThrows(IllegalArgumentException.class, () -> second.appendChild(child));
        assertThrows(IllegalArgumentException.class, () -> first.appendChild(first));
    }

    @Test
    void freezeCoversTheWholeSubtree() {
        TreeNode root = TreeNode.root();
        TreeNode leaf = root.appendChild(new TreeNode("div")).appendChild(new TreeNode("b"));
        root.freeze();
        assertTrue(leaf.isFrozen());
        assertThrows(IllegalStateException.class, () -> leaf.appendText("late"));
    }

    @Test
    void missingAttributeIsEmpty() {
        TreeNode node = new TreeNode("img");
        assertTrue(node.attribute("alt").isEmpty());
        assertEquals("img", node.toString());
    }
}
