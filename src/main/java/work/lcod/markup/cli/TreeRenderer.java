package work.lcod.markup.cli;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import picocli.CommandLine.Help.Ansi;
import work.lcod.markup.tree.TreeNode;

/**
 * Renders a tree as indented markup, one tag per line, with ANSI colors when the terminal supports them.
 */
final class TreeRenderer {
    private static final String INDENT = "  ";

    private final boolean colored;

    TreeRenderer(Ansi ansi) {
        this.colored = ansi.enabled();
    }

    String render(TreeNode root) {
        var out = new StringBuilder();
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(root, 0, false));
        while (!stack.isEmpty()) {
            Frame frame = stack.pop();
            TreeNode node = frame.node();
            String prefix = INDENT.repeat(frame.depth());
            if (frame.closing()) {
                out.append(prefix).append(style(Ansi.Style.fg_blue, "</" + node.name() + ">")).append('\n');
                continue;
            }
            out.append(prefix).append(openTag(node)).append('\n');
            String text = node.textContent().strip();
            if (!text.isEmpty()) {
                out.append(prefix).append(INDENT).append(text).append('\n');
            }
            stack.push(new Frame(node, frame.depth(), true));
            List<TreeNode> children = node.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(new Frame(children.get(i), frame.depth() + 1, false));
            }
        }
        return out.toString();
    }

    private String openTag(TreeNode node) {
        var tag = new StringBuilder(style(Ansi.Style.fg_blue, "<" + node.name()));
        for (Map.Entry<String, String> attribute : node.attributes().entrySet()) {
            tag.append(' ')
                .append(style(Ansi.Style.fg_green, attribute.getKey() + "="))
                .append(style(Ansi.Style.fg_yellow, "\"" + attribute.getValue() + "\""));
        }
        return tag.append(style(Ansi.Style.fg_blue, ">")).toString();
    }

    private String style(Ansi.Style style, String text) {
        return colored ? style.on() + text + style.off() : text;
    }

    private record Frame(TreeNode node, int depth, boolean closing) {}
}
