package work.lcod.markup.tree;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import work.lcod.markup.token.Token;
import work.lcod.markup.token.TokenType;
import work.lcod.markup.trace.ParsingTrace;
import work.lcod.markup.trace.TraceEventKind;

/**
 * Turns a token list into a {@link TreeNode} graph using an explicit stack of open elements.
 *
 * <p>The only recovery rule is the implicit closure of {@code <p>} before a block-level start tag. Closing an element,
 * explicitly or implicitly, removes just that element from the stack; elements opened inside it stay open and keep
 * receiving content. Unmatched end tags are ignored. The builder never fails: any token list yields a frozen tree rooted at {@link TreeNode#ROOT_NAME}.
 */
public final class TreeBuilder {
    public static final Set<String> BLOCK_ELEMENTS = Set.of(
        "div", "blockquote", "section", "article", "nav", "aside",
        "header", "footer", "h1", "h2", "h3", "h4", "h5", "h6"
    );

    private final ParsingTrace trace;

    public TreeBuilder(ParsingTrace trace) {
        this.trace = Objects.requireNonNull(trace, "trace");
    }

    public TreeNode build(List<Token> tokens) {
        trace.record(TraceEventKind.PARSING_START, Map.of("token_count", tokens.size()));
        TreeNode root = TreeNode.root();
        List<TreeNode> openElements = new ArrayList<>();
        openElements.add(root);

        for (Token token : tokens) {
            if (token.type() == TokenType.EOF) {
                break;
            }
            switch (token.type()) {
                case START_TAG -> processStartTag(token, openElements);
                case END_TAG -> processEndTag(token, openElements);
                case CHARACTER -> processCharacter(token, openElements);
                default -> {
                    // doctype, comment and error tokens carry nothing for the tree
                }
            }
        }

        TreeMetrics.Summary summary = TreeMetrics.summarize(root);
        trace.record(TraceEventKind.PARSING_COMPLETE, Map.of(
            "tree_depth", summary.maxDepth(),
            "node_count", summary.nodeCount()
        ));
        return root.freeze();
    }

    private void processStartTag(Token token, List<TreeNode> openElements) {
        String name = token.name() == null ? "" : token.name();
        if (BLOCK_ELEMENTS.contains(name)) {
            int paragraph = indexOfOpen("p", openElements);
            if (paragraph > 0) {
                openElements.remove(paragraph);
                trace.record(TraceEventKind.IMPLICIT_CLOSURE, Map.of("before_tag", name));
            }
        }

        TreeNode node = new TreeNode(name, token.attributes());
        current(openElements).appendChild(node);
        if (!token.selfClosing()) {
            openElements.add(node);
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("tag", name);
        details.put("attributes", token.attributes());
        details.put("self_closing", token.selfClosing());
        trace.record(TraceEventKind.START_TAG_PROCESSED, details);
    }

    private void processEndTag(Token token, List<TreeNode> openElements) {
        String name = token.name() == null ? "" : token.name();
        int index = indexOfOpen(name, openElements);
        if (index > 0) {
            openElements.remove(index);
        }
        trace.record(TraceEventKind.END_TAG_PROCESSED, Map.of("tag", name, "matched", index > 0));
    }

    private void processCharacter(Token token, List<TreeNode> openElements) {
        if (token.data() == null || token.data().isEmpty()) {
            return;
        }
        current(openElements).appendText(token.data());
        trace.record(TraceEventKind.CHARACTER_PROCESSED, Map.of("char", token.data()));
    }

    private static TreeNode current(List<TreeNode> openElements) {
        return openElements.get(openElements.size() - 1);
    }

    /**
     * Index of the innermost open element named {@code name}, or -1. The root (index 0) never matches.
     */
    private static int indexOfOpen(String name, List<TreeNode> openElements) {
        for (int i = openElements.size() - 1; i > 0; i--) {
            if (openElements.get(i).name().equals(name)) {
                return i;
            }
        }
        return -1;
    }
}
