package work.lcod.markup.api;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import work.lcod.markup.token.Token;
import work.lcod.markup.trace.ParsingTrace;
import work.lcod.markup.tree.TreeNode;

/**
 * Result of {@link MarkupParser#parseWithTrace(String)}: the token list, the frozen tree and the finished trace.
 */
public record ParseOutcome(List<Token> tokens, TreeNode tree, ParsingTrace trace) {
    public ParseOutcome {
        tokens = List.copyOf(tokens);
    }

    public Map<String, Object> toMap() {
        List<Map<String, Object>> serializedTokens = new ArrayList<>(tokens.size());
        for (Token token : tokens) {
            serializedTokens.add(token.toMap());
        }
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("tokens", serializedTokens);
        map.put("tree", tree.serialize());
        map.put("trace", trace.toMap());
        return map;
    }
}
