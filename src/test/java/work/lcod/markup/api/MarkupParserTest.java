package work.lcod.markup.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.lcod.markup.token.TokenType;
import work.lcod.markup.trace.TraceEventKind;
import work.lcod.markup.tree.TreeNode;
import work.lcod.markup.verify.DifferentialOracle;

class MarkupParserTest {
    private final MarkupParser parser = new MarkupParser();

    @Test
    void tagCaseDoesNotChangeTheTree() {
        TreeNode upper = parser.parse("<DIV><P>x</P></DIV>");
        TreeNode lower = parser.parse("<div><p>x</p></div>");
        assertEquals(DifferentialOracle.tagSequence(lower), DifferentialOracle.tagSequence(upper));
        assertEquals(lower.serialize(), upper.serialize());
    }

    @Test
    void tokenizeEndsWithEof() {
        var tokens = parser.tokenize("<b>x</b>");
        assertEquals(TokenType.EOF, tokens.get(tokens.size() - 1).type());
        assertEquals(4, tokens.size());
    }

    @Test
    void parseWithTraceReturnsAllThreeParts() {
        ParseOutcome outcome = parser.parseWithTrace("<p>Text<div>Block</div>");
        assertEquals(TokenType.EOF, outcome.tokens().get(outcome.tokens().size() - 1).type());
        assertEquals(List.of("p", "div"), outcome.tree().children().stream().map(TreeNode::name).toList());
        assertTrue(outcome.trace().isFinished());
        assertEquals(1, outcome.trace().count(TraceEventKind.TOKENIZATION_START));
        assertEquals(1, outcome.trace().count(TraceEventKind.IMPLICIT_CLOSURE));
        assertEquals(TraceEventKind.PARSING_COMPLETE, outcome.trace().events().get(outcome.trace().events().size() - 1).kind());
    }

    @Test
    void eachCallGetsItsOwnTrace() {
        ParseOutcome first = parser.parseWithTrace("<p>");
        ParseOutcome second = parser.parseWithTrace("<p>");
        assertNotSame(first.trace(), second.trace());
        assertEquals(first.trace().events().size(), second.trace().events().size());
    }

    @Test
    void outcomeMapHasTokensTreeAndTrace() {
        Map<String, Object> map = parser.parseWithTrace("<i>x</i>").toMap();
        assertEquals(List.of("tokens", "tree", "trace"), List.copyOf(map.keySet()));
    }
}
