package work.lcod.markup.api;

import java.util.List;
import work.lcod.markup.token.Token;
import work.lcod.markup.token.Tokenizer;
import work.lcod.markup.trace.ParsingTrace;
import work.lcod.markup.tree.TreeBuilder;
import work.lcod.markup.tree.TreeNode;

/**
 * Public entry point for tokenizing and parsing markup.
 *
 * <p>Every call creates its own trace, tokenizer and open-element stack, so one instance can be used from several
 * threads at once.
 */
public final class MarkupParser {
    public List<Token> tokenize(String input) {
        return new Tokenizer(new ParsingTrace()).tokenize(input);
    }

    public TreeNode parse(String input) {
        return parseWithTrace(input).tree();
    }

    public ParseOutcome parseWithTrace(String input) {
        var trace = new ParsingTrace();
        var tokens = new Tokenizer(trace).tokenize(input);
        var tree = new TreeBuilder(trace).build(tokens);
        trace.finish();
        return new ParseOutcome(tokens, tree, trace);
    }
}
