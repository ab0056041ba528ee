package work.lcod.markup.cli;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import picocli.CommandLine;
import work.lcod.markup.api.MarkupParser;
import work.lcod.markup.token.Token;

@CommandLine.Command(
    name = "tokenize",
    description = "Print the token stream of a document.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class TokenizeCommand extends InputSubcommand {
    @Override
    public Integer call() throws Exception {
        configuration();
        List<Map<String, Object>> tokens = new ArrayList<>();
        for (Token token : new MarkupParser().tokenize(readInput())) {
            tokens.add(token.toMap());
        }
        emit(tokens);
        return 0;
    }
}
