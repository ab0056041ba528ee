package work.lcod.markup.cli;

import picocli.CommandLine;
import work.lcod.markup.api.MarkupParser;

@CommandLine.Command(
    name = "parse",
    description = "Parse a document and print the serialized tree.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class ParseCommand extends InputSubcommand {
    @CommandLine.Option(names = "--trace", description = "Include tokens and the execution trace.")
    private boolean trace;

    @Override
    public Integer call() throws Exception {
        configuration();
        var parser = new MarkupParser();
        String input = readInput();
        if (trace) {
            emit(parser.parseWithTrace(input).toMap());
        } else {
            emit(parser.parse(input).serialize());
        }
        return 0;
    }
}
