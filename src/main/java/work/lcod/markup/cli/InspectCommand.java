package work.lcod.markup.cli;

import picocli.CommandLine;
import work.lcod.markup.api.MarkupParser;

@CommandLine.Command(
    name = "inspect",
    description = "Print the parsed tree as indented, colorized markup.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class InspectCommand extends InputSubcommand {
    @Override
    public Integer call() throws Exception {
        configuration();
        var out = spec.commandLine().getOut();
        out.print(new TreeRenderer(spec.commandLine().getColorScheme().ansi()).render(new MarkupParser().parse(readInput())));
        out.flush();
        return 0;
    }
}
