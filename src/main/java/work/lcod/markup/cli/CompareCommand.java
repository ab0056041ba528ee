package work.lcod.markup.cli;

import picocli.CommandLine;
import work.lcod.markup.api.MarkupParser;
import work.lcod.markup.verify.DifferentialOracle;
import work.lcod.markup.verify.OracleReport;

@CommandLine.Command(
    name = "compare",
    description = "Compare the parsed element structure with jsoup.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class CompareCommand extends InputSubcommand {
    @Override
    public Integer call() throws Exception {
        configuration();
        String input = readInput();
        OracleReport report = new DifferentialOracle().compare(input, new MarkupParser().parse(input));
        emit(report.toMap());
        return report.matches() ? 0 : 1;
    }
}
