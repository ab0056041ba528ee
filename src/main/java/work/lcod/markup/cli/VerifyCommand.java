package work.lcod.markup.cli;

import picocli.CommandLine;
import work.lcod.markup.api.MarkupConfiguration;
import work.lcod.markup.api.MarkupParser;
import work.lcod.markup.verify.IntegrityReport;
import work.lcod.markup.verify.IntegrityVerifier;

@CommandLine.Command(
    name = "verify",
    description = "Check tree depth and node count against the configured limits.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class VerifyCommand extends InputSubcommand {
    @CommandLine.Option(names = "--max-depth", description = "Override the configured depth limit.")
    private Integer maxDepth;

    @CommandLine.Option(names = "--max-nodes", description = "Override the configured node limit.")
    private Integer maxNodes;

    @Override
    public Integer call() throws Exception {
        MarkupConfiguration config = configuration();
        var verifier = new IntegrityVerifier(
            maxDepth != null ? maxDepth : config.maxDepth(),
            maxNodes != null ? maxNodes : config.maxNodes()
        );
        IntegrityReport report = verifier.verify(new MarkupParser().parse(readInput()));
        emit(report.toMap());
        return report.valid() ? 0 : 1;
    }
}
