package work.lcod.markup.cli;

import java.time.Duration;
import java.util.Random;
import picocli.CommandLine;
import work.lcod.markup.api.MarkupConfiguration;
import work.lcod.markup.api.MarkupParser;
import work.lcod.markup.fuzz.AdversarialGenerator;
import work.lcod.markup.fuzz.ParseInvoker;
import work.lcod.markup.fuzz.StressReport;
import work.lcod.markup.fuzz.StressRunner;
import work.lcod.markup.sandbox.SandboxExecutor;
import work.lcod.markup.verify.IntegrityVerifier;
import work.lcod.markup.verify.SemanticComplianceAuditor;

@CommandLine.Command(
    name = "stress",
    description = "Run generated documents through the sandbox, auditor and integrity checks.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class StressCommand extends MarkupSubcommand {
    @CommandLine.Option(names = "--iterations", defaultValue = "100", description = "Number of generated documents.")
    private int iterations;

    @CommandLine.Option(names = "--complexity", defaultValue = "10", description = "Random-walk steps per document.")
    private int complexity;

    @CommandLine.Option(names = "--seed", description = "Seed for reproducible runs.")
    private Long seed;

    @CommandLine.Option(names = "--in-process", description = "Parse in this JVM instead of sandbox workers.")
    private boolean inProcess;

    @Override
    public Integer call() throws Exception {
        MarkupConfiguration config = configuration();
        ParseInvoker invoker;
        if (inProcess) {
            invoker = ParseInvoker.inProcess(new MarkupParser());
        } else {
            SandboxExecutor sandbox = SandboxExecutor.from(config);
            Duration timeout = config.sandboxTimeout();
            invoker = input -> sandbox.safeParse(input, timeout);
        }
        var runner = new StressRunner(
            new AdversarialGenerator(seed == null ? new Random() : new Random(seed)),
            invoker,
            new SemanticComplianceAuditor(),
            IntegrityVerifier.from(config)
        );
        StressReport report = runner.run(iterations, complexity);
        emit(report.toMap());
        return report.clean() ? 0 : 1;
    }
}
