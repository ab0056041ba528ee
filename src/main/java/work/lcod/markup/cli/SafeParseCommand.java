package work.lcod.markup.cli;

import java.time.Duration;
import picocli.CommandLine;
import work.lcod.markup.api.MarkupConfiguration;
import work.lcod.markup.sandbox.SandboxExecutor;
import work.lcod.markup.sandbox.SandboxResult;
import work.lcod.markup.shared.DurationParser;

@CommandLine.Command(
    name = "safe-parse",
    description = "Parse in an isolated worker JVM with a timeout.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class SafeParseCommand extends InputSubcommand {
    @CommandLine.Option(names = "--timeout", description = "Worker timeout (e.g. 500ms, 5s, 1.5); overrides the configuration.")
    private String timeoutRaw;

    @Override
    public Integer call() throws Exception {
        MarkupConfiguration config = configuration();
        Duration timeout = DurationParser.parse(timeoutRaw).orElse(config.sandboxTimeout());
        SandboxResult result = SandboxExecutor.from(config).safeParse(readInput(), timeout);
        emit(result.toMap());
        return result.success() ? 0 : 1;
    }
}
