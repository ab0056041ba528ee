package work.lcod.markup.cli;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import java.util.logging.Handler;
import java.util.logging.Logger;
import picocli.CommandLine;
import work.lcod.markup.api.ConfigurationLoader;
import work.lcod.markup.api.LogLevel;
import work.lcod.markup.api.MarkupConfiguration;
import work.lcod.markup.shared.Json;

@CommandLine.Command(
    name = "markup",
    description = "Tokenize, parse, audit and stress-test markup documents.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true,
    subcommands = {
        TokenizeCommand.class,
        ParseCommand.class,
        AuditCommand.class,
        AccessibilityCommand.class,
        VerifyCommand.class,
        CompareCommand.class,
        SafeParseCommand.class,
        InspectCommand.class,
        FuzzCommand.class,
        StressCommand.class
    }
)
final class MarkupCommand implements Callable<Integer> {
    enum Format { json, yaml }

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(
        names = "--config",
        paramLabel = "PATH",
        description = "TOML configuration file (limits, sandbox, logging)."
    )
    private Path configPath;

    @CommandLine.Option(
        names = "--log-level",
        description = "Log threshold (trace|debug|info|warn|error|fatal); falls back to MARKUP_LOG_LEVEL."
    )
    private String logLevelRaw;

    @CommandLine.Option(
        names = "--format",
        description = "Output format: ${COMPLETION-CANDIDATES}.",
        defaultValue = "json"
    )
    private Format format = Format.json;

    private MarkupConfiguration configuration;

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getErr());
        return 2;
    }

    MarkupConfiguration configuration() {
        if (configuration != null) {
            return configuration;
        }
        MarkupConfiguration resolved = configPath == null
            ? MarkupConfiguration.defaults()
            : ConfigurationLoader.load(configPath.toAbsolutePath().normalize());
        String level = logLevelRaw;
        if (level == null || level.isBlank()) {
            level = System.getenv("MARKUP_LOG_LEVEL");
        }
        if (level != null && !level.isBlank()) {
            resolved = resolved.toBuilder().logLevel(LogLevel.from(level)).build();
        }
        applyLogLevel(resolved.logLevel());
        configuration = resolved;
        return resolved;
    }

    void emit(PrintWriter out, Object value) throws IOException {
        String rendered = format == Format.yaml
            ? Json.YAML.writeValueAsString(value)
            : Json.PRETTY.writeValueAsString(value);
        out.println(rendered.stripTrailing());
        out.flush();
    }

    private static void applyLogLevel(LogLevel level) {
        Logger root = Logger.getLogger("");
        root.setLevel(level.julLevel());
        for (Handler handler : root.getHandlers()) {
            handler.setLevel(level.julLevel());
        }
    }
}
