package work.lcod.markup.cli;

import java.io.IOException;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.lcod.markup.api.MarkupConfiguration;

/**
 * Shared plumbing for subcommands: configuration from the parent command and formatted output.
 */
abstract class MarkupSubcommand implements Callable<Integer> {
    @CommandLine.ParentCommand
    private MarkupCommand parent;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    MarkupConfiguration configuration() {
        return parent.configuration();
    }

    void emit(Object value) throws IOException {
        parent.emit(spec.commandLine().getOut(), value);
    }
}
