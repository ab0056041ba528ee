package work.lcod.markup.cli;

import picocli.CommandLine;

abstract class InputSubcommand extends MarkupSubcommand {
    @CommandLine.Mixin
    private InputOptions input;

    String readInput() {
        return input.read(spec.commandLine());
    }
}
