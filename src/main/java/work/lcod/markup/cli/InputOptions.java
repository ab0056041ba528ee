package work.lcod.markup.cli;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import picocli.CommandLine;

/**
 * Where a subcommand reads its markup from: a file, stdin ({@code -}) or an inline {@code --html} value.
 */
final class InputOptions {
    @CommandLine.Parameters(
        index = "0",
        arity = "0..1",
        paramLabel = "PATH|-",
        description = "Markup file; use '-' to read from stdin."
    )
    private String path;

    @CommandLine.Option(
        names = "--html",
        paramLabel = "MARKUP",
        description = "Inline markup instead of a file."
    )
    private String html;

    String read(CommandLine commandLine) {
        if (html != null) {
            if (path != null) {
                throw new CommandLine.ParameterException(commandLine, "Use either PATH or --html, not both.");
            }
            return html;
        }
        if (path == null || path.isBlank()) {
            throw new CommandLine.ParameterException(commandLine, "Markup input is required (PATH, '-' or --html).");
        }
        if ("-".equals(path)) {
            try {
                return new String(System.in.readAllBytes(), StandardCharsets.UTF_8);
            } catch (IOException ex) {
                throw new CommandLine.ExecutionException(commandLine, "Unable to read stdin: " + ex.getMessage(), ex);
            }
        }
        Path file = Paths.get(path).toAbsolutePath().normalize();
        if (!Files.isRegularFile(file)) {
            throw new CommandLine.ParameterException(commandLine, "Markup file not found: " + file);
        }
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new CommandLine.ParameterException(commandLine, "Cannot read markup file: " + file);
        }
    }
}
