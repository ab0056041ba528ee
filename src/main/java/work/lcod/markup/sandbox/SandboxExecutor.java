package work.lcod.markup.sandbox;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;
import work.lcod.markup.api.MarkupConfiguration;
import work.lcod.markup.shared.DurationParser;
import work.lcod.markup.shared.Json;

/**
 * Runs a parse in a separate JVM so that a runaway loop or a crash cannot take the caller down.
 *
 * <p>Each call starts one worker. The input is copied into a private temp file wired to the worker's stdin and the
 * worker answers with a single JSON envelope on stdout, which is redirected to a second temp file. The caller waits at
 * most the given timeout; a worker still running after that is destroyed together with its descendants. Callers
 * always get a {@link SandboxResult}; nothing is thrown for worker failures.
 */
public final class SandboxExecutor {
    private static final Logger LOGGER = Logger.getLogger(SandboxExecutor.class.getName());
    private static final Duration REAP_TIMEOUT = Duration.ofSeconds(10);

    private final WorkerCommand command;

    public SandboxExecutor(WorkerCommand command) {
        this.command = Objects.requireNonNull(command, "command");
    }

    public static SandboxExecutor from(MarkupConfiguration configuration) {
        return new SandboxExecutor(WorkerCommand.from(configuration));
    }

    public SandboxResult safeParse(String input, double timeoutSeconds) {
        return safeParse(input, DurationParser.ofSeconds(timeoutSeconds));
    }

    public SandboxResult safeParse(String input, Duration timeout) {
        Objects.requireNonNull(timeout, "timeout");
        Path inputFile = null;
        Path outputFile = null;
        Path errorFile = null;
        Process process = null;
        try {
            inputFile = Files.createTempFile("markup-sandbox-", ".in");
            outputFile = Files.createTempFile("markup-sandbox-", ".out");
            errorFile = Files.createTempFile("markup-sandbox-", ".err");
            Files.writeString(inputFile, input == null ? "" : input, StandardCharsets.UTF_8);

            process = new ProcessBuilder(command.toCommandLine())
                .redirectInput(inputFile.toFile())
                .redirectOutput(outputFile.toFile())
                .redirectError(errorFile.toFile())
                .start();
            long pid = process.pid();
            LOGGER.fine(() -> "Started parser worker " + pid + " (" + command.mainClass() + ")");

            if (!process.waitFor(timeout.toNanos(), TimeUnit.NANOSECONDS)) {
                terminate(process);
                String seconds = DurationParser.toSecondsLabel(timeout);
                LOGGER.warning(() -> "Parser worker " + pid + " exceeded " + seconds + "s and was terminated");
                return SandboxResult.timedOut("Parsing timed out after " + seconds + " seconds", pid);
            }
            return collect(outputFile, errorFile, process.exitValue(), pid);
        } catch (IOException ex) {
            LOGGER.log(Level.WARNING, "Unable to run parser worker", ex);
            return SandboxResult.workerFailed("Unable to run parser worker: " + ex.getMessage(), process == null ? -1L : process.pid());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            if (process != null) {
                terminate(process);
            }
            return SandboxResult.workerFailed("Interrupted while waiting for parser worker", process == null ? -1L : process.pid());
        } finally {
            delete(inputFile);
            delete(outputFile);
            delete(errorFile);
        }
    }

    private SandboxResult collect(Path outputFile, Path errorFile, int exitCode, long pid) throws IOException {
        if (Files.size(outputFile) == 0) {
            logWorkerError(errorFile, pid);
            return SandboxResult.workerFailed("Parser failed to return result (worker exit code " + exitCode + ")", pid);
        }
        WorkerEnvelope envelope;
        try {
            envelope = Json.MAPPER.readValue(outputFile.toFile(), WorkerEnvelope.class);
        } catch (IOException ex) {
            logWorkerError(errorFile, pid);
            return SandboxResult.workerFailed("Parser worker returned an unreadable result: " + ex.getMessage(), pid);
        }
        if (envelope.success() && envelope.tree() != null) {
            return SandboxResult.completed(envelope.tree(), pid);
        }
        String error = envelope.error();
        return SandboxResult.workerFailed(error == null || error.isBlank() ? "Parser failed to return result" : error, pid);
    }

    private static void terminate(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
        try {
            if (!process.waitFor(REAP_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
                LOGGER.warning(() -> "Parser worker " + process.pid() + " did not exit after being destroyed");
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
    }

    private static void logWorkerError(Path errorFile, long pid) throws IOException {
        if (LOGGER.isLoggable(Level.FINE) && Files.size(errorFile) > 0) {
            LOGGER.fine("Parser worker " + pid + " stderr:\n" + Files.readString(errorFile, StandardCharsets.UTF_8));
        }
    }

    private static void delete(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException ex) {
            LOGGER.log(Level.FINE, "Unable to delete sandbox file " + file, ex);
        }
    }
}
