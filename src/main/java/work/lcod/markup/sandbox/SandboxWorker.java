package work.lcod.markup.sandbox;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import work.lcod.markup.api.MarkupParser;
import work.lcod.markup.shared.Json;

/**
 * Worker process entry point: reads the whole markup document from stdin, parses it and writes one
 * {@link WorkerEnvelope} as JSON to stdout.
 */
public final class SandboxWorker {
    private SandboxWorker() {}

    public static void main(String[] args) throws IOException {
        byte[] response;
        int exitCode = 0;
        try {
            String input = new String(System.in.readAllBytes(), StandardCharsets.UTF_8);
            response = Json.MAPPER.writeValueAsBytes(WorkerEnvelope.completed(new MarkupParser().parse(input).serialize()));
        } catch (Exception | StackOverflowError ex) {
            String message = ex.getMessage();
            WorkerEnvelope failure = WorkerEnvelope.failed(
                message == null || message.isBlank() ? ex.getClass().getSimpleName() : message
            );
            response = Json.MAPPER.writeValueAsBytes(failure);
            exitCode = 1;
        }
        OutputStream out = System.out;
        out.write(response);
        out.flush();
        System.exit(exitCode);
    }
}
