package work.lcod.markup.fuzz;

import work.lcod.markup.api.MarkupParser;
import work.lcod.markup.sandbox.SandboxResult;

/**
 * Strategy used by {@link StressRunner} to parse one generated document.
 */
@FunctionalInterface
public interface ParseInvoker {
    SandboxResult invoke(String input);

    /**
     * Parses in the calling thread; only for inputs already known to be harmless.
     */
    static ParseInvoker inProcess(MarkupParser parser) {
        return input -> SandboxResult.completed(parser.parse(input).serialize(), ProcessHandle.current().pid());
    }
}
