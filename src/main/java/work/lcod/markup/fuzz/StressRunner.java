package work.lcod.markup.fuzz;

import java.util.Objects;
import java.util.logging.Logger;
import work.lcod.markup.sandbox.SandboxResult;
import work.lcod.markup.tree.TreeNode;
import work.lcod.markup.verify.IntegrityVerifier;
import work.lcod.markup.verify.SemanticComplianceAuditor;

/**
 * Feeds generated documents through a {@link ParseInvoker} and checks every tree that comes back.
 */
public final class StressRunner {
    private static final Logger LOGGER = Logger.getLogger(StressRunner.class.getName());
    private static final int PROGRESS_INTERVAL = 10;

    private final AdversarialGenerator generator;
    private final ParseInvoker invoker;
    private final SemanticComplianceAuditor auditor;
    private final IntegrityVerifier verifier;

    public StressRunner(
        AdversarialGenerator generator,
        ParseInvoker invoker,
        SemanticComplianceAuditor auditor,
        IntegrityVerifier verifier
    ) {
        this.generator = Objects.requireNonNull(generator, "generator");
        this.invoker = Objects.requireNonNull(invoker, "invoker");
        this.auditor = Objects.requireNonNull(auditor, "auditor");
        this.verifier = Objects.requireNonNull(verifier, "verifier");
    }

    public StressReport run(int iterations, int complexity) {
        if (iterations < 0) {
            throw new IllegalArgumentException("iterations must not be negative: " + iterations);
        }
        int completed = 0;
        int failures = 0;
        int timeouts = 0;
        int violations = 0;
        int integrityFailures = 0;
        for (int i = 1; i <= iterations; i++) {
            String input = generator.generate(complexity);
            SandboxResult result = invoker.invoke(input);
            switch (result.outcome()) {
                case COMPLETED -> {
                    completed++;
                    TreeNode tree = result.tree().toTree();
                    violations += auditor.audit(tree).violations().size();
                    if (!verifier.verify(tree).valid()) {
                        integrityFailures++;
                    }
                }
                case TIMED_OUT -> {
                    timeouts++;
                    LOGGER.warning("Iteration " + i + " timed out: " + result.error());
                }
                case WORKER_FAILED -> {
                    failures++;
                    LOGGER.warning("Iteration " + i + " failed: " + result.error());
                }
            }
            if (i % PROGRESS_INTERVAL == 0) {
                int iteration = i;
                int total = violations;
                LOGGER.info(() -> "Iteration " + iteration + "/" + iterations + ": " + total + " violations so far");
            }
        }
        return new StressReport(iterations, completed, failures, timeouts, violations, integrityFailures);
    }
}
