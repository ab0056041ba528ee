package work.lcod.markup.fuzz;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Random;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;
import work.lcod.markup.api.MarkupConfiguration;
import work.lcod.markup.api.MarkupParser;
import work.lcod.markup.sandbox.SandboxResult;
import work.lcod.markup.verify.IntegrityVerifier;
import work.lcod.markup.verify.SemanticComplianceAuditor;

class StressRunnerTest {
    private final IntegrityVerifier verifier = IntegrityVerifier.from(MarkupConfiguration.defaults());

    @Test
    void inProcessRunCompletesEveryIteration() {
        var runner = new StressRunner(
            new AdversarialGenerator(new Random(11)),
            ParseInvoker.inProcess(new MarkupParser()),
            new SemanticComplianceAuditor(),
            verifier
        );
        StressReport report = runner.run(30, 15);
        assertEquals(30, report.iterations());
        assertEquals(30, report.completed());
        assertTrue(report.clean());
        assertEquals(0, report.integrityFailures());
    }

    @Test
    void countsTimeoutsAndFailuresSeparately() {
        var calls = new AtomicInteger();
        ParseInvoker flaky = input -> {
            int call = calls.incrementAndGet();
            if (call % 3 == 0) {
                return SandboxResult.timedOut("Parsing timed out after 5 seconds", 1L);
            }
            if (call % 3 == 1) {
                return SandboxResult.workerFailed("boom", 1L);
            }
            return ParseInvoker.inProcess(new MarkupParser()).invoke(input);
        };
        var runner = new StressRunner(new AdversarialGenerator(new Random(5)), flaky, new SemanticComplianceAuditor(), verifier);
        StressReport report = runner.run(9, 5);
        assertEquals(3, report.completed());
        assertEquals(3, report.failures());
        assertEquals(3, report.timeouts());
        assertFalse(report.clean());
        assertEquals(false, report.toMap().get("clean"));
    }

    @Test
    void countsIntegrityFailures() {
        var runner = new StressRunner(
            new AdversarialGenerator(new Random(2)),
            ParseInvoker.inProcess(new MarkupParser()),
            new SemanticComplianceAuditor(),
            new IntegrityVerifier(1, 1)
        );
        StressReport report = runner.run(5, 30);
        assertTrue(report.integrityFailures() > 0);
        assertTrue(report.clean());
    }
}
