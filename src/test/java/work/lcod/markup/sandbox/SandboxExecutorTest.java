package work.lcod.markup.sandbox;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.lcod.markup.api.MarkupConfiguration;
import work.lcod.markup.tree.SerializedNode;

class SandboxExecutorTest {
    private final MarkupConfiguration config = MarkupConfiguration.defaults();
    private final WorkerCommand command = WorkerCommand.from(config);

    @Test
    void parsesInAWorkerProcess() {
        SandboxResult result = SandboxExecutor.from(config).safeParse("<div id='a'><p>x</p></div>", 30);
        assertTrue(result.success(), result.error());
        assertEquals(SandboxResult.Outcome.COMPLETED, result.outcome());
        SerializedNode tree = result.tree();
        assertEquals("html", tree.name());
        SerializedNode div = tree.children().get(0);
        assertEquals(Map.of("id", "a"), div.attributes());
        assertEquals("x", div.children().get(0).textContent());
        assertTrue(result.workerPid() > 0);
        assertTrue(result.workerPid() != ProcessHandle.current().pid());
    }

    @Test
    void returnsDeeplyNestedTreeFromWorker() {
        int depth = 5000;
        SandboxResult result = SandboxExecutor.from(config).safeParse("<div>".repeat(depth), 60);
        assertEquals(SandboxResult.Outcome.COMPLETED, result.outcome(), result.error());
        int levels = 0;
        SerializedNode node = result.tree();
        while (!node.children().isEmpty()) {
            node = node.children().get(0);
            assertEquals("div", node.name());
            levels++;
        }
        assertEquals(depth, levels);
    }

    @Test
    void handlesNonAsciiInput() {
        SandboxResult result = SandboxExecutor.from(config).safeParse("<p>héllo ☃</p>", Duration.ofSeconds(30));
        assertTrue(result.success(), result.error());
        assertEquals("héllo ☃", result.tree().children().get(0).textContent());
    }

    @Test
    void timesOutAndKillsTheWorker() {
        var executor = new SandboxExecutor(command.withMainClass(HangingWorker.class.getName()));
        SandboxResult result = executor.safeParse("<div>", 1);
        assertEquals(SandboxResult.Outcome.TIMED_OUT, result.outcome());
        assertFalse(result.success());
        assertEquals("Parsing timed out after 1 seconds", result.error());
        assertTrue(result.treeIfPresent().isEmpty());
        boolean alive = ProcessHandle.of(result.workerPid()).map(ProcessHandle::isAlive).orElse(false);
        assertFalse(alive);
    }

    @Test
    void reportsWorkerThatExitsWithoutResult() {
        var executor = new SandboxExecutor(command.withMainClass(CrashingWorker.class.getName()));
        SandboxResult result = executor.safeParse("<p>", 30);
        assertEquals(SandboxResult.Outcome.WORKER_FAILED, result.outcome());
        assertEquals("Parser failed to return result (worker exit code 3)", result.error());
    }

    @Test
    void reportsUnreadableWorkerOutput() {
        var executor = new SandboxExecutor(command.withMainClass(GarbageWorker.class.getName()));
        SandboxResult result = executor.safeParse("<p>", 30);
        assertEquals(SandboxResult.Outcome.WORKER_FAILED, result.outcome());
        assertTrue(result.error().startsWith("Parser worker returned an unreadable result"), result.error());
    }

    @Test
    void reportsWorkerThatCannotStart() {
        var missing = new WorkerCommand(
            config.javaExecutable().resolveSibling("no-such-java"),
            command.classpath(),
            command.mainClass(),
            List.of()
        );
        SandboxResult result = new SandboxExecutor(missing).safeParse("<p>", 5);
        assertEquals(SandboxResult.Outcome.WORKER_FAILED, result.outcome());
        assertEquals(-1L, result.workerPid());
        assertTrue(result.error().startsWith("Unable to run parser worker"));
    }

    @Test
    void resultMapCarriesEitherTreeOrError() {
        Map<String, Object> failed = SandboxResult.timedOut("Parsing timed out after 5 seconds", 42L).toMap();
        assertEquals(false, failed.get("success"));
        assertEquals("timed_out", failed.get("outcome"));
        assertEquals(42L, failed.get("worker_pid"));
        assertFalse(failed.containsKey("tree"));

        Map<String, Object> ok = SandboxResult.completed(new SerializedNode("html", null, null, null), 42L).toMap();
        assertEquals(true, ok.get("success"));
        assertFalse(ok.containsKey("error"));
    }

    @Test
    void commandLineListsOptionsBeforeTheMainClass() {
        var worker = new WorkerCommand(config.javaExecutable(), "cp", "x.Main", List.of("-Xmx32m"));
        assertEquals(
            List.of(config.javaExecutable().toString(), "-Xmx32m", "-cp", "cp", "x.Main"),
            worker.toCommandLine()
        );
    }
}
