package work.lcod.markup.sandbox;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import work.lcod.markup.tree.SerializedNode;

/**
 * Outcome of {@link SandboxExecutor#safeParse}. Exactly one of {@code tree} and {@code error} is set.
 * {@code workerPid} is -1 when no worker was started.
 */
public record SandboxResult(Outcome outcome, SerializedNode tree, String error, long workerPid) {
    public SandboxResult {
        Objects.requireNonNull(outcome, "outcome");
        if (outcome == Outcome.COMPLETED) {
            Objects.requireNonNull(tree, "tree");
        } else {
            Objects.requireNonNull(error, "error");
        }
    }

    public static SandboxResult completed(SerializedNode tree, long workerPid) {
        return new SandboxResult(Outcome.COMPLETED, tree, null, workerPid);
    }

    public static SandboxResult timedOut(String error, long workerPid) {
        return new SandboxResult(Outcome.TIMED_OUT, null, error, workerPid);
    }

    public static SandboxResult workerFailed(String error, long workerPid) {
        return new SandboxResult(Outcome.WORKER_FAILED, null, error, workerPid);
    }

    public boolean success() {
        return outcome == Outcome.COMPLETED;
    }

    public Optional<SerializedNode> treeIfPresent() {
        return Optional.ofNullable(tree);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("success", success());
        map.put("outcome", outcome.name().toLowerCase(Locale.ROOT));
        map.put("worker_pid", workerPid);
        if (success()) {
            map.put("tree", tree);
        } else {
            map.put("error", error);
        }
        return map;
    }

    public enum Outcome {
        COMPLETED,
        TIMED_OUT,
        WORKER_FAILED
    }
}
