package work.lcod.markup.api;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Immutable settings for the verifiers and the sandbox. Limits are always supplied here, never hardcoded in the
 * components that enforce them.
 */
public record MarkupConfiguration(
    int maxDepth,
    int maxNodes,
    Duration sandboxTimeout,
    Path javaExecutable,
    List<String> workerJvmOptions,
    LogLevel logLevel
) {
    public static final int DEFAULT_MAX_DEPTH = 100;
    public static final int DEFAULT_MAX_NODES = 1000;
    public static final Duration DEFAULT_SANDBOX_TIMEOUT = Duration.ofSeconds(5);

    public MarkupConfiguration {
        if (maxDepth <= 0) {
            throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        }
        if (maxNodes <= 0) {
            throw new IllegalArgumentException("maxNodes must be positive: " + maxNodes);
        }
        Objects.requireNonNull(sandboxTimeout, "sandboxTimeout");
        if (sandboxTimeout.isNegative()) {
            throw new IllegalArgumentException("sandboxTimeout must not be negative");
        }
        Objects.requireNonNull(javaExecutable, "javaExecutable");
        workerJvmOptions = workerJvmOptions == null ? List.of() : List.copyOf(workerJvmOptions);
        Objects.requireNonNull(logLevel, "logLevel");
    }

    public static MarkupConfiguration defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .maxDepth(maxDepth)
            .maxNodes(maxNodes)
            .sandboxTimeout(sandboxTimeout)
            .javaExecutable(javaExecutable)
            .workerJvmOptions(workerJvmOptions)
            .logLevel(logLevel);
    }

    static Path currentJava() {
        return Path.of(System.getProperty("java.home"), "bin", "java");
    }

    public static final class Builder {
        private int maxDepth = DEFAULT_MAX_DEPTH;
        private int maxNodes = DEFAULT_MAX_NODES;
        private Duration sandboxTimeout = DEFAULT_SANDBOX_TIMEOUT;
        private Path javaExecutable = currentJava();
        private List<String> workerJvmOptions = List.of();
        private LogLevel logLevel = LogLevel.WARN;

        public Builder maxDepth(int maxDepth) {
            this.maxDepth = maxDepth;
            return this;
        }

        public Builder maxNodes(int maxNodes) {
            this.maxNodes = maxNodes;
            return this;
        }

        public Builder sandboxTimeout(Duration sandboxTimeout) {
            this.sandboxTimeout = sandboxTimeout;
            return this;
        }

        public Builder javaExecutable(Path javaExecutable) {
            this.javaExecutable = javaExecutable;
            return this;
        }

        public Builder workerJvmOptions(List<String> workerJvmOptions) {
            this.workerJvmOptions = workerJvmOptions;
            return this;
        }

        public Builder logLevel(LogLevel logLevel) {
            this.logLevel = logLevel;
            return this;
        }

        public MarkupConfiguration build() {
            return new MarkupConfiguration(
                maxDepth,
                maxNodes,
                sandboxTimeout,
                javaExecutable,
                workerJvmOptions,
                logLevel
            );
        }
    }
}
