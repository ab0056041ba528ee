package work.lcod.markup.sandbox;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import work.lcod.markup.api.MarkupConfiguration;

/**
 * Command line used to start a sandbox worker JVM.
 */
public record WorkerCommand(Path javaExecutable, String classpath, String mainClass, List<String> jvmOptions) {
    public WorkerCommand {
        Objects.requireNonNull(javaExecutable, "javaExecutable");
        Objects.requireNonNull(classpath, "classpath");
        Objects.requireNonNull(mainClass, "mainClass");
        jvmOptions = jvmOptions == null ? List.of() : List.copyOf(jvmOptions);
    }

    /**
     * Worker running {@link SandboxWorker} on the classpath of the current JVM.
     */
    public static WorkerCommand from(MarkupConfiguration configuration) {
        return new WorkerCommand(
            configuration.javaExecutable(),
            System.getProperty("java.class.path", ""),
            SandboxWorker.class.getName(),
            configuration.workerJvmOptions()
        );
    }

    public WorkerCommand withMainClass(String mainClass) {
        return new WorkerCommand(javaExecutable, classpath, mainClass, jvmOptions);
    }

    public List<String> toCommandLine() {
        List<String> command = new ArrayList<>();
        command.add(javaExecutable.toString());
        command.addAll(jvmOptions);
        command.add("-cp");
        command.add(classpath);
        command.add(mainClass);
        return command;
    }
}
