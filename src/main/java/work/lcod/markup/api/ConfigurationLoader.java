package work.lcod.markup.api;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;
import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlInvalidTypeException;
import org.tomlj.TomlParseResult;
import work.lcod.markup.shared.DurationParser;

/**
 * Reads {@link MarkupConfiguration} from a TOML file. Keys that are absent keep their defaults.
 *
 * <pre>
 * [integrity]
 * max_depth = 100
 * max_nodes = 1000
 *
 * [sandbox]
 * timeout = "5s"
 * java = "/usr/bin/java"
 * jvm_options = ["-Xmx128m"]
 *
 * [logging]
 * level = "info"
 * </pre>
 */
public final class ConfigurationLoader {
    private static final Logger LOGGER = Logger.getLogger(ConfigurationLoader.class.getName());

    private ConfigurationLoader() {}

    public static MarkupConfiguration load(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            throw new IllegalArgumentException("Configuration file not found: " + path);
        }
        try {
            MarkupConfiguration configuration = fromToml(Toml.parse(path), MarkupConfiguration.builder());
            LOGGER.fine(() -> "Loaded configuration from " + path);
            return configuration;
        } catch (IOException ex) {
            throw new IllegalArgumentException("Unable to read configuration " + path + ": " + ex.getMessage(), ex);
        }
    }

    public static MarkupConfiguration parse(String toml) {
        return fromToml(Toml.parse(toml == null ? "" : toml), MarkupConfiguration.builder());
    }

    static MarkupConfiguration fromToml(TomlParseResult result, MarkupConfiguration.Builder builder) {
        if (result.hasErrors()) {
            throw new IllegalArgumentException("Invalid configuration: " + result.errors().get(0).toString());
        }
        try {
            Long maxDepth = result.getLong("integrity.max_depth");
            if (maxDepth != null) {
                builder.maxDepth(Math.toIntExact(maxDepth));
            }
            Long maxNodes = result.getLong("integrity.max_nodes");
            if (maxNodes != null) {
                builder.maxNodes(Math.toIntExact(maxNodes));
            }
            readDuration(result, "sandbox.timeout").ifPresent(builder::sandboxTimeout);
            String java = result.getString("sandbox.java");
            if (java != null && !java.isBlank()) {
                builder.javaExecutable(Path.of(java));
            }
            TomlArray options = result.getArray("sandbox.jvm_options");
            if (options != null) {
                List<String> values = new ArrayList<>(options.size());
                for (int i = 0; i < options.size(); i++) {
                    values.add(options.getString(i));
                }
                builder.workerJvmOptions(values);
            }
            String level = result.getString("logging.level");
            if (level != null) {
                builder.logLevel(LogLevel.from(level));
            }
        } catch (TomlInvalidTypeException | ArithmeticException ex) {
            throw new IllegalArgumentException("Invalid configuration value: " + ex.getMessage(), ex);
        }
        return builder.build();
    }

    private static Optional<Duration> readDuration(TomlParseResult result, String key) {
        if (!result.contains(key)) {
            return Optional.empty();
        }
        if (result.isString(key)) {
            return DurationParser.parse(result.getString(key));
        }
        if (result.isLong(key)) {
            return Optional.of(DurationParser.ofSeconds(result.getLong(key)));
        }
        if (result.isDouble(key)) {
            return Optional.of(DurationParser.ofSeconds(result.getDouble(key)));
        }
        throw new IllegalArgumentException("Invalid duration for " + key);
    }
}
