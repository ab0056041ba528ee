package work.lcod.markup.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;

class ConfigurationLoaderTest {
    @Test
    void loadsFixtureFile() {
        var path = Path.of("src", "test", "resources", "markup.toml").toAbsolutePath();
        MarkupConfiguration config = ConfigurationLoader.load(path);
        assertEquals(40, config.maxDepth());
        assertEquals(500, config.maxNodes());
        assertEquals(Duration.ofMillis(2500), config.sandboxTimeout());
        assertEquals(List.of("-Xmx64m", "-Xss1m"), config.workerJvmOptions());
        assertEquals(LogLevel.INFO, config.logLevel());
    }

    @Test
    void missingKeysKeepDefaults() {
        MarkupConfiguration config = ConfigurationLoader.parse("[integrity]\nmax_depth = 12\n");
        assertEquals(12, config.maxDepth());
        assertEquals(MarkupConfiguration.DEFAULT_MAX_NODES, config.maxNodes());
        assertEquals(MarkupConfiguration.DEFAULT_SANDBOX_TIMEOUT, config.sandboxTimeout());
    }

    @Test
    void numericTimeoutIsSeconds() {
        assertEquals(Duration.ofSeconds(3), ConfigurationLoader.parse("[sandbox]\ntimeout = 3\n").sandboxTimeout());
        assertEquals(Duration.ofMillis(1500), ConfigurationLoader.parse("[sandbox]\ntimeout = 1.5\n").sandboxTimeout());
    }

    @Test
    void rejectsInvalidFiles() {
        assertThrows(IllegalArgumentException.class, () -> ConfigurationLoader.parse("[integrity\nmax_depth = 1"));
        assertThrows(IllegalArgumentException.class, () -> ConfigurationLoader.parse("[integrity]\nmax_depth = \"deep\"\n"));
        assertThrows(IllegalArgumentException.class, () -> ConfigurationLoader.parse("[integrity]\nmax_nodes = 0\n"));
        assertThrows(IllegalArgumentException.class, () -> ConfigurationLoader.load(Path.of("does-not-exist.toml")));
    }
}
