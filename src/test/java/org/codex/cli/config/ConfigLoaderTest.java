package org.codex.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.codex.cli.config.ConfigLoader.ConfigMessageHandler;
import org.codex.cli.config.ConfigLoader.MessageLevel;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.File;
import java.io.IOException;
import java.net.URISyntaxException;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;

/**
 * Unit tests for {@link ConfigLoader}: layering of system properties, environment, file and
 * reference defaults, and the order in which configuration files are looked up.
 */
@Tag("unit")
@ExtendWith(MockitoExtension.class)
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Mock
    ConfigMessageHandler handler;

    @BeforeEach
    void setUp() {
        ConfigFactory.invalidateCaches();
    }

    @AfterEach
    void tearDown() {
        System.clearProperty("test.value");
        System.clearProperty("config.file");
        ConfigFactory.invalidateCaches();
    }

    @Test
    @DisplayName("loadFromFile layers the file over the reference defaults")
    void loadFromFile_layersFileOverDefaults() {
        Config config = ConfigLoader.loadFromFile(testResource("test-config.conf"));

        assertThat(config.getString("test.value")).isEqualTo("file-value");
        assertThat(config.getString("test.nested.setting")).isEqualTo("file-nested");
        assertThat(config.getString("logging.levels.\"org.codex.compiler\"")).isEqualTo("ERROR");
        assertThat(config.getConfigList("codex.corpora")).hasSize(2);
    }

    @Test
    @DisplayName("System properties override the configuration file")
    void loadFromFile_systemPropertyWins() {
        System.setProperty("test.value", "system-value");
        ConfigFactory.invalidateCaches();

        Config config = ConfigLoader.loadFromFile(testResource("test-config.conf"));

        assertThat(config.getString("test.value")).isEqualTo("system-value");
        assertThat(config.getString("test.priority")).isEqualTo("file-priority");
    }

    @Test
    @DisplayName("loadDefaults exposes the bundled corpora")
    void loadDefaults_containsBundledCorpora() {
        Config config = ConfigLoader.loadDefaults();

        assertThat(config.getConfigList("codex.corpora"))
                .extracting(c -> c.getString("name"))
                .containsExactly("emoji", "sym");
        assertThat(config.getString("logging.default-level")).isEqualTo("WARN");
    }

    @Test
    @DisplayName("An explicit --config file is used and reported")
    void resolve_usesExplicitFile() {
        File file = testResource("test-config.conf");

        Config config = ConfigLoader.resolve(file, handler);

        assertThat(config.getString("test.value")).isEqualTo("file-value");
        verify(handler).log(eq(MessageLevel.INFO), contains("--config"));
    }

    @Test
    @DisplayName("A missing --config file is an error")
    void resolve_missingExplicitFileFails() {
        File missing = tempDir.resolve("missing.conf").toFile();

        assertThatThrownBy(() -> ConfigLoader.resolve(missing, handler))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("missing.conf");
    }

    @Test
    @DisplayName("-Dconfig.file is honored when no --config is given")
    void resolve_usesConfigFileProperty() throws IOException {
        Path file = tempDir.resolve("custom.conf");
        Files.writeString(file, "test.value = property-file\n", StandardCharsets.UTF_8);
        System.setProperty("config.file", file.toString());

        Config config = ConfigLoader.resolve(null, handler);

        assertThat(config.getString("test.value")).isEqualTo("property-file");
        verify(handler).log(eq(MessageLevel.INFO), contains("-Dconfig.file"));
    }

    @Test
    @DisplayName("Falls back to bundled defaults with a warning")
    void resolve_fallsBackToDefaults() {
        Config config = ConfigLoader.resolve(null, handler);

        assertThat(config.hasPath("codex.corpora")).isTrue();
        verify(handler).log(eq(MessageLevel.WARN), contains("bundled defaults"));
    }

    @Test
    @DisplayName("Malformed files surface as ConfigException")
    void resolve_malformedFileFails() throws IOException {
        Path file = tempDir.resolve("broken.conf");
        Files.writeString(file, "test { value = \n", StandardCharsets.UTF_8);

        assertThatThrownBy(() -> ConfigLoader.resolve(file.toFile(), handler))
                .isInstanceOf(ConfigException.class);
    }

    private static File testResource(String name) {
        URL url = ConfigLoaderTest.class.getClassLoader().getResource(name);
        assertThat(url).as("test resource %s", name).isNotNull();
        try {
            return new File(url.toURI());
        } catch (URISyntaxException e) {
            throw new IllegalStateException(e);
        }
    }
}
