package org.codex.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.io.File;
import java.net.URISyntaxException;
import java.security.CodeSource;

/**
 * Loads the HOCON configuration used by the codex command line.
 * <p>
 * Layers, highest precedence first:
 * <ol>
 *   <li>Java system properties ({@code -Dcodex.corpora...})</li>
 *   <li>Environment variables</li>
 *   <li>The user configuration file, if one is found</li>
 *   <li>{@code reference.conf} on the classpath (bundled corpora and logging defaults)</li>
 * </ol>
 * The user file is the first of: the {@code --config} option, {@code -Dconfig.file},
 * {@code config/codex.conf} in the working directory, {@code APP_HOME/config/codex.conf}.
 */
public final class ConfigLoader {

    static final String CONFIG_DIR = "config";
    static final String CONFIG_FILE_NAME = "codex.conf";

    private ConfigLoader() {
    }

    /** Severity of a resolution message. */
    public enum MessageLevel {
        INFO,
        WARN
    }

    /**
     * Receives progress messages while the configuration file is being located.
     */
    @FunctionalInterface
    public interface ConfigMessageHandler {
        void log(MessageLevel level, String message);
    }

    /**
     * Locates the user configuration file and composes the final configuration.
     *
     * @param explicitConfigFile The file given via {@code --config}, or null.
     * @param handler            Receives progress messages.
     * @return The resolved configuration.
     * @throws IllegalArgumentException if an explicitly requested file does not exist.
     * @throws com.typesafe.config.ConfigException if a file cannot be parsed or resolved.
     */
    public static Config resolve(final File explicitConfigFile, final ConfigMessageHandler handler) {
        if (explicitConfigFile != null) {
            return fromRequiredFile(explicitConfigFile, "--config", handler);
        }

        final String property = System.getProperty("config.file");
        if (property != null && !property.isBlank()) {
            return fromRequiredFile(new File(property).getAbsoluteFile(), "-Dconfig.file", handler);
        }

        final File workingDirFile = new File(CONFIG_DIR, CONFIG_FILE_NAME);
        if (workingDirFile.isFile()) {
            handler.log(MessageLevel.INFO, "Using configuration file from working directory: " + workingDirFile.getAbsolutePath());
            return loadFromFile(workingDirFile);
        }

        final File installedFile = installationConfigFile();
        if (installedFile != null) {
            handler.log(MessageLevel.INFO, "Using configuration file from installation directory: " + installedFile.getAbsolutePath());
            return loadFromFile(installedFile);
        }

        handler.log(MessageLevel.WARN, "No " + CONFIG_DIR + "/" + CONFIG_FILE_NAME + " found, using bundled defaults.");
        return loadDefaults();
    }

    private static Config fromRequiredFile(File file, String origin, ConfigMessageHandler handler) {
        if (!file.exists()) {
            throw new IllegalArgumentException("Configuration file given via " + origin + " not found: " + file.getAbsolutePath());
        }
        handler.log(MessageLevel.INFO, "Using configuration file given via " + origin + ": " + file.getAbsolutePath());
        return loadFromFile(file);
    }

    /**
     * Loads a configuration file layered over the classpath defaults.
     */
    static Config loadFromFile(final File configFile) {
        return ConfigFactory.systemProperties()
            .withFallback(ConfigFactory.systemEnvironment())
            .withFallback(ConfigFactory.parseFile(configFile))
            .withFallback(ConfigFactory.defaultReferenceUnresolved())
            .resolve();
    }

    /**
     * Loads the classpath defaults, still honoring system properties and environment variables.
     */
    static Config loadDefaults() {
        return ConfigFactory.systemProperties()
            .withFallback(ConfigFactory.systemEnvironment())
            .withFallback(ConfigFactory.defaultReferenceUnresolved())
            .resolve();
    }

    /**
     * Returns {@code APP_HOME/config/codex.conf} when running from {@code APP_HOME/lib/codex.jar}
     * and that file exists, otherwise null.
     */
    private static File installationConfigFile() {
        final CodeSource codeSource = ConfigLoader.class.getProtectionDomain().getCodeSource();
        if (codeSource == null || codeSource.getLocation() == null) {
            return null;
        }
        final File jar;
        try {
            jar = new File(codeSource.getLocation().toURI());
        } catch (URISyntaxException | IllegalArgumentException e) {
            return null;
        }
        if (!jar.isFile() || jar.getParentFile() == null || jar.getParentFile().getParentFile() == null) {
            return null;
        }
        final File candidate = new File(new File(jar.getParentFile().getParentFile(), CONFIG_DIR), CONFIG_FILE_NAME);
        return candidate.isFile() ? candidate : null;
    }
}
