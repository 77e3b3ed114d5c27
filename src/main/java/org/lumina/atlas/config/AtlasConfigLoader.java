package org.lumina.atlas.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.util.function.Supplier;

/**
 * Builds the atlas pipeline configuration for an embedding application.
 * <p>
 * The final {@link Config} is layered, highest precedence first:
 * <ol>
 *   <li>Java system properties ({@code -Dlumina.atlas.packing.padding=4})</li>
 *   <li>Environment overrides ({@code CONFIG_FORCE_lumina_atlas_packing_padding=4})</li>
 *   <li>The application source: a file, a classpath resource or a {@link Config} the
 *       application already holds</li>
 *   <li>{@code reference.conf} of this library</li>
 * </ol>
 * The layers are resolved together, so substitutions in {@code reference.conf} see the
 * application's values.
 */
public final class AtlasConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(AtlasConfigLoader.class);

    /** Root path of all pipeline settings. */
    public static final String ROOT_PATH = "lumina.atlas";

    /** File name looked up in {@code config/} and as a classpath resource. */
    public static final String CONFIG_FILE_NAME = "lumina-atlas.conf";

    private static final String CONFIG_DIR = "config";

    private AtlasConfigLoader() {
    }

    /**
     * Message severity levels for configuration resolution feedback.
     */
    public enum MessageLevel {
        INFO,
        WARN
    }

    /**
     * Receives progress messages while the configuration source is looked up.
     */
    @FunctionalInterface
    public interface ConfigMessageHandler {
        void log(MessageLevel level, String message);
    }

    /**
     * Handler that forwards messages to this class's SLF4J logger.
     */
    public static ConfigMessageHandler loggingHandler() {
        return (level, message) -> {
            if (level == MessageLevel.WARN) {
                log.warn(message);
            } else {
                log.info(message);
            }
        };
    }

    /**
     * Picks the application source and layers it. The first match wins:
     * <ol>
     *   <li>{@code explicitConfigFile}, if given</li>
     *   <li>the file named by {@code -Dconfig.file}</li>
     *   <li>{@code config/lumina-atlas.conf} in the working directory</li>
     *   <li>a {@code lumina-atlas.conf} resource on the classpath</li>
     *   <li>nothing, so only {@code reference.conf} applies</li>
     * </ol>
     *
     * @param explicitConfigFile file chosen by the embedding application, or {@code null}.
     * @param handler            callback for resolution messages.
     * @throws IllegalArgumentException if a named file does not exist or cannot be parsed.
     */
    public static Config resolve(final File explicitConfigFile, final ConfigMessageHandler handler) {
        if (explicitConfigFile != null) {
            handler.log(MessageLevel.INFO, "Atlas configuration file: " + explicitConfigFile.getAbsolutePath());
            return layered(parseExistingFile(explicitConfigFile, "Atlas configuration file"));
        }

        final String systemConfigPath = System.getProperty("config.file");
        if (systemConfigPath != null && !systemConfigPath.isBlank()) {
            final File systemConfigFile = new File(systemConfigPath).getAbsoluteFile();
            handler.log(MessageLevel.INFO, "Atlas configuration from -Dconfig.file: " + systemConfigFile);
            return layered(parseExistingFile(systemConfigFile, "File named by -Dconfig.file"));
        }

        final File workingDirFile = new File(CONFIG_DIR, CONFIG_FILE_NAME);
        if (workingDirFile.exists()) {
            handler.log(MessageLevel.INFO, "Atlas configuration from working directory: "
                + workingDirFile.getAbsolutePath());
            return layered(parse(() -> ConfigFactory.parseFile(workingDirFile), workingDirFile.getPath()));
        }

        final Config resource = parse(() -> ConfigFactory.parseResources(CONFIG_FILE_NAME), CONFIG_FILE_NAME);
        if (!resource.isEmpty()) {
            handler.log(MessageLevel.INFO, "Atlas configuration from classpath resource " + CONFIG_FILE_NAME);
            return layered(resource);
        }

        handler.log(MessageLevel.WARN, "No " + CONFIG_FILE_NAME + " found, using the built-in atlas defaults");
        return layered(ConfigFactory.empty());
    }

    /**
     * Layers a configuration the application already holds (e.g. its own
     * {@code ConfigFactory.load()}) between the overrides and {@code reference.conf}.
     */
    public static Config layered(final Config application) {
        return ConfigFactory.systemProperties()
            .withFallback(ConfigFactory.systemEnvironmentOverrides())
            .withFallback(application)
            .withFallback(ConfigFactory.defaultReferenceUnresolved())
            .resolve();
    }

    /**
     * Resolves the configuration and parses the {@code lumina.atlas} block.
     *
     * @throws IllegalArgumentException if a file is missing or a value is invalid.
     */
    public static AtlasSettings loadSettings(final File explicitConfigFile) {
        return settings(resolve(explicitConfigFile, loggingHandler()));
    }

    /**
     * Parses the {@code lumina.atlas} block of an already resolved configuration.
     *
     * @throws IllegalArgumentException if the block is missing or a value is invalid.
     */
    public static AtlasSettings settings(final Config root) {
        try {
            return AtlasSettings.fromConfig(root.getConfig(ROOT_PATH));
        } catch (ConfigException e) {
            throw new IllegalArgumentException("Invalid atlas configuration at '" + ROOT_PATH + "'", e);
        }
    }

    private static Config parseExistingFile(final File file, final String what) {
        if (!file.exists()) {
            throw new IllegalArgumentException(what + " not found: " + file.getAbsolutePath());
        }
        return parse(() -> ConfigFactory.parseFile(file), file.getPath());
    }

    private static Config parse(final Supplier<Config> parser, final String origin) {
        try {
            return parser.get();
        } catch (ConfigException e) {
            throw new IllegalArgumentException("Cannot parse atlas configuration " + origin + ": " + e.getMessage(), e);
        }
    }
}
