package org.silica.compiler.api;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Loads the front end configuration.
 * <p>
 * Load order, highest precedence first: system properties, environment variables,
 * an explicit file (or {@code silica.conf} in the working directory when none is
 * given), and the classpath defaults in {@code reference.conf}.
 */
public final class SourceOptionsLoader {

    private static final Logger log = LoggerFactory.getLogger(SourceOptionsLoader.class);

    /** Name of the configuration file picked up from the working directory. */
    public static final String CONFIG_FILE_NAME = "silica.conf";

    private SourceOptionsLoader() {}

    /**
     * Loads the configuration.
     *
     * @param configFile An explicit configuration file, or {@code null}.
     * @return The resolved configuration.
     * @throws CompilationException if the explicit file does not exist or a file cannot be parsed.
     */
    public static Config load(File configFile) throws CompilationException {
        try {
            if (configFile != null) {
                if (!configFile.exists()) {
                    throw new CompilationException("Configuration file was not found: " + configFile.getAbsolutePath());
                }
                log.debug("Using configuration file {}", configFile.getAbsolutePath());
                return withFile(configFile);
            }

            File cwdConfigFile = new File(CONFIG_FILE_NAME);
            if (cwdConfigFile.exists()) {
                log.debug("Using configuration file found in current directory: {}", cwdConfigFile.getAbsolutePath());
                return withFile(cwdConfigFile);
            }

            return ConfigFactory.systemProperties()
                    .withFallback(ConfigFactory.systemEnvironment())
                    .withFallback(ConfigFactory.load())
                    .resolve();
        } catch (com.typesafe.config.ConfigException e) {
            throw new CompilationException("Failed to load or parse configuration: " + e.getMessage(), e);
        }
    }

    /**
     * Loads the configuration and maps it to source options.
     *
     * @param configFile An explicit configuration file, or {@code null}.
     * @return The options.
     * @throws CompilationException if the configuration cannot be loaded or is invalid.
     */
    public static SourceOptions loadOptions(File configFile) throws CompilationException {
        Config config = load(configFile);
        try {
            return SourceOptions.fromConfig(config);
        } catch (com.typesafe.config.ConfigException | IllegalArgumentException e) {
            throw new CompilationException("Invalid source options: " + e.getMessage(), e);
        }
    }

    private static Config withFile(File file) {
        return ConfigFactory.systemProperties()
                .withFallback(ConfigFactory.systemEnvironment())
                .withFallback(ConfigFactory.parseFile(file))
                .withFallback(ConfigFactory.load())
                .resolve();
    }
}
