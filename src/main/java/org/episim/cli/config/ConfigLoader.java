package org.episim.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.io.File;
import java.net.URL;
import java.security.CodeSource;
import java.util.Optional;

/**
 * Loads the application settings ({@code episim.*}) shared by all commands.
 * <p>
 * Settings choose the spreading engine, logging levels and data conventions. They are separate
 * from the JSON simulation configuration handed to {@code run}. Values are layered as
 * {@code -Dkey=value} over environment variables over the settings file over
 * {@code reference.conf}.
 */
public final class ConfigLoader {

    static final String SETTINGS_FILE = "config/episim.conf";
    static final String HOME_VARIABLE = "EPISIM_HOME";

    private ConfigLoader() {
    }

    public enum MessageLevel {
        INFO,
        WARN
    }

    @FunctionalInterface
    public interface ConfigMessageHandler {

        void log(MessageLevel level, String message);
    }

    /**
     * Places a settings file is looked up, in order. The first existing file wins; a file named
     * explicitly must exist.
     */
    enum Origin {
        APP_CONFIG_OPTION("--app-config", true),
        CONFIG_FILE_PROPERTY("-Dconfig.file", true),
        WORKING_DIRECTORY("the working directory", false),
        INSTALLATION("the installation directory", false);

        private final String description;
        private final boolean explicit;

        Origin(String description, boolean explicit) {
            this.description = description;
            this.explicit = explicit;
        }

        String description() {
            return description;
        }

        boolean explicit() {
            return explicit;
        }
    }

    /**
     * @param appConfigFile settings file from {@code --app-config}, or {@code null}
     * @param handler       receives the lookup outcome
     * @return the resolved settings
     * @throws IllegalArgumentException            if a file named via {@code --app-config} or
     *                                             {@code -Dconfig.file} does not exist
     * @throws com.typesafe.config.ConfigException if the settings cannot be parsed or resolved
     */
    public static Config resolve(final File appConfigFile, final ConfigMessageHandler handler) {
        for (Origin origin : Origin.values()) {
            Optional<File> candidate = candidate(origin, appConfigFile);
            if (candidate.isEmpty()) {
                continue;
            }
            File file = candidate.get().getAbsoluteFile();
            if (file.isFile()) {
                handler.log(MessageLevel.INFO, "Settings from " + origin.description() + ": " + file);
                return layered(ConfigFactory.parseFile(file));
            }
            if (origin.explicit()) {
                throw new IllegalArgumentException(
                        "Settings file given via " + origin.description() + " not found: " + file);
            }
        }
        handler.log(MessageLevel.INFO, "No " + SETTINGS_FILE + " found; using built-in settings");
        return layered(ConfigFactory.empty());
    }

    /**
     * Puts system properties and environment variables on top of {@code settings} and
     * {@code reference.conf} underneath, then resolves substitutions across all layers.
     */
    static Config layered(final Config settings) {
        return ConfigFactory.systemProperties()
            .withFallback(ConfigFactory.systemEnvironment())
            .withFallback(settings)
            .withFallback(ConfigFactory.defaultReferenceUnresolved())
            .resolve();
    }

    static Optional<File> candidate(final Origin origin, final File appConfigFile) {
        switch (origin) {
            case APP_CONFIG_OPTION:
                return Optional.ofNullable(appConfigFile);
            case CONFIG_FILE_PROPERTY:
                return nonBlank(System.getProperty("config.file")).map(File::new);
            case WORKING_DIRECTORY:
                return Optional.of(new File(SETTINGS_FILE));
            case INSTALLATION:
                return installationHome().map(home -> new File(home, SETTINGS_FILE));
            default:
                throw new IllegalStateException("Unhandled settings origin " + origin);
        }
    }

    /**
     * {@code EPISIM_HOME} if set, else the parent of the {@code lib} folder holding the running jar.
     */
    private static Optional<File> installationHome() {
        Optional<File> fromEnvironment = nonBlank(System.getenv(HOME_VARIABLE)).map(File::new);
        if (fromEnvironment.isPresent()) {
            return fromEnvironment;
        }
        CodeSource codeSource = ConfigLoader.class.getProtectionDomain().getCodeSource();
        URL location = codeSource == null ? null : codeSource.getLocation();
        if (location == null || !"file".equals(location.getProtocol())) {
            return Optional.empty();
        }
        File jar = new File(location.getPath());
        File lib = jar.isFile() ? jar.getParentFile() : null;
        return Optional.ofNullable(lib == null ? null : lib.getParentFile());
    }

    private static Optional<String> nonBlank(String value) {
        return value == null || value.isBlank() ? Optional.empty() : Optional.of(value);
    }
}
