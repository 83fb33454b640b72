package org.chipinput.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.ConsoleHandler;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

public class ConfigManager {
    private static final Logger APP_LOGGER = Logger.getLogger(ConfigManager.class.getName());
    public static final Path DEFAULT_CONFIG_PATH = Path.of("conf", "config.yaml");
    static AppConfig appConfig;

    static {
        System.setProperty("java.util.logging.SimpleFormatter.format", "[%1$tF %1$tT] [%4$-7s] %3$s - %5$s %6$s%n");
        ConsoleHandler handler = new ConsoleHandler();
        handler.setFormatter(new SimpleFormatter());
        handler.setLevel(Level.ALL);
        Logger rootLogger = Logger.getLogger("");
        for (var existing : rootLogger.getHandlers()) {
            if (existing instanceof ConsoleHandler) rootLogger.removeHandler(existing);
        }
        rootLogger.addHandler(handler);
        rootLogger.setLevel(Level.INFO);
    }

    private ConfigManager() {
    }

    public static synchronized AppConfig getConfig() throws IOException {
        return getConfig(DEFAULT_CONFIG_PATH);
    }

    /**
     * Loads the configuration once; later calls return the cached instance whatever the path.
     */
    public static synchronized AppConfig getConfig(Path configPath) throws IOException {
        if (appConfig == null) {
            appConfig = loadConfig(configPath);
        }
        return appConfig;
    }

    /**
     * Reads a YAML configuration without caching it. Relative paths inside the file are kept as written.
     */
    public static AppConfig loadConfig(Path configPath) throws IOException {
        if (!Files.isRegularFile(configPath)) {
            throw new IOException("Configuration file not found: " + configPath.toAbsolutePath());
        }
        ObjectMapper frameworkObjectMapper = new ObjectMapper(new YAMLFactory());
        frameworkObjectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        AppConfig config = frameworkObjectMapper.readValue(configPath.toFile(), AppConfig.class);
        APP_LOGGER.info("Loaded configuration from " + configPath.toAbsolutePath());
        return config;
    }
}
