package com.tpanalyzer.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utility for loading analyzer conventions from YAML files.
 *
 * <p>Uses Jackson to deserialize {@code tp-analyzer.yaml} into {@link AnalyzerConfig}.
 * If the file is missing or invalid, returns {@link AnalyzerConfig#defaults()}. Sections
 * missing from a valid file are filled from the defaults.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * AnalyzerConfig config = ConfigLoader.load(Paths.get("tp-analyzer.yaml"));
 * LabelClass role = config.classifyLabel(510);
 * }</pre>
 */
public class ConfigLoader {

    /** Default configuration file name, looked up in the analyzed directory. */
    public static final String DEFAULT_FILE_NAME = "tp-analyzer.yaml";

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
    }

    /**
     * Loads configuration from a YAML file.
     *
     * <p>If the file doesn't exist or can't be parsed, logs a warning and returns
     * {@link AnalyzerConfig#defaults()}.
     *
     * @param configPath path to {@code tp-analyzer.yaml}
     * @return loaded configuration or defaults if unavailable
     */
    public static AnalyzerConfig load(Path configPath) {
        if (configPath == null || !Files.exists(configPath)) {
            log.debug("Configuration file not found: {}. Using default conventions.", configPath);
            return AnalyzerConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using default conventions.", configPath);
            return AnalyzerConfig.defaults();
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            AnalyzerConfig config = YAML_MAPPER.readValue(configPath.toFile(), AnalyzerConfig.class);
            if (config == null) {
                log.warn("Configuration file is empty: {}. Using default conventions.", configPath);
                return AnalyzerConfig.defaults();
            }
            log.info("Loaded configuration from: {}", configPath);
            return config.withDefaults();
        } catch (IOException | IllegalArgumentException e) {
            log.error("Failed to parse configuration file: {}. Using default conventions. Error: {}",
                configPath, e.getMessage());
            return AnalyzerConfig.defaults();
        }
    }
}
