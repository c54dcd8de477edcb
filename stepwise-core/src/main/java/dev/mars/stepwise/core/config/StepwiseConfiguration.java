/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.stepwise.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

/**
 * Configuration management for the Stepwise engine.
 * Loads defaults, then the first readable {@code stepwise.properties} file, then
 * {@code stepwise.*} system properties.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-02
 * @version 1.0
 */
public class StepwiseConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(StepwiseConfiguration.class);

    public static final String MAP_PARALLELISM = "stepwise.map.parallelism";
    public static final String MAX_STEP_VISITS = "stepwise.flow.max.step.visits";
    public static final String STATE_PRETTY_PRINT = "stepwise.state.pretty.print";
    public static final String STORE_DIRECTORY = "stepwise.store.directory";
    public static final String MAX_EVENTS = "stepwise.events.max";

    // Default configuration values
    private static final int DEFAULT_MAP_PARALLELISM = 0; // cached pool
    private static final int DEFAULT_MAX_STEP_VISITS = 1000;
    private static final int DEFAULT_MAX_EVENTS = 500;
    private static final String DEFAULT_STORE_DIRECTORY =
            Paths.get(System.getProperty("java.io.tmpdir"), "stepwise").toString();

    private final Properties properties;

    public StepwiseConfiguration() {
        this.properties = new Properties();
        loadDefaultConfiguration();
        loadConfigurationFromFile();
        loadConfigurationFromSystemProperties();
    }

    public StepwiseConfiguration(Properties properties) {
        this.properties = new Properties();
        loadDefaultConfiguration();
        if (properties != null) {
            this.properties.putAll(properties);
        }
    }

    /**
     * Defaults only, no files or system properties.
     */
    public static StepwiseConfiguration defaults() {
        return new StepwiseConfiguration(null);
    }

    // Execution Configuration

    /**
     * Threads used by parallel map steps; 0 selects an unbounded cached pool.
     */
    public int getMapParallelism() {
        return getIntProperty(MAP_PARALLELISM, DEFAULT_MAP_PARALLELISM);
    }

    public int getMaxStepVisits() {
        return getIntProperty(MAX_STEP_VISITS, DEFAULT_MAX_STEP_VISITS);
    }

    public int getMaxEvents() {
        return getIntProperty(MAX_EVENTS, DEFAULT_MAX_EVENTS);
    }

    // Persistence Configuration
    public boolean isStatePrettyPrint() {
        return getBooleanProperty(STATE_PRETTY_PRINT, false);
    }

    public Path getStoreDirectory() {
        return Paths.get(getStringProperty(STORE_DIRECTORY, DEFAULT_STORE_DIRECTORY));
    }

    // Generic property access
    public String getProperty(String key) {
        return properties.getProperty(key);
    }

    public String getProperty(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
    }

    public void setProperty(String key, String value) {
        properties.setProperty(key, value);
    }

    // Utility methods for type conversion
    private String getStringProperty(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
    }

    private int getIntProperty(String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                logger.warn("Invalid integer value for property {}: {}. Using default: {}", key, value, defaultValue);
            }
        }
        return defaultValue;
    }

    private boolean getBooleanProperty(String key, boolean defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            return Boolean.parseBoolean(value.trim());
        }
        return defaultValue;
    }

    private void loadDefaultConfiguration() {
        properties.setProperty(MAP_PARALLELISM, String.valueOf(DEFAULT_MAP_PARALLELISM));
        properties.setProperty(MAX_STEP_VISITS, String.valueOf(DEFAULT_MAX_STEP_VISITS));
        properties.setProperty(MAX_EVENTS, String.valueOf(DEFAULT_MAX_EVENTS));
        properties.setProperty(STATE_PRETTY_PRINT, "false");
        properties.setProperty(STORE_DIRECTORY, DEFAULT_STORE_DIRECTORY);
    }

    private void loadConfigurationFromFile() {
        String[] configFiles = {
                "stepwise.properties",
                "config/stepwise.properties",
                System.getProperty("user.home") + "/.stepwise/stepwise.properties"
        };

        for (String configFile : configFiles) {
            Path configPath = Paths.get(configFile);
            if (Files.exists(configPath) && Files.isReadable(configPath)) {
                try (InputStream input = Files.newInputStream(configPath)) {
                    properties.load(input);
                    logger.info("Loaded configuration from: {}", configPath);
                    return;
                } catch (IOException e) {
                    logger.warn("Failed to load configuration from {}: {}", configPath, e.getMessage());
                }
            }
        }

        try (InputStream input = getClass().getClassLoader().getResourceAsStream("stepwise.properties")) {
            if (input != null) {
                properties.load(input);
                logger.info("Loaded configuration from classpath");
            }
        } catch (IOException e) {
            logger.warn("Failed to load configuration from classpath: {}", e.getMessage());
        }
    }

    private void loadConfigurationFromSystemProperties() {
        System.getProperties().entrySet().stream()
                .filter(entry -> entry.getKey().toString().startsWith("stepwise."))
                .forEach(entry -> {
                    properties.setProperty(entry.getKey().toString(), entry.getValue().toString());
                    logger.debug("Override from system property: {}={}", entry.getKey(), entry.getValue());
                });
    }

    @Override
    public String toString() {
        return "StepwiseConfiguration{" +
                "mapParallelism=" + getMapParallelism() +
                ", maxStepVisits=" + getMaxStepVisits() +
                ", statePrettyPrint=" + isStatePrettyPrint() +
                ", storeDirectory='" + getStoreDirectory() + '\'' +
                '}';
    }
}
