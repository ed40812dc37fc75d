package dev.mars.hivemind.config;

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


import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;
import java.util.logging.Logger;

/**
 * Configuration management for the Hivemind orchestration core.
 * Values are layered: built-in defaults, then the first readable properties file,
 * then {@code hivemind.*} system properties.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class HivemindConfiguration {
    private static final Logger logger = Logger.getLogger(HivemindConfiguration.class.getName());

    public static final String STEP_TIMEOUT_MS = "hivemind.workflow.step.timeout.ms";
    public static final String STEP_RETRIES = "hivemind.workflow.step.retries";
    public static final String STEP_RETRY_DELAY_MS = "hivemind.workflow.step.retry.delay.ms";
    public static final String MAX_CONCURRENT_EXECUTIONS = "hivemind.workflow.max.concurrent.executions";
    public static final String HISTORY_MAX_ENTRIES = "hivemind.workflow.history.max.entries";
    public static final String HISTORY_ENABLED = "hivemind.workflow.history.enabled";
    public static final String METRICS_ENABLED = "hivemind.workflow.metrics.enabled";
    public static final String LEARNING_RATE = "hivemind.equilibrium.learning.rate";
    public static final String MAX_ITERATIONS = "hivemind.equilibrium.max.iterations";
    public static final String CONVERGENCE_THRESHOLD = "hivemind.equilibrium.convergence.threshold";
    public static final String MIN_PARTICIPATION = "hivemind.equilibrium.min.participation";
    public static final String UPDATE_MODE = "hivemind.equilibrium.update.mode";

    // Default configuration values
    private static final long DEFAULT_STEP_TIMEOUT_MS = 30_000;
    private static final int DEFAULT_STEP_RETRIES = 0;
    private static final long DEFAULT_STEP_RETRY_DELAY_MS = 1000;
    private static final int DEFAULT_MAX_CONCURRENT_EXECUTIONS = 10;
    private static final int DEFAULT_HISTORY_MAX_ENTRIES = 1000;
    private static final double DEFAULT_LEARNING_RATE = 0.1;
    private static final int DEFAULT_MAX_ITERATIONS = 100;
    private static final double DEFAULT_CONVERGENCE_THRESHOLD = 0.001;
    private static final double DEFAULT_MIN_PARTICIPATION = 0.01;
    private static final String DEFAULT_UPDATE_MODE = "SNAPSHOT";

    private final Properties properties;

    public HivemindConfiguration() {
        this.properties = new Properties();
        loadDefaultConfiguration();
        loadConfigurationFromFile();
        loadConfigurationFromSystemProperties();
    }

    public HivemindConfiguration(Properties properties) {
        this.properties = new Properties();
        loadDefaultConfiguration();
        if (properties != null) {
            this.properties.putAll(properties);
        }
    }

    // Workflow Configuration
    public long getStepTimeoutMs() {
        return getLongProperty(STEP_TIMEOUT_MS, DEFAULT_STEP_TIMEOUT_MS);
    }

    public int getStepRetries() {
        return getIntProperty(STEP_RETRIES, DEFAULT_STEP_RETRIES);
    }

    public long getStepRetryDelayMs() {
        return getLongProperty(STEP_RETRY_DELAY_MS, DEFAULT_STEP_RETRY_DELAY_MS);
    }

    public int getMaxConcurrentExecutions() {
        return getIntProperty(MAX_CONCURRENT_EXECUTIONS, DEFAULT_MAX_CONCURRENT_EXECUTIONS);
    }

    public int getHistoryMaxEntries() {
        return getIntProperty(HISTORY_MAX_ENTRIES, DEFAULT_HISTORY_MAX_ENTRIES);
    }

    public boolean isHistoryEnabled() {
        return getBooleanProperty(HISTORY_ENABLED, true);
    }

    public boolean isMetricsEnabled() {
        return getBooleanProperty(METRICS_ENABLED, true);
    }

    // Equilibrium Configuration
    public double getLearningRate() {
        return getDoubleProperty(LEARNING_RATE, DEFAULT_LEARNING_RATE);
    }

    public int getMaxIterations() {
        return getIntProperty(MAX_ITERATIONS, DEFAULT_MAX_ITERATIONS);
    }

    public double getConvergenceThreshold() {
        return getDoubleProperty(CONVERGENCE_THRESHOLD, DEFAULT_CONVERGENCE_THRESHOLD);
    }

    public double getMinParticipation() {
        return getDoubleProperty(MIN_PARTICIPATION, DEFAULT_MIN_PARTICIPATION);
    }

    public String getUpdateMode() {
        return getStringProperty(UPDATE_MODE, DEFAULT_UPDATE_MODE).trim();
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
                logger.warning("Invalid integer value for property " + key + ": " + value +
                             ". Using default: " + defaultValue);
            }
        }
        return defaultValue;
    }

    private long getLongProperty(String key, long defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            try {
                return Long.parseLong(value.trim());
            } catch (NumberFormatException e) {
                logger.warning("Invalid long value for property " + key + ": " + value +
                             ". Using default: " + defaultValue);
            }
        }
        return defaultValue;
    }

    private double getDoubleProperty(String key, double defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            try {
                return Double.parseDouble(value.trim());
            } catch (NumberFormatException e) {
                logger.warning("Invalid double value for property " + key + ": " + value +
                             ". Using default: " + defaultValue);
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
        properties.setProperty(STEP_TIMEOUT_MS, String.valueOf(DEFAULT_STEP_TIMEOUT_MS));
        properties.setProperty(STEP_RETRIES, String.valueOf(DEFAULT_STEP_RETRIES));
        properties.setProperty(STEP_RETRY_DELAY_MS, String.valueOf(DEFAULT_STEP_RETRY_DELAY_MS));
        properties.setProperty(MAX_CONCURRENT_EXECUTIONS, String.valueOf(DEFAULT_MAX_CONCURRENT_EXECUTIONS));
        properties.setProperty(HISTORY_MAX_ENTRIES, String.valueOf(DEFAULT_HISTORY_MAX_ENTRIES));
        properties.setProperty(HISTORY_ENABLED, "true");
        properties.setProperty(METRICS_ENABLED, "true");
        properties.setProperty(LEARNING_RATE, String.valueOf(DEFAULT_LEARNING_RATE));
        properties.setProperty(MAX_ITERATIONS, String.valueOf(DEFAULT_MAX_ITERATIONS));
        properties.setProperty(CONVERGENCE_THRESHOLD, String.valueOf(DEFAULT_CONVERGENCE_THRESHOLD));
        properties.setProperty(MIN_PARTICIPATION, String.valueOf(DEFAULT_MIN_PARTICIPATION));
        properties.setProperty(UPDATE_MODE, DEFAULT_UPDATE_MODE);
    }

    private void loadConfigurationFromFile() {
        String[] configFiles = {
                "hivemind.properties",
                "config/hivemind.properties",
                System.getProperty("user.home") + "/.hivemind/hivemind.properties",
                "/etc/hivemind/hivemind.properties"
        };

        for (String configFile : configFiles) {
            Path configPath = Paths.get(configFile);
            if (Files.exists(configPath) && Files.isReadable(configPath)) {
                try (InputStream input = Files.newInputStream(configPath)) {
                    properties.load(input);
                    logger.info("Loaded configuration from: " + configPath);
                    return;
                } catch (IOException e) {
                    logger.warning("Failed to load configuration from " + configPath + ": " + e.getMessage());
                }
            }
        }

        try (InputStream input = getClass().getClassLoader().getResourceAsStream("hivemind.properties")) {
            if (input != null) {
                properties.load(input);
                logger.info("Loaded configuration from classpath");
            }
        } catch (IOException e) {
            logger.warning("Failed to load configuration from classpath: " + e.getMessage());
        }
    }

    private void loadConfigurationFromSystemProperties() {
        System.getProperties().entrySet().stream()
                .filter(entry -> entry.getKey().toString().startsWith("hivemind."))
                .forEach(entry -> {
                    properties.setProperty(entry.getKey().toString(), entry.getValue().toString());
                    logger.fine("Override from system property: " + entry.getKey() + "=" + entry.getValue());
                });
    }

    @Override
    public String toString() {
        return "HivemindConfiguration{" +
                "stepTimeoutMs=" + getStepTimeoutMs() +
                ", maxConcurrentExecutions=" + getMaxConcurrentExecutions() +
                ", historyMaxEntries=" + getHistoryMaxEntries() +
                ", learningRate=" + getLearningRate() +
                ", maxIterations=" + getMaxIterations() +
                '}';
    }
}
