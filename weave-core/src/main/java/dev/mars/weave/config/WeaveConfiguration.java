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

package dev.mars.weave.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Properties;
import java.util.logging.Logger;

/**
 * Configuration for the Weave workflow engine.
 *
 * <p>Values are layered: built-in defaults, then the first {@code weave.properties}
 * found on disk or on the classpath, then {@code weave.*} system properties.
 * Passing an explicit {@link Properties} skips the file and system property lookup.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public class WeaveConfiguration {
    private static final Logger logger = Logger.getLogger(WeaveConfiguration.class.getName());

    public static final String PAUSE_CHECK_INTERVAL_KEY = "weave.workflow.pause.check.interval.ms";
    public static final String EXECUTOR_THREADS_KEY = "weave.workflow.executor.threads";
    public static final String METRICS_ENABLED_KEY = "weave.monitoring.metrics.enabled";

    private static final long DEFAULT_PAUSE_CHECK_INTERVAL_MS = 100;
    private static final int DEFAULT_EXECUTOR_THREADS = 0; // 0 = cached pool

    private final Properties properties;

    public WeaveConfiguration() {
        this.properties = new Properties();
        loadDefaultConfiguration();
        loadConfigurationFromFile();
        loadConfigurationFromSystemProperties();
    }

    public WeaveConfiguration(Properties properties) {
        this.properties = new Properties();
        loadDefaultConfiguration();
        if (properties != null) {
            this.properties.putAll(properties);
        }
    }

    /**
     * Configuration with built-in defaults only.
     */
    public static WeaveConfiguration defaults() {
        return new WeaveConfiguration(null);
    }

    // Workflow execution
    public long getPauseCheckIntervalMs() {
        long value = getLongProperty(PAUSE_CHECK_INTERVAL_KEY, DEFAULT_PAUSE_CHECK_INTERVAL_MS);
        if (value <= 0) {
            logger.warning("Pause check interval must be positive, got " + value +
                         ". Using default: " + DEFAULT_PAUSE_CHECK_INTERVAL_MS);
            return DEFAULT_PAUSE_CHECK_INTERVAL_MS;
        }
        return value;
    }

    public Duration getPauseCheckInterval() {
        return Duration.ofMillis(getPauseCheckIntervalMs());
    }

    /**
     * Task threads of a run's own pool; the execution loop gets one more. 0 means a cached pool.
     */
    public int getExecutorThreads() {
        return Math.max(0, getIntProperty(EXECUTOR_THREADS_KEY, DEFAULT_EXECUTOR_THREADS));
    }

    // Monitoring
    public boolean isMetricsEnabled() {
        return getBooleanProperty(METRICS_ENABLED_KEY, true);
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

    private boolean getBooleanProperty(String key, boolean defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            return Boolean.parseBoolean(value.trim());
        }
        return defaultValue;
    }

    private void loadDefaultConfiguration() {
        properties.setProperty(PAUSE_CHECK_INTERVAL_KEY, String.valueOf(DEFAULT_PAUSE_CHECK_INTERVAL_MS));
        properties.setProperty(EXECUTOR_THREADS_KEY, String.valueOf(DEFAULT_EXECUTOR_THREADS));
        properties.setProperty(METRICS_ENABLED_KEY, "true");
    }

    private void loadConfigurationFromFile() {
        String[] configFiles = {
                "weave.properties",
                "config/weave.properties",
                System.getProperty("user.home") + "/.weave/weave.properties",
                "/etc/weave/weave.properties"
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

        try (InputStream input = getClass().getClassLoader().getResourceAsStream("weave.properties")) {
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
                .filter(entry -> entry.getKey().toString().startsWith("weave."))
                .forEach(entry -> {
                    properties.setProperty(entry.getKey().toString(), entry.getValue().toString());
                    logger.fine("Override from system property: " + entry.getKey() + "=" + entry.getValue());
                });
    }

    @Override
    public String toString() {
        return "WeaveConfiguration{" +
                "pauseCheckIntervalMs=" + getPauseCheckIntervalMs() +
                ", executorThreads=" + getExecutorThreads() +
                ", metricsEnabled=" + isMetricsEnabled() +
                '}';
    }
}
