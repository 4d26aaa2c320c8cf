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

package dev.mars.taskdag.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

/**
 * Configuration management for TaskDAG.
 * Loads defaults, then the first readable {@code taskdag.properties} file (or the classpath copy),
 * then {@code taskdag.*} system properties, each layer overriding the previous one.
 * 
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class TaskDagConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(TaskDagConfiguration.class);
    
    public static final String DEFAULT_MAX_RETRIES_KEY = "taskdag.retry.default.max";
    public static final String DEFAULT_RETRY_DELAY_KEY = "taskdag.retry.default.delay.ms";
    public static final String DEFAULT_BACKOFF_KEY = "taskdag.retry.default.backoff";
    public static final String SCHEDULER_THREADS_KEY = "taskdag.scheduler.threads";
    public static final String METRICS_ENABLED_KEY = "taskdag.monitoring.metrics.enabled";
    public static final String MAX_RETAINED_EXECUTIONS_KEY = "taskdag.executions.max.retained";
    
    private static final String PROPERTY_PREFIX = "taskdag.";
    private static final String CONFIG_FILE_NAME = "taskdag.properties";
    
    // Default configuration values
    private static final int DEFAULT_MAX_RETRIES = 0;
    private static final long DEFAULT_RETRY_DELAY_MS = 3000;
    private static final double DEFAULT_BACKOFF_MULTIPLIER = 2.0;
    private static final int DEFAULT_SCHEDULER_THREADS = 1;
    private static final int DEFAULT_MAX_RETAINED_EXECUTIONS = 50;
    
    private final Properties properties;
    
    public TaskDagConfiguration() {
        this.properties = new Properties();
        loadDefaultConfiguration();
        loadConfigurationFromFile();
        loadConfigurationFromSystemProperties();
    }
    
    public TaskDagConfiguration(Properties properties) {
        this.properties = new Properties();
        loadDefaultConfiguration();
        if (properties != null) {
            this.properties.putAll(properties);
        }
    }
    
    // Retry defaults, applied to nodes that declare no policy of their own
    public int getDefaultMaxRetries() {
        return Math.max(0, getIntProperty(DEFAULT_MAX_RETRIES_KEY, DEFAULT_MAX_RETRIES));
    }
    
    public long getDefaultRetryDelayMs() {
        return Math.max(0L, getLongProperty(DEFAULT_RETRY_DELAY_KEY, DEFAULT_RETRY_DELAY_MS));
    }
    
    public double getDefaultBackoffMultiplier() {
        return getDoubleProperty(DEFAULT_BACKOFF_KEY, DEFAULT_BACKOFF_MULTIPLIER);
    }
    
    // Hosting
    public int getSchedulerThreads() {
        return Math.max(1, getIntProperty(SCHEDULER_THREADS_KEY, DEFAULT_SCHEDULER_THREADS));
    }
    
    public int getMaxRetainedExecutions() {
        return Math.max(0, getIntProperty(MAX_RETAINED_EXECUTIONS_KEY, DEFAULT_MAX_RETAINED_EXECUTIONS));
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
                logger.warn("Invalid integer value for property {}: {}. Using default: {}", key, value, defaultValue);
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
                logger.warn("Invalid long value for property {}: {}. Using default: {}", key, value, defaultValue);
            }
        }
        return defaultValue;
    }
    
    private double getDoubleProperty(String key, double defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            try {
                double parsed = Double.parseDouble(value.trim());
                if (!Double.isNaN(parsed) && !Double.isInfinite(parsed) && parsed > 0) {
                    return parsed;
                }
                logger.warn("Out of range value for property {}: {}. Using default: {}", key, value, defaultValue);
            } catch (NumberFormatException e) {
                logger.warn("Invalid decimal value for property {}: {}. Using default: {}", key, value, defaultValue);
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
        properties.setProperty(DEFAULT_MAX_RETRIES_KEY, String.valueOf(DEFAULT_MAX_RETRIES));
        properties.setProperty(DEFAULT_RETRY_DELAY_KEY, String.valueOf(DEFAULT_RETRY_DELAY_MS));
        properties.setProperty(DEFAULT_BACKOFF_KEY, String.valueOf(DEFAULT_BACKOFF_MULTIPLIER));
        properties.setProperty(SCHEDULER_THREADS_KEY, String.valueOf(DEFAULT_SCHEDULER_THREADS));
        properties.setProperty(MAX_RETAINED_EXECUTIONS_KEY, String.valueOf(DEFAULT_MAX_RETAINED_EXECUTIONS));
        properties.setProperty(METRICS_ENABLED_KEY, "true");
    }
    
    private void loadConfigurationFromFile() {
        String[] configFiles = {
                CONFIG_FILE_NAME,
                "config/" + CONFIG_FILE_NAME,
                System.getProperty("user.home") + "/.taskdag/" + CONFIG_FILE_NAME
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
        
        try (InputStream input = getClass().getClassLoader().getResourceAsStream(CONFIG_FILE_NAME)) {
            if (input != null) {
                properties.load(input);
                logger.info("Loaded configuration from classpath");
            }
        } catch (IOException e) {
            logger.warn("Failed to load configuration from classpath: {}", e.getMessage());
        }
    }
    
    private void loadConfigurationFromSystemProperties() {
        System.getProperties().stringPropertyNames().stream()
                .filter(key -> key.startsWith(PROPERTY_PREFIX))
                .forEach(key -> {
                    properties.setProperty(key, System.getProperty(key));
                    logger.debug("Override from system property: {}={}", key, System.getProperty(key));
                });
    }
    
    @Override
    public String toString() {
        return "TaskDagConfiguration{" +
                "defaultMaxRetries=" + getDefaultMaxRetries() +
                ", defaultRetryDelayMs=" + getDefaultRetryDelayMs() +
                ", defaultBackoffMultiplier=" + getDefaultBackoffMultiplier() +
                ", schedulerThreads=" + getSchedulerThreads() +
                ", maxRetainedExecutions=" + getMaxRetainedExecutions() +
                ", metricsEnabled=" + isMetricsEnabled() +
                '}';
    }
}
