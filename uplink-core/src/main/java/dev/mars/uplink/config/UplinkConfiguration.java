package dev.mars.uplink.config;

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
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Properties;
import java.util.logging.Logger;

/**
 * Configuration management for the Uplink upload client.
 * Handles loading and providing access to upload, engine, API and store parameters.
 *
 * <p>Resolution order (highest priority last): built-in defaults, the first
 * {@code uplink.properties} found on disk or the classpath, then system properties
 * starting with {@code uplink.}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class UplinkConfiguration {
    private static final Logger logger = Logger.getLogger(UplinkConfiguration.class.getName());

    public static final String CHUNK_SIZE = "uplink.upload.chunk.size";
    public static final String RESUMABLE_THRESHOLD = "uplink.upload.resumable.threshold";
    public static final String MAX_CONCURRENT_UPLOADS = "uplink.engine.max.concurrent";
    public static final String SHUTDOWN_TIMEOUT_SECONDS = "uplink.engine.shutdown.timeout.seconds";
    public static final String API_BASE_URL = "uplink.api.base.url";
    public static final String API_CONNECT_TIMEOUT_MS = "uplink.api.connect.timeout.ms";
    public static final String API_IDLE_TIMEOUT_SECONDS = "uplink.api.idle.timeout.seconds";
    public static final String API_REQUEST_TIMEOUT_MS = "uplink.api.request.timeout.ms";
    public static final String API_USER_AGENT = "uplink.api.user.agent";
    public static final String API_HEADER_PREFIX = "uplink.api.header.";
    public static final String STORE_TYPE = "uplink.store.type";
    public static final String STORE_DIR = "uplink.store.dir";
    public static final String STORE_MAX_AGE_MS = "uplink.store.max.age.ms";
    public static final String TELEMETRY_ENABLED = "uplink.telemetry.enabled";

    // Default configuration values
    private static final int DEFAULT_CHUNK_SIZE = 4 * 1024 * 1024; // 4 MiB
    private static final long DEFAULT_RESUMABLE_THRESHOLD = 1024L * 1024 * 1024; // 1 GiB
    private static final int DEFAULT_MAX_CONCURRENT_UPLOADS = 4;
    private static final long DEFAULT_SHUTDOWN_TIMEOUT_SECONDS = 30;
    private static final String DEFAULT_API_BASE_URL = "http://localhost:8080/v1";
    private static final int DEFAULT_CONNECT_TIMEOUT_MS = 30000;
    private static final int DEFAULT_IDLE_TIMEOUT_SECONDS = 60;
    private static final long DEFAULT_REQUEST_TIMEOUT_MS = 120000; // a 4 MiB chunk on a slow uplink
    private static final String DEFAULT_USER_AGENT = "Uplink/1.0";
    private static final String DEFAULT_STORE_TYPE = "memory";
    private static final String DEFAULT_STORE_DIR =
            System.getProperty("user.home") + "/.uplink/sessions";
    private static final long DEFAULT_STORE_MAX_AGE_MS = 7L * 24 * 3600 * 1000; // 7 days

    private final Properties properties;

    public UplinkConfiguration() {
        this.properties = new Properties();
        loadDefaultConfiguration();
        loadConfigurationFromFile();
        loadConfigurationFromSystemProperties();
    }

    public UplinkConfiguration(Properties properties) {
        this.properties = new Properties();
        loadDefaultConfiguration();
        if (properties != null) {
            this.properties.putAll(properties);
        }
    }

    // Upload Configuration
    public int getChunkSize() {
        return getIntProperty(CHUNK_SIZE, DEFAULT_CHUNK_SIZE);
    }

    public long getResumableThreshold() {
        return getLongProperty(RESUMABLE_THRESHOLD, DEFAULT_RESUMABLE_THRESHOLD);
    }

    // Engine Configuration
    public int getMaxConcurrentUploads() {
        return getIntProperty(MAX_CONCURRENT_UPLOADS, DEFAULT_MAX_CONCURRENT_UPLOADS);
    }

    public long getShutdownTimeoutSeconds() {
        return getLongProperty(SHUTDOWN_TIMEOUT_SECONDS, DEFAULT_SHUTDOWN_TIMEOUT_SECONDS);
    }

    // API Configuration
    public String getApiBaseUrl() {
        String url = getStringProperty(API_BASE_URL, DEFAULT_API_BASE_URL).trim();
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    public int getConnectTimeoutMs() {
        return getIntProperty(API_CONNECT_TIMEOUT_MS, DEFAULT_CONNECT_TIMEOUT_MS);
    }

    public int getIdleTimeoutSeconds() {
        return getIntProperty(API_IDLE_TIMEOUT_SECONDS, DEFAULT_IDLE_TIMEOUT_SECONDS);
    }

    public long getRequestTimeoutMs() {
        return getLongProperty(API_REQUEST_TIMEOUT_MS, DEFAULT_REQUEST_TIMEOUT_MS);
    }

    public String getUserAgent() {
        return getStringProperty(API_USER_AGENT, DEFAULT_USER_AGENT);
    }

    /**
     * Extra headers sent with every API request, taken from {@code uplink.api.header.<Name>} keys.
     */
    public Map<String, String> getApiHeaders() {
        Map<String, String> headers = new LinkedHashMap<>();
        for (String key : properties.stringPropertyNames()) {
            if (key.startsWith(API_HEADER_PREFIX) && key.length() > API_HEADER_PREFIX.length()) {
                headers.put(key.substring(API_HEADER_PREFIX.length()), properties.getProperty(key));
            }
        }
        return Collections.unmodifiableMap(headers);
    }

    // Session Store Configuration
    public String getStoreType() {
        return getStringProperty(STORE_TYPE, DEFAULT_STORE_TYPE).trim().toLowerCase();
    }

    public Path getStoreDirectory() {
        return Paths.get(getStringProperty(STORE_DIR, DEFAULT_STORE_DIR));
    }

    public long getStoreMaxAgeMs() {
        return getLongProperty(STORE_MAX_AGE_MS, DEFAULT_STORE_MAX_AGE_MS);
    }

    // Monitoring Configuration
    public boolean isTelemetryEnabled() {
        return getBooleanProperty(TELEMETRY_ENABLED, true);
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

    /**
     * Fails fast on values the upload loop cannot work with.
     *
     * @throws IllegalStateException if a value is out of range
     */
    public void validate() {
        if (getChunkSize() <= 0) {
            throw new IllegalStateException("Chunk size must be positive, got: " + getChunkSize());
        }
        if (getResumableThreshold() < 0) {
            throw new IllegalStateException(
                    "Resumable threshold cannot be negative, got: " + getResumableThreshold());
        }
        if (getMaxConcurrentUploads() <= 0) {
            throw new IllegalStateException(
                    "Max concurrent uploads must be positive, got: " + getMaxConcurrentUploads());
        }
        String baseUrl = getApiBaseUrl();
        if (!baseUrl.startsWith("http://") && !baseUrl.startsWith("https://")) {
            throw new IllegalStateException("API base URL must start with http:// or https://, got: " + baseUrl);
        }
        try {
            URI.create(baseUrl);
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Malformed API base URL: " + baseUrl, e);
        }
        if (!"memory".equals(getStoreType()) && !"file".equals(getStoreType())) {
            throw new IllegalStateException("Store type must be 'memory' or 'file', got: " + getStoreType());
        }
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

    private boolean getBooleanProperty(String key, boolean defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            return Boolean.parseBoolean(value.trim());
        }
        return defaultValue;
    }

    private void loadDefaultConfiguration() {
        properties.setProperty(CHUNK_SIZE, String.valueOf(DEFAULT_CHUNK_SIZE));
        properties.setProperty(RESUMABLE_THRESHOLD, String.valueOf(DEFAULT_RESUMABLE_THRESHOLD));
        properties.setProperty(MAX_CONCURRENT_UPLOADS, String.valueOf(DEFAULT_MAX_CONCURRENT_UPLOADS));
        properties.setProperty(SHUTDOWN_TIMEOUT_SECONDS, String.valueOf(DEFAULT_SHUTDOWN_TIMEOUT_SECONDS));
        properties.setProperty(API_BASE_URL, DEFAULT_API_BASE_URL);
        properties.setProperty(API_CONNECT_TIMEOUT_MS, String.valueOf(DEFAULT_CONNECT_TIMEOUT_MS));
        properties.setProperty(API_IDLE_TIMEOUT_SECONDS, String.valueOf(DEFAULT_IDLE_TIMEOUT_SECONDS));
        properties.setProperty(API_REQUEST_TIMEOUT_MS, String.valueOf(DEFAULT_REQUEST_TIMEOUT_MS));
        properties.setProperty(API_USER_AGENT, DEFAULT_USER_AGENT);
        properties.setProperty(STORE_TYPE, DEFAULT_STORE_TYPE);
        properties.setProperty(STORE_DIR, DEFAULT_STORE_DIR);
        properties.setProperty(STORE_MAX_AGE_MS, String.valueOf(DEFAULT_STORE_MAX_AGE_MS));
        properties.setProperty(TELEMETRY_ENABLED, "true");
    }

    private void loadConfigurationFromFile() {
        String[] configFiles = {
                "uplink.properties",
                "config/uplink.properties",
                System.getProperty("user.home") + "/.uplink/uplink.properties",
                "/etc/uplink/uplink.properties"
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

        try (InputStream input = getClass().getClassLoader().getResourceAsStream("uplink.properties")) {
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
                .filter(entry -> entry.getKey().toString().startsWith("uplink."))
                .forEach(entry -> {
                    properties.setProperty(entry.getKey().toString(), entry.getValue().toString());
                    logger.fine("Override from system property: " + entry.getKey() + "=" + entry.getValue());
                });
    }

    @Override
    public String toString() {
        return "UplinkConfiguration{" +
                "chunkSize=" + getChunkSize() +
                ", resumableThreshold=" + getResumableThreshold() +
                ", maxConcurrentUploads=" + getMaxConcurrentUploads() +
                ", apiBaseUrl='" + getApiBaseUrl() + '\'' +
                ", storeType='" + getStoreType() + '\'' +
                '}';
    }
}
