package io.github.shangor.landrop.core.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

/**
 * Network and protocol settings. Loaded from the bundled {@code landrop.properties}, then
 * {@code ~/.landrop/landrop.properties}, then {@code landrop.*} system properties.
 */
public record LanDropConfig(int discoveryPort,
                            int transferPort,
                            String broadcastAddress,
                            long announceIntervalMillis,
                            long stalenessWindowMillis,
                            long sweepIntervalMillis,
                            int chunkSize,
                            int maxFrameLength,
                            int maxHeaderLength,
                            long responseTimeoutMillis,
                            boolean autoAccept,
                            long progressIntervalMillis) {
    private static final Logger log = LoggerFactory.getLogger(LanDropConfig.class);

    public static final String RESOURCE = "landrop.properties";
    public static final String SYSTEM_PREFIX = "landrop.";

    public LanDropConfig {
        requirePort("discovery.port", discoveryPort);
        requirePort("transfer.port", transferPort);
        if (broadcastAddress == null || broadcastAddress.isBlank()) {
            throw new IllegalArgumentException("discovery.broadcast-address must not be empty");
        }
        requirePositive("discovery.announce-interval-ms", announceIntervalMillis);
        requirePositive("discovery.staleness-window-ms", stalenessWindowMillis);
        requirePositive("discovery.sweep-interval-ms", sweepIntervalMillis);
        requirePositive("transfer.chunk-size", chunkSize);
        requirePositive("transfer.max-frame-length", maxFrameLength);
        requirePositive("transfer.max-header-length", maxHeaderLength);
        requirePositive("transfer.response-timeout-ms", responseTimeoutMillis);
        requirePositive("transfer.progress-interval-ms", progressIntervalMillis);
        if (stalenessWindowMillis < 2 * announceIntervalMillis) {
            throw new IllegalArgumentException("discovery.staleness-window-ms must be at least twice the announce interval");
        }
        if (sweepIntervalMillis * 2 > stalenessWindowMillis) {
            throw new IllegalArgumentException("discovery.sweep-interval-ms must not exceed half the staleness window");
        }
        if (chunkSize > maxFrameLength) {
            throw new IllegalArgumentException("transfer.chunk-size must not exceed transfer.max-frame-length");
        }
    }

    public static LanDropConfig defaults() {
        return fromProperties(loadResource());
    }

    public static LanDropConfig load() {
        Properties props = loadResource();
        Path userFile = UserPreferences.defaultBaseDir().resolve(RESOURCE);
        if (Files.exists(userFile)) {
            try (InputStream in = Files.newInputStream(userFile)) {
                props.load(in);
                log.info("Loaded configuration overrides from {}", userFile);
            } catch (IOException e) {
                log.warn("Failed to load configuration from {}", userFile, e);
            }
        }
        System.getProperties().stringPropertyNames().stream()
                .filter(name -> name.startsWith(SYSTEM_PREFIX))
                .forEach(name -> props.setProperty(name.substring(SYSTEM_PREFIX.length()), System.getProperty(name)));
        return fromProperties(props);
    }

    public static LanDropConfig fromProperties(Properties props) {
        return new LanDropConfig(
                parseInt(props, "discovery.port", 5200),
                parseInt(props, "transfer.port", 5201),
                props.getProperty("discovery.broadcast-address", "255.255.255.255").trim(),
                parseLong(props, "discovery.announce-interval-ms", 3000),
                parseLong(props, "discovery.staleness-window-ms", 10000),
                parseLong(props, "discovery.sweep-interval-ms", 1000),
                parseInt(props, "transfer.chunk-size", 64 * 1024),
                parseInt(props, "transfer.max-frame-length", 1024 * 1024),
                parseInt(props, "transfer.max-header-length", 8 * 1024 * 1024),
                parseLong(props, "transfer.response-timeout-ms", 120000),
                Boolean.parseBoolean(props.getProperty("transfer.auto-accept", "true").trim()),
                parseLong(props, "transfer.progress-interval-ms", 500));
    }

    public LanDropConfig withPorts(int discoveryPort, int transferPort) {
        return new LanDropConfig(discoveryPort, transferPort, broadcastAddress, announceIntervalMillis,
                stalenessWindowMillis, sweepIntervalMillis, chunkSize, maxFrameLength, maxHeaderLength,
                responseTimeoutMillis, autoAccept, progressIntervalMillis);
    }

    public LanDropConfig withAutoAccept(boolean autoAccept) {
        return new LanDropConfig(discoveryPort, transferPort, broadcastAddress, announceIntervalMillis,
                stalenessWindowMillis, sweepIntervalMillis, chunkSize, maxFrameLength, maxHeaderLength,
                responseTimeoutMillis, autoAccept, progressIntervalMillis);
    }

    private static Properties loadResource() {
        Properties props = new Properties();
        try (InputStream in = LanDropConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) {
                props.load(in);
            }
        } catch (IOException e) {
            log.warn("Failed to read bundled {}", RESOURCE, e);
        }
        return props;
    }

    private static int parseInt(Properties props, String key, int defaultValue) {
        String text = props.getProperty(key);
        if (text == null || text.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(text.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + key + ": " + text, e);
        }
    }

    private static long parseLong(Properties props, String key, long defaultValue) {
        String text = props.getProperty(key);
        if (text == null || text.isBlank()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(text.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number for " + key + ": " + text, e);
        }
    }

    private static void requirePort(String key, int port) {
        if (port < 0 || port > 0xFFFF) {
            throw new IllegalArgumentException(key + " out of range: " + port);
        }
    }

    private static void requirePositive(String key, long value) {
        if (value <= 0) {
            throw new IllegalArgumentException(key + " must be positive: " + value);
        }
    }
}
