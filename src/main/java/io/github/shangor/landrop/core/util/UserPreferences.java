package io.github.shangor.landrop.core.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Properties;
import java.util.UUID;

/**
 * Installation-local state: the device identifier, display name and destination root.
 */
public final class UserPreferences {
    private static final Logger log = LoggerFactory.getLogger(UserPreferences.class);
    private static final String DEVICE_ID_FILE = "device-id";
    private static final String PREFERENCES_FILE = "preferences.properties";
    private static final String KEY_DEVICE_NAME = "device.name";
    private static final String KEY_DESTINATION = "destination";

    private final Path baseDir;
    private String deviceId;

    public UserPreferences(Path baseDir) {
        this.baseDir = baseDir;
    }

    public static Path defaultBaseDir() {
        return Path.of(System.getProperty("user.home"), ".landrop");
    }

    public Path baseDir() {
        return baseDir;
    }

    /**
     * Returns the stable device identifier, generating and storing one on first use.
     */
    public synchronized String deviceId() {
        if (deviceId != null) {
            return deviceId;
        }
        Path file = baseDir.resolve(DEVICE_ID_FILE);
        if (Files.exists(file)) {
            try {
                String stored = Files.readString(file, StandardCharsets.UTF_8).trim();
                if (!stored.isEmpty()) {
                    deviceId = stored;
                    return deviceId;
                }
            } catch (IOException e) {
                log.warn("Failed to read device id from {}", file, e);
            }
        }
        deviceId = UUID.randomUUID().toString();
        try {
            Files.createDirectories(baseDir);
            Files.writeString(file, deviceId, StandardCharsets.UTF_8);
            log.info("Generated new device id {}", deviceId);
        } catch (IOException e) {
            log.warn("Failed to persist device id to {}", file, e);
        }
        return deviceId;
    }

    public String deviceName() {
        String name = loadProps().getProperty(KEY_DEVICE_NAME, "");
        return name.isBlank() ? hostName() : name;
    }

    public void saveDeviceName(String name) {
        Properties props = loadProps();
        props.setProperty(KEY_DEVICE_NAME, name == null ? "" : name);
        storeProps(props);
    }

    public Path destinationRoot() {
        String value = loadProps().getProperty(KEY_DESTINATION, "");
        if (value.isBlank()) {
            return Path.of(System.getProperty("user.home"), "Downloads", "LanDrop");
        }
        return Path.of(value);
    }

    public void saveDestinationRoot(Path destination) {
        Properties props = loadProps();
        props.setProperty(KEY_DESTINATION, destination.toAbsolutePath().toString());
        storeProps(props);
    }

    /**
     * Coarse platform tag announced to peers.
     */
    public static String platformTag() {
        String os = System.getProperty("os.name", "").toLowerCase(Locale.ROOT);
        if (os.contains("win")) {
            return "win32";
        }
        if (os.contains("mac") || os.contains("darwin")) {
            return "darwin";
        }
        if (os.contains("linux")) {
            return "linux";
        }
        return os.isBlank() ? "unknown" : os;
    }

    private static String hostName() {
        try {
            String host = InetAddress.getLocalHost().getHostName();
            if (host != null && !host.isBlank()) {
                return host;
            }
        } catch (UnknownHostException e) {
            log.debug("Could not resolve local host name", e);
        }
        return "LanDrop Device";
    }

    private Properties loadProps() {
        Properties props = new Properties();
        Path file = baseDir.resolve(PREFERENCES_FILE);
        if (Files.exists(file)) {
            try (InputStream in = Files.newInputStream(file)) {
                props.load(in);
            } catch (IOException e) {
                log.warn("Failed to load preferences from {}", file, e);
            }
        }
        return props;
    }

    private void storeProps(Properties props) {
        Path file = baseDir.resolve(PREFERENCES_FILE);
        try {
            Files.createDirectories(baseDir);
            try (OutputStream out = Files.newOutputStream(file)) {
                props.store(out, "LanDrop preferences");
            }
        } catch (IOException e) {
            log.warn("Failed to store preferences to {}", file, e);
        }
    }
}
