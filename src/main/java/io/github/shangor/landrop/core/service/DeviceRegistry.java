package io.github.shangor.landrop.core.service;

import io.github.shangor.landrop.core.model.Device;
import io.github.shangor.landrop.core.protocol.AnnounceMessage;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Known peers keyed by device identifier. Written only by {@link DiscoveryService}; every
 * {@link Device} handed out is an immutable snapshot.
 */
public class DeviceRegistry {
    private final Map<String, Device> devices = new ConcurrentHashMap<>();
    private final long stalenessWindowMillis;
    private final Clock clock;

    public DeviceRegistry(long stalenessWindowMillis) {
        this(stalenessWindowMillis, Clock.systemUTC());
    }

    public DeviceRegistry(long stalenessWindowMillis, Clock clock) {
        if (stalenessWindowMillis <= 0) {
            throw new IllegalArgumentException("stalenessWindowMillis must be positive");
        }
        this.stalenessWindowMillis = stalenessWindowMillis;
        this.clock = clock;
    }

    public boolean upsert(AnnounceMessage announcement, String sourceAddress) {
        return upsert(announcement, sourceAddress, clock.millis());
    }

    /**
     * Records or refreshes the announcing device.
     *
     * @return {@code true} if the device was unknown or offline until now
     */
    public boolean upsert(AnnounceMessage announcement, String sourceAddress, long seenAtMillis) {
        Device existing = devices.get(announcement.deviceId());
        if (existing == null) {
            devices.put(announcement.deviceId(), new Device(announcement.deviceId(), announcement.deviceName(),
                    sourceAddress, announcement.transferPort(), announcement.platform(), seenAtMillis));
            return true;
        }
        devices.put(existing.getId(), existing.refreshed(announcement.deviceName(), sourceAddress,
                announcement.transferPort(), announcement.platform(), seenAtMillis));
        return !existing.isOnline();
    }

    public List<Device> sweep() {
        return sweep(clock.millis());
    }

    /**
     * Flags every online device silent for longer than the staleness window as offline.
     *
     * @return the devices that went offline in this sweep
     */
    public List<Device> sweep(long nowMillis) {
        List<Device> wentOffline = new ArrayList<>();
        for (Device device : devices.values()) {
            if (device.isOnline() && nowMillis - device.getLastSeenMillis() > stalenessWindowMillis) {
                Device offline = device.offline();
                devices.put(offline.getId(), offline);
                wentOffline.add(offline);
            }
        }
        return wentOffline;
    }

    public List<Device> list() {
        List<Device> online = new ArrayList<>();
        for (Device device : devices.values()) {
            if (device.isOnline()) {
                online.add(device);
            }
        }
        return Collections.unmodifiableList(online);
    }

    public Optional<Device> get(String id) {
        return Optional.ofNullable(devices.get(id));
    }

    public int size() {
        return devices.size();
    }

    public long stalenessWindowMillis() {
        return stalenessWindowMillis;
    }
}
