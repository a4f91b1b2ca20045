package io.github.shangor.landrop.core.model;

import java.util.Objects;

/**
 * Snapshot of a peer seen on the local network. The registry replaces snapshots as
 * announcements arrive and peers fall silent; a snapshot itself never changes.
 */
public final class Device {
    private final String id;
    private final String name;
    private final String address;
    private final int transferPort;
    private final String platform;
    private final boolean online;
    private final long lastSeenMillis;

    public Device(String id, String name, String address, int transferPort, String platform, long lastSeenMillis) {
        this(id, name, address, transferPort, platform, true, lastSeenMillis);
    }

    private Device(String id, String name, String address, int transferPort, String platform, boolean online,
                   long lastSeenMillis) {
        this.id = Objects.requireNonNull(id, "id");
        this.name = name;
        this.address = address;
        this.transferPort = transferPort;
        this.platform = platform == null ? "" : platform;
        this.online = online;
        this.lastSeenMillis = lastSeenMillis;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getAddress() {
        return address;
    }

    public int getTransferPort() {
        return transferPort;
    }

    public String getPlatform() {
        return platform;
    }

    public DeviceType getType() {
        return DeviceType.fromPlatform(platform);
    }

    public boolean isOnline() {
        return online;
    }

    public long getLastSeenMillis() {
        return lastSeenMillis;
    }

    /**
     * @return an online copy carrying the details of a newer announcement
     */
    public Device refreshed(String name, String address, int transferPort, String platform, long seenAtMillis) {
        return new Device(id, name, address, transferPort, platform, true, seenAtMillis);
    }

    public Device offline() {
        return new Device(id, name, address, transferPort, platform, false, lastSeenMillis);
    }

    @Override
    public String toString() {
        return name + " [" + id + "] " + address + ":" + transferPort + (online ? "" : " (offline)");
    }
}
