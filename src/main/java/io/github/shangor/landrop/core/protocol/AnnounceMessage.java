package io.github.shangor.landrop.core.protocol;

/**
 * One presence datagram. The sender's address is never part of the payload; receivers use the
 * transport-observed source instead.
 */
public record AnnounceMessage(String kind,
                              String deviceId,
                              String deviceName,
                              String platform,
                              int transferPort,
                              long timestamp) {

    public static AnnounceMessage of(String deviceId, String deviceName, String platform, int transferPort, long timestamp) {
        return new AnnounceMessage(MessageKind.ANNOUNCE, deviceId, deviceName, platform, transferPort, timestamp);
    }
}
