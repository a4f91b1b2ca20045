package io.github.shangor.landrop.core.service;

import io.github.shangor.landrop.core.model.Device;
import io.github.shangor.landrop.core.protocol.AnnounceMessage;
import io.github.shangor.landrop.core.protocol.ProtocolCodec;
import io.github.shangor.landrop.core.util.LanDropConfig;
import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DiscoveryServiceTest {

    private final MutableClock clock = new MutableClock();
    private final DeviceRegistry registry = new DeviceRegistry(10_000, clock);
    private final ListenerList<DiscoveryListener> listeners = new ListenerList<>();
    private final List<String> events = new ArrayList<>();
    private final DiscoveryService discovery = new DiscoveryService(null, LanDropConfig.defaults(), registry, listeners,
            "self", "Me", "linux", 5201);

    DiscoveryServiceTest() {
        listeners.subscribe(new DiscoveryListener() {
            @Override
            public void onDeviceDiscovered(Device device) {
                events.add("discovered:" + device.getId());
            }

            @Override
            public void onDeviceOffline(Device device) {
                events.add("offline:" + device.getId());
            }

            @Override
            public void onDevicesChanged(List<Device> onlineDevices) {
                events.add("devices:" + onlineDevices.size());
            }
        });
    }

    private static byte[] packet(String id) {
        return ProtocolCodec.encodeAnnouncement(AnnounceMessage.of(id, "Peer " + id, "darwin", 5201, 0));
    }

    @Test
    void peerAnnouncementUsesObservedSourceAddress() {
        discovery.onPacket(new InetSocketAddress("192.168.1.20", 5200), packet("peer"));

        Device device = registry.get("peer").orElseThrow();
        assertEquals("192.168.1.20", device.getAddress());
        assertEquals(List.of("discovered:peer", "devices:1"), events);
    }

    @Test
    void repeatedAnnouncementIsNotRediscovered() {
        discovery.onPacket(new InetSocketAddress("192.168.1.20", 5200), packet("peer"));
        clock.millis = 3_000;
        discovery.onPacket(new InetSocketAddress("192.168.1.20", 5200), packet("peer"));
        assertEquals(List.of("discovered:peer", "devices:1"), events);
        assertEquals(3_000, registry.get("peer").orElseThrow().getLastSeenMillis());
    }

    @Test
    void ownAnnouncementsAreIgnored() {
        discovery.onPacket(new InetSocketAddress("192.168.1.10", 5200), packet("self"));
        assertEquals(0, registry.size());
        assertTrue(events.isEmpty());
    }

    @Test
    void garbageIsIgnored() {
        discovery.onPacket(new InetSocketAddress("192.168.1.10", 5200), "hello".getBytes(StandardCharsets.UTF_8));
        assertEquals(0, registry.size());
    }

    @Test
    void sweepReportsSilentPeers() {
        discovery.onPacket(new InetSocketAddress("192.168.1.20", 5200), packet("peer"));
        events.clear();
        clock.millis = 11_000;
        discovery.sweep();
        assertEquals(List.of("offline:peer", "devices:0"), events);
        discovery.sweep();
        assertEquals(2, events.size());
    }

    @Test
    void refreshPushesCurrentListWhenStopped() {
        discovery.onPacket(new InetSocketAddress("192.168.1.20", 5200), packet("peer"));
        events.clear();
        discovery.refresh();
        assertEquals(List.of("devices:1"), events);
    }

    private static final class MutableClock extends Clock {
        long millis;

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return Instant.ofEpochMilli(millis);
        }

        @Override
        public long millis() {
            return millis;
        }
    }
}
