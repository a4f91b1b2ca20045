package io.github.shangor.landrop.core.service;

import io.github.shangor.landrop.core.model.Device;
import io.github.shangor.landrop.core.net.UdpEndpoint;
import io.github.shangor.landrop.core.protocol.AnnounceMessage;
import io.github.shangor.landrop.core.protocol.ProtocolCodec;
import io.github.shangor.landrop.core.util.LanDropConfig;
import io.netty.channel.EventLoop;
import io.netty.channel.EventLoopGroup;
import io.netty.util.concurrent.ScheduledFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Periodically broadcasts this device's presence, ingests peer announcements into the
 * {@link DeviceRegistry} and evicts peers that fall silent.
 */
public class DiscoveryService implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(DiscoveryService.class);

    private final EventLoopGroup group;
    private final LanDropConfig config;
    private final DeviceRegistry registry;
    private final ListenerList<DiscoveryListener> listeners;
    private final String deviceId;
    private final String deviceName;
    private final String platform;
    private final int transferPort;
    private UdpEndpoint endpoint;
    private ScheduledFuture<?> announceTask;
    private ScheduledFuture<?> sweepTask;
    private volatile boolean running;

    public DiscoveryService(EventLoopGroup group, LanDropConfig config, DeviceRegistry registry,
                            ListenerList<DiscoveryListener> listeners, String deviceId, String deviceName,
                            String platform, int transferPort) {
        this.group = group;
        this.config = config;
        this.registry = registry;
        this.listeners = listeners;
        this.deviceId = deviceId;
        this.deviceName = deviceName;
        this.platform = platform;
        this.transferPort = transferPort;
    }

    public synchronized void start() throws IOException {
        if (running) {
            return;
        }
        endpoint = new UdpEndpoint(group);
        endpoint.bind(config.discoveryPort(), this::onPacket, this::onSocketError);
        running = true;
        EventLoop loop = endpoint.channel().eventLoop();
        announceTask = loop.scheduleAtFixedRate(this::announce, 0, config.announceIntervalMillis(), TimeUnit.MILLISECONDS);
        sweepTask = loop.scheduleAtFixedRate(this::sweep, config.sweepIntervalMillis(), config.sweepIntervalMillis(),
                TimeUnit.MILLISECONDS);
        log.info("Discovery started on UDP port {} as {} ({})", endpoint.localPort(), deviceName, deviceId);
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Announces immediately and pushes the current device list to listeners.
     */
    public void refresh() {
        if (running) {
            endpoint.channel().eventLoop().execute(this::announce);
        }
        List<Device> online = registry.list();
        listeners.fire(l -> l.onDevicesChanged(online));
    }

    void onPacket(InetSocketAddress sender, byte[] data) {
        Optional<AnnounceMessage> decoded = ProtocolCodec.decodeAnnouncement(data);
        if (decoded.isEmpty()) {
            log.debug("Ignoring datagram from {}", sender);
            return;
        }
        AnnounceMessage announcement = decoded.get();
        if (deviceId.equals(announcement.deviceId())) {
            return;
        }
        String address = sender.getAddress() != null ? sender.getAddress().getHostAddress() : sender.getHostString();
        if (registry.upsert(announcement, address)) {
            Device device = registry.get(announcement.deviceId()).orElseThrow();
            log.info("Discovered {}", device);
            listeners.fire(l -> l.onDeviceDiscovered(device));
            List<Device> online = registry.list();
            listeners.fire(l -> l.onDevicesChanged(online));
        }
    }

    void sweep() {
        List<Device> wentOffline = registry.sweep();
        if (wentOffline.isEmpty()) {
            return;
        }
        for (Device device : wentOffline) {
            log.info("Device went offline: {}", device);
            listeners.fire(l -> l.onDeviceOffline(device));
        }
        List<Device> online = registry.list();
        listeners.fire(l -> l.onDevicesChanged(online));
    }

    private void announce() {
        if (!running) {
            return;
        }
        AnnounceMessage message = AnnounceMessage.of(deviceId, deviceName, platform, transferPort, System.currentTimeMillis());
        InetSocketAddress target = new InetSocketAddress(config.broadcastAddress(), config.discoveryPort());
        endpoint.send(target, ProtocolCodec.encodeAnnouncement(message)).addListener(future -> {
            if (!future.isSuccess()) {
                log.warn("Failed to send announcement to {}: {}", target, future.cause().toString());
            }
        });
    }

    private void onSocketError(Throwable cause) {
        log.error("Discovery socket failed, stopping discovery", cause);
        stop();
        listeners.fire(l -> l.onDiscoveryFailed(cause));
    }

    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        if (announceTask != null) {
            announceTask.cancel(false);
        }
        if (sweepTask != null) {
            sweepTask.cancel(false);
        }
        endpoint.close();
        log.info("Discovery stopped");
    }

    @Override
    public void close() {
        stop();
    }
}
