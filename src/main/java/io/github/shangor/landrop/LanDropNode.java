package io.github.shangor.landrop;

import io.github.shangor.landrop.core.model.Device;
import io.github.shangor.landrop.core.model.FileEntry;
import io.github.shangor.landrop.core.model.TransferTask;
import io.github.shangor.landrop.core.service.AcceptPolicy;
import io.github.shangor.landrop.core.service.DeviceRegistry;
import io.github.shangor.landrop.core.service.DiscoveryListener;
import io.github.shangor.landrop.core.service.DiscoveryService;
import io.github.shangor.landrop.core.service.ListenerList;
import io.github.shangor.landrop.core.service.PendingDecisions;
import io.github.shangor.landrop.core.service.SessionContext;
import io.github.shangor.landrop.core.service.TransferHistory;
import io.github.shangor.landrop.core.service.TransferListener;
import io.github.shangor.landrop.core.service.TransferReceiverService;
import io.github.shangor.landrop.core.service.TransferSenderService;
import io.github.shangor.landrop.core.service.TransferSession;
import io.github.shangor.landrop.core.util.FileEntries;
import io.github.shangor.landrop.core.util.LanDropConfig;
import io.github.shangor.landrop.core.util.UserPreferences;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.MultiThreadIoEventLoopGroup;
import io.netty.channel.nio.NioIoHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.Inet4Address;
import java.net.InetAddress;
import java.net.NetworkInterface;
import java.net.SocketException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Enumeration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * One LAN Drop participant: discovery, the transfer server and outbound transfers, all running on
 * a single event loop thread owned by this node.
 */
public class LanDropNode implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(LanDropNode.class);

    private final LanDropConfig config;
    private final UserPreferences preferences;
    private final EventLoopGroup group = new MultiThreadIoEventLoopGroup(1, NioIoHandler.newFactory());
    private final DeviceRegistry registry;
    private final ListenerList<DiscoveryListener> discoveryListeners = new ListenerList<>();
    private final SessionContext context;
    private final PendingDecisions pendingDecisions = new PendingDecisions();
    private final AcceptPolicy acceptPolicy;
    private final TransferSenderService sender;
    private final String deviceId;
    private volatile Path destinationRoot;
    private TransferReceiverService receiver;
    private DiscoveryService discovery;
    private boolean started;

    public LanDropNode(LanDropConfig config, UserPreferences preferences) {
        this(config, preferences, TransferHistory.NONE);
    }

    public LanDropNode(LanDropConfig config, UserPreferences preferences, TransferHistory history) {
        this.config = config;
        this.preferences = preferences;
        this.registry = new DeviceRegistry(config.stalenessWindowMillis());
        this.context = SessionContext.create(config).withHistory(history);
        this.acceptPolicy = config.autoAccept() ? AcceptPolicy.autoAccept() : pendingDecisions;
        this.deviceId = preferences.deviceId();
        this.destinationRoot = preferences.destinationRoot();
        this.sender = new TransferSenderService(group, context, deviceId, preferences::deviceName);
    }

    /**
     * Binds the transfer server, then starts announcing and listening for peers.
     *
     * @throws IOException if either port cannot be bound; nothing stays open in that case
     */
    public synchronized void start() throws IOException {
        if (started) {
            return;
        }
        receiver = new TransferReceiverService(group, context, this::destinationRoot, acceptPolicy, registry);
        receiver.start(config.transferPort());
        discovery = new DiscoveryService(group, config, registry, discoveryListeners, deviceId,
                preferences.deviceName(), UserPreferences.platformTag(), receiver.port());
        try {
            discovery.start();
        } catch (IOException e) {
            receiver.close();
            throw e;
        }
        started = true;
        log.info("LAN Drop node {} started, saving to {}", deviceId, destinationRoot);
    }

    public List<Device> devices() {
        return registry.list();
    }

    public Device localDevice() {
        int port = receiver != null ? receiver.port() : config.transferPort();
        return new Device(deviceId, preferences.deviceName(), localAddress(), port, UserPreferences.platformTag(),
                System.currentTimeMillis());
    }

    public void refreshDevices() {
        if (discovery != null) {
            discovery.refresh();
        } else {
            List<Device> online = registry.list();
            discoveryListeners.fire(l -> l.onDevicesChanged(online));
        }
    }

    public List<FileEntry> expand(List<Path> picked) throws IOException {
        return FileEntries.expand(picked);
    }

    public TransferTask send(Device peer, List<FileEntry> entries) {
        return sender.send(peer, entries);
    }

    public boolean cancel(String taskId) {
        TransferSession session = context.tasks().session(taskId);
        if (session == null) {
            return false;
        }
        session.cancel();
        return true;
    }

    public boolean accept(String taskId) {
        return pendingDecisions.accept(taskId);
    }

    public boolean reject(String taskId, String reason) {
        return pendingDecisions.reject(taskId, reason);
    }

    public Collection<TransferTask> activeTasks() {
        return context.tasks().all();
    }

    public AutoCloseable addTransferListener(TransferListener listener) {
        return context.listeners().subscribe(listener);
    }

    public AutoCloseable addDiscoveryListener(DiscoveryListener listener) {
        return discoveryListeners.subscribe(listener);
    }

    public Path getDestinationRoot() {
        return destinationRoot;
    }

    /**
     * Changes where accepted transfers are written. Sessions already streaming keep their root.
     *
     * @throws IllegalArgumentException if {@code path} is not an existing directory
     */
    public void setDestinationRoot(Path path) {
        if (path == null || !Files.isDirectory(path)) {
            throw new IllegalArgumentException("Not an existing directory: " + path);
        }
        destinationRoot = path.toAbsolutePath();
        preferences.saveDestinationRoot(destinationRoot);
        log.info("Destination root set to {}", destinationRoot);
    }

    public int transferPort() {
        return receiver != null ? receiver.port() : -1;
    }

    private Path destinationRoot() {
        return destinationRoot;
    }

    @Override
    public synchronized void close() {
        for (TransferTask task : context.tasks().all()) {
            cancel(task.getTaskId());
        }
        if (discovery != null) {
            discovery.close();
        }
        if (receiver != null) {
            receiver.close();
        }
        group.shutdownGracefully(0, 2, TimeUnit.SECONDS).awaitUninterruptibly();
        started = false;
        log.info("LAN Drop node {} stopped", deviceId);
    }

    static String localAddress() {
        try {
            Enumeration<NetworkInterface> interfaces = NetworkInterface.getNetworkInterfaces();
            while (interfaces != null && interfaces.hasMoreElements()) {
                NetworkInterface nic = interfaces.nextElement();
                if (!nic.isUp() || nic.isLoopback()) {
                    continue;
                }
                Enumeration<InetAddress> addresses = nic.getInetAddresses();
                while (addresses.hasMoreElements()) {
                    InetAddress address = addresses.nextElement();
                    if (address instanceof Inet4Address && !address.isLoopbackAddress()) {
                        return address.getHostAddress();
                    }
                }
            }
        } catch (SocketException e) {
            log.debug("Could not enumerate network interfaces", e);
        }
        return "127.0.0.1";
    }
}
