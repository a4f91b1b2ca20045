package io.github.shangor.landrop;

import io.github.shangor.landrop.core.model.Device;
import io.github.shangor.landrop.core.model.FileEntry;
import io.github.shangor.landrop.core.model.TransferTask;
import io.github.shangor.landrop.core.service.DiscoveryListener;
import io.github.shangor.landrop.core.service.TransferListener;
import io.github.shangor.landrop.core.util.LanDropConfig;
import io.github.shangor.landrop.core.util.UserPreferences;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;

/**
 * Headless launcher. Without arguments the node keeps running and accepts transfers; with
 * {@code send <host[:port]> <path>...} it sends the given files and folders, then exits.
 */
public final class LanDropApp {
    private static final Logger logger = LoggerFactory.getLogger(LanDropApp.class);

    private LanDropApp() {
    }

    public static void main(String[] args) throws Exception {
        logger.info("Starting LAN Drop");
        LanDropConfig config = LanDropConfig.load();
        LanDropNode node = new LanDropNode(config, new UserPreferences(UserPreferences.defaultBaseDir()));
        node.addDiscoveryListener(new DiscoveryListener() {
            @Override
            public void onDeviceDiscovered(Device device) {
                logger.info("Peer online: {}", device);
            }

            @Override
            public void onDeviceOffline(Device device) {
                logger.info("Peer offline: {}", device);
            }

            @Override
            public void onDiscoveryFailed(Throwable cause) {
                logger.error("Discovery stopped", cause);
            }
        });

        if (args.length > 0 && "send".equals(args[0])) {
            if (args.length < 3) {
                System.err.println("usage: send <host[:port]> <path>...");
                System.exit(2);
            }
            int status = send(node, config, args);
            System.exit(status);
        }

        Runtime.getRuntime().addShutdownHook(new Thread(node::close, "landrop-shutdown"));
        node.addTransferListener(new TransferListener() {
            @Override
            public void onCompleted(TransferTask task) {
                logger.info("Received {} from {} into {}", task.getTaskId(), task.getPeer().getName(), node.getDestinationRoot());
            }

            @Override
            public void onError(TransferTask task, String reason) {
                logger.warn("Transfer {} ended as {}: {}", task.getTaskId(), task.getStatus(), reason);
            }
        });
        node.start();
        logger.info("Local device: {}", node.localDevice());
        new CountDownLatch(1).await();
    }

    private static int send(LanDropNode node, LanDropConfig config, String[] args) throws IOException, InterruptedException {
        String target = args[1];
        String host = target;
        int port = config.transferPort();
        int colon = target.lastIndexOf(':');
        if (colon > 0 && target.indexOf(':') == colon) {
            host = target.substring(0, colon);
            port = Integer.parseInt(target.substring(colon + 1));
        }
        List<Path> picked = new ArrayList<>();
        for (int i = 2; i < args.length; i++) {
            picked.add(Path.of(args[i]));
        }
        List<FileEntry> entries = node.expand(picked);
        Device peer = new Device(host, host, host, port, "", System.currentTimeMillis());

        CountDownLatch done = new CountDownLatch(1);
        int[] status = {1};
        node.addTransferListener(new TransferListener() {
            @Override
            public void onCompleted(TransferTask task) {
                logger.info("Sent {} bytes to {} in {} ms", task.getTotalBytes(), peer.getAddress(), task.getDuration().toMillis());
                status[0] = 0;
                done.countDown();
            }

            @Override
            public void onError(TransferTask task, String reason) {
                logger.error("Transfer {} ended as {}: {}", task.getTaskId(), task.getStatus(), reason);
                done.countDown();
            }
        });
        try (node) {
            node.send(peer, entries);
            done.await();
        }
        return status[0];
    }
}
