package io.github.shangor.landrop.core.service;

import io.github.shangor.landrop.core.model.Device;
import io.github.shangor.landrop.core.model.FileEntry;
import io.github.shangor.landrop.core.model.TransferDirection;
import io.github.shangor.landrop.core.model.TransferStatus;
import io.github.shangor.landrop.core.model.TransferTask;
import io.github.shangor.landrop.core.util.FileEntries;
import io.github.shangor.landrop.core.util.LanDropConfig;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.MultiThreadIoEventLoopGroup;
import io.netty.channel.nio.NioIoHandler;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class TransferRoundTripTest {

    @TempDir
    Path source;

    @TempDir
    Path destination;

    private final EventLoopGroup group = new MultiThreadIoEventLoopGroup(1, NioIoHandler.newFactory());
    private final LanDropConfig config = LanDropConfig.defaults().withPorts(0, 0);
    private final CompletableFuture<TransferTask> received = new CompletableFuture<>();
    private final CompletableFuture<TransferTask> sent = new CompletableFuture<>();
    private final PendingDecisions decisions = new PendingDecisions();
    private TransferReceiverService receiver;
    private TransferSenderService sender;
    private Device peer;

    @BeforeEach
    void setUp() throws Exception {
        SessionContext receiverContext = SessionContext.create(config).withHistory(received::complete);
        receiver = new TransferReceiverService(group, receiverContext, () -> destination, decisions, null);
        receiver.start(0);
        SessionContext senderContext = SessionContext.create(config).withHistory(sent::complete);
        sender = new TransferSenderService(group, senderContext, "sender-id", () -> "Sender");
        peer = new Device("receiver-id", "Receiver", "127.0.0.1", receiver.port(), "linux", System.currentTimeMillis());
        receiverContext.listeners().subscribe(new TransferListener() {
            @Override
            public void onRequest(TransferTask task) {
                if (task.getPeer().getName().equals("Sender") && task.getTotalBytes() > 0) {
                    decisions.accept(task.getTaskId());
                } else {
                    decisions.reject(task.getTaskId(), "nothing to receive");
                }
            }
        });
    }

    @AfterEach
    void tearDown() {
        receiver.close();
        group.shutdownGracefully(0, 1, TimeUnit.SECONDS).awaitUninterruptibly();
    }

    @Test
    void nestedFolderArrivesByteIdentical() throws Exception {
        Random random = new Random(42);
        Path album = Files.createDirectories(source.resolve("album"));
        Files.createDirectories(album.resolve("raw/empty-dir"));
        byte[] big = new byte[300_000];
        random.nextBytes(big);
        Files.write(album.resolve("raw/big.bin"), big);
        Files.write(album.resolve("notes.txt"), "notes".getBytes());
        Files.write(album.resolve("zero.txt"), new byte[0]);
        List<FileEntry> entries = FileEntries.expand(List.of(album));

        TransferTask task = sender.send(peer, entries);

        TransferTask outbound = sent.get(10, TimeUnit.SECONDS);
        TransferTask inbound = received.get(10, TimeUnit.SECONDS);
        assertSame(task, outbound);
        assertEquals(TransferStatus.COMPLETED, outbound.getStatus(), outbound.getReason());
        assertEquals(TransferStatus.COMPLETED, inbound.getStatus(), inbound.getReason());
        assertEquals(task.getTaskId(), inbound.getTaskId());
        assertEquals(300_005, inbound.getBytesTransferred());
        assertArrayEquals(big, Files.readAllBytes(destination.resolve("raw/big.bin")));
        assertEquals("notes", Files.readString(destination.resolve("notes.txt")));
        assertEquals(0, Files.size(destination.resolve("zero.txt")));
        assertTrue(Files.isDirectory(destination.resolve("raw/empty-dir")));
    }

    @Test
    void receiverWriteFailureIsNotReportedAsSuccess() throws Exception {
        Files.createDirectories(destination.resolve("notes.txt"));
        Path file = Files.write(source.resolve("notes.txt"), "notes".getBytes());

        sender.send(peer, FileEntries.expand(List.of(file)));

        TransferTask inbound = received.get(10, TimeUnit.SECONDS);
        TransferTask outbound = sent.get(10, TimeUnit.SECONDS);
        assertEquals(TransferStatus.FAILED, inbound.getStatus());
        assertEquals(TransferStatus.FAILED, outbound.getStatus(), outbound.getReason());
    }

    @Test
    void rejectionLeavesDestinationUntouched() throws Exception {
        Path file = Files.write(source.resolve("empty.txt"), new byte[0]);

        sender.send(peer, FileEntries.expand(List.of(file)));

        TransferTask outbound = sent.get(10, TimeUnit.SECONDS);
        assertEquals(TransferStatus.REJECTED, outbound.getStatus());
        assertEquals("nothing to receive", outbound.getReason());
        assertEquals(TransferStatus.REJECTED, received.get(10, TimeUnit.SECONDS).getStatus());
        try (var files = Files.list(destination)) {
            assertEquals(0, files.count());
        }
    }

    @Test
    void unreachablePeerFails() throws Exception {
        Path file = Files.write(source.resolve("a.txt"), new byte[]{1});
        int port = receiver.port();
        receiver.close();
        Device gone = new Device("gone", "Gone", "127.0.0.1", port, "linux", 0);

        sender.send(gone, FileEntries.expand(List.of(file)));

        TransferTask outbound = sent.get(10, TimeUnit.SECONDS);
        assertEquals(TransferStatus.FAILED, outbound.getStatus());
        assertTrue(outbound.getReason().startsWith("could not connect"));
    }

    @Test
    void secondSendWhileBusyFailsImmediately() throws Exception {
        Path file = Files.write(source.resolve("a.txt"), new byte[]{1});
        List<FileEntry> entries = FileEntries.expand(List.of(file));
        SessionContext busy = SessionContext.create(config);
        TransferSenderService busySender = new TransferSenderService(group, busy, "id", () -> "Busy");
        assertTrue(busy.slot().tryAcquire(new SenderSession(busy, new TransferTask("holder", peer, entries,
                TransferDirection.OUTBOUND), "id", "Busy")));

        TransferTask task = busySender.send(peer, entries);

        assertEquals(TransferStatus.FAILED, task.getStatus());
        assertEquals("another transfer is in progress", task.getReason());
    }
}
