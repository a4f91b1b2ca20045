package io.github.shangor.landrop.core.service;

import io.github.shangor.landrop.core.model.Device;
import io.github.shangor.landrop.core.model.FileEntry;
import io.github.shangor.landrop.core.model.TransferDirection;
import io.github.shangor.landrop.core.model.TransferStatus;
import io.github.shangor.landrop.core.model.TransferTask;
import io.github.shangor.landrop.core.net.TransferFrameDecoder;
import io.github.shangor.landrop.core.protocol.ProtocolCodec;
import io.github.shangor.landrop.core.protocol.TransferRequestMessage;
import io.github.shangor.landrop.core.protocol.TransferResponseMessage;
import io.github.shangor.landrop.core.util.LanDropConfig;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class SenderSessionTest {

    private static final Device PEER = new Device("peer", "Peer", "127.0.0.1", 5201, "linux", 0);

    @TempDir
    Path dir;

    private SessionContext context;
    private final List<TransferTask> history = new ArrayList<>();

    @BeforeEach
    void setUp() {
        Properties props = new Properties();
        props.setProperty("transfer.chunk-size", "512");
        props.setProperty("transfer.response-timeout-ms", "20");
        context = SessionContext.create(LanDropConfig.fromProperties(props)).withHistory(history::add);
    }

    private SenderSession session(List<FileEntry> entries) {
        TransferTask task = new TransferTask("task-1", PEER, entries, TransferDirection.OUTBOUND);
        SenderSession session = new SenderSession(context, task, "me", "My Laptop");
        context.tasks().register(session);
        return session;
    }

    private static EmbeddedChannel channel(SenderSession session) {
        return new EmbeddedChannel(new TransferFrameDecoder(1 << 20, 1 << 20), session);
    }

    private static ByteBuf line(TransferResponseMessage response) {
        return Unpooled.copiedBuffer(ProtocolCodec.encode(response) + "\n", StandardCharsets.UTF_8);
    }

    private static ByteBuf drainOutbound(EmbeddedChannel ch) {
        ByteBuf all = Unpooled.buffer();
        for (ByteBuf buf = ch.readOutbound(); buf != null; buf = ch.readOutbound()) {
            all.writeBytes(buf);
            buf.release();
        }
        return all;
    }

    private static String readLine(ByteBuf buf) {
        int eol = buf.indexOf(buf.readerIndex(), buf.writerIndex(), (byte) '\n');
        String text = buf.toString(buf.readerIndex(), eol - buf.readerIndex(), StandardCharsets.UTF_8);
        buf.readerIndex(eol + 1);
        return text;
    }

    @Test
    void streamsManifestInOrderAfterAcceptance() throws Exception {
        byte[] a = new byte[1100];
        for (int i = 0; i < a.length; i++) {
            a[i] = (byte) i;
        }
        Path fileA = Files.write(dir.resolve("a.bin"), a);
        Path empty = Files.write(dir.resolve("empty.txt"), new byte[0]);
        Path fileB = Files.write(dir.resolve("b.txt"), "hello".getBytes(StandardCharsets.UTF_8));
        List<FileEntry> entries = List.of(
                FileEntry.file(fileA, 1100, null),
                FileEntry.directory(dir, "folder"),
                FileEntry.file(empty, 0, "folder/empty.txt"),
                FileEntry.file(fileB, 5, "folder/b.txt"));
        SenderSession session = session(entries);
        EmbeddedChannel ch = channel(session);

        assertEquals(SessionState.REQUEST_SENT, session.state());
        ByteBuf out = drainOutbound(ch);
        TransferRequestMessage request = ProtocolCodec.decodeRequest(readLine(out));
        assertEquals(1105L, request.totalSize());
        assertEquals("task-1", request.taskId());
        assertEquals("My Laptop", request.senderName());
        assertEquals(4, request.files().size());
        out.release();

        ch.writeInbound(line(TransferResponseMessage.accept()));
        assertEquals(SessionState.FINISHING, session.state());

        ByteBuf frames = drainOutbound(ch);
        List<Integer> lengths = new ArrayList<>();
        ByteBuf payload = Unpooled.buffer();
        while (frames.isReadable()) {
            int length = frames.readInt();
            lengths.add(length);
            payload.writeBytes(frames, length);
        }
        frames.release();
        assertEquals(List.of(512, 512, 76, 5, 0), lengths);
        byte[] expected = new byte[1105];
        System.arraycopy(a, 0, expected, 0, 1100);
        System.arraycopy("hello".getBytes(StandardCharsets.UTF_8), 0, expected, 1100, 5);
        byte[] actual = new byte[payload.readableBytes()];
        payload.readBytes(actual);
        payload.release();
        assertArrayEquals(expected, actual);

        ch.writeInbound(Unpooled.buffer(4).writeInt(0));
        assertEquals(SessionState.COMPLETED, session.state());
        assertEquals(TransferStatus.COMPLETED, history.get(0).getStatus());
        assertEquals(1105, history.get(0).getBytesTransferred());
        assertNull(context.tasks().get("task-1"));
    }

    @Test
    void rejectionEndsSessionWithReason() {
        SenderSession session = session(List.of(new FileEntry("x", 0, false, null, null)));
        EmbeddedChannel ch = channel(session);
        drainOutbound(ch).release();

        ch.writeInbound(line(TransferResponseMessage.reject("receiver busy")));

        assertEquals(SessionState.REJECTED, session.state());
        assertEquals("receiver busy", session.task().getReason());
        assertEquals(TransferStatus.REJECTED, history.get(0).getStatus());
        assertFalse(ch.isOpen());
    }

    @Test
    void missingResponseTimesOut() throws Exception {
        SenderSession session = session(List.of(new FileEntry("x", 0, false, null, null)));
        EmbeddedChannel ch = channel(session);
        drainOutbound(ch).release();

        Thread.sleep(60);
        ch.runScheduledPendingTasks();

        assertEquals(SessionState.FAILED, session.state());
        assertEquals("no response from receiver", session.task().getReason());
    }

    @Test
    void closeWithoutConfirmationFails() {
        SenderSession session = session(List.of(new FileEntry("x", 0, false, null, null)));
        EmbeddedChannel ch = channel(session);
        drainOutbound(ch).release();
        ch.writeInbound(line(TransferResponseMessage.accept()));
        assertEquals(SessionState.FINISHING, session.state());

        ch.close();

        assertEquals(SessionState.FAILED, session.state());
        assertEquals("receiver did not confirm", session.task().getReason());
        assertEquals(TransferStatus.FAILED, history.get(0).getStatus());
    }

    @Test
    void closeBeforeCompletionFails() {
        SenderSession session = session(List.of(new FileEntry("x", 0, false, null, null)));
        EmbeddedChannel ch = channel(session);
        drainOutbound(ch).release();

        ch.close();

        assertEquals(SessionState.FAILED, session.state());
        assertEquals("connection closed by peer", session.task().getReason());
    }

    @Test
    void truncatedSourceFileFails() throws Exception {
        Path file = Files.write(dir.resolve("short.bin"), new byte[100]);
        SenderSession session = session(List.of(FileEntry.file(file, 400, null)));
        EmbeddedChannel ch = channel(session);
        drainOutbound(ch).release();

        ch.writeInbound(line(TransferResponseMessage.accept()));

        assertEquals(SessionState.FAILED, session.state());
        assertFalse(ch.isOpen());
    }

    @Test
    void cancelBeforeResponse() {
        SenderSession session = session(List.of(new FileEntry("x", 0, false, null, null)));
        EmbeddedChannel ch = channel(session);

        session.cancel();

        assertEquals(SessionState.CANCELLED, session.state());
        assertEquals(TransferStatus.CANCELLED, history.get(0).getStatus());
        assertFalse(ch.isOpen());
    }
}
