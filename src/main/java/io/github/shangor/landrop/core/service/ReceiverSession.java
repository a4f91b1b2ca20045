package io.github.shangor.landrop.core.service;

import io.github.shangor.landrop.core.model.Device;
import io.github.shangor.landrop.core.model.FileEntry;
import io.github.shangor.landrop.core.model.TransferDirection;
import io.github.shangor.landrop.core.model.TransferTask;
import io.github.shangor.landrop.core.net.DataFrame;
import io.github.shangor.landrop.core.net.TransferFrames;
import io.github.shangor.landrop.core.protocol.ProtocolCodec;
import io.github.shangor.landrop.core.protocol.ProtocolException;
import io.github.shangor.landrop.core.protocol.TransferRequestMessage;
import io.github.shangor.landrop.core.protocol.TransferResponseMessage;
import io.github.shangor.landrop.core.util.PathUtil;
import io.netty.buffer.ByteBuf;
import io.netty.channel.Channel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletionStage;
import java.util.function.Supplier;

/**
 * Responder role: parse and validate the manifest, suspend until the accept policy decides,
 * then materialise entries below the destination root as their bytes arrive.
 */
public class ReceiverSession extends TransferSession {
    private static final Logger log = LoggerFactory.getLogger(ReceiverSession.class);

    private final Supplier<Path> destinationRoot;
    private final AcceptPolicy acceptPolicy;
    private final DeviceRegistry devices;
    private List<FileEntry> entries = List.of();
    private List<Path> targets = List.of();
    private Path root;
    private int entryIndex = -1;
    private long position;
    private long remaining;

    public ReceiverSession(SessionContext context, Supplier<Path> destinationRoot, AcceptPolicy acceptPolicy, DeviceRegistry devices) {
        super(context);
        this.destinationRoot = destinationRoot;
        this.acceptPolicy = acceptPolicy;
        this.devices = devices;
    }

    @Override
    protected void onControl(String line) throws IOException {
        if (state() != SessionState.IDLE) {
            throw new ProtocolException("Unexpected control record in state " + state());
        }
        TransferRequestMessage request;
        try {
            request = ProtocolCodec.decodeRequest(line);
        } catch (ProtocolException e) {
            respond(TransferResponseMessage.reject("invalid request: " + e.getMessage()));
            throw e;
        }
        entries = request.toFileEntries();
        String taskId = request.taskId() == null || request.taskId().isBlank() ? UUID.randomUUID().toString() : request.taskId();
        task = new TransferTask(taskId, resolvePeer(request), entries, TransferDirection.INBOUND);
        if (!context.tasks().register(this)) {
            taskId = UUID.randomUUID().toString();
            task = new TransferTask(taskId, task.getPeer(), entries, TransferDirection.INBOUND);
            context.tasks().register(this);
        }
        transition(SessionState.REQUEST_RECEIVED);
        log.info("Transfer request {} from {}: {} entries, {} bytes", taskId, task.getPeer().getName(),
                entries.size(), task.getTotalBytes());

        root = destinationRoot.get();
        List<Path> resolved = new ArrayList<>(entries.size());
        for (FileEntry entry : entries) {
            try {
                resolved.add(PathUtil.resolveUnder(root, entry.targetPath()));
            } catch (ProtocolException e) {
                respond(TransferResponseMessage.reject(e.getMessage()));
                throw e;
            }
        }
        targets = resolved;

        if (!context.slot().tryAcquire(this)) {
            log.info("Rejecting task {}: another transfer is active", taskId);
            respond(TransferResponseMessage.reject("receiver busy"));
            finish(SessionState.REJECTED, "receiver busy");
            return;
        }

        channel.config().setAutoRead(false);
        CompletionStage<TransferDecision> decision = acceptPolicy.decide(task);
        context.listeners().fire(l -> l.onRequest(task));
        decision.whenComplete((result, error) -> runOnLoop(() -> onDecision(result, error)));
    }

    private void onDecision(TransferDecision decision, Throwable error) {
        if (state() != SessionState.REQUEST_RECEIVED) {
            log.debug("Ignoring decision for task {} in state {}", taskId(), state());
            return;
        }
        if (error != null) {
            log.warn("Accept decision for task {} failed", taskId(), error);
            decision = TransferDecision.reject("receiver could not decide");
        }
        if (!decision.accepted()) {
            respond(TransferResponseMessage.reject(decision.reason()));
            finish(SessionState.REJECTED, decision.reason());
            return;
        }
        respond(TransferResponseMessage.accept());
        transition(SessionState.ACCEPTED);
        transition(SessionState.STREAMING);
        channel.config().setAutoRead(true);
        try {
            Files.createDirectories(root);
            skipEmptyEntries();
        } catch (IOException e) {
            log.warn("Failed to prepare destination for task {}", taskId(), e);
            fail(describe(e));
        }
    }

    @Override
    protected void onData(DataFrame frame) throws IOException {
        if (state() != SessionState.STREAMING) {
            throw new ProtocolException("File data received in state " + state());
        }
        ByteBuf buf = frame.content();
        while (buf.isReadable()) {
            if (currentFile == null && !openNextFile()) {
                throw new ProtocolException("Received more data than the manifest declared");
            }
            int length = (int) Math.min(buf.readableBytes(), remaining);
            int written = 0;
            while (written < length) {
                written += buf.readBytes(currentFile, position + written, length - written);
            }
            position += written;
            remaining -= written;
            applied(written);
            if (remaining == 0) {
                closeCurrentFile();
                skipEmptyEntries();
            }
        }
    }

    @Override
    protected void onEndOfTransfer() throws IOException {
        if (state() != SessionState.STREAMING) {
            throw new ProtocolException("End of transfer received in state " + state());
        }
        skipEmptyEntries();
        if (currentFile != null || entryIndex + 1 < entries.size()) {
            throw new ProtocolException("Transfer ended before all declared bytes were received");
        }
        transition(SessionState.FINISHING);
        finish(SessionState.COMPLETED, "");
    }

    /**
     * A completed transfer is confirmed with a zero-length frame; the initiator only reports success
     * once it has seen it.
     */
    @Override
    protected ByteBuf closingRecord(Channel ch, SessionState terminal) {
        if (terminal == SessionState.COMPLETED) {
            return TransferFrames.endOfTransfer(ch.alloc());
        }
        return super.closingRecord(ch, terminal);
    }

    @Override
    protected void releaseResources() {
        if (task != null) {
            acceptPolicy.abandon(task);
        }
    }

    /**
     * Creates directories and empty files that follow the current position, stopping at the
     * next entry that still expects bytes.
     */
    private void skipEmptyEntries() throws IOException {
        while (currentFile == null && entryIndex + 1 < entries.size()) {
            FileEntry next = entries.get(entryIndex + 1);
            if (!next.directory() && next.size() > 0) {
                return;
            }
            entryIndex++;
            Path target = targets.get(entryIndex);
            PathUtil.requireInsideRealRoot(root, target);
            if (next.directory()) {
                Files.createDirectories(target);
                log.debug("Task {} created directory {}", taskId(), target);
            } else {
                openForWrite(target).close();
                log.debug("Task {} created empty file {}", taskId(), target);
            }
        }
    }

    private boolean openNextFile() throws IOException {
        skipEmptyEntries();
        if (entryIndex + 1 >= entries.size()) {
            return false;
        }
        entryIndex++;
        FileEntry entry = entries.get(entryIndex);
        Path target = targets.get(entryIndex);
        PathUtil.requireInsideRealRoot(root, target);
        currentFile = openForWrite(target);
        position = 0;
        remaining = entry.size();
        log.debug("Task {} receiving {} ({} bytes)", taskId(), target, entry.size());
        return true;
    }

    private static FileChannel openForWrite(Path target) throws IOException {
        Path parent = target.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        FileChannel file = FileChannel.open(target, StandardOpenOption.CREATE, StandardOpenOption.WRITE,
                StandardOpenOption.TRUNCATE_EXISTING, LinkOption.NOFOLLOW_LINKS);
        try {
            FileLock lock = file.tryLock();
            if (lock == null) {
                throw new IOException("File is locked by another process: " + target);
            }
        } catch (IOException | RuntimeException e) {
            file.close();
            throw e;
        }
        return file;
    }

    private void respond(TransferResponseMessage response) {
        TransferFrames.writeControl(channel, ProtocolCodec.encode(response)).addListener(future -> {
            if (!future.isSuccess()) {
                onTransportError(future.cause());
            }
        });
    }

    private Device resolvePeer(TransferRequestMessage request) {
        String address = remoteHost();
        if (request.senderId() != null && devices != null) {
            Device known = devices.get(request.senderId()).orElse(null);
            if (known != null) {
                return known;
            }
        }
        String id = request.senderId() == null || request.senderId().isBlank() ? "unknown" : request.senderId();
        String name = request.senderName() == null || request.senderName().isBlank() ? address : request.senderName();
        return new Device(id, name, address, 0, "", System.currentTimeMillis());
    }

    private String remoteHost() {
        if (channel != null && channel.remoteAddress() instanceof InetSocketAddress remote) {
            return remote.getAddress() != null ? remote.getAddress().getHostAddress() : remote.getHostString();
        }
        return "unknown";
    }
}
