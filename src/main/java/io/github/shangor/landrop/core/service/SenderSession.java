package io.github.shangor.landrop.core.service;

import io.github.shangor.landrop.core.model.FileEntry;
import io.github.shangor.landrop.core.model.TransferTask;
import io.github.shangor.landrop.core.net.DataFrame;
import io.github.shangor.landrop.core.net.TransferFrames;
import io.github.shangor.landrop.core.protocol.ProtocolCodec;
import io.github.shangor.landrop.core.protocol.ProtocolException;
import io.github.shangor.landrop.core.protocol.TransferRequestMessage;
import io.github.shangor.landrop.core.protocol.TransferResponseMessage;
import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.util.concurrent.ScheduledFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Initiator role: request, wait for the decision, stream every file in manifest order, send the
 * end-of-transfer sentinel and complete once the receiver confirms with its own sentinel.
 */
public class SenderSession extends TransferSession {
    private static final Logger log = LoggerFactory.getLogger(SenderSession.class);

    private final String senderId;
    private final String senderName;
    private final List<FileEntry> entries;
    private final ChannelFutureListener writeFailureListener = future -> {
        if (!future.isSuccess()) {
            onTransportError(future.cause());
        }
    };
    private int entryIndex = -1;
    private long position;
    private long remaining;
    private ScheduledFuture<?> responseTimeout;

    public SenderSession(SessionContext context, TransferTask task, String senderId, String senderName) {
        super(context);
        this.task = task;
        this.entries = task.getFiles();
        this.senderId = senderId;
        this.senderName = senderName;
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        super.channelActive(ctx);
        if (state().isTerminal()) {
            ctx.close();
            return;
        }
        transition(SessionState.REQUEST_SENT);
        TransferRequestMessage request = TransferRequestMessage.of(task.getTaskId(), senderId, senderName, entries);
        log.info("Sending transfer request {} to {}: {} entries, {} bytes", task.getTaskId(), ctx.channel().remoteAddress(),
                entries.size(), task.getTotalBytes());
        TransferFrames.writeControl(channel, ProtocolCodec.encode(request)).addListener(writeFailureListener);
        long timeoutMillis = context.config().responseTimeoutMillis();
        responseTimeout = ctx.executor().schedule(() -> {
            if (state() == SessionState.REQUEST_SENT) {
                log.warn("No response for task {} within {} ms", task.getTaskId(), timeoutMillis);
                fail("no response from receiver");
            }
        }, timeoutMillis, TimeUnit.MILLISECONDS);
    }

    @Override
    protected void onControl(String line) throws IOException {
        if (state() != SessionState.REQUEST_SENT) {
            throw new ProtocolException("Unexpected control record in state " + state());
        }
        TransferResponseMessage response = ProtocolCodec.decodeResponse(line);
        cancelResponseTimeout();
        if (!response.isAccepted()) {
            String reason = response.reason() == null || response.reason().isBlank() ? "rejected by receiver" : response.reason();
            log.info("Task {} rejected: {}", task.getTaskId(), reason);
            finish(SessionState.REJECTED, reason);
            return;
        }
        log.info("Task {} accepted, streaming {} bytes", task.getTaskId(), task.getTotalBytes());
        transition(SessionState.ACCEPTED);
        transition(SessionState.STREAMING);
        pump();
    }

    @Override
    protected void onData(DataFrame frame) throws IOException {
        throw new ProtocolException("Receiver sent file data");
    }

    /**
     * The receiver's confirmation that every byte was written.
     */
    @Override
    protected void onEndOfTransfer() throws IOException {
        if (state() != SessionState.FINISHING) {
            throw new ProtocolException("Unexpected confirmation in state " + state());
        }
        log.debug("Task {} confirmed by receiver", task.getTaskId());
        finish(SessionState.COMPLETED, "");
    }

    @Override
    public void channelWritabilityChanged(ChannelHandlerContext ctx) throws Exception {
        if (state() == SessionState.STREAMING && ctx.channel().isWritable()) {
            pump();
        }
        super.channelWritabilityChanged(ctx);
    }

    @Override
    protected void onConnectionClosed() {
        if (state() == SessionState.FINISHING) {
            fail("receiver did not confirm");
        } else {
            super.onConnectionClosed();
        }
    }

    @Override
    protected void releaseResources() {
        cancelResponseTimeout();
    }

    /**
     * Writes chunks while the transport accepts them; resumes from
     * {@link #channelWritabilityChanged(ChannelHandlerContext)}.
     */
    private void pump() {
        try {
            while (state() == SessionState.STREAMING && channel.isWritable()) {
                if (currentFile == null && !openNextFile()) {
                    channel.write(TransferFrames.endOfTransfer(channel.alloc())).addListener(writeFailureListener);
                    transition(SessionState.FINISHING);
                    log.debug("Task {} sent end-of-transfer, waiting for confirmation", task.getTaskId());
                    break;
                }
                int length = (int) Math.min(context.config().chunkSize(), remaining);
                ByteBuf chunk = TransferFrames.readChunk(channel.alloc(), currentFile, position, length);
                channel.write(chunk).addListener(writeFailureListener);
                position += length;
                remaining -= length;
                applied(length);
                if (remaining == 0) {
                    closeCurrentFile();
                }
            }
            channel.flush();
        } catch (IOException e) {
            log.warn("Failed to read source file for task {}", task.getTaskId(), e);
            fail(describe(e));
        }
    }

    /**
     * Skips directory and empty entries and opens the next file that has bytes to send.
     *
     * @return {@code false} once the manifest is exhausted
     */
    private boolean openNextFile() throws IOException {
        while (++entryIndex < entries.size()) {
            FileEntry entry = entries.get(entryIndex);
            if (entry.directory() || entry.size() == 0) {
                continue;
            }
            if (entry.sourcePath() == null) {
                throw new IOException("No source path for " + entry.name());
            }
            currentFile = FileChannel.open(entry.sourcePath(), StandardOpenOption.READ);
            position = 0;
            remaining = entry.size();
            log.debug("Task {} streaming {} ({} bytes)", task.getTaskId(), entry.sourcePath(), entry.size());
            return true;
        }
        return false;
    }

    private void cancelResponseTimeout() {
        if (responseTimeout != null) {
            responseTimeout.cancel(false);
            responseTimeout = null;
        }
    }
}
