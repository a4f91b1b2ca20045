package io.github.shangor.landrop.core.service;

import io.github.shangor.landrop.core.model.TransferTask;
import io.github.shangor.landrop.core.net.ControlLine;
import io.github.shangor.landrop.core.net.DataFrame;
import io.github.shangor.landrop.core.net.EndOfTransfer;
import io.github.shangor.landrop.core.protocol.ProtocolException;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.handler.codec.DecoderException;
import io.netty.util.ReferenceCountUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.channels.FileChannel;

/**
 * One transfer conversation over one connection. Every method runs on the connection's event
 * loop; calls from elsewhere go through {@link #runOnLoop(Runnable)}.
 */
public abstract class TransferSession extends ChannelInboundHandlerAdapter {
    private static final Logger log = LoggerFactory.getLogger(TransferSession.class);

    protected final SessionContext context;
    protected volatile TransferTask task;
    protected volatile Channel channel;
    protected FileChannel currentFile;
    private volatile SessionState state = SessionState.IDLE;
    private ProgressMeter meter;

    protected TransferSession(SessionContext context) {
        this.context = context;
    }

    public SessionState state() {
        return state;
    }

    public TransferTask task() {
        return task;
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        channel = ctx.channel();
        super.channelActive(ctx);
    }

    @Override
    public void channelRead(ChannelHandlerContext ctx, Object msg) {
        try {
            if (state.isTerminal()) {
                return;
            }
            if (msg instanceof ControlLine line) {
                onControl(line.text());
            } else if (msg instanceof DataFrame frame) {
                onData(frame);
            } else if (msg == EndOfTransfer.INSTANCE) {
                onEndOfTransfer();
            } else {
                log.debug("Ignoring unexpected message {}", msg);
            }
        } catch (ProtocolException e) {
            log.warn("Protocol error in task {}: {}", taskId(), e.getMessage());
            fail(e.getMessage());
        } catch (IOException e) {
            log.warn("I/O error in task {}", taskId(), e);
            fail(describe(e));
        } finally {
            ReferenceCountUtil.release(msg);
        }
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        onConnectionClosed();
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        onTransportError(cause);
    }

    protected void onTransportError(Throwable cause) {
        if (state.isTerminal()) {
            log.debug("Ignoring error after task {} ended", taskId(), cause);
            return;
        }
        Throwable root = cause instanceof DecoderException && cause.getCause() != null ? cause.getCause() : cause;
        log.warn("Transfer connection error in task {}: {}", taskId(), root.toString());
        fail(describe(root));
    }

    protected abstract void onControl(String line) throws IOException;

    protected abstract void onData(DataFrame frame) throws IOException;

    protected abstract void onEndOfTransfer() throws IOException;

    protected void onConnectionClosed() {
        if (!state.isTerminal()) {
            fail("connection closed by peer");
        }
    }

    /**
     * Stops the session from any non-terminal state: no further chunks are read or written, open
     * files are closed and the connection is dropped.
     */
    public void cancel() {
        runOnLoop(() -> {
            if (!state.isTerminal()) {
                log.info("Cancelling task {}", taskId());
                finish(SessionState.CANCELLED, "cancelled by user");
            }
        });
    }

    public void fail(String reason) {
        finish(SessionState.FAILED, reason);
    }

    protected void transition(SessionState next) {
        if (!state.canMoveTo(next)) {
            throw new IllegalStateException("Illegal transition " + state + " -> " + next + " for task " + taskId());
        }
        log.debug("Task {}: {} -> {}", taskId(), state, next);
        state = next;
        if (task != null) {
            task.setStatus(next.toStatus());
            if (next == SessionState.STREAMING) {
                meter = new ProgressMeter(context.config().progressIntervalMillis(), System.nanoTime());
            }
            context.listeners().fire(l -> l.onStatusChanged(task));
        }
    }

    /**
     * Moves to a terminal state exactly once: files closed, streaming slot released, connection
     * closed, task handed to history and listeners.
     *
     * @return {@code false} if the session had already ended
     */
    protected boolean finish(SessionState terminal, String reason) {
        if (state.isTerminal()) {
            return false;
        }
        state = terminal;
        closeCurrentFile();
        releaseResources();
        context.slot().release(this);
        Channel ch = channel;
        if (ch != null && ch.isOpen()) {
            if (terminal == SessionState.COMPLETED || terminal == SessionState.REJECTED) {
                ch.writeAndFlush(closingRecord(ch, terminal)).addListener(ChannelFutureListener.CLOSE);
            } else {
                ch.close();
            }
        }
        TransferTask t = task;
        if (t == null) {
            log.info("Session ended as {} before a task was created: {}", terminal, reason);
            return true;
        }
        t.setReason(reason);
        t.setStatus(terminal.toStatus());
        context.tasks().remove(this);
        if (terminal == SessionState.COMPLETED) {
            log.info("Task {} completed: {} bytes in {} ms", t.getTaskId(), t.getBytesTransferred(), t.getDuration().toMillis());
            context.listeners().fire(l -> l.onProgress(progressSnapshot(t)));
            context.listeners().fire(l -> l.onStatusChanged(t));
            context.listeners().fire(l -> l.onCompleted(t));
        } else {
            log.info("Task {} ended as {}: {}", t.getTaskId(), terminal, reason);
            context.listeners().fire(l -> l.onStatusChanged(t));
            context.listeners().fire(l -> l.onError(t, reason));
        }
        context.history().record(t);
        return true;
    }

    /**
     * Last bytes written before an orderly close. Already queued control records are flushed
     * ahead of it.
     */
    protected ByteBuf closingRecord(Channel ch, SessionState terminal) {
        return Unpooled.EMPTY_BUFFER;
    }

    /**
     * Hook for subclasses to release anything beyond the current file.
     */
    protected void releaseResources() {
    }

    /**
     * Accounts for bytes written to disk or handed to the transport.
     */
    protected void applied(long bytes) {
        TransferTask t = task;
        t.addBytesTransferred(bytes);
        if (meter != null && meter.record(bytes, System.nanoTime())) {
            t.setBytesPerSecond(meter.bytesPerSecond());
            context.listeners().fire(l -> l.onProgress(progressSnapshot(t)));
        }
    }

    protected void closeCurrentFile() {
        FileChannel file = currentFile;
        currentFile = null;
        if (file != null) {
            try {
                file.close();
            } catch (IOException e) {
                log.debug("Failed to close file channel for task {}", taskId(), e);
            }
        }
    }

    protected void runOnLoop(Runnable action) {
        Channel ch = channel;
        if (ch == null || ch.eventLoop().inEventLoop()) {
            action.run();
        } else {
            ch.eventLoop().execute(action);
        }
    }

    protected String taskId() {
        TransferTask t = task;
        return t == null ? "-" : t.getTaskId();
    }

    static TransferProgress progressSnapshot(TransferTask task) {
        return new TransferProgress(task.getTaskId(), task.getBytesTransferred(), task.getTotalBytes(),
                task.getProgress(), task.getBytesPerSecond());
    }

    static String describe(Throwable cause) {
        String message = cause.getMessage();
        return message == null || message.isBlank() ? cause.getClass().getSimpleName() : message;
    }
}
