package io.github.shangor.landrop.core.service;

import io.github.shangor.landrop.core.model.Device;
import io.github.shangor.landrop.core.model.FileEntry;
import io.github.shangor.landrop.core.model.TransferDirection;
import io.github.shangor.landrop.core.model.TransferTask;
import io.github.shangor.landrop.core.net.TransferFrameDecoder;
import io.netty.bootstrap.Bootstrap;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.WriteBufferWaterMark;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.List;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Opens one outbound connection per transfer and drives it with a {@link SenderSession}.
 */
public class TransferSenderService {
    private static final Logger log = LoggerFactory.getLogger(TransferSenderService.class);

    private final EventLoopGroup group;
    private final SessionContext context;
    private final String senderId;
    private final Supplier<String> senderName;

    public TransferSenderService(EventLoopGroup group, SessionContext context, String senderId, Supplier<String> senderName) {
        this.group = group;
        this.context = context;
        this.senderId = senderId;
        this.senderName = senderName;
    }

    /**
     * Starts sending {@code entries} to {@code peer}. Failures after this point, including a
     * refused connection, are reported through the transfer listeners.
     *
     * @return the new task; already FAILED if another transfer holds the streaming slot
     */
    public TransferTask send(Device peer, List<FileEntry> entries) {
        if (entries == null || entries.isEmpty()) {
            throw new IllegalArgumentException("Nothing to send");
        }
        for (FileEntry entry : entries) {
            if (!entry.directory() && entry.size() > 0 && entry.sourcePath() == null) {
                throw new IllegalArgumentException("No source path for " + entry.name());
            }
        }
        TransferTask task = new TransferTask(UUID.randomUUID().toString(), peer, entries, TransferDirection.OUTBOUND);
        SenderSession session = new SenderSession(context, task, senderId, senderName.get());
        context.tasks().register(session);
        context.listeners().fire(l -> l.onStatusChanged(task));
        if (!context.slot().tryAcquire(session)) {
            log.info("Refusing to start task {}: another transfer is in progress", task.getTaskId());
            session.fail("another transfer is in progress");
            return task;
        }

        InetSocketAddress remote = new InetSocketAddress(peer.getAddress(), peer.getTransferPort());
        int chunk = context.config().chunkSize();
        Bootstrap bootstrap = new Bootstrap()
                .group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.TCP_NODELAY, true)
                .option(ChannelOption.WRITE_BUFFER_WATER_MARK, new WriteBufferWaterMark(chunk, chunk * 4))
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ch.pipeline()
                                .addLast("frames", new TransferFrameDecoder(context.config().maxHeaderLength(),
                                        context.config().maxFrameLength()))
                                .addLast("session", session);
                    }
                });
        log.info("Connecting to {} for task {}", remote, task.getTaskId());
        ChannelFuture connect = bootstrap.connect(remote);
        connect.addListener(future -> {
            if (!future.isSuccess()) {
                log.warn("Could not connect to {} for task {}: {}", remote, task.getTaskId(), future.cause().toString());
                session.fail("could not connect to " + remote + ": " + TransferSession.describe(future.cause()));
            }
        });
        return task;
    }
}
