package io.github.shangor.landrop.core.service;

import io.github.shangor.landrop.core.net.TransferFrameDecoder;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.file.Path;
import java.util.function.Supplier;

/**
 * Listens for inbound transfer connections. Each accepted connection gets its own
 * {@link ReceiverSession}.
 */
public class TransferReceiverService implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(TransferReceiverService.class);

    private final EventLoopGroup group;
    private final SessionContext context;
    private final Supplier<Path> destinationRoot;
    private final AcceptPolicy acceptPolicy;
    private final DeviceRegistry devices;
    private volatile Channel serverChannel;

    public TransferReceiverService(EventLoopGroup group, SessionContext context, Supplier<Path> destinationRoot,
                                   AcceptPolicy acceptPolicy, DeviceRegistry devices) {
        this.group = group;
        this.context = context;
        this.destinationRoot = destinationRoot;
        this.acceptPolicy = acceptPolicy;
        this.devices = devices;
    }

    public void start(int port) throws IOException {
        ServerBootstrap bootstrap = new ServerBootstrap()
                .group(group)
                .channel(NioServerSocketChannel.class)
                .option(ChannelOption.SO_REUSEADDR, true)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ch.pipeline()
                                .addLast("frames", new TransferFrameDecoder(context.config().maxHeaderLength(),
                                        context.config().maxFrameLength()))
                                .addLast("session", new ReceiverSession(context, destinationRoot, acceptPolicy, devices));
                    }
                });
        ChannelFuture future = bootstrap.bind(port).awaitUninterruptibly();
        if (!future.isSuccess()) {
            throw new IOException("Failed to bind transfer port " + port, future.cause());
        }
        serverChannel = future.channel();
        log.info("Transfer server listening on port {}", port());
    }

    public int port() {
        Channel ch = serverChannel;
        if (ch == null) {
            return -1;
        }
        return ((InetSocketAddress) ch.localAddress()).getPort();
    }

    @Override
    public void close() {
        Channel ch = serverChannel;
        serverChannel = null;
        if (ch != null) {
            ch.close().awaitUninterruptibly();
            log.info("Transfer server stopped");
        }
    }
}
