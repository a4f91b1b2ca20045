package io.github.shangor.landrop.core.net;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.socket.DatagramChannel;
import io.netty.channel.socket.DatagramPacket;
import io.netty.channel.socket.nio.NioDatagramChannel;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

/**
 * Broadcast-capable datagram endpoint running on a caller-supplied event loop group.
 */
public class UdpEndpoint implements AutoCloseable {
    private final EventLoopGroup group;
    private volatile Channel channel;

    public UdpEndpoint(EventLoopGroup group) {
        this.group = group;
    }

    public void bind(int port, BiConsumer<InetSocketAddress, byte[]> onMessage, Consumer<Throwable> onError) throws IOException {
        Bootstrap bootstrap = new Bootstrap()
                .group(group)
                .channel(NioDatagramChannel.class)
                .option(ChannelOption.SO_BROADCAST, true)
                .option(ChannelOption.SO_REUSEADDR, true)
                .handler(new ChannelInitializer<DatagramChannel>() {
                    @Override
                    protected void initChannel(DatagramChannel ch) {
                        ch.pipeline().addLast(new SimpleChannelInboundHandler<DatagramPacket>() {
                            @Override
                            protected void channelRead0(ChannelHandlerContext ctx, DatagramPacket packet) {
                                ByteBuf buf = packet.content();
                                byte[] data = new byte[buf.readableBytes()];
                                buf.readBytes(data);
                                onMessage.accept(packet.sender(), data);
                            }

                            @Override
                            public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
                                onError.accept(cause);
                            }
                        });
                    }
                });

        ChannelFuture future = bootstrap.bind(port).awaitUninterruptibly();
        if (!future.isSuccess()) {
            throw new IOException("Failed to bind UDP port " + port, future.cause());
        }
        channel = future.channel();
    }

    public ChannelFuture send(InetSocketAddress recipient, byte[] data) {
        Channel ch = channel;
        if (ch == null) {
            throw new IllegalStateException("Channel not bound");
        }
        ByteBuf buf = Unpooled.wrappedBuffer(data);
        return ch.writeAndFlush(new DatagramPacket(buf, recipient));
    }

    public int localPort() {
        Channel ch = channel;
        if (ch == null) {
            return -1;
        }
        return ((InetSocketAddress) ch.localAddress()).getPort();
    }

    public boolean isOpen() {
        Channel ch = channel;
        return ch != null && ch.isOpen();
    }

    public Channel channel() {
        return channel;
    }

    @Override
    public void close() {
        Channel ch = channel;
        if (ch != null) {
            ch.close();
        }
    }
}
