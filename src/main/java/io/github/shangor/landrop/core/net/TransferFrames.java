package io.github.shangor.landrop.core.net;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufAllocator;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;

/**
 * Helpers for writing the transfer wire format.
 */
public final class TransferFrames {

    private TransferFrames() {
    }

    public static ChannelFuture writeControl(Channel channel, String json) {
        byte[] data = json.getBytes(StandardCharsets.UTF_8);
        ByteBuf buf = channel.alloc().buffer(data.length + 1);
        buf.writeBytes(data);
        buf.writeByte('\n');
        return channel.writeAndFlush(buf);
    }

    /**
     * Reads exactly {@code length} bytes at {@code position} into a new length-prefixed frame.
     *
     * @throws IOException if the file ends before {@code length} bytes were read
     */
    public static ByteBuf readChunk(ByteBufAllocator alloc, FileChannel file, long position, int length) throws IOException {
        ByteBuf buf = alloc.buffer(4 + length);
        try {
            buf.writeInt(length);
            int remaining = length;
            long offset = position;
            while (remaining > 0) {
                int read = buf.writeBytes(file, offset, remaining);
                if (read < 0) {
                    throw new IOException("File ended " + remaining + " bytes before its declared size");
                }
                remaining -= read;
                offset += read;
            }
            return buf;
        } catch (IOException | RuntimeException e) {
            buf.release();
            throw e;
        }
    }

    public static ByteBuf endOfTransfer(ByteBufAllocator alloc) {
        return alloc.buffer(4).writeInt(0);
    }
}
