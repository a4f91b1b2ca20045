package io.github.shangor.landrop.core.net;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;
import io.netty.handler.codec.CorruptedFrameException;
import io.netty.handler.codec.TooLongFrameException;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Splits an inbound transfer stream into one {@link ControlLine} followed by {@link DataFrame}s and
 * {@link EndOfTransfer}. Nothing is emitted until the declared number of bytes is buffered, so TCP
 * segment boundaries never leak into the protocol.
 */
public class TransferFrameDecoder extends ByteToMessageDecoder {
    private static final int LENGTH_FIELD = 4;

    private final int maxHeaderLength;
    private final int maxFrameLength;
    private boolean headerDecoded;

    public TransferFrameDecoder(int maxHeaderLength, int maxFrameLength) {
        this.maxHeaderLength = maxHeaderLength;
        this.maxFrameLength = maxFrameLength;
    }

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) {
        if (!headerDecoded) {
            decodeHeader(in, out);
            return;
        }
        if (in.readableBytes() < LENGTH_FIELD) {
            return;
        }
        int length = in.getInt(in.readerIndex());
        if (length < 0) {
            throw new CorruptedFrameException("Negative frame length: " + length);
        }
        if (length > maxFrameLength) {
            throw new TooLongFrameException("Frame length " + length + " exceeds " + maxFrameLength);
        }
        if (length == 0) {
            in.skipBytes(LENGTH_FIELD);
            out.add(EndOfTransfer.INSTANCE);
            return;
        }
        if (in.readableBytes() < LENGTH_FIELD + length) {
            return;
        }
        in.skipBytes(LENGTH_FIELD);
        out.add(new DataFrame(in.readRetainedSlice(length)));
    }

    private void decodeHeader(ByteBuf in, List<Object> out) {
        int start = in.readerIndex();
        int eol = in.indexOf(start, in.writerIndex(), (byte) '\n');
        if (eol < 0) {
            if (in.readableBytes() > maxHeaderLength) {
                throw new TooLongFrameException("Control record longer than " + maxHeaderLength + " bytes");
            }
            return;
        }
        int length = eol - start;
        if (length > maxHeaderLength) {
            throw new TooLongFrameException("Control record longer than " + maxHeaderLength + " bytes");
        }
        String line = in.toString(start, length, StandardCharsets.UTF_8);
        if (line.endsWith("\r")) {
            line = line.substring(0, line.length() - 1);
        }
        in.skipBytes(length + 1);
        headerDecoded = true;
        out.add(new ControlLine(line));
    }
}
