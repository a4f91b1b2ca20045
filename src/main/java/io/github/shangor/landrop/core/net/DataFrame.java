package io.github.shangor.landrop.core.net;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.DefaultByteBufHolder;

/**
 * Payload of one non-empty length-prefixed frame. Frame boundaries carry no meaning beyond the
 * bytes themselves; a frame may span the end of one file and the start of the next.
 */
public final class DataFrame extends DefaultByteBufHolder {

    public DataFrame(ByteBuf content) {
        super(content);
    }

    public int length() {
        return content().readableBytes();
    }

    @Override
    public DataFrame replace(ByteBuf content) {
        return new DataFrame(content);
    }
}
