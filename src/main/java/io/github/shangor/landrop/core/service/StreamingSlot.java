package io.github.shangor.landrop.core.service;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-wide guard that lets only one session move file data at a time.
 */
public class StreamingSlot {
    private final AtomicReference<TransferSession> holder = new AtomicReference<>();

    public boolean tryAcquire(TransferSession session) {
        return holder.compareAndSet(null, session) || holder.get() == session;
    }

    public void release(TransferSession session) {
        holder.compareAndSet(session, null);
    }

    public boolean isBusy() {
        return holder.get() != null;
    }
}
