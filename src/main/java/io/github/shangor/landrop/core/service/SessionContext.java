package io.github.shangor.landrop.core.service;

import io.github.shangor.landrop.core.util.LanDropConfig;

/**
 * Collaborators shared by every session of one node.
 */
public record SessionContext(LanDropConfig config,
                             TaskRegistry tasks,
                             StreamingSlot slot,
                             ListenerList<TransferListener> listeners,
                             TransferHistory history) {

    public static SessionContext create(LanDropConfig config) {
        return new SessionContext(config, new TaskRegistry(), new StreamingSlot(), new ListenerList<>(), TransferHistory.NONE);
    }

    public SessionContext withHistory(TransferHistory history) {
        return new SessionContext(config, tasks, slot, listeners, history);
    }
}
