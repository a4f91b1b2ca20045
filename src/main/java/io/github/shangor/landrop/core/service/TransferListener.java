package io.github.shangor.landrop.core.service;

import io.github.shangor.landrop.core.model.TransferTask;

/**
 * Transfer notifications, keyed by {@link TransferTask#getTaskId()}. Callbacks run on the node's
 * event loop and must not block.
 */
public interface TransferListener {

    /**
     * An inbound request is waiting for a decision.
     */
    default void onRequest(TransferTask task) {
    }

    default void onStatusChanged(TransferTask task) {
    }

    default void onProgress(TransferProgress progress) {
    }

    default void onCompleted(TransferTask task) {
    }

    /**
     * The task ended as {@code FAILED}, {@code REJECTED} or {@code CANCELLED}; see
     * {@link TransferTask#getStatus()} and {@link TransferTask#getReason()}.
     */
    default void onError(TransferTask task, String reason) {
    }
}
