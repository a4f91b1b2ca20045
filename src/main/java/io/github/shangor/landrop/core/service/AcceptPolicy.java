package io.github.shangor.landrop.core.service;

import io.github.shangor.landrop.core.model.TransferTask;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Decides whether an inbound request is accepted. The receiving session performs no file I/O
 * until the returned stage completes.
 */
@FunctionalInterface
public interface AcceptPolicy {

    CompletionStage<TransferDecision> decide(TransferTask request);

    /**
     * The session for {@code request} ended; a decision still pending for it is no longer needed.
     */
    default void abandon(TransferTask request) {
    }

    static AcceptPolicy autoAccept() {
        return request -> CompletableFuture.completedFuture(TransferDecision.accept());
    }
}
