package io.github.shangor.landrop.core.service;

import io.github.shangor.landrop.core.model.TransferTask;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Holds inbound requests until a user answers them with {@link #accept(String)} or
 * {@link #reject(String, String)}.
 */
public class PendingDecisions implements AcceptPolicy {
    private final Map<String, CompletableFuture<TransferDecision>> pending = new ConcurrentHashMap<>();

    @Override
    public CompletionStage<TransferDecision> decide(TransferTask request) {
        CompletableFuture<TransferDecision> future = new CompletableFuture<>();
        pending.put(request.getTaskId(), future);
        return future;
    }

    @Override
    public void abandon(TransferTask request) {
        CompletableFuture<TransferDecision> future = pending.remove(request.getTaskId());
        if (future != null) {
            future.cancel(false);
        }
    }

    /**
     * @return {@code false} if no request with this id is waiting
     */
    public boolean accept(String taskId) {
        return complete(taskId, TransferDecision.accept());
    }

    public boolean reject(String taskId, String reason) {
        return complete(taskId, TransferDecision.reject(reason));
    }

    public boolean isPending(String taskId) {
        return pending.containsKey(taskId);
    }

    private boolean complete(String taskId, TransferDecision decision) {
        CompletableFuture<TransferDecision> future = pending.remove(taskId);
        return future != null && future.complete(decision);
    }
}
