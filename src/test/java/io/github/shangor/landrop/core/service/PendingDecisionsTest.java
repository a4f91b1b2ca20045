package io.github.shangor.landrop.core.service;

import io.github.shangor.landrop.core.model.Device;
import io.github.shangor.landrop.core.model.TransferDirection;
import io.github.shangor.landrop.core.model.TransferTask;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

class PendingDecisionsTest {

    private static TransferTask task(String id) {
        return new TransferTask(id, new Device("p", "Peer", "10.0.0.2", 5201, "", 0), List.of(), TransferDirection.INBOUND);
    }

    @Test
    void acceptCompletesTheWaitingStage() {
        PendingDecisions decisions = new PendingDecisions();
        CompletableFuture<TransferDecision> stage = decisions.decide(task("t1")).toCompletableFuture();
        assertFalse(stage.isDone());
        assertTrue(decisions.isPending("t1"));

        assertTrue(decisions.accept("t1"));
        assertTrue(stage.join().accepted());
        assertFalse(decisions.accept("t1"));
    }

    @Test
    void rejectCarriesReason() {
        PendingDecisions decisions = new PendingDecisions();
        CompletableFuture<TransferDecision> stage = decisions.decide(task("t1")).toCompletableFuture();
        assertTrue(decisions.reject("t1", "too large"));
        assertEquals("too large", stage.join().reason());
        assertFalse(stage.join().accepted());
    }

    @Test
    void abandonDropsThePendingRequest() {
        PendingDecisions decisions = new PendingDecisions();
        CompletableFuture<TransferDecision> stage = decisions.decide(task("t1")).toCompletableFuture();
        decisions.abandon(task("t1"));
        assertTrue(stage.isCancelled());
        assertFalse(decisions.accept("t1"));
    }

    @Test
    void unknownIdIsIgnored() {
        assertFalse(new PendingDecisions().reject("missing", null));
        assertEquals("rejected by receiver", TransferDecision.reject(" ").reason());
    }
}
