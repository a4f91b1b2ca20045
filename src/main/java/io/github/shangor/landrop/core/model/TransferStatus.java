package io.github.shangor.landrop.core.model;

public enum TransferStatus {
    PENDING,
    AWAITING_ACCEPTANCE,
    TRANSFERRING,
    COMPLETED,
    FAILED,
    REJECTED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == REJECTED || this == CANCELLED;
    }
}
