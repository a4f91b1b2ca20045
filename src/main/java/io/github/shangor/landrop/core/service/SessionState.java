package io.github.shangor.landrop.core.service;

import io.github.shangor.landrop.core.model.TransferStatus;

/**
 * States of one transfer conversation. {@code REQUEST_SENT} belongs to the initiator,
 * {@code REQUEST_RECEIVED} to the responder; the remaining states are shared.
 */
public enum SessionState {
    IDLE,
    REQUEST_SENT,
    REQUEST_RECEIVED,
    ACCEPTED,
    STREAMING,
    FINISHING,
    COMPLETED,
    REJECTED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == REJECTED || this == FAILED || this == CANCELLED;
    }

    public boolean canMoveTo(SessionState next) {
        if (isTerminal()) {
            return false;
        }
        if (next == FAILED || next == CANCELLED) {
            return true;
        }
        return switch (this) {
            case IDLE -> next == REQUEST_SENT || next == REQUEST_RECEIVED;
            case REQUEST_SENT, REQUEST_RECEIVED -> next == ACCEPTED || next == REJECTED;
            case ACCEPTED -> next == STREAMING;
            case STREAMING -> next == FINISHING;
            case FINISHING -> next == COMPLETED;
            default -> false;
        };
    }

    public TransferStatus toStatus() {
        return switch (this) {
            case IDLE -> TransferStatus.PENDING;
            case REQUEST_SENT, REQUEST_RECEIVED -> TransferStatus.AWAITING_ACCEPTANCE;
            case ACCEPTED, STREAMING, FINISHING -> TransferStatus.TRANSFERRING;
            case COMPLETED -> TransferStatus.COMPLETED;
            case REJECTED -> TransferStatus.REJECTED;
            case FAILED -> TransferStatus.FAILED;
            case CANCELLED -> TransferStatus.CANCELLED;
        };
    }
}
