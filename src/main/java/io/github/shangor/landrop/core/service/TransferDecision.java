package io.github.shangor.landrop.core.service;

public record TransferDecision(boolean accepted, String reason) {

    public static TransferDecision accept() {
        return new TransferDecision(true, null);
    }

    public static TransferDecision reject(String reason) {
        return new TransferDecision(false, reason == null || reason.isBlank() ? "rejected by receiver" : reason);
    }
}
