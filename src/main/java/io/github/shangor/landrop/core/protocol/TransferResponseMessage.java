package io.github.shangor.landrop.core.protocol;

public record TransferResponseMessage(String kind, Boolean accepted, String reason) {

    public static TransferResponseMessage accept() {
        return new TransferResponseMessage(MessageKind.TRANSFER_RESPONSE, true, null);
    }

    public static TransferResponseMessage reject(String reason) {
        return new TransferResponseMessage(MessageKind.TRANSFER_RESPONSE, false, reason);
    }

    public boolean isAccepted() {
        return Boolean.TRUE.equals(accepted);
    }
}
