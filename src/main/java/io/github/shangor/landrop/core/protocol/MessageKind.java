package io.github.shangor.landrop.core.protocol;

public final class MessageKind {
    public static final String ANNOUNCE = "announce";
    public static final String TRANSFER_REQUEST = "transfer_request";
    public static final String TRANSFER_RESPONSE = "transfer_response";

    private MessageKind() {
    }
}
