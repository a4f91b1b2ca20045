package io.github.shangor.landrop.core.protocol;

import java.io.IOException;

/**
 * A peer sent something the transfer protocol does not allow. Aborts the session it occurred in.
 */
public class ProtocolException extends IOException {

    public ProtocolException(String message) {
        super(message);
    }

    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
