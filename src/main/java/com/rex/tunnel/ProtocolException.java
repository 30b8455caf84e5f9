package com.rex.tunnel;

/**
 * Unexpected or unknown message at a point where a specific message was required
 */
public class ProtocolException extends TunnelException {

    public ProtocolException(String message) {
        super(message);
    }

    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
