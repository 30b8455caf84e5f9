package com.rex.tunnel;

/**
 * Transport connect, timeout or lost connection failures
 */
public class ConnectionException extends TunnelException {

    public ConnectionException(String message) {
        super(message);
    }

    public ConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
