package com.rex.tunnel;

/**
 * Failure while relaying bytes between the server and the local service
 */
public class RelayException extends TunnelException {

    public RelayException(String message) {
        super(message);
    }

    public RelayException(String message, Throwable cause) {
        super(message, cause);
    }
}
