package com.rex.tunnel;

/**
 * Error message relayed by the server
 */
public class ServerException extends TunnelException {

    public ServerException(String message) {
        super(message);
    }

    public ServerException(String message, Throwable cause) {
        super(message, cause);
    }
}
