package com.rex.tunnel;

/**
 * Handshake rejected or challenge sequence violated
 */
public class AuthException extends TunnelException {

    public AuthException(String message) {
        super(message);
    }

    public AuthException(String message, Throwable cause) {
        super(message, cause);
    }
}
