package com.rex.tunnel;

import io.netty.handler.codec.CodecException;

import java.io.IOException;

/**
 * Base of all tunnel client failures
 */
public class TunnelException extends IOException {

    public TunnelException(String message) {
        super(message);
    }

    public TunnelException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Unwrap the codec layer, returns the underlying TunnelException if any, otherwise the cause as is
     */
    public static Throwable unwrap(Throwable cause) {
        Throwable tr = cause;
        while (tr instanceof CodecException && tr.getCause() != null) {
            tr = tr.getCause();
        }
        return tr;
    }
}
