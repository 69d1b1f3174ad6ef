package com.navblocks.network.exception;

/**
 * Thrown when a request couldn't reach the server or the exchange was cut
 * short (unknown host, refused connection, timeout, reset stream).
 */
public class NoConnectionException extends RuntimeException {

    public NoConnectionException(final Throwable cause) {
        super(cause != null ? cause.getMessage() : null, cause);
    }

}
