package com.navblocks.exception;

/**
 * Thrown when the HTTP exchange succeeded but its content can't be accepted:
 * malformed bodies, missing mandatory elements or empty write echoes.
 */
public class NavProtocolException extends NavServiceException {

    public NavProtocolException(final String message) {
        super(message);
    }

    public NavProtocolException(final String message, final Throwable cause) {
        super(message, cause);
    }

}
