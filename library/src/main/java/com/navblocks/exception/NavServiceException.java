package com.navblocks.exception;

/**
 * Base class of every failure a NAV service call reports to its caller.
 */
public class NavServiceException extends RuntimeException {

    public NavServiceException(final String message) {
        super(message);
    }

    public NavServiceException(final String message, final Throwable cause) {
        super(message, cause);
    }

}
