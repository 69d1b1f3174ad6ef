package com.navblocks.exception;

/**
 * Thrown when a request didn't produce a successful HTTP exchange: the server
 * was unreachable or it answered with a non-2xx status code.
 */
public class NavTransportException extends NavServiceException {
    public static final int NO_STATUS = -1;

    private final int statusCode;
    private final String faultText;

    public NavTransportException(final String message, final Throwable cause) {
        this(message, NO_STATUS, null, cause);
    }

    public NavTransportException(final String message,
                                 final int statusCode,
                                 final String faultText,
                                 final Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
        this.faultText = faultText;
    }

    /**
     * @return The HTTP status code, or {@link #NO_STATUS} if no response was
     * received.
     */
    public int statusCode() {
        return statusCode;
    }

    /**
     * @return The SOAP fault text or raw error body sent by the server. May be
     * null.
     */
    public String faultText() {
        return faultText;
    }

}
