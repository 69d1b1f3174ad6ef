package com.navblocks.network.exception;

/**
 * Thrown when the server responded with a status code outside the 2xx range.
 * The raw response body is kept since NAV describes most failures in it.
 */
public class ResponseStatusException extends RuntimeException {
    private final int code;
    private final String body;

    public ResponseStatusException(final int code, final String message, final String body) {
        super(String.format("HTTP %d %s", code, message != null ? message : ""));
        this.code = code;
        this.body = body != null ? body : "";
    }

    /**
     * @return The HTTP status code of the failed response.
     */
    public int code() {
        return code;
    }

    /**
     * @return The response body as text. Never null, but may be empty.
     */
    public String body() {
        return body;
    }

}
