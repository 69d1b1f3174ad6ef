package com.navblocks.network;

import java.util.List;

/**
 * This interface describes the minimum required capabilities of any network
 * clients in order to be usable by the NAV service blocks.
 */
public interface NetworkClient {

    /**
     * This data structure describes a header key/value entry.
     */
    @SuppressWarnings("WeakerAccess")
    final class Header {
        public final String key;
        public final String value;

        public Header(final String key, final String value) {
            this.key = key;
            this.value = value;
        }

        @Override
        public String toString() {
            return key + ": " + value;
        }
    }

    /**
     * Performs a synchronous network request.
     *
     * @param url         The target URL of the request.
     * @param method      The HTTP method.
     * @param headers     Any optional key/value header pairs. May be null.
     * @param payload     Any optional data to send. May be null.
     * @param contentType The type of payload being sent. May be null.
     * @return The server response body as a byte array. Never null, but may
     * be empty.
     * @throws com.navblocks.network.exception.ResponseStatusException If the
     *         server responded with a non-2xx status code.
     * @throws com.navblocks.network.exception.NoConnectionException If the
     *         request couldn't be completed for connectivity reasons.
     */
    byte[] execute(final String url,
                   final String method,
                   final List<Header> headers,
                   final byte[] payload,
                   final String contentType);

}
