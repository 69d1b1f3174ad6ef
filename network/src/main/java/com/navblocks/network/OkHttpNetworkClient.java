package com.navblocks.network;

import com.annimon.stream.Stream;
import com.navblocks.network.exception.NoConnectionException;
import com.navblocks.network.exception.ResponseStatusException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.TimeUnit;

import okhttp3.Call;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.BufferedSink;

import static com.navblocks.network.Utils.debug;
import static com.navblocks.network.Utils.info;
import static com.navblocks.network.Utils.notEmpty;

/**
 * This class is responsible for executing HTTP requests against a NAV
 * server and delivering the raw response bodies. It's safe to share a single
 * instance between any number of services and threads.
 */
@SuppressWarnings("WeakerAccess")
public class OkHttpNetworkClient implements NetworkClient {

    /**
     * This class allows the caller to configure the network client behavior.
     * All settings are read once, when the parent network client is created.
     */
    public static class Settings {
        private final long connectTimeoutMillis;
        private final long readTimeoutMillis;
        private final boolean followRedirects;
        private final boolean followSslRedirects;
        private final List<Header> defaultHeaders;

        /**
         * Creates a default settings object with OkHttp's default timeouts,
         * allowing all kinds of redirects and without any default headers.
         */
        public Settings() {
            this(10_000, 10_000, true, true, null);
        }

        /**
         * Creates a new settings object with custom configuration.
         *
         * @param connectTimeoutMillis The connect timeout. Zero means none.
         * @param readTimeoutMillis    The read (and write) timeout. Zero means
         *                             none.
         * @param followRedirects      Whether to follow redirects or not.
         * @param followSslRedirects   Whether to follow SSL redirects that
         *                             redirect to non-SSL endpoints or not.
         * @param defaultHeaders       Headers to add to every request, for
         *                             example an Authorization header. May be
         *                             null.
         */
        public Settings(final long connectTimeoutMillis,
                        final long readTimeoutMillis,
                        final boolean followRedirects,
                        final boolean followSslRedirects,
                        final List<Header> defaultHeaders) {

            this.connectTimeoutMillis = connectTimeoutMillis;
            this.readTimeoutMillis = readTimeoutMillis;
            this.followRedirects = followRedirects;
            this.followSslRedirects = followSslRedirects;
            this.defaultHeaders = defaultHeaders == null ?
                    Collections.emptyList() :
                    Collections.unmodifiableList(new ArrayList<>(defaultHeaders));
        }

        /**
         * Returns a copy of these settings with one more default header.
         *
         * @param key   The header name.
         * @param value The header value. Null values are ignored.
         * @return The new settings object.
         */
        public Settings withDefaultHeader(final String key, final String value) {
            if (value == null)
                return this;

            List<Header> headers = new ArrayList<>(defaultHeaders);
            headers.add(new Header(key, value));
            return new Settings(connectTimeoutMillis, readTimeoutMillis,
                    followRedirects, followSslRedirects, headers);
        }

        public long connectTimeoutMillis() {
            return connectTimeoutMillis;
        }

        public long readTimeoutMillis() {
            return readTimeoutMillis;
        }

        public boolean followRedirects() {
            return followRedirects;
        }

        public boolean followSslRedirects() {
            return followSslRedirects;
        }

        public List<Header> defaultHeaders() {
            return defaultHeaders;
        }
    }

    /**
     * This class provides the body content to the real request as expected by
     * the backing HTTP client.
     */
    private static final class DefaultRequestBody extends RequestBody {
        private final byte[] payload;
        private final MediaType mediaType;

        private static RequestBody prepare(final String method,
                                           final byte[] payload,
                                           final String contentType) {

            if (payload == null && !requiresBody(method))
                return null;

            return new DefaultRequestBody(payload, contentType);
        }

        private static boolean requiresBody(final String method) {
            return "POST".equals(method) || "PUT".equals(method) || "PATCH".equals(method);
        }

        private DefaultRequestBody(final byte[] payload, final String contentType) {
            this.payload = payload == null ?
                    new byte[0] :
                    payload;
            this.mediaType = contentType == null ?
                    null :
                    MediaType.parse(contentType);
        }

        @Override
        public MediaType contentType() {
            return mediaType;
        }

        @Override
        public long contentLength() {
            return payload.length;
        }

        @Override
        public void writeTo(final BufferedSink sink) throws IOException {
            sink.write(payload);
        }
    }

    private final List<Header> defaultHeaders;
    private volatile OkHttpClient okHttpClient;

    /**
     * Creates a network client with default settings.
     */
    public OkHttpNetworkClient() {
        this(new Settings());
    }

    /**
     * Creates a network client with custom settings.
     *
     * @param settings The settings to apply. Null means default settings.
     */
    public OkHttpNetworkClient(final Settings settings) {
        this(buildClient(settings == null ? new Settings() : settings),
                settings == null ? null : settings.defaultHeaders());
    }

    /**
     * Creates a network client on top of an externally configured OkHttp
     * client. Use this when authentication, proxies, TLS or connection pools
     * need more control than {@link Settings} offers.
     *
     * @param okHttpClient   The OkHttp client to send requests through.
     * @param defaultHeaders Headers to add to every request. May be null.
     */
    public OkHttpNetworkClient(final OkHttpClient okHttpClient, final List<Header> defaultHeaders) {
        if (okHttpClient == null)
            throw new IllegalArgumentException("The OkHttpClient mustn't be null");

        this.okHttpClient = okHttpClient;
        this.defaultHeaders = defaultHeaders == null ?
                Collections.emptyList() :
                Collections.unmodifiableList(new ArrayList<>(defaultHeaders));
    }

    /**
     * Synchronously performs an HTTP request and returns the response body.
     *
     * @param url         The URL to terminate in.
     * @param method      The request method.
     * @param headers     Any optional key/value header pairs.
     * @param payload     Any optional data to send through the request.
     * @param contentType The content type of the payload.
     * @return The server response body.
     * @throws ResponseStatusException If the response returned an unsuccessful
     *                                 (non-2xx) status code.
     * @throws NoConnectionException   If a connection to the given URL couldn't
     *                                 be established or was interrupted.
     * @throws IllegalStateException   If execute() is called after
     *                                 shutdownNow() has been called.
     */
    @Override
    public byte[] execute(final String url,
                          final String method,
                          final List<Header> headers,
                          final byte[] payload,
                          final String contentType) {

        OkHttpClient client = okHttpClient;
        if (client == null)
            throw new IllegalStateException("Calling execute() after shutdownNow() was called");

        Request.Builder requestBuilder = new Request.Builder();
        requestBuilder.url(url);
        requestBuilder.method(method, DefaultRequestBody.prepare(method, payload, contentType));

        Stream.of(defaultHeaders)
                .forEach(header -> requestBuilder.header(header.key, header.value));

        if (headers != null)
            Stream.of(headers)
                    .filter(header -> notEmpty(header.key) && header.value != null)
                    .forEach(header -> requestBuilder.header(header.key, header.value));

        debug("%s %s", method, url);
        Call call = client.newCall(requestBuilder.build());
        try (Response response = call.execute()) {
            ResponseBody body = response.body();
            byte[] bytes = body != null ?
                    body.bytes() :
                    new byte[0];

            if (response.isSuccessful())
                return bytes;

            info("Request failed with status %d: %s %s", response.code(), method, url);
            throw new ResponseStatusException(response.code(), response.message(),
                    new String(bytes, StandardCharsets.UTF_8));
        } catch (IOException e) {
            info(e, "Couldn't execute request due to a connectivity error: %s", url);
            throw new NoConnectionException(e);
        }
    }

    /**
     * Forces the OkHttpNetworkClient to aggressively release its internal
     * resources. Any enqueued calls that aren't actively executing yet are
     * dropped and idle connections are evicted.
     */
    public void shutdownNow() {
        OkHttpClient client = okHttpClient;
        if (client != null) {
            okHttpClient = null;
            client.dispatcher().executorService().shutdownNow();
            client.connectionPool().evictAll();
        }
    }

    private static OkHttpClient buildClient(final Settings settings) {
        return new OkHttpClient.Builder()
                .connectTimeout(settings.connectTimeoutMillis(), TimeUnit.MILLISECONDS)
                .readTimeout(settings.readTimeoutMillis(), TimeUnit.MILLISECONDS)
                .writeTimeout(settings.readTimeoutMillis(), TimeUnit.MILLISECONDS)
                .followRedirects(settings.followRedirects())
                .followSslRedirects(settings.followSslRedirects())
                .build();
    }

}
