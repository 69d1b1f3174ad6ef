package com.navblocks.odata;

import com.google.gson.reflect.TypeToken;
import com.navblocks.exception.EntityNotFoundException;
import com.navblocks.exception.NavProtocolException;
import com.navblocks.exception.NavTransportException;
import com.navblocks.model.HasConcurrencyToken;
import com.navblocks.network.JsonParser;
import com.navblocks.network.NetworkClient;
import com.navblocks.network.exception.NoConnectionException;
import com.navblocks.network.exception.ResponseStatusException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Default {@link NavODataService}, one request per call.
 *
 * @param <T> The record type.
 */
public class GenericODataService<T> implements NavODataService<T> {
    private static final Logger log = LoggerFactory.getLogger(GenericODataService.class);

    static final String JSON_CONTENT_TYPE = "application/json";
    static final String IF_MATCH = "If-Match";

    private final NetworkClient networkClient;
    private final JsonParser jsonParser;
    private final String baseAddress;
    private final String serviceName;
    private final Class<T> type;
    private final Type collectionType;
    private final List<NetworkClient.Header> headers;

    /**
     * @param networkClient The transport to send requests through.
     * @param jsonParser    The parser for request and response bodies.
     * @param baseAddress   The OData base address, ending with a slash.
     * @param type          The record type.
     * @param serviceName   The entity set name. Null means the simple name of
     *                      the record type.
     * @param headers       Headers to add to every request. May be null.
     */
    public GenericODataService(final NetworkClient networkClient,
                               final JsonParser jsonParser,
                               final String baseAddress,
                               final Class<T> type,
                               final String serviceName,
                               final List<NetworkClient.Header> headers) {

        if (networkClient == null)
            throw new IllegalArgumentException("The NetworkClient mustn't be null");
        if (jsonParser == null)
            throw new IllegalArgumentException("The JsonParser mustn't be null");
        if (type == null)
            throw new IllegalArgumentException("The record type mustn't be null");

        this.networkClient = networkClient;
        this.jsonParser = jsonParser;
        this.baseAddress = baseAddress == null ? "" : baseAddress;
        this.type = type;
        this.serviceName = serviceName == null || serviceName.isEmpty() ? type.getSimpleName() : serviceName;
        this.collectionType = TypeToken.getParameterized(ODataResponse.class, type).getType();

        List<NetworkClient.Header> allHeaders = new ArrayList<>();
        allHeaders.add(new NetworkClient.Header("Accept", JSON_CONTENT_TYPE));
        if (headers != null)
            allHeaders.addAll(headers);
        this.headers = Collections.unmodifiableList(allHeaders);
    }

    public String serviceName() {
        return serviceName;
    }

    @Override
    public List<T> getEntities(final String filter, final String... filters) {
        String url = baseAddress + serviceName + ODataFilters.query(ODataFilters.combine(filter, filters));
        log.debug("Fetching entities from {}", url);

        ODataResponse<T> response = readCollection("retrieve entities", url);
        List<T> result = response == null || response.getValue() == null ?
                Collections.emptyList() :
                response.getValue();

        log.info("Retrieved {} entities from {}", result.size(), serviceName);
        return result;
    }

    @Override
    public T getEntity(final String filter) {
        String url = baseAddress + serviceName + ODataFilters.query(filter);
        log.debug("Fetching entity by filter from {}", url);

        ODataResponse<T> response = readCollection("retrieve entity", url);
        if (response == null || response.getValue() == null || response.getValue().isEmpty()) {
            log.warn("No entity found in '{}' matching filter: {}", serviceName, filter);
            throw new EntityNotFoundException(serviceName, filter);
        }

        log.info("Entity retrieved successfully from {}", serviceName);
        return response.getValue().get(0);
    }

    @Override
    public T createEntity(final T entity) {
        log.debug("Creating new entity in {}", serviceName);

        String body = execute("creation", baseAddress + serviceName, "POST", headers, toJson(entity));
        T created = parse("creation", body, "Response body was empty or malformed.");

        log.info("Entity created successfully in {}", serviceName);
        return created;
    }

    @Override
    public T updateEntity(final String key, final T entity) {
        List<NetworkClient.Header> requestHeaders = new ArrayList<>(headers);
        String etag = entity instanceof HasConcurrencyToken ?
                ((HasConcurrencyToken) entity).concurrencyToken() :
                null;

        if (etag != null && !etag.isEmpty()) {
            requestHeaders.add(new NetworkClient.Header(IF_MATCH, etag));
            log.debug("Including ETag header for concurrency control: {}", etag);
        }

        log.debug("Updating entity {} in {}", key, serviceName);

        String body = execute("update", keyUrl(key), "PATCH", requestHeaders, toJson(entity));
        T updated = parse("update", body, "Update succeeded but response body was empty or invalid.");

        log.info("Entity {} updated successfully in {}", key, serviceName);
        return updated;
    }

    @Override
    public void deleteEntity(final String key) {
        log.debug("Deleting entity {} from {}", key, serviceName);

        execute("deletion", keyUrl(key), "DELETE", headers, null);

        log.info("Entity {} deleted successfully from {}", key, serviceName);
    }

    private String keyUrl(final String key) {
        return baseAddress + serviceName + "('" + key + "')";
    }

    private ODataResponse<T> readCollection(final String operation, final String url) {
        String body = execute(operation, url, "GET", headers, null);
        if (body.trim().isEmpty())
            return null;

        try {
            return jsonParser.fromJson(body, collectionType);
        } catch (IllegalArgumentException e) {
            log.error("Malformed response from {}", serviceName, e);
            throw new NavProtocolException("Failed to " + operation + ": " + e.getMessage(), e);
        }
    }

    private T parse(final String operation, final String body, final String emptyMessage) {
        T result;
        try {
            result = body.trim().isEmpty() ? null : jsonParser.fromJson(body, type);
        } catch (IllegalArgumentException e) {
            log.error("Error during {} in {}", operation, serviceName, e);
            throw new NavProtocolException(emptyMessage, e);
        }

        if (result == null) {
            log.error("Error during {} in {}: {}", operation, serviceName, emptyMessage);
            throw new NavProtocolException(emptyMessage);
        }

        return result;
    }

    private byte[] toJson(final T entity) {
        if (entity == null)
            throw new IllegalArgumentException("The entity mustn't be null");

        return jsonParser.toJson(entity).getBytes(StandardCharsets.UTF_8);
    }

    private String execute(final String operation,
                           final String url,
                           final String method,
                           final List<NetworkClient.Header> requestHeaders,
                           final byte[] payload) {
        try {
            byte[] response = networkClient.execute(url, method, requestHeaders, payload,
                    payload != null ? JSON_CONTENT_TYPE : null);
            return new String(response, StandardCharsets.UTF_8);
        } catch (ResponseStatusException e) {
            log.error("HTTP error during {} in {}", operation, serviceName, e);
            throw new NavTransportException(String.format("HTTP error during %s: %s", operation, e.getMessage()),
                    e.code(), e.body(), e);
        } catch (NoConnectionException e) {
            log.error("HTTP error during {} in {}", operation, serviceName, e);
            throw new NavTransportException(String.format("HTTP error during %s: %s", operation, e.getMessage()), e);
        }
    }

}
