package com.navblocks.odata;

import com.navblocks.config.ServiceEndpoint;
import com.navblocks.config.ServiceProtocol;
import com.navblocks.model.ODataIgnore;
import com.navblocks.network.DefaultJsonParser;
import com.navblocks.network.JsonParser;
import com.navblocks.network.NetworkClient;

import java.util.ArrayList;
import java.util.List;

/**
 * Creates {@link NavODataService} instances that share one transport, one
 * OData endpoint and one JSON parser.
 */
public class NavODataServiceFactory {
    private final NetworkClient networkClient;
    private final JsonParser jsonParser;
    private final String baseAddress;
    private final List<NetworkClient.Header> headers;

    /**
     * Creates a factory using a JSON parser that leaves out fields marked with
     * {@link ODataIgnore}.
     */
    public NavODataServiceFactory(final NetworkClient networkClient, final ServiceEndpoint endpoint) {
        this(networkClient, endpoint, new DefaultJsonParser(ODataIgnore.class));
    }

    /**
     * @param networkClient The transport to send requests through.
     * @param endpoint      An OData V4 endpoint. Its credentials, if any, are
     *                      sent as an Authorization header.
     * @param jsonParser    The parser for request and response bodies.
     * @throws IllegalArgumentException If the endpoint isn't an OData
     *                                  endpoint.
     */
    public NavODataServiceFactory(final NetworkClient networkClient,
                                  final ServiceEndpoint endpoint,
                                  final JsonParser jsonParser) {

        if (endpoint == null || endpoint.protocol() != ServiceProtocol.ODATA_V4)
            throw new IllegalArgumentException("An OData V4 service endpoint is required, got: " + endpoint);

        this.networkClient = networkClient;
        this.jsonParser = jsonParser;
        this.baseAddress = endpoint.baseAddress();
        this.headers = new ArrayList<>();

        String authorization = endpoint.credentials().authorizationHeader();
        if (authorization != null)
            headers.add(new NetworkClient.Header("Authorization", authorization));
    }

    /**
     * Creates a service for the entity set named after the simple name of
     * the record type.
     */
    public <T> NavODataService<T> create(final Class<T> type) {
        return create(type, null);
    }

    /**
     * @param type        The record type.
     * @param serviceName The entity set name. Null means the type's simple
     *                    name.
     */
    public <T> NavODataService<T> create(final Class<T> type, final String serviceName) {
        return new GenericODataService<>(networkClient, jsonParser, baseAddress, type, serviceName, headers);
    }

}
