package com.navblocks.soap;

import com.navblocks.config.ServiceEndpoint;
import com.navblocks.config.ServiceProtocol;
import com.navblocks.network.NetworkClient;

import java.util.ArrayList;
import java.util.List;

/**
 * Creates {@link NavSoapService} instances that share one transport and one
 * SOAP endpoint.
 */
public class NavSoapServiceFactory {
    private final SoapRequestDispatcher dispatcher;

    /**
     * @param networkClient The transport to send requests through.
     * @param endpoint      A SOAP endpoint. Its credentials, if any, are sent
     *                      as an Authorization header.
     * @throws IllegalArgumentException If the endpoint isn't a SOAP endpoint.
     */
    public NavSoapServiceFactory(final NetworkClient networkClient, final ServiceEndpoint endpoint) {
        if (endpoint == null || endpoint.protocol() != ServiceProtocol.SOAP)
            throw new IllegalArgumentException("A SOAP service endpoint is required, got: " + endpoint);

        List<NetworkClient.Header> headers = new ArrayList<>();
        String authorization = endpoint.credentials().authorizationHeader();
        if (authorization != null)
            headers.add(new NetworkClient.Header("Authorization", authorization));

        this.dispatcher = new SoapRequestDispatcher(networkClient, endpoint.baseAddress(), headers);
    }

    /**
     * Creates a service named after the simple name of the record type.
     */
    public <T> NavSoapService<T> create(final Class<T> type) {
        return create(type, null, null);
    }

    public <T> NavSoapService<T> create(final Class<T> type, final String serviceName) {
        return create(type, serviceName, null);
    }

    /**
     * @param type        The page record type.
     * @param serviceName The page service name. Null means the type's simple
     *                    name.
     * @param entityName  The entity element name in responses. Null means the
     *                    type's simple name.
     */
    public <T> NavSoapService<T> create(final Class<T> type, final String serviceName, final String entityName) {
        return new GenericSoapService<>(dispatcher, type, serviceName, entityName);
    }

}
