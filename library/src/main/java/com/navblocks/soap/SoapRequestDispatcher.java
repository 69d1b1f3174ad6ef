package com.navblocks.soap;

import com.navblocks.exception.NavTransportException;
import com.navblocks.exception.SoapFaultException;
import com.navblocks.network.NetworkClient;
import com.navblocks.network.exception.NoConnectionException;
import com.navblocks.network.exception.ResponseStatusException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Element;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Posts SOAP envelopes to page and codeunit services and screens the
 * responses for faults.
 */
public class SoapRequestDispatcher {
    private static final Logger log = LoggerFactory.getLogger(SoapRequestDispatcher.class);

    static final String CONTENT_TYPE = "text/xml; charset=utf-8";
    static final String SOAP_ACTION = "SOAPAction";

    private final NetworkClient networkClient;
    private final String baseAddress;
    private final List<NetworkClient.Header> headers;

    /**
     * @param networkClient The transport to send requests through.
     * @param baseAddress   The SOAP base address, ending with a slash.
     * @param headers       Headers to add to every request. May be null.
     */
    public SoapRequestDispatcher(final NetworkClient networkClient,
                                 final String baseAddress,
                                 final List<NetworkClient.Header> headers) {

        if (networkClient == null)
            throw new IllegalArgumentException("The NetworkClient mustn't be null");
        if (baseAddress == null)
            throw new IllegalArgumentException("The base address mustn't be null");

        this.networkClient = networkClient;
        this.baseAddress = baseAddress;
        this.headers = headers == null ?
                Collections.emptyList() :
                Collections.unmodifiableList(new ArrayList<>(headers));
    }

    public String baseAddress() {
        return baseAddress;
    }

    /**
     * Sends a page operation to {@code baseAddress + serviceName}.
     *
     * @param serviceName The page service name.
     * @param verb        The page operation, e.g. "Read".
     * @param envelope    The envelope to send.
     * @return The raw response body.
     * @throws NavTransportException If the request failed or the server
     *                               answered with a non-2xx status.
     * @throws SoapFaultException    If the response carries a fault.
     */
    public String sendPageRequest(final String serviceName, final String verb, final Element envelope) {
        String url = baseAddress + serviceName;
        return send(url, SoapNamespaces.pageAction(verb), envelope, serviceName);
    }

    /**
     * Sends a codeunit call. The address is the page address of the service
     * with its "/Page/" segment replaced by "/Codeunit/".
     *
     * @param serviceName The codeunit service name.
     * @param envelope    The envelope to send.
     * @return The raw response body.
     * @throws NavTransportException If the request failed or the server
     *                               answered with a non-2xx status.
     * @throws SoapFaultException    If the response carries a fault.
     */
    public String sendCodeunitRequest(final String serviceName, final Element envelope) {
        String url = (baseAddress + serviceName).replace("/Page/", "/Codeunit/");
        return send(url, SoapNamespaces.codeunitAction(serviceName), envelope, "codeunit " + serviceName);
    }

    private String send(final String url,
                        final String soapAction,
                        final Element envelope,
                        final String target) {

        List<NetworkClient.Header> requestHeaders = new ArrayList<>(headers);
        requestHeaders.add(new NetworkClient.Header(SOAP_ACTION, soapAction));
        byte[] payload = Xml.toString(envelope).getBytes(StandardCharsets.UTF_8);

        log.debug("Sending SOAP request {} to {}", soapAction, url);

        String content;
        try {
            byte[] response = networkClient.execute(url, "POST", requestHeaders, payload, CONTENT_TYPE);
            content = new String(response, StandardCharsets.UTF_8);
        } catch (ResponseStatusException e) {
            String fault = SoapFaultExtractor.extract(e.body()).orElse(e.body());
            log.error("SOAP error {}: {}", e.code(), fault);
            throw new NavTransportException(String.format("SOAP Error: HTTP %d - %s", e.code(), fault),
                    e.code(), fault, e);
        } catch (NoConnectionException e) {
            log.error("HTTP Request failed for {}", target, e);
            throw new NavTransportException("HTTP Request failed: " + e.getMessage(), e);
        }

        if (SoapFaultExtractor.hasFaultMarker(content)) {
            String fault = SoapFaultExtractor.extract(content).orElse(null);
            log.error("SOAP fault in {}: {}", target, fault);
            throw new SoapFaultException(fault);
        }

        log.debug("SOAP response received successfully from {}", target);
        return content;
    }

}
