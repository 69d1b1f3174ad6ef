package com.navblocks.soap;

import com.navblocks.model.SoapResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Element;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Default {@link NavSoapService}. Requests are built in the namespace of the
 * service name, responses are read in the namespace of the entity name.
 *
 * @param <T> The page record type.
 */
public class GenericSoapService<T> implements NavSoapService<T> {
    private static final Logger log = LoggerFactory.getLogger(GenericSoapService.class);

    private final SoapRequestDispatcher dispatcher;
    private final SoapResponseParser responseParser;
    private final XmlEntityBinder binder;
    private final Class<T> type;
    private final String serviceName;
    private final String entityName;
    private final String namespace;

    /**
     * @param dispatcher  The dispatcher bound to the SOAP endpoint.
     * @param type        The page record type.
     * @param serviceName The page service name as published in NAV.
     * @param entityName  The entity element name in responses. Null means the
     *                    simple name of the record type.
     */
    public GenericSoapService(final SoapRequestDispatcher dispatcher,
                              final Class<T> type,
                              final String serviceName,
                              final String entityName) {
        this(dispatcher, type, serviceName, entityName, new XmlEntityBinder());
    }

    public GenericSoapService(final SoapRequestDispatcher dispatcher,
                              final Class<T> type,
                              final String serviceName,
                              final String entityName,
                              final XmlEntityBinder binder) {

        if (dispatcher == null)
            throw new IllegalArgumentException("The SoapRequestDispatcher mustn't be null");
        if (type == null)
            throw new IllegalArgumentException("The record type mustn't be null");
        if (binder == null)
            throw new IllegalArgumentException("The XmlEntityBinder mustn't be null");

        this.dispatcher = dispatcher;
        this.type = type;
        this.serviceName = serviceName == null || serviceName.isEmpty() ? type.getSimpleName() : serviceName;
        this.entityName = entityName == null || entityName.isEmpty() ? type.getSimpleName() : entityName;
        this.namespace = SoapNamespaces.pageNamespace(this.serviceName);
        this.binder = binder;
        this.responseParser = new SoapResponseParser(binder);
    }

    public String serviceName() {
        return serviceName;
    }

    public String entityName() {
        return entityName;
    }

    /**
     * @return The namespace request bodies for this service are built in.
     */
    public String namespace() {
        return namespace;
    }

    @Override
    public List<T> readAll(final List<Element> filters, final String bookmarkKey, final int setSize) {
        log.info("Reading all records from {}", serviceName);

        Element body = SoapPayloads.readMultiple(namespace, filters, bookmarkKey, setSize);
        String response = send("ReadMultiple", body);
        List<T> result = responseParser.parseReadMultiple(response, type, entityName);

        log.info("Read {} records from {}", result.size(), serviceName);
        return result;
    }

    @Override
    public List<T> readAll(final List<Element> filters) {
        return readAll(filters, null, 0);
    }

    @Override
    public Optional<T> read(final Element keyFieldsXml) {
        log.info("Reading single record from {}", serviceName);

        String response = send("Read", keyFieldsXml);
        return responseParser.parseRead(response, type, entityName);
    }

    @Override
    public Optional<T> read(final Map<String, String> keyFields) {
        return read(SoapPayloads.read(namespace, keyFields));
    }

    @Override
    public Optional<T> create(final Element createPayloadXml) {
        log.info("Creating record in {}", serviceName);

        String response = send("Create", createPayloadXml);
        return responseParser.parseCreateOrUpdate(response, type, entityName);
    }

    @Override
    public Optional<T> create(final T record) {
        return create(SoapPayloads.entity(namespace, "Create", entityName, record, binder));
    }

    @Override
    public Optional<T> update(final Element updatePayloadXml) {
        log.info("Updating record in {}", serviceName);

        String response = send("Update", updatePayloadXml);
        return responseParser.parseCreateOrUpdate(response, type, entityName);
    }

    @Override
    public Optional<T> update(final T record) {
        return update(SoapPayloads.entity(namespace, "Update", entityName, record, binder));
    }

    @Override
    public boolean delete(final Element keyFieldsXml) {
        log.warn("Deleting record in {}", serviceName);

        String response = send("Delete", keyFieldsXml);
        return SoapResponseParser.parseDelete(response);
    }

    @Override
    public boolean delete(final String key) {
        return delete(SoapPayloads.delete(namespace, key));
    }

    @Override
    public SoapResult invokeCodeunit(final String codeunitService,
                                     final String methodName,
                                     final Element parametersXml) {

        log.debug("Invoking codeunit {}.{}", codeunitService, methodName);

        Element envelope = SoapEnvelopeBuilder.buildEnvelope(parametersXml);
        if (log.isDebugEnabled())
            log.debug("Envelope content {}", Xml.toString(envelope));

        String response = dispatcher.sendCodeunitRequest(codeunitService, envelope);
        return SoapResponseParser.parseCodeunit(response, methodName, codeunitService);
    }

    @Override
    public SoapResult invokeCodeunit(final String codeunitService,
                                     final String methodName,
                                     final Map<String, String> parameters) {

        Element body = SoapPayloads.codeunit(SoapNamespaces.codeunitNamespace(codeunitService), methodName, parameters);
        return invokeCodeunit(codeunitService, methodName, body);
    }

    private String send(final String verb, final Element body) {
        Element envelope = SoapEnvelopeBuilder.buildEnvelope(body);
        if (log.isDebugEnabled())
            log.debug("Envelope content {}", Xml.toString(envelope));

        return dispatcher.sendPageRequest(serviceName, verb, envelope);
    }

}
