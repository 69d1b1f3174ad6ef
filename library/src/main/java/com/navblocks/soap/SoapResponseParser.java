package com.navblocks.soap;

import com.navblocks.exception.NavProtocolException;
import com.navblocks.model.SoapResult;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Extracts results from NAV SOAP responses. Page results sit in a
 * {@code <Verb>_Result} element in the page namespace of the entity; codeunit
 * results sit in a {@code <Method>_Result} element in the codeunit namespace.
 */
public class SoapResponseParser {
    private static final String READ_MULTIPLE_RESULT = "ReadMultiple_Result";
    private static final String READ_RESULT = "Read_Result";
    private static final String CREATE_RESULT = "Create_Result";
    private static final String UPDATE_RESULT = "Update_Result";
    private static final String DELETE_RESULT = "Delete_Result";
    private static final String RETURN_VALUE = "return_value";

    private final XmlEntityBinder binder;

    public SoapResponseParser() {
        this(new XmlEntityBinder());
    }

    public SoapResponseParser(final XmlEntityBinder binder) {
        if (binder == null)
            throw new IllegalArgumentException("The XmlEntityBinder mustn't be null");

        this.binder = binder;
    }

    /**
     * Reads the entities of a ReadMultiple response.
     *
     * @param soapResponse The raw response body.
     * @param type         The record type.
     * @param entityName   The entity element name, which also names the page
     *                     namespace.
     * @return The records, in document order. Empty if the result wrapper is
     * missing or holds no entities.
     * @throws NavProtocolException If the body isn't XML or an entity can't be
     *                              bound.
     */
    public <T> List<T> parseReadMultiple(final String soapResponse,
                                         final Class<T> type,
                                         final String entityName) {

        String namespace = SoapNamespaces.pageNamespace(entityName);
        Element outer = resultElement(soapResponse, namespace, READ_MULTIPLE_RESULT);
        Element inner = Xml.firstChild(outer, namespace, READ_MULTIPLE_RESULT);
        if (inner == null)
            return Collections.emptyList();

        List<T> result = new ArrayList<>();
        for (Element item : Xml.children(inner, namespace, entityName))
            result.add(bind(item, type, entityName));

        return result;
    }

    /**
     * Reads the entity of a Read response.
     *
     * @return The record, or empty if the response holds none.
     * @throws NavProtocolException If the body isn't XML or the entity can't be
     *                              bound.
     */
    public <T> Optional<T> parseRead(final String soapResponse,
                                     final Class<T> type,
                                     final String entityName) {

        return parseResultByTag(soapResponse, type, entityName, READ_RESULT);
    }

    /**
     * Reads the echoed entity of a Create or an Update response, whichever
     * result wrapper is present.
     *
     * @return The record, or empty if the response holds none.
     * @throws NavProtocolException If the body isn't XML or the entity can't be
     *                              bound.
     */
    public <T> Optional<T> parseCreateOrUpdate(final String soapResponse,
                                               final Class<T> type,
                                               final String entityName) {

        Optional<T> created = parseResultByTag(soapResponse, type, entityName, CREATE_RESULT);
        return created.isPresent() ?
                created :
                parseResultByTag(soapResponse, type, entityName, UPDATE_RESULT);
    }

    /**
     * A delete succeeded if the raw response mentions its result element
     * anywhere. The body isn't parsed.
     *
     * @param soapResponse The raw response body. May be null.
     * @return True if the body contains "Delete_Result".
     */
    public static boolean parseDelete(final String soapResponse) {
        return soapResponse != null && soapResponse.contains(DELETE_RESULT);
    }

    /**
     * Reads the return value of a codeunit method. Never throws; anything
     * unexpected is reported as a failed result.
     *
     * @param soapResponse The raw response body.
     * @param methodName   The invoked method.
     * @param codeunitName The codeunit service name, which names the
     *                     namespace.
     * @return A successful result holding the text of {@code return_value}, or
     * a failed result explaining what was missing.
     */
    public static SoapResult parseCodeunit(final String soapResponse,
                                           final String methodName,
                                           final String codeunitName) {
        try {
            String namespace = SoapNamespaces.codeunitNamespace(codeunitName);
            Element result = Xml.firstDescendant(body(Xml.parse(soapResponse)), namespace, methodName + "_Result");
            Element returnValue = Xml.firstChild(result, namespace, RETURN_VALUE);
            if (returnValue == null)
                return SoapResult.failure(RETURN_VALUE + " element not found.");

            return SoapResult.success(returnValue.getTextContent());
        } catch (RuntimeException e) {
            return SoapResult.failure("Error parsing response: " + e.getMessage());
        }
    }

    private <T> Optional<T> parseResultByTag(final String soapResponse,
                                             final Class<T> type,
                                             final String entityName,
                                             final String tagName) {

        String namespace = SoapNamespaces.pageNamespace(entityName);
        Element result = resultElement(soapResponse, namespace, tagName);
        Element entity = Xml.firstChild(result, namespace, entityName);
        return entity == null ?
                Optional.empty() :
                Optional.ofNullable(bind(entity, type, entityName));
    }

    private static Element resultElement(final String soapResponse, final String namespace, final String tagName) {
        Document document;
        try {
            document = Xml.parse(soapResponse);
        } catch (IllegalArgumentException e) {
            throw new NavProtocolException("Malformed SOAP response: " + e.getMessage(), e);
        }

        return Xml.firstDescendant(body(document), namespace, tagName);
    }

    private static Element body(final Document document) {
        return Xml.firstDescendant(document, SoapNamespaces.ENVELOPE, "Body");
    }

    private <T> T bind(final Element element, final Class<T> type, final String entityName) {
        try {
            return binder.read(element, type);
        } catch (IllegalArgumentException e) {
            throw new NavProtocolException("Couldn't bind " + entityName + " element: " + e.getMessage(), e);
        }
    }

}
