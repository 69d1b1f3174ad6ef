package com.navblocks.soap;

import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.util.List;
import java.util.Map;

/**
 * Builds the body elements NAV page and codeunit services expect. Every
 * method returns the root element of a new document.
 */
public final class SoapPayloads {
    static final int DEFAULT_SET_SIZE = 1000;

    private SoapPayloads() {
    }

    /**
     * @return {@code <filter><Field>field</Field><Criteria>criteria</Criteria></filter>}.
     */
    public static Element filter(final String namespace, final String field, final String criteria) {
        Document document = Xml.newDocument();
        Element filter = document.createElementNS(namespace, "filter");
        filter.appendChild(Xml.textElement(document, namespace, "Field", field));
        filter.appendChild(Xml.textElement(document, namespace, "Criteria", criteria));
        document.appendChild(filter);
        return filter;
    }

    /**
     * Builds a ReadMultiple request.
     *
     * @param namespace   The page namespace.
     * @param filters     Filter elements, copied in order. May be null.
     * @param bookmarkKey The key to continue after. May be null.
     * @param setSize     The page size. Zero or less means 1000.
     * @return The ReadMultiple element.
     */
    public static Element readMultiple(final String namespace,
                                       final List<Element> filters,
                                       final String bookmarkKey,
                                       final int setSize) {

        Document document = Xml.newDocument();
        Element readMultiple = document.createElementNS(namespace, "ReadMultiple");
        document.appendChild(readMultiple);

        if (filters != null)
            for (Element filter : filters)
                if (filter != null)
                    readMultiple.appendChild(document.importNode(filter, true));

        if (bookmarkKey != null && !bookmarkKey.isEmpty())
            readMultiple.appendChild(Xml.textElement(document, namespace, "bookmarkKey", bookmarkKey));

        readMultiple.appendChild(Xml.textElement(document, namespace, "setSize",
                String.valueOf(setSize > 0 ? setSize : DEFAULT_SET_SIZE)));

        return readMultiple;
    }

    /**
     * @param keyFields Primary key field names and values, in key order.
     * @return {@code <Read><Field>value</Field>...</Read>}.
     */
    public static Element read(final String namespace, final Map<String, String> keyFields) {
        return fields(namespace, "Read", keyFields);
    }

    /**
     * Wraps a record in a page operation element.
     *
     * @param namespace   The page namespace.
     * @param verb        The page operation, usually "Create" or "Update".
     * @param elementName The entity element name.
     * @param record      The record to write.
     * @param binder      The binder that writes the record.
     * @return {@code <Verb><Entity>...</Entity></Verb>}.
     */
    public static Element entity(final String namespace,
                                 final String verb,
                                 final String elementName,
                                 final Object record,
                                 final XmlEntityBinder binder) {

        Document document = Xml.newDocument();
        Element operation = document.createElementNS(namespace, verb);
        document.appendChild(operation);
        operation.appendChild(binder.write(document, namespace, elementName, record));
        return operation;
    }

    /**
     * @param key The server-assigned record key.
     * @return {@code <Delete><Key>key</Key></Delete>}.
     */
    public static Element delete(final String namespace, final String key) {
        Document document = Xml.newDocument();
        Element delete = document.createElementNS(namespace, "Delete");
        delete.appendChild(Xml.textElement(document, namespace, "Key", key));
        document.appendChild(delete);
        return delete;
    }

    /**
     * @param method     The codeunit method.
     * @param parameters Parameter names and values, in declaration order.
     * @return {@code <Method><param>value</param>...</Method>}.
     */
    public static Element codeunit(final String namespace,
                                   final String method,
                                   final Map<String, String> parameters) {
        return fields(namespace, method, parameters);
    }

    private static Element fields(final String namespace,
                                  final String name,
                                  final Map<String, String> values) {

        Document document = Xml.newDocument();
        Element element = document.createElementNS(namespace, name);
        document.appendChild(element);

        if (values != null)
            for (Map.Entry<String, String> entry : values.entrySet())
                element.appendChild(Xml.textElement(document, namespace, entry.getKey(), entry.getValue()));

        return element;
    }

}
