package com.navblocks.soap;

import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.xml.sax.InputSource;
import org.xml.sax.helpers.DefaultHandler;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import java.io.StringReader;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Namespace aware DOM helpers. Document type declarations are rejected when
 * parsing.
 */
public final class Xml {
    private static final DocumentBuilderFactory DOCUMENT_BUILDER_FACTORY = createDocumentBuilderFactory();
    private static final TransformerFactory TRANSFORMER_FACTORY = createTransformerFactory();

    private Xml() {
    }

    /**
     * @return A new, empty document.
     */
    public static Document newDocument() {
        return newDocumentBuilder().newDocument();
    }

    /**
     * Parses XML text into a document.
     *
     * @param xml The text to parse.
     * @return The parsed document.
     * @throws IllegalArgumentException If the text isn't well-formed XML.
     */
    public static Document parse(final String xml) {
        if (xml == null || xml.trim().isEmpty())
            throw new IllegalArgumentException("Couldn't parse XML: empty content");

        try {
            DocumentBuilder builder = newDocumentBuilder();
            builder.setErrorHandler(new DefaultHandler());
            return builder.parse(new InputSource(new StringReader(xml)));
        } catch (Exception e) {
            throw new IllegalArgumentException("Couldn't parse XML: " + e.getMessage(), e);
        }
    }

    /**
     * Serializes a node without an XML declaration and without indentation.
     *
     * @param node The node to serialize.
     * @return The XML text.
     */
    public static String toString(final Node node) {
        try {
            Transformer transformer;
            synchronized (TRANSFORMER_FACTORY) {
                transformer = TRANSFORMER_FACTORY.newTransformer();
            }
            transformer.setOutputProperty(OutputKeys.OMIT_XML_DECLARATION, "yes");
            transformer.setOutputProperty(OutputKeys.ENCODING, "UTF-8");
            transformer.setOutputProperty(OutputKeys.INDENT, "no");

            StringWriter writer = new StringWriter();
            transformer.transform(new DOMSource(node), new StreamResult(writer));
            return writer.toString();
        } catch (TransformerException e) {
            throw new IllegalArgumentException("Couldn't serialize XML node: " + node.getNodeName(), e);
        }
    }

    /**
     * Creates an element holding only text.
     */
    public static Element textElement(final Document document,
                                      final String namespace,
                                      final String name,
                                      final String text) {
        Element element = document.createElementNS(namespace, name);
        if (text != null)
            element.setTextContent(text);
        return element;
    }

    /**
     * Finds the first element below the given node, in document order, with
     * the given namespace and local name. A null namespace matches only
     * unqualified elements.
     *
     * @return The element, or null if there is none.
     */
    public static Element firstDescendant(final Node root, final String namespace, final String localName) {
        if (root == null)
            return null;

        for (Node child = root.getFirstChild(); child != null; child = child.getNextSibling()) {
            if (child.getNodeType() != Node.ELEMENT_NODE)
                continue;

            if (matches(child, namespace, localName))
                return (Element) child;

            Element found = firstDescendant(child, namespace, localName);
            if (found != null)
                return found;
        }

        return null;
    }

    /**
     * @return The first direct child element with the given namespace and
     * local name, or null if there is none.
     */
    public static Element firstChild(final Node parent, final String namespace, final String localName) {
        if (parent == null)
            return null;

        for (Node child = parent.getFirstChild(); child != null; child = child.getNextSibling())
            if (child.getNodeType() == Node.ELEMENT_NODE && matches(child, namespace, localName))
                return (Element) child;

        return null;
    }

    /**
     * @return All direct child elements with the given namespace and local
     * name, in document order. Never null.
     */
    public static List<Element> children(final Node parent, final String namespace, final String localName) {
        List<Element> result = new ArrayList<>();
        if (parent == null)
            return result;

        for (Node child = parent.getFirstChild(); child != null; child = child.getNextSibling())
            if (child.getNodeType() == Node.ELEMENT_NODE && matches(child, namespace, localName))
                result.add((Element) child);

        return result;
    }

    /**
     * @return All direct child elements, in document order. Never null.
     */
    public static List<Element> childElements(final Node parent) {
        List<Element> result = new ArrayList<>();
        if (parent == null)
            return result;

        for (Node child = parent.getFirstChild(); child != null; child = child.getNextSibling())
            if (child.getNodeType() == Node.ELEMENT_NODE)
                result.add((Element) child);

        return result;
    }

    /**
     * @return The namespace of the node, with "" normalized to null.
     */
    public static String namespaceOf(final Node node) {
        String namespace = node.getNamespaceURI();
        return namespace == null || namespace.isEmpty() ? null : namespace;
    }

    private static boolean matches(final Node node, final String namespace, final String localName) {
        String name = node.getLocalName() != null ? node.getLocalName() : node.getNodeName();
        String expectedNamespace = namespace == null || namespace.isEmpty() ? null : namespace;
        return localName.equals(name) && Objects.equals(expectedNamespace, namespaceOf(node));
    }

    private static DocumentBuilder newDocumentBuilder() {
        try {
            synchronized (DOCUMENT_BUILDER_FACTORY) {
                return DOCUMENT_BUILDER_FACTORY.newDocumentBuilder();
            }
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("No usable XML parser available", e);
        }
    }

    private static DocumentBuilderFactory createDocumentBuilderFactory() {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(true);
        factory.setXIncludeAware(false);
        factory.setExpandEntityReferences(false);
        try {
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser doesn't support secure processing", e);
        }
        return factory;
    }

    private static TransformerFactory createTransformerFactory() {
        TransformerFactory factory = TransformerFactory.newInstance();
        factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_DTD, "");
        factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_STYLESHEET, "");
        return factory;
    }

}
