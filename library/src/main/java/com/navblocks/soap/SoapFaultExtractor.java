package com.navblocks.soap;

import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.util.Optional;

/**
 * Best-effort lookup of a readable message in a SOAP fault response.
 */
public final class SoapFaultExtractor {

    private SoapFaultExtractor() {
    }

    /**
     * @param content A raw response body. May be null.
     * @return True if the body carries one of the literal fault markers
     * {@code <faultcode>} or {@code <Fault>}.
     */
    public static boolean hasFaultMarker(final String content) {
        return content != null && (content.contains("<faultcode>") || content.contains("<Fault>"));
    }

    /**
     * Looks for a {@code faultstring} element, then a {@code detail} element,
     * each first in the namespace of the document root and then unqualified.
     *
     * @param content A raw response body. May be null.
     * @return The text of the first element found. Empty if none exists or the
     * content isn't XML.
     */
    public static Optional<String> extract(final String content) {
        Document document;
        try {
            document = Xml.parse(content);
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }

        Element root = document.getDocumentElement();
        String rootNamespace = root != null ? Xml.namespaceOf(root) : null;

        Element fault = find(document, rootNamespace, "faultstring");
        if (fault == null)
            fault = find(document, rootNamespace, "detail");

        return fault == null ?
                Optional.empty() :
                Optional.of(fault.getTextContent());
    }

    private static Element find(final Document document, final String rootNamespace, final String name) {
        Element element = Xml.firstDescendant(document, rootNamespace, name);
        return element != null ?
                element :
                Xml.firstDescendant(document, null, name);
    }

}
