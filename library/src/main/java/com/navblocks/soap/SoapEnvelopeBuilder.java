package com.navblocks.soap;

import org.w3c.dom.Document;
import org.w3c.dom.Element;

import javax.xml.XMLConstants;

/**
 * Wraps body elements in SOAP 1.1 envelopes.
 */
public final class SoapEnvelopeBuilder {

    private SoapEnvelopeBuilder() {
    }

    /**
     * Builds {@code <soap:Envelope><soap:Header/><soap:Body>body</soap:Body></soap:Envelope>}
     * in a new document. The given element is copied, not moved.
     *
     * @param body The single body element.
     * @return The envelope element.
     */
    public static Element buildEnvelope(final Element body) {
        if (body == null)
            throw new IllegalArgumentException("The SOAP body element mustn't be null");

        Document document = Xml.newDocument();
        Element envelope = document.createElementNS(SoapNamespaces.ENVELOPE, "soap:Envelope");
        envelope.setAttributeNS(XMLConstants.XMLNS_ATTRIBUTE_NS_URI, "xmlns:soap", SoapNamespaces.ENVELOPE);
        document.appendChild(envelope);

        envelope.appendChild(document.createElementNS(SoapNamespaces.ENVELOPE, "soap:Header"));

        Element bodyElement = document.createElementNS(SoapNamespaces.ENVELOPE, "soap:Body");
        bodyElement.appendChild(document.importNode(body, true));
        envelope.appendChild(bodyElement);

        return envelope;
    }

}
