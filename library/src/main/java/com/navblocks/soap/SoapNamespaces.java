package com.navblocks.soap;

import java.util.Locale;

/**
 * Naming conventions of the NAV SOAP surface. Every method is a pure
 * function of its arguments.
 */
public final class SoapNamespaces {
    public static final String ENVELOPE = "http://schemas.xmlsoap.org/soap/envelope/";
    public static final String SCHEMA_PREFIX = "urn:microsoft-dynamics-schemas/";

    private SoapNamespaces() {
    }

    /**
     * @param name A page service or entity name, e.g. "Customer".
     * @return The page namespace, e.g. "urn:microsoft-dynamics-schemas/page/customer".
     */
    public static String pageNamespace(final String name) {
        return SCHEMA_PREFIX + "page/" + requireName(name).toLowerCase(Locale.ROOT);
    }

    /**
     * @param name A codeunit service name. Its case is kept.
     * @return The codeunit namespace, e.g. "urn:microsoft-dynamics-schemas/codeunit/Sales".
     */
    public static String codeunitNamespace(final String name) {
        return SCHEMA_PREFIX + "codeunit/" + requireName(name);
    }

    /**
     * @param verb The page operation, e.g. "ReadMultiple".
     * @return The SOAPAction header value for the operation.
     */
    public static String pageAction(final String verb) {
        return SCHEMA_PREFIX + "page/" + requireName(verb);
    }

    /**
     * @param serviceName The codeunit service name.
     * @return The SOAPAction header value for a call to the codeunit.
     */
    public static String codeunitAction(final String serviceName) {
        return SCHEMA_PREFIX + "codeunit/" + requireName(serviceName);
    }

    private static String requireName(final String name) {
        if (name == null || name.trim().isEmpty())
            throw new IllegalArgumentException("A SOAP name mustn't be blank");

        return name.trim();
    }

}
