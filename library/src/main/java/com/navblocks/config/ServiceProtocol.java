package com.navblocks.config;

import java.util.Locale;

/**
 * The web service protocols a NAV server instance exposes.
 */
public enum ServiceProtocol {
    ODATA_V4("ODataV4"),
    SOAP("SOAP");

    private final String label;

    ServiceProtocol(final String label) {
        this.label = label;
    }

    /**
     * @return The name NAV uses for the protocol.
     */
    public String label() {
        return label;
    }

    /**
     * Resolves a protocol from its configuration name, ignoring case.
     *
     * @param value The name, e.g. "ODataV4" or "soap".
     * @return The matching protocol.
     * @throws IllegalArgumentException If the name isn't known.
     */
    public static ServiceProtocol parse(final String value) {
        String normalized = value == null ? "" : value.trim().toUpperCase(Locale.ROOT);
        for (ServiceProtocol protocol : values())
            if (protocol.label.toUpperCase(Locale.ROOT).equals(normalized) || protocol.name().equals(normalized))
                return protocol;

        throw new IllegalArgumentException("Unknown service type: " + value);
    }
}
