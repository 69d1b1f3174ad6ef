package com.navblocks.exception;

/**
 * Thrown when a response with a successful status code still carries a SOAP
 * fault.
 */
public class SoapFaultException extends NavProtocolException {
    private final String faultText;

    public SoapFaultException(final String faultText) {
        super("SOAP Fault: " + faultText);
        this.faultText = faultText;
    }

    /**
     * @return The extracted fault string or detail. May be null when the
     * fault markers were present but no readable message was found.
     */
    public String faultText() {
        return faultText;
    }

}
