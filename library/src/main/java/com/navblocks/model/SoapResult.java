package com.navblocks.model;

/**
 * The outcome of a codeunit invocation. A missing return value is reported
 * here as a failure instead of being thrown.
 */
public final class SoapResult {
    private final boolean success;
    private final String message;
    private final Object returnValue;

    private SoapResult(final boolean success, final String message, final Object returnValue) {
        this.success = success;
        this.message = message;
        this.returnValue = returnValue;
    }

    public static SoapResult success(final Object returnValue) {
        return new SoapResult(true, "Success", returnValue);
    }

    public static SoapResult failure(final String message) {
        return new SoapResult(false, message, null);
    }

    public boolean isSuccess() {
        return success;
    }

    public String getMessage() {
        return message;
    }

    /**
     * @return The codeunit's return value, as parsed. Null on failure or when
     * the method returns nothing.
     */
    public Object getReturnValue() {
        return returnValue;
    }

    /**
     * @return The return value as text, or null if there is none.
     */
    public String getReturnValueAsString() {
        return returnValue == null ? null : String.valueOf(returnValue);
    }

    @Override
    public String toString() {
        return "SoapResult{success=" + success +
                ", message='" + message + '\'' +
                ", returnValue=" + returnValue + '}';
    }

}
