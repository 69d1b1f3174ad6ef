package com.navblocks.exception;

/**
 * Thrown when a lookup that must produce exactly one record produced none.
 */
public class EntityNotFoundException extends NavServiceException {
    private final String serviceName;
    private final String filter;

    public EntityNotFoundException(final String serviceName, final String filter) {
        super(String.format("No entity found in '%s' matching filter: %s", serviceName, filter));
        this.serviceName = serviceName;
        this.filter = filter;
    }

    public String serviceName() {
        return serviceName;
    }

    public String filter() {
        return filter;
    }

}
