package com.navblocks.model;

/**
 * Implemented by records that carry an optimistic concurrency token. Updates
 * of such records send the token as an If-Match precondition.
 */
public interface HasConcurrencyToken {

    /**
     * @return The opaque version marker, or null if the record has none.
     */
    String concurrencyToken();

}
