package com.navblocks.odata;

import java.util.List;

/**
 * Generic CRUD access to one NAV OData V4 entity set.
 *
 * @param <T> The record type.
 */
public interface NavODataService<T> {

    /**
     * Lists the records matching all given filter expressions.
     *
     * @param filter  The primary {@code $filter} expression. May be null.
     * @param filters Additional expressions, AND-ed with the primary one.
     * @return The matching records. Empty, never null, if none match.
     */
    List<T> getEntities(String filter, String... filters);

    /**
     * Looks up the first record matching a filter expression.
     *
     * @param filter The {@code $filter} expression.
     * @return The first match.
     * @throws com.navblocks.exception.EntityNotFoundException If nothing
     *                                                         matches.
     */
    T getEntity(String filter);

    /**
     * @param entity The record to create.
     * @return The created record as echoed by the server.
     */
    T createEntity(T entity);

    /**
     * Patches a record. If the record carries a concurrency token it's sent
     * as an If-Match precondition.
     *
     * @param key    The key of the record.
     * @param entity The new field values.
     * @return The updated record as echoed by the server.
     */
    T updateEntity(String key, T entity);

    /**
     * @param key The key of the record to delete.
     */
    void deleteEntity(String key);

}
