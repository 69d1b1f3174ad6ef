package com.navblocks.soap;

import com.navblocks.model.SoapResult;
import org.w3c.dom.Element;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Generic access to one NAV page web service over SOAP, plus codeunit calls
 * through the same endpoint.
 * <p>
 * Every method issues exactly one request. Transport failures throw
 * {@link com.navblocks.exception.NavTransportException}, faults and
 * unreadable responses throw {@link com.navblocks.exception.NavProtocolException}.
 *
 * @param <T> The page record type.
 */
public interface NavSoapService<T> {

    /**
     * Reads all records matching the filters.
     *
     * @param filters     Filter elements, see {@link SoapPayloads#filter}. May
     *                    be null.
     * @param bookmarkKey The key of the last record of the previous set. May be
     *                    null.
     * @param setSize     The maximum number of records. Zero or less means
     *                    1000.
     * @return The records. Empty, never null, if none match.
     */
    List<T> readAll(List<Element> filters, String bookmarkKey, int setSize);

    /**
     * Same as {@link #readAll(List, String, int)} with no bookmark and the
     * default set size.
     */
    List<T> readAll(List<Element> filters);

    /**
     * Reads a single record.
     *
     * @param keyFieldsXml The complete Read element.
     * @return The record, or empty if the server returned none.
     */
    Optional<T> read(Element keyFieldsXml);

    /**
     * Reads a single record by its primary key fields.
     */
    Optional<T> read(Map<String, String> keyFields);

    /**
     * @param createPayloadXml The complete Create element.
     * @return The created record as echoed by the server, or empty if the
     * response didn't echo it.
     */
    Optional<T> create(Element createPayloadXml);

    /**
     * Creates the given record.
     */
    Optional<T> create(T record);

    /**
     * @param updatePayloadXml The complete Update element.
     * @return The updated record as echoed by the server, or empty if the
     * response didn't echo it.
     */
    Optional<T> update(Element updatePayloadXml);

    /**
     * Updates the given record. NAV requires its {@code Key}.
     */
    Optional<T> update(T record);

    /**
     * @param keyFieldsXml The complete Delete element.
     * @return True if the server acknowledged the delete.
     */
    boolean delete(Element keyFieldsXml);

    /**
     * Deletes the record with the given server-assigned key.
     */
    boolean delete(String key);

    /**
     * Calls a codeunit method. A response without a return value is reported
     * as a failed result, not thrown.
     *
     * @param serviceName   The codeunit service name.
     * @param methodName    The method name.
     * @param parametersXml The complete method element.
     * @return The outcome of the call.
     */
    SoapResult invokeCodeunit(String serviceName, String methodName, Element parametersXml);

    /**
     * Calls a codeunit method with simple text parameters.
     */
    SoapResult invokeCodeunit(String serviceName, String methodName, Map<String, String> parameters);

}
