package com.navblocks.network;

import com.google.gson.JsonElement;

/**
 * This interface describes the feature set of a JSON adapter. JSON adapters are
 * expected to be used when a value type needs custom conversion, like dates in
 * the NAV wire format.
 *
 * @param <T> The Java type the adapter handles.
 */
public interface JsonAdapter<T> {

    /**
     * Transforms the given JSON element into a corresponding Java object.
     *
     * @param jsonElement The JSON element to transform.
     * @return The corresponding Java object. May be null.
     */
    T deserialize(JsonElement jsonElement);

    /**
     * Transforms the given Java object into a corresponding JSON element.
     *
     * @param value The object to transform. Never null.
     * @return The corresponding JSON element.
     */
    JsonElement serialize(T value);

}
