package com.navblocks.odata;

import com.google.gson.annotations.SerializedName;

import java.util.List;

/**
 * The OData V4 collection envelope: {@code {"@odata.context": ..., "value": [...]}}.
 *
 * @param <T> The record type.
 */
public class ODataResponse<T> {

    @SerializedName("@odata.context")
    private String context;

    @SerializedName("value")
    private List<T> value;

    public String getContext() {
        return context;
    }

    /**
     * @return The records, or null if the envelope had no value array.
     */
    public List<T> getValue() {
        return value;
    }

}
