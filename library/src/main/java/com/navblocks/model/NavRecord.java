package com.navblocks.model;

import com.google.gson.annotations.SerializedName;

/**
 * Common base of typed NAV page records. Subclasses declare the page fields,
 * using {@link SerializedName} where the Java name differs from the NAV field
 * name.
 * <p>
 * The OData surface versions records with an ETag, the SOAP surface with a
 * server-assigned Key. Each is hidden from the other protocol.
 */
public abstract class NavRecord implements HasConcurrencyToken {

    @SerializedName("@odata.etag")
    @SoapIgnore
    private String etag;

    @SerializedName("Key")
    @ODataIgnore
    private String key;

    public String getEtag() {
        return etag;
    }

    public void setEtag(final String etag) {
        this.etag = etag;
    }

    public String getKey() {
        return key;
    }

    public void setKey(final String key) {
        this.key = key;
    }

    @Override
    public String concurrencyToken() {
        return etag;
    }

}
