package com.navblocks.config;

/**
 * Describes one NAV web service endpoint: where the server lives, which
 * company and protocol to talk to and how to authenticate. Produces the base
 * address every service request is prefixed with.
 * <p>
 * Instances are immutable; use {@link #builder()} to create them.
 */
public final class ServiceEndpoint {
    private static final String DEFAULT_OBJECT_TYPE = "Page";

    /**
     * Collects the endpoint properties.
     */
    public static final class Builder {
        private String host;
        private int port;
        private String serverInstance;
        private String company;
        private ServiceProtocol protocol;
        private String objectType;
        private Credentials credentials = Credentials.ambient();

        private Builder() {
        }

        /**
         * @param host The scheme and host, e.g. "http://nav.local".
         */
        public Builder host(final String host) {
            this.host = host;
            return this;
        }

        public Builder port(final int port) {
            this.port = port;
            return this;
        }

        public Builder serverInstance(final String serverInstance) {
            this.serverInstance = serverInstance;
            return this;
        }

        public Builder company(final String company) {
            this.company = company;
            return this;
        }

        public Builder protocol(final ServiceProtocol protocol) {
            this.protocol = protocol;
            return this;
        }

        /**
         * @param protocol The protocol name, see {@link ServiceProtocol#parse(String)}.
         */
        public Builder protocol(final String protocol) {
            this.protocol = ServiceProtocol.parse(protocol);
            return this;
        }

        /**
         * @param objectType The SOAP object type segment, "Page" or
         *                   "Codeunit". Blank means "Page".
         */
        public Builder objectType(final String objectType) {
            this.objectType = objectType;
            return this;
        }

        public Builder credentials(final Credentials credentials) {
            this.credentials = credentials == null ? Credentials.ambient() : credentials;
            return this;
        }

        public ServiceEndpoint build() {
            require(host, "host");
            require(serverInstance, "serverInstance");
            require(company, "company");
            if (protocol == null)
                throw new IllegalStateException("A service endpoint needs a protocol");
            if (port < 1 || port > 65535)
                throw new IllegalStateException("Invalid port: " + port);

            return new ServiceEndpoint(this);
        }

        private static void require(final String value, final String name) {
            if (value == null || value.trim().isEmpty())
                throw new IllegalStateException("A service endpoint needs a " + name);
        }
    }

    private final String host;
    private final int port;
    private final String serverInstance;
    private final String company;
    private final ServiceProtocol protocol;
    private final String objectType;
    private final Credentials credentials;

    private ServiceEndpoint(final Builder builder) {
        this.host = stripTrailingSlash(builder.host.trim());
        this.port = builder.port;
        this.serverInstance = builder.serverInstance.trim();
        this.company = builder.company.trim();
        this.protocol = builder.protocol;
        this.objectType = builder.objectType == null || builder.objectType.trim().isEmpty() ?
                DEFAULT_OBJECT_TYPE :
                builder.objectType.trim();
        this.credentials = builder.credentials;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String host() {
        return host;
    }

    public int port() {
        return port;
    }

    public String serverInstance() {
        return serverInstance;
    }

    public String company() {
        return company;
    }

    public ServiceProtocol protocol() {
        return protocol;
    }

    public String objectType() {
        return objectType;
    }

    public Credentials credentials() {
        return credentials;
    }

    /**
     * Builds the address all service names are appended to. It always ends
     * with a slash.
     *
     * @return "{host}:{port}/{instance}/ODataV4/Company('{company}')/" for
     * OData or "{host}:{port}/{instance}/WS/{company}/{objectType}/" for SOAP.
     */
    public String baseAddress() {
        switch (protocol) {
            case ODATA_V4:
                return String.format("%s:%d/%s/ODataV4/Company('%s')/", host, port, serverInstance, company);
            case SOAP:
                return String.format("%s:%d/%s/WS/%s/%s/", host, port, serverInstance, company, objectType);
            default:
                throw new IllegalStateException("Unknown service type: " + protocol);
        }
    }

    @Override
    public String toString() {
        return "ServiceEndpoint{" + protocol.label() + ", " + baseAddress() + ", " + credentials + "}";
    }

    private static String stripTrailingSlash(final String value) {
        return value.endsWith("/") ? value.substring(0, value.length() - 1) : value;
    }

}
