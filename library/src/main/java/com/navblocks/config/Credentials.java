package com.navblocks.config;

/**
 * How requests to a NAV endpoint authenticate. Basic and bearer credentials
 * become an Authorization header; ambient credentials add nothing and leave
 * authentication (for example Windows/NTLM) to a custom OkHttp client.
 */
public final class Credentials {

    public enum Kind {
        BASIC,
        BEARER,
        AMBIENT
    }

    private static final Credentials AMBIENT = new Credentials(Kind.AMBIENT, null, null, null);

    private final Kind kind;
    private final String username;
    private final String password;
    private final String token;

    private Credentials(final Kind kind,
                        final String username,
                        final String password,
                        final String token) {
        this.kind = kind;
        this.username = username;
        this.password = password;
        this.token = token;
    }

    public static Credentials basic(final String username, final String password) {
        if (username == null || username.isEmpty())
            throw new IllegalArgumentException("Basic credentials need a username");

        return new Credentials(Kind.BASIC, username, password == null ? "" : password, null);
    }

    public static Credentials bearer(final String token) {
        if (token == null || token.isEmpty())
            throw new IllegalArgumentException("Bearer credentials need a token");

        return new Credentials(Kind.BEARER, null, null, token);
    }

    public static Credentials ambient() {
        return AMBIENT;
    }

    public Kind kind() {
        return kind;
    }

    public String username() {
        return username;
    }

    /**
     * @return The Authorization header value, or null for ambient credentials.
     */
    public String authorizationHeader() {
        switch (kind) {
            case BASIC:
                return okhttp3.Credentials.basic(username, password);
            case BEARER:
                return "Bearer " + token;
            default:
                return null;
        }
    }

    @Override
    public String toString() {
        // Never print secrets.
        return kind == Kind.BASIC ?
                "Credentials{BASIC, username=" + username + "}" :
                "Credentials{" + kind + "}";
    }

}
