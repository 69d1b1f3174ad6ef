package com.navblocks.odata;

import com.annimon.stream.Stream;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Helpers for the {@code $filter} query option.
 */
public final class ODataFilters {

    private ODataFilters() {
    }

    /**
     * Joins all non-empty filter expressions with " and ".
     *
     * @param filter  The primary expression. May be null or empty.
     * @param filters Additional expressions. May be null or hold empty values.
     * @return The combined expression, or null if every expression is empty.
     */
    public static String combine(final String filter, final String... filters) {
        List<String> parts = new ArrayList<>();
        if (filter != null && !filter.isEmpty())
            parts.add(filter);

        if (filters != null)
            Stream.of(filters)
                    .filter(part -> part != null && !part.isEmpty())
                    .forEach(parts::add);

        return parts.isEmpty() ? null : String.join(" and ", parts);
    }

    /**
     * Percent-encodes a query value the RFC 3986 way: everything except
     * unreserved characters is escaped, spaces become %20.
     *
     * @param value The value to encode.
     * @return The encoded value.
     */
    public static String encode(final String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8)
                .replace("+", "%20")
                .replace("*", "%2A")
                .replace("%7E", "~");
    }

    /**
     * @return "?$filter=" followed by the encoded expression, or an empty
     * string if the expression is null or empty.
     */
    public static String query(final String expression) {
        return expression == null || expression.isEmpty() ?
                "" :
                "?$filter=" + encode(expression);
    }

}
