package io.routecontract.core.model;

import java.util.Locale;

/** HTTP methods a route can be registered for, in document order. */
public enum HttpMethod {
    GET,
    PUT,
    POST,
    DELETE,
    OPTIONS,
    HEAD,
    PATCH;

    /** Lower-case name, as used for operation keys in API documents. */
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a method name, case-insensitively.
     *
     * @throws IllegalArgumentException for an unsupported method
     */
    public static HttpMethod parse(String name) {
        return valueOf(name.trim().toUpperCase(Locale.ROOT));
    }
}
