package io.routecontract.core.contract;

import io.routecontract.core.error.ContractDefinitionException;

/**
 * Where a request parameter lives. Each location maps to one structured field
 * of the request value; query and header schemas accept undeclared keys.
 */
public enum ParameterLocation {
    PATH("path", "path-params", false),
    QUERY("query", "query-params", true),
    HEADER("header", "headers", true),
    BODY("body", "body-params", false),
    FORM_DATA("formData", "form-params", false);

    private final String tag;
    private final String field;
    private final boolean loose;

    ParameterLocation(String tag, String field, boolean loose) {
        this.tag = tag;
        this.field = field;
        this.loose = loose;
    }

    /** The location name used in contracts and documents ({@code path}, {@code formData}, ...). */
    public String tag() {
        return tag;
    }

    /** The request field the location reads from ({@code path-params}, ...). */
    public String field() {
        return field;
    }

    /** Whether undeclared keys are accepted at this location. */
    public boolean loose() {
        return loose;
    }

    /**
     * Resolves a location tag.
     *
     * @throws ContractDefinitionException if the tag is not a known location
     */
    public static ParameterLocation fromTag(String tag) {
        for (ParameterLocation location : values()) {
            if (location.tag.equals(tag)) {
                return location;
            }
        }
        throw new ContractDefinitionException("Unknown parameter location: '" + tag + "'");
    }
}
