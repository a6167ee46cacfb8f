package io.routecontract.core.schema;

/** Wildcard schema: every value matches. */
public enum AnySchema implements Schema {
    INSTANCE
}
