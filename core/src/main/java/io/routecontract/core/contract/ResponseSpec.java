package io.routecontract.core.contract;

import io.routecontract.core.schema.Schema;

/**
 * A declared response. Every part is optional: an empty spec documents the
 * status without constraining it.
 *
 * @param description human-readable text, or {@code null}
 * @param schema      body schema, or {@code null} for an undeclared body
 * @param headers     header schema, or {@code null}
 */
public record ResponseSpec(String description, Schema schema, Schema headers) {

    private static final ResponseSpec EMPTY = new ResponseSpec(null, null, null);

    public static ResponseSpec empty() {
        return EMPTY;
    }

    public static ResponseSpec body(Schema schema) {
        return new ResponseSpec(null, schema, null);
    }

    public static ResponseSpec described(String description) {
        return new ResponseSpec(description, null, null);
    }

    public ResponseSpec withDescription(String description) {
        return new ResponseSpec(description, schema, headers);
    }

    public ResponseSpec withHeaders(Schema headers) {
        return new ResponseSpec(description, schema, headers);
    }
}
