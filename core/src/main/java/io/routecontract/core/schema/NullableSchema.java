package io.routecontract.core.schema;

import java.util.Objects;

/**
 * Matches JSON null, or any value matching {@code schema}.
 *
 * @param schema the schema for non-null values
 */
public record NullableSchema(Schema schema) implements Schema {

    public NullableSchema {
        Objects.requireNonNull(schema, "schema must not be null");
    }
}
