package io.routecontract.core.coerce;

import com.fasterxml.jackson.databind.JsonNode;
import io.routecontract.core.schema.Schema;
import java.util.Objects;

/**
 * The failed side of a {@link CoercionResult}.
 *
 * @param schema the schema the value was checked against
 * @param value  the original, unconverted value
 * @param errors the structured error tree (see {@link SchemaExplainer})
 */
public record SchemaMismatch(Schema schema, JsonNode value, ValidationError errors) {

    public SchemaMismatch {
        Objects.requireNonNull(schema, "schema must not be null");
        Objects.requireNonNull(value, "value must not be null; use NullNode for absent values");
        Objects.requireNonNull(errors, "errors must not be null");
    }
}
