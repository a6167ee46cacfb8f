package io.routecontract.core.schema;

import java.util.Objects;

/**
 * Gives {@code schema} a name. When a scalar value fails the inner schema the
 * explanation is the name itself, so authors can phrase their own messages
 * (e.g. {@code "positive-id"}). Map failures are still explained field by
 * field.
 *
 * @param name   the label reported for leaf mismatches
 * @param schema the wrapped schema
 */
public record NamedSchema(String name, Schema schema) implements Schema {

    public NamedSchema {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(schema, "schema must not be null");
    }
}
