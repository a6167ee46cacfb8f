package io.routecontract.core.coerce;

import com.fasterxml.jackson.databind.JsonNode;
import io.routecontract.core.schema.Schema;

/**
 * Converts a value before the {@link Coercer} checks it against a schema.
 * Called once for every schema node the walk visits, with the value found at
 * that position.
 *
 * <p>
 * Implementations return the value unchanged when they have nothing to do and
 * must never throw: a value they cannot convert is returned as-is and the
 * coercer reports the mismatch. Implementations must be stateless.
 *
 * @see CoercionMatchers
 */
@FunctionalInterface
public interface CoercionMatcher {

    /**
     * @param schema the schema about to be checked
     * @param value  the value at this position, never {@code null}
     * @return the value to check, never {@code null}
     */
    JsonNode apply(Schema schema, JsonNode value);
}
