package io.routecontract.core.schema;

import java.util.List;

/**
 * Matches a JSON string equal to one of {@code values}.
 *
 * @param values allowed values, in declaration order
 */
public record EnumSchema(List<String> values) implements Schema {

    public EnumSchema {
        if (values == null || values.isEmpty()) {
            throw new IllegalArgumentException("enumeration must declare at least one value");
        }
        values = List.copyOf(values);
    }
}
