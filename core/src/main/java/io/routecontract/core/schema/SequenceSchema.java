package io.routecontract.core.schema;

import java.util.Objects;

/**
 * Matches a JSON array whose every element matches {@code element}.
 *
 * @param element the element schema
 */
public record SequenceSchema(Schema element) implements Schema {

    public SequenceSchema {
        Objects.requireNonNull(element, "element must not be null");
    }
}
