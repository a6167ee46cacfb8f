package io.routecontract.core.coerce;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;

/**
 * Turns a {@link ValidationError} tree into the JSON clients receive.
 *
 * <ul>
 * <li>A named failure wrapping a map failure explains the map, key by key;
 * the name only surfaces for leaf failures.</li>
 * <li>Any other named failure explains as the name.</li>
 * <li>Map failures become objects with the same keys.</li>
 * <li>Sequence failures become arrays with {@code null} at valid indices.</li>
 * <li>Leaf failures become their diagnostic string.</li>
 * </ul>
 *
 * <p>
 * Thread-safe: stateless utility class.
 */
public final class SchemaExplainer {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private SchemaExplainer() {}

    public static JsonNode explain(ValidationError error) {
        if (error instanceof ValidationError.Named named) {
            return named.error() instanceof ValidationError.MapErrors
                    ? explain(named.error())
                    : TextNode.valueOf(named.name());
        }
        if (error instanceof ValidationError.MapErrors map) {
            ObjectNode node = NODES.objectNode();
            map.errors().forEach((key, value) -> node.set(key, explain(value)));
            return node;
        }
        if (error instanceof ValidationError.SequenceErrors sequence) {
            ArrayNode node = NODES.arrayNode();
            sequence.errors().forEach(value -> node.add(value != null ? explain(value) : NODES.nullNode()));
            return node;
        }
        return TextNode.valueOf(String.valueOf(error));
    }
}
