package io.routecontract.core.coerce;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.routecontract.core.schema.AnySchema;
import io.routecontract.core.schema.EnumSchema;
import io.routecontract.core.schema.MapSchema;
import io.routecontract.core.schema.NamedSchema;
import io.routecontract.core.schema.NullableSchema;
import io.routecontract.core.schema.ScalarSchema;
import io.routecontract.core.schema.Schema;
import io.routecontract.core.schema.SequenceSchema;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Walks a {@link Schema} in lock-step with a JSON value, converting scalar
 * leaves with a {@link CoercionMatcher} and collecting every structural
 * disagreement into a {@link ValidationError} tree.
 *
 * <p>
 * The input value is never mutated: a successful result is a fresh tree of
 * the same shape. Optional keys that are absent stay absent.
 *
 * <p>
 * Thread-safe and immutable.
 */
public final class Coercer {

    /** Diagnostic for a required map key that is absent. */
    public static final String MISSING_REQUIRED_KEY = "missing-required-key";

    /** Diagnostic for an undeclared key on a strict map. */
    public static final String DISALLOWED_KEY = "disallowed-key";

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private final CoercionMatcher matcher;

    /** Creates a coercer that validates without converting. */
    public Coercer() {
        this(CoercionMatchers.none());
    }

    public Coercer(CoercionMatcher matcher) {
        this.matcher = Objects.requireNonNull(matcher, "matcher must not be null");
    }

    /**
     * Coerces {@code value} to {@code schema}.
     *
     * @param schema the expected shape
     * @param value  the raw value; {@code null} is treated as JSON null
     * @return COERCED with the converted value, or MISMATCH with the error tree
     */
    public CoercionResult coerce(Schema schema, JsonNode value) {
        Objects.requireNonNull(schema, "schema must not be null");
        JsonNode input = value != null ? value : NullNode.getInstance();
        Outcome outcome = walk(schema, input);
        if (outcome.error != null) {
            return CoercionResult.mismatch(new SchemaMismatch(schema, input, outcome.error));
        }
        return CoercionResult.coerced(outcome.value);
    }

    // --- Walk ---

    private Outcome walk(Schema schema, JsonNode raw) {
        JsonNode value = matcher.apply(schema, raw);
        if (value == null) {
            value = NullNode.getInstance();
        }

        if (schema instanceof AnySchema) {
            return Outcome.ok(value);
        }
        if (schema instanceof ScalarSchema scalar) {
            return scalar.matches(value) ? Outcome.ok(value) : Outcome.fail(expected(scalar.typeName(), value));
        }
        if (schema instanceof EnumSchema enumeration) {
            return value.isTextual() && enumeration.values().contains(value.textValue())
                    ? Outcome.ok(value)
                    : Outcome.fail(expected("one of " + enumeration.values(), value));
        }
        if (schema instanceof NullableSchema nullable) {
            return value.isNull() ? Outcome.ok(value) : walk(nullable.schema(), value);
        }
        if (schema instanceof NamedSchema named) {
            Outcome inner = walk(named.schema(), value);
            return inner.error != null ? Outcome.fail(new ValidationError.Named(named.name(), inner.error)) : inner;
        }
        if (schema instanceof SequenceSchema sequence) {
            return walkSequence(sequence, value);
        }
        if (schema instanceof MapSchema map) {
            return walkMap(map, value);
        }
        throw new IllegalArgumentException("Unsupported schema type: " + schema.getClass().getName());
    }

    private Outcome walkSequence(SequenceSchema sequence, JsonNode value) {
        if (!value.isArray()) {
            return Outcome.fail(expected("array", value));
        }
        ArrayNode coerced = NODES.arrayNode(value.size());
        List<ValidationError> errors = new ArrayList<>(value.size());
        boolean failed = false;
        for (JsonNode element : value) {
            Outcome outcome = walk(sequence.element(), element);
            errors.add(outcome.error);
            if (outcome.error != null) {
                failed = true;
            } else {
                coerced.add(outcome.value);
            }
        }
        return failed ? Outcome.fail(new ValidationError.SequenceErrors(errors)) : Outcome.ok(coerced);
    }

    private Outcome walkMap(MapSchema map, JsonNode value) {
        if (!value.isObject()) {
            return Outcome.fail(expected("map", value));
        }
        ObjectNode coerced = NODES.objectNode();
        Map<String, ValidationError> errors = new LinkedHashMap<>();

        for (Map.Entry<String, MapSchema.Entry> declared : map.entries().entrySet()) {
            String key = declared.getKey();
            JsonNode child = value.get(key);
            if (child == null) {
                if (declared.getValue().required()) {
                    errors.put(key, new ValidationError.Leaf(MISSING_REQUIRED_KEY));
                }
                continue;
            }
            collect(key, walk(declared.getValue().schema(), child), coerced, errors);
        }

        Iterator<Map.Entry<String, JsonNode>> fields = value.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (map.entries().containsKey(field.getKey())) {
                continue;
            }
            if (!map.isLoose()) {
                errors.put(field.getKey(), new ValidationError.Leaf(DISALLOWED_KEY));
                continue;
            }
            collect(field.getKey(), walk(map.extraValues(), field.getValue()), coerced, errors);
        }

        return errors.isEmpty() ? Outcome.ok(coerced) : Outcome.fail(new ValidationError.MapErrors(errors));
    }

    private static void collect(
            String key, Outcome outcome, ObjectNode coerced, Map<String, ValidationError> errors) {
        if (outcome.error != null) {
            errors.put(key, outcome.error);
        } else {
            coerced.set(key, outcome.value);
        }
    }

    private static ValidationError expected(String what, JsonNode actual) {
        return new ValidationError.Leaf("expected " + what + ", got " + actual);
    }

    /** Either a converted value or an error, never both. */
    private static final class Outcome {

        private final JsonNode value;
        private final ValidationError error;

        private Outcome(JsonNode value, ValidationError error) {
            this.value = value;
            this.error = error;
        }

        static Outcome ok(JsonNode value) {
            return new Outcome(value, null);
        }

        static Outcome fail(ValidationError error) {
            return new Outcome(null, error);
        }
    }
}
