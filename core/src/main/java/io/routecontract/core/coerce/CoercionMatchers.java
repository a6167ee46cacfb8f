package io.routecontract.core.coerce;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.DoubleNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.LongNode;
import io.routecontract.core.schema.ScalarSchema;
import java.math.BigDecimal;

/**
 * Built-in {@link CoercionMatcher}s.
 *
 * <ul>
 * <li>{@link #string()}: for values that arrive as text (path, query,
 * headers, form fields): numeric and boolean strings become numbers and
 * booleans where the schema asks for them. Values that are not text get
 * the {@link #json()} rules.</li>
 * <li>{@link #json()}: for decoded JSON: integral floating numbers become
 * integers where the schema asks for them.</li>
 * <li>{@link #none()}: no conversion; plain validation.</li>
 * </ul>
 */
public final class CoercionMatchers {

    private static final CoercionMatcher NONE = (schema, value) -> value;

    private static final CoercionMatcher JSON = (schema, value) -> {
        if (schema == ScalarSchema.INTEGER
                && value.isFloatingPointNumber()
                && value.canConvertToExactIntegral()) {
            return integral(value.longValue());
        }
        return value;
    };

    private static final CoercionMatcher STRING = (schema, value) -> {
        if (!value.isTextual()) {
            return JSON.apply(schema, value);
        }
        if (!(schema instanceof ScalarSchema scalar)) {
            return value;
        }
        String text = value.textValue().trim();
        return switch (scalar) {
            case INTEGER -> parseLong(text, value);
            case NUMBER -> parseDecimal(text, value);
            case BOOLEAN -> parseBoolean(text, value);
            case STRING -> value;
        };
    };

    private CoercionMatchers() {
        // utility class
    }

    /** Text-to-scalar conversions for request parameters. */
    public static CoercionMatcher string() {
        return STRING;
    }

    /** Numeric normalisation for decoded JSON bodies. */
    public static CoercionMatcher json() {
        return JSON;
    }

    /** Identity: validates without converting. */
    public static CoercionMatcher none() {
        return NONE;
    }

    // --- Private helpers ---

    private static JsonNode parseLong(String text, JsonNode original) {
        try {
            return integral(Long.parseLong(text));
        } catch (NumberFormatException e) {
            return original;
        }
    }

    private static JsonNode integral(long value) {
        return value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE
                ? IntNode.valueOf((int) value)
                : LongNode.valueOf(value);
    }

    private static JsonNode parseDecimal(String text, JsonNode original) {
        try {
            return DoubleNode.valueOf(new BigDecimal(text).doubleValue());
        } catch (NumberFormatException e) {
            return original;
        }
    }

    private static JsonNode parseBoolean(String text, JsonNode original) {
        if ("true".equalsIgnoreCase(text)) {
            return BooleanNode.TRUE;
        }
        if ("false".equalsIgnoreCase(text)) {
            return BooleanNode.FALSE;
        }
        return original;
    }
}
