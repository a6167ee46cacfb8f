package io.routecontract.core.schema;

import java.util.List;

/**
 * Recursive structural description of an expected value.
 *
 * <p>
 * A schema is one of: a scalar type predicate ({@link ScalarSchema}), the
 * {@link AnySchema} wildcard, an {@link EnumSchema}, a {@link NullableSchema},
 * a {@link SequenceSchema}, a {@link MapSchema} of required/optional keys, or
 * a {@link NamedSchema} that labels its inner schema for error explanations.
 *
 * <p>
 * Schemas are immutable values with structural equality. They are built once
 * by contract authors and shared freely across threads.
 */
public interface Schema {

    // ── Factory methods ──

    /** Matches JSON strings. */
    static Schema string() {
        return ScalarSchema.STRING;
    }

    /** Matches integral JSON numbers. */
    static Schema integer() {
        return ScalarSchema.INTEGER;
    }

    /** Matches any JSON number. */
    static Schema number() {
        return ScalarSchema.NUMBER;
    }

    /** Matches JSON booleans. */
    static Schema bool() {
        return ScalarSchema.BOOLEAN;
    }

    /** Matches every value, including null. */
    static Schema any() {
        return AnySchema.INSTANCE;
    }

    /** Matches one of the given strings. */
    static Schema oneOf(String... values) {
        return new EnumSchema(List.of(values));
    }

    /** Matches null or the given schema. */
    static Schema nullable(Schema schema) {
        return new NullableSchema(schema);
    }

    /** Matches a JSON array whose every element matches {@code element}. */
    static Schema sequence(Schema element) {
        return new SequenceSchema(element);
    }

    /** Labels {@code schema} so mismatches explain themselves by name. */
    static Schema named(String name, Schema schema) {
        return new NamedSchema(name, schema);
    }

    /** Starts a map schema. */
    static MapSchema.Builder map() {
        return MapSchema.builder();
    }
}
