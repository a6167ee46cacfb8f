package io.routecontract.core.schema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Matches a JSON object key by key.
 *
 * <p>
 * Each declared key is either required or optional. Keys that are not declared
 * are rejected unless the schema carries an {@code extraValues} schema (a
 * <em>loosened</em> map), in which case every undeclared key is validated
 * against it.
 *
 * @param entries     declared keys in declaration order
 * @param extraValues schema for undeclared keys, or {@code null} to reject them
 */
public record MapSchema(Map<String, Entry> entries, Schema extraValues) implements Schema {

    /**
     * One declared key.
     *
     * @param required whether the key must be present
     * @param schema   the value schema
     */
    public record Entry(boolean required, Schema schema) {

        public Entry {
            Objects.requireNonNull(schema, "schema must not be null");
        }
    }

    private static final MapSchema EMPTY = new MapSchema(Map.of(), null);

    public MapSchema {
        entries = entries == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    /** A strict map with no declared keys: only {@code {}} matches. */
    public static MapSchema empty() {
        return EMPTY;
    }

    /** True when undeclared keys are accepted. */
    public boolean isLoose() {
        return extraValues != null;
    }

    /** Returns a copy that accepts any undeclared key with any value. */
    public MapSchema loosened() {
        return isLoose() ? this : new MapSchema(entries, AnySchema.INSTANCE);
    }

    /**
     * Returns a map holding this schema's entries plus {@code other}'s; on a
     * shared key {@code other} wins. The result is loose if either input is.
     */
    public MapSchema union(MapSchema other) {
        Map<String, Entry> merged = new LinkedHashMap<>(entries);
        merged.putAll(other.entries);
        return new MapSchema(merged, other.extraValues != null ? other.extraValues : extraValues);
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Fluent builder; keys keep their declaration order. */
    public static final class Builder {

        private final Map<String, Entry> entries = new LinkedHashMap<>();
        private Schema extraValues;

        Builder() {}

        public Builder required(String key, Schema schema) {
            entries.put(key, new Entry(true, schema));
            return this;
        }

        public Builder optional(String key, Schema schema) {
            entries.put(key, new Entry(false, schema));
            return this;
        }

        /** Accepts undeclared keys whose values match {@code schema}. */
        public Builder extraValues(Schema schema) {
            this.extraValues = schema;
            return this;
        }

        /** Accepts undeclared keys with any value. */
        public Builder loose() {
            return extraValues(AnySchema.INSTANCE);
        }

        public MapSchema build() {
            return new MapSchema(entries, extraValues);
        }
    }
}
