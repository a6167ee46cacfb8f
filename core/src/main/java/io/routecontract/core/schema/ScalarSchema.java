package io.routecontract.core.schema;

import com.fasterxml.jackson.databind.JsonNode;

/** Type predicates for JSON scalar leaves. */
public enum ScalarSchema implements Schema {
    STRING("string") {
        @Override
        public boolean matches(JsonNode node) {
            return node.isTextual();
        }
    },
    INTEGER("integer") {
        @Override
        public boolean matches(JsonNode node) {
            return node.isIntegralNumber();
        }
    },
    NUMBER("number") {
        @Override
        public boolean matches(JsonNode node) {
            return node.isNumber();
        }
    },
    BOOLEAN("boolean") {
        @Override
        public boolean matches(JsonNode node) {
            return node.isBoolean();
        }
    };

    private final String typeName;

    ScalarSchema(String typeName) {
        this.typeName = typeName;
    }

    /** True when {@code node} is a non-null value of this type. */
    public abstract boolean matches(JsonNode node);

    /** Lowercase type name used in diagnostics and documents. */
    public String typeName() {
        return typeName;
    }
}
