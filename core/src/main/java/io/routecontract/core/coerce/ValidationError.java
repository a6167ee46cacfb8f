package io.routecontract.core.coerce;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Structured failure produced by the {@link Coercer}. The tree mirrors the
 * rejected value: map failures are keyed like the value, sequence failures are
 * indexed like it, and every failing leaf carries a short diagnostic.
 *
 * <p>
 * Use {@link SchemaExplainer#explain(ValidationError)} to render a tree as
 * JSON for clients.
 */
public interface ValidationError {

    /**
     * A scalar failure.
     *
     * @param diagnostic short text such as {@code missing-required-key} or
     *                   {@code expected integer, got "W"}
     */
    record Leaf(String diagnostic) implements ValidationError {

        public Leaf {
            Objects.requireNonNull(diagnostic, "diagnostic must not be null");
        }

        @Override
        public String toString() {
            return diagnostic;
        }
    }

    /**
     * A failure inside a {@link io.routecontract.core.schema.NamedSchema}.
     *
     * @param name  the schema name
     * @param error the failure of the wrapped schema
     */
    record Named(String name, ValidationError error) implements ValidationError {

        public Named {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(error, "error must not be null");
        }

        @Override
        public String toString() {
            return "(named " + error + " " + name + ")";
        }
    }

    /**
     * Per-key failures of a map. Only failing keys are present.
     *
     * @param errors failing keys in encounter order
     */
    record MapErrors(Map<String, ValidationError> errors) implements ValidationError {

        public MapErrors {
            errors = Collections.unmodifiableMap(new LinkedHashMap<>(errors));
        }

        @Override
        public String toString() {
            return errors.toString();
        }
    }

    /**
     * Per-index failures of a sequence; {@code null} marks a valid element.
     *
     * @param errors one slot per element of the rejected array
     */
    record SequenceErrors(List<ValidationError> errors) implements ValidationError {

        public SequenceErrors {
            errors = Collections.unmodifiableList(new ArrayList<>(errors));
        }

        @Override
        public String toString() {
            return errors.toString();
        }
    }
}
