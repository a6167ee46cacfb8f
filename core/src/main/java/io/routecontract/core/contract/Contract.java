package io.routecontract.core.contract;

import io.routecontract.core.schema.MapSchema;
import io.routecontract.core.schema.NamedSchema;
import io.routecontract.core.schema.Schema;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * Declarative description of what a route accepts and what it may return.
 *
 * <p>
 * Contracts are attached to individual interceptors and folded together along
 * a route, outer to inner, with {@link #merge(Contract)}. Immutable; the
 * collection components are unmodifiable views with stable iteration order
 * (tags, media types in declaration order, parameters by location, responses
 * by {@link ResponseCode}).
 *
 * @param description long description, or {@code null}
 * @param summary     one-line summary, or {@code null}
 * @param operationId document operation id, or {@code null}
 * @param tags        grouping tags
 * @param consumes    accepted request media types
 * @param produces    response media types
 * @param parameters  request schema per location
 * @param responses   declared responses per status
 */
public record Contract(
        String description,
        String summary,
        String operationId,
        Set<String> tags,
        Set<String> consumes,
        Set<String> produces,
        Map<ParameterLocation, Schema> parameters,
        Map<ResponseCode, ResponseSpec> responses) {

    /** The contract that declares nothing. */
    public static final Contract EMPTY = builder().build();

    public Contract {
        tags = orderedSet(tags);
        consumes = orderedSet(consumes);
        produces = orderedSet(produces);
        parameters = Collections.unmodifiableMap(
                parameters == null || parameters.isEmpty()
                        ? new EnumMap<>(ParameterLocation.class)
                        : new EnumMap<>(parameters));
        responses = Collections.unmodifiableMap(responses == null ? new TreeMap<>() : new TreeMap<>(responses));
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isEmpty() {
        return equals(EMPTY);
    }

    /**
     * Folds an inner (more specific) contract over this one.
     *
     * <p>
     * Scalar fields take the inner value when it is non-null. Tags and media
     * types are order-preserving unions. Parameters and responses are unions
     * by key; two map schemas at the same location are unioned entry by entry
     * with the inner entry winning, any other collision goes to the inner
     * value.
     */
    public Contract merge(Contract inner) {
        Objects.requireNonNull(inner, "inner must not be null");
        Map<ParameterLocation, Schema> mergedParameters = new EnumMap<>(ParameterLocation.class);
        mergedParameters.putAll(parameters);
        inner.parameters.forEach((location, schema) -> mergedParameters.merge(location, schema, Contract::mergeSchema));

        Map<ResponseCode, ResponseSpec> mergedResponses = new TreeMap<>(responses);
        mergedResponses.putAll(inner.responses);

        return new Contract(
                inner.description != null ? inner.description : description,
                inner.summary != null ? inner.summary : summary,
                inner.operationId != null ? inner.operationId : operationId,
                union(tags, inner.tags),
                union(consumes, inner.consumes),
                union(produces, inner.produces),
                mergedParameters,
                mergedResponses);
    }

    // --- Private helpers ---

    /**
     * Unions two map schemas, seeing through names; the inner name wins, then
     * the outer one. Anything else is replaced by the inner schema.
     */
    private static Schema mergeSchema(Schema outer, Schema inner) {
        MapSchema outerMap = unwrapMap(outer);
        MapSchema innerMap = unwrapMap(inner);
        if (outerMap == null || innerMap == null) {
            return inner;
        }
        MapSchema union = outerMap.union(innerMap);
        if (inner instanceof NamedSchema named) {
            return new NamedSchema(named.name(), union);
        }
        if (outer instanceof NamedSchema named) {
            return new NamedSchema(named.name(), union);
        }
        return union;
    }

    private static MapSchema unwrapMap(Schema schema) {
        if (schema instanceof NamedSchema named) {
            return named.schema() instanceof MapSchema map ? map : null;
        }
        return schema instanceof MapSchema map ? map : null;
    }

    private static Set<String> union(Set<String> first, Set<String> second) {
        Set<String> merged = new LinkedHashSet<>(first);
        merged.addAll(second);
        return merged;
    }

    private static Set<String> orderedSet(Set<String> values) {
        return values == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(values));
    }

    /** Fluent builder for {@link Contract}. */
    public static final class Builder {

        private String description;
        private String summary;
        private String operationId;
        private final Set<String> tags = new LinkedHashSet<>();
        private final Set<String> consumes = new LinkedHashSet<>();
        private final Set<String> produces = new LinkedHashSet<>();
        private final Map<ParameterLocation, Schema> parameters = new EnumMap<>(ParameterLocation.class);
        private final Map<ResponseCode, ResponseSpec> responses = new TreeMap<>();

        Builder() {}

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder summary(String summary) {
            this.summary = summary;
            return this;
        }

        public Builder operationId(String operationId) {
            this.operationId = operationId;
            return this;
        }

        public Builder tags(String... tags) {
            Collections.addAll(this.tags, tags);
            return this;
        }

        public Builder consumes(String... mediaTypes) {
            Collections.addAll(consumes, mediaTypes);
            return this;
        }

        public Builder produces(String... mediaTypes) {
            Collections.addAll(produces, mediaTypes);
            return this;
        }

        public Builder parameter(ParameterLocation location, Schema schema) {
            parameters.put(Objects.requireNonNull(location, "location"), Objects.requireNonNull(schema, "schema"));
            return this;
        }

        /**
         * @throws io.routecontract.core.error.ContractDefinitionException for an
         *         unknown location tag
         */
        public Builder parameter(String locationTag, Schema schema) {
            return parameter(ParameterLocation.fromTag(locationTag), schema);
        }

        public Builder path(Schema schema) {
            return parameter(ParameterLocation.PATH, schema);
        }

        public Builder query(Schema schema) {
            return parameter(ParameterLocation.QUERY, schema);
        }

        public Builder headers(Schema schema) {
            return parameter(ParameterLocation.HEADER, schema);
        }

        public Builder body(Schema schema) {
            return parameter(ParameterLocation.BODY, schema);
        }

        public Builder formData(Schema schema) {
            return parameter(ParameterLocation.FORM_DATA, schema);
        }

        public Builder response(int status, ResponseSpec spec) {
            return response(ResponseCode.of(status), spec);
        }

        public Builder response(ResponseCode code, ResponseSpec spec) {
            responses.put(Objects.requireNonNull(code, "code"), Objects.requireNonNull(spec, "spec"));
            return this;
        }

        public Builder response(int status, Schema body) {
            return response(status, ResponseSpec.body(body));
        }

        public Builder defaultResponse(ResponseSpec spec) {
            return response(ResponseCode.DEFAULT, spec);
        }

        public Contract build() {
            return new Contract(description, summary, operationId, tags, consumes, produces, parameters, responses);
        }
    }
}
