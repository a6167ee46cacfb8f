package io.routecontract.core.contract;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.routecontract.core.schema.MapSchema;
import io.routecontract.core.schema.NamedSchema;
import io.routecontract.core.schema.Schema;
import java.util.Map;
import java.util.Optional;

/**
 * Translates contract fragments into schemas over whole request and response
 * values, and fills the defaults those schemas expect.
 *
 * <p>
 * A request value is an object with the fields {@code body-params},
 * {@code form-params}, {@code path-params}, {@code query-params} and
 * {@code headers}; a response value is an object with {@code body} and
 * {@code headers}.
 *
 * <p>
 * Thread-safe: stateless utility class.
 */
public final class ExchangeSchemas {

    public static final String BODY = "body";
    public static final String HEADERS = "headers";

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private ExchangeSchemas() {
        // utility class
    }

    // ── Request ──

    /**
     * Builds the schema of a whole request value from per-location schemas.
     * Query and header schemas are loosened, as is the composite, so
     * undeclared fields pass through.
     */
    public static MapSchema toRequestSchema(Map<ParameterLocation, Schema> parameters) {
        MapSchema.Builder builder = MapSchema.builder();
        parameters.forEach((location, schema) ->
                builder.required(location.field(), location.loose() ? loosen(schema) : schema));
        return builder.loose().build();
    }

    /**
     * Returns a copy of {@code request} where absent fields take their
     * defaults: {@code body-params} null, the other four {@code {}}.
     */
    public static ObjectNode withRequestDefaults(JsonNode request) {
        ObjectNode value = copy(request);
        for (ParameterLocation location : ParameterLocation.values()) {
            if (!value.has(location.field())) {
                value.set(location.field(), location == ParameterLocation.BODY ? NODES.nullNode() : NODES.objectNode());
            }
        }
        return value;
    }

    // ── Response ──

    /**
     * Picks the spec that governs {@code status}: the exact code, otherwise
     * {@code default}, otherwise none. A status outside 100..599 never matches
     * an exact code.
     */
    public static Optional<ResponseSpec> selectResponse(Map<ResponseCode, ResponseSpec> responses, int status) {
        ResponseSpec exact = ResponseCode.isValid(status) ? responses.get(ResponseCode.of(status)) : null;
        if (exact != null) {
            return Optional.of(exact);
        }
        return Optional.ofNullable(responses.get(ResponseCode.DEFAULT));
    }

    /**
     * Builds {@code {body: schema, headers: loosened(headers)}}, leaving out
     * undeclared parts. The result is loosened.
     */
    public static MapSchema toResponseSchema(ResponseSpec spec) {
        MapSchema.Builder builder = MapSchema.builder();
        if (spec.schema() != null) {
            builder.required(BODY, spec.schema());
        }
        if (spec.headers() != null) {
            builder.required(HEADERS, loosen(spec.headers()));
        }
        return builder.loose().build();
    }

    /** Returns a copy of {@code response} with {@code headers {}} and {@code body null} when absent. */
    public static ObjectNode withResponseDefaults(JsonNode response) {
        ObjectNode value = copy(response);
        if (!value.has(HEADERS)) {
            value.set(HEADERS, NODES.objectNode());
        }
        if (!value.has(BODY)) {
            value.set(BODY, NODES.nullNode());
        }
        return value;
    }

    // ── Shared ──

    /**
     * Makes a map schema accept any undeclared key. A named map is loosened
     * inside its name; other schemas are returned unchanged.
     */
    public static Schema loosen(Schema schema) {
        if (schema instanceof MapSchema map) {
            return map.loosened();
        }
        if (schema instanceof NamedSchema named && named.schema() instanceof MapSchema) {
            return new NamedSchema(named.name(), loosen(named.schema()));
        }
        return schema;
    }

    private static ObjectNode copy(JsonNode value) {
        if (value == null || value.isNull()) {
            return NODES.objectNode();
        }
        if (!value.isObject()) {
            throw new IllegalArgumentException("Expected an object value, got " + value.getNodeType());
        }
        return ((ObjectNode) value).deepCopy();
    }
}
