package io.routecontract.javalin.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.javalin.http.Context;
import io.routecontract.core.model.ApiRequest;
import io.routecontract.core.model.ApiResponse;
import io.routecontract.core.model.HttpMethod;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Converts between Javalin's {@link Context} and the core request/response
 * model.
 *
 * <p>
 * Header names are lower-cased. Query parameters that occur once become
 * strings; repeated ones become arrays of strings. Path parameters are always
 * strings, left for the request coercer to convert.
 */
public final class JavalinExchangeAdapter {

    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private JavalinExchangeAdapter() {
        // utility class
    }

    public static ApiRequest toApiRequest(Context ctx) {
        return ApiRequest.builder(HttpMethod.parse(ctx.method().name()), ctx.path())
                .contentType(ctx.contentType())
                .rawBody(ctx.bodyAsBytes())
                .pathParams(pathParams(ctx.pathParamMap()))
                .queryParams(queryParams(ctx.queryParamMap()))
                .headers(headers(ctx.headerMap()))
                .build();
    }

    /**
     * Writes status, headers and body. A JSON-null body leaves the response
     * body empty.
     *
     * @throws IllegalStateException if the body cannot be serialized
     */
    public static void writeResponse(Context ctx, ApiResponse response) {
        ctx.status(response.status());
        response.headers().forEach(ctx::header);
        if (response.body().isNull()) {
            return;
        }
        try {
            ctx.contentType("application/json");
            ctx.result(JSON_MAPPER.writeValueAsString(response.body()));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize response body", e);
        }
    }

    // --- Private helpers ---

    static ObjectNode pathParams(Map<String, String> params) {
        ObjectNode node = NODES.objectNode();
        params.forEach(node::put);
        return node;
    }

    static ObjectNode queryParams(Map<String, List<String>> params) {
        ObjectNode node = NODES.objectNode();
        params.forEach((name, values) -> {
            if (values.size() == 1) {
                node.put(name, values.get(0));
            } else {
                ArrayNode array = node.putArray(name);
                values.forEach(array::add);
            }
        });
        return node;
    }

    static ObjectNode headers(Map<String, String> headers) {
        ObjectNode node = NODES.objectNode();
        headers.forEach((name, value) -> node.put(name.toLowerCase(Locale.ROOT), value));
        return node;
    }
}
