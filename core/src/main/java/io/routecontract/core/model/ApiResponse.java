package io.routecontract.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outbound response produced by a handler or an interceptor.
 *
 * @param status  HTTP status code
 * @param headers response headers in insertion order
 * @param body    JSON body; {@link NullNode} when there is none
 */
public record ApiResponse(int status, Map<String, String> headers, JsonNode body) {

    public static final String STATUS = "status";
    public static final String HEADERS = "headers";
    public static final String BODY = "body";

    public ApiResponse {
        headers = headers != null ? Collections.unmodifiableMap(new LinkedHashMap<>(headers)) : Map.of();
        body = body != null ? body : NullNode.getInstance();
    }

    public static ApiResponse of(int status, JsonNode body) {
        return new ApiResponse(status, Map.of(), body);
    }

    public static ApiResponse ok(JsonNode body) {
        return of(200, body);
    }

    /** {@code {"error": detail}} with the given status. */
    public static ApiResponse error(int status, JsonNode detail) {
        ObjectNode body = JsonNodeFactory.instance.objectNode();
        body.set("error", detail);
        return of(status, body);
    }

    public ApiResponse withHeader(String name, String value) {
        Map<String, String> copy = new LinkedHashMap<>(headers);
        copy.put(name, value);
        return new ApiResponse(status, copy, body);
    }

    /** {@code {status, headers, body}} as one object. */
    public ObjectNode toValue() {
        ObjectNode value = JsonNodeFactory.instance.objectNode();
        value.put(STATUS, status);
        ObjectNode headerNode = value.putObject(HEADERS);
        headers.forEach(headerNode::put);
        value.set(BODY, body);
        return value;
    }

    /**
     * Returns a copy whose headers and body are read from {@code value}; the
     * status is kept.
     */
    public ApiResponse withValue(JsonNode value) {
        Map<String, String> copy = new LinkedHashMap<>();
        JsonNode headerNode = value.path(HEADERS);
        Iterator<Map.Entry<String, JsonNode>> fields = headerNode.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            copy.put(field.getKey(), field.getValue().asText());
        }
        return new ApiResponse(status, copy, value.get(BODY));
    }
}
