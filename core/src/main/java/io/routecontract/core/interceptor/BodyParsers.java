package io.routecontract.core.interceptor;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Built-in {@link BodyParser}s and the default content-type map. */
public final class BodyParsers {

    public static final String APPLICATION_JSON = "application/json";
    public static final String APPLICATION_YAML = "application/yaml";
    public static final String APPLICATION_X_YAML = "application/x-yaml";
    public static final String FORM_URLENCODED = "application/x-www-form-urlencoded";

    private static final ObjectMapper JSON_MAPPER =
            new ObjectMapper().enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    private static final ObjectMapper YAML_MAPPER =
            new ObjectMapper(new YAMLFactory()).enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    private BodyParsers() {
        // utility class
    }

    /** JSON into {@code body-params}. Content after the first value is rejected. */
    public static BodyParser json() {
        return request -> request.withBodyParams(readTree(JSON_MAPPER, request.rawBody()));
    }

    /** YAML into {@code body-params}. */
    public static BodyParser yaml() {
        return request -> request.withBodyParams(readTree(YAML_MAPPER, request.rawBody()));
    }

    /**
     * URL-encoded form fields into {@code form-params}. Repeated fields become
     * arrays; values stay strings.
     */
    public static BodyParser form() {
        return request -> request.withFormParams(decodeForm(new String(request.rawBody(), StandardCharsets.UTF_8)));
    }

    /** Media type to parser for JSON, both YAML types and URL-encoded forms. */
    public static Map<String, BodyParser> defaults() {
        Map<String, BodyParser> parsers = new LinkedHashMap<>();
        parsers.put(APPLICATION_JSON, json());
        parsers.put(APPLICATION_YAML, yaml());
        parsers.put(APPLICATION_X_YAML, yaml());
        parsers.put(FORM_URLENCODED, form());
        return Collections.unmodifiableMap(parsers);
    }

    // --- Private helpers ---

    private static JsonNode readTree(ObjectMapper mapper, byte[] body) throws IOException {
        JsonNode node = mapper.readTree(body);
        if (node == null || node.isMissingNode()) {
            throw new IOException("No content to decode");
        }
        return node;
    }

    private static ObjectNode decodeForm(String body) throws IOException {
        ObjectNode fields = JsonNodeFactory.instance.objectNode();
        try {
            for (String pair : body.split("&")) {
                if (pair.isEmpty()) {
                    continue;
                }
                int eq = pair.indexOf('=');
                String key = URLDecoder.decode(eq < 0 ? pair : pair.substring(0, eq), StandardCharsets.UTF_8);
                String value = eq < 0 ? "" : URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8);
                add(fields, key, value);
            }
        } catch (IllegalArgumentException e) {
            throw new IOException("Malformed form encoding: " + e.getMessage(), e);
        }
        return fields;
    }

    private static void add(ObjectNode fields, String key, String value) {
        JsonNode existing = fields.get(key);
        if (existing == null) {
            fields.put(key, value);
        } else if (existing.isArray()) {
            ((ArrayNode) existing).add(value);
        } else {
            ArrayNode values = fields.arrayNode().add(existing).add(value);
            fields.set(key, values);
        }
    }
}
