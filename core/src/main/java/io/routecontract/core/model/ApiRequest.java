package io.routecontract.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Locale;
import java.util.Objects;

/**
 * Inbound request as seen by interceptors. Adapters build it from their native
 * request; interceptors replace it with updated copies.
 *
 * <p>
 * The five structured fields are JSON values and may each be {@code null}
 * (absent). Header names are lower-cased by the adapter. Query values are
 * strings, or arrays of strings when a parameter repeats.
 *
 * @param method      the HTTP method
 * @param path        the request path, without query string
 * @param contentType the Content-Type header value, or {@code null}
 * @param rawBody     undecoded body bytes, empty when there is no body
 * @param bodyParams  decoded body, or {@code null}
 * @param formParams  decoded form fields, or {@code null}
 * @param pathParams  path template captures, or {@code null}
 * @param queryParams query parameters, or {@code null}
 * @param headers     request headers, or {@code null}
 */
public record ApiRequest(
        HttpMethod method,
        String path,
        String contentType,
        byte[] rawBody,
        JsonNode bodyParams,
        JsonNode formParams,
        JsonNode pathParams,
        JsonNode queryParams,
        JsonNode headers) {

    public static final String BODY_PARAMS = "body-params";
    public static final String FORM_PARAMS = "form-params";
    public static final String PATH_PARAMS = "path-params";
    public static final String QUERY_PARAMS = "query-params";
    public static final String HEADERS = "headers";

    private static final byte[] NO_BODY = new byte[0];

    public ApiRequest {
        Objects.requireNonNull(method, "method must not be null");
        Objects.requireNonNull(path, "path must not be null");
        rawBody = rawBody != null ? rawBody : NO_BODY;
    }

    public static Builder builder(HttpMethod method, String path) {
        return new Builder(method, path);
    }

    public boolean hasBody() {
        return rawBody.length > 0;
    }

    /** Returns a header value (name matched lower-case), or {@code null}. */
    public String header(String name) {
        if (headers == null) {
            return null;
        }
        JsonNode value = headers.get(name.toLowerCase(Locale.ROOT));
        return value != null && !value.isNull() ? value.asText() : null;
    }

    /** The structured fields as one object; absent fields are left out. */
    public ObjectNode toValue() {
        ObjectNode value = JsonNodeFactory.instance.objectNode();
        putIfPresent(value, BODY_PARAMS, bodyParams);
        putIfPresent(value, FORM_PARAMS, formParams);
        putIfPresent(value, PATH_PARAMS, pathParams);
        putIfPresent(value, QUERY_PARAMS, queryParams);
        putIfPresent(value, HEADERS, headers);
        return value;
    }

    /** Returns a copy whose structured fields are read from {@code value}. */
    public ApiRequest withValue(JsonNode value) {
        return new ApiRequest(
                method,
                path,
                contentType,
                rawBody,
                value.get(BODY_PARAMS),
                value.get(FORM_PARAMS),
                value.get(PATH_PARAMS),
                value.get(QUERY_PARAMS),
                value.get(HEADERS));
    }

    public ApiRequest withBodyParams(JsonNode bodyParams) {
        return new ApiRequest(
                method, path, contentType, rawBody, bodyParams, formParams, pathParams, queryParams, headers);
    }

    public ApiRequest withFormParams(JsonNode formParams) {
        return new ApiRequest(
                method, path, contentType, rawBody, bodyParams, formParams, pathParams, queryParams, headers);
    }

    private static void putIfPresent(ObjectNode target, String field, JsonNode value) {
        if (value != null) {
            target.set(field, value);
        }
    }

    /** Fluent builder used by adapters and tests. */
    public static final class Builder {

        private final HttpMethod method;
        private final String path;
        private String contentType;
        private byte[] rawBody;
        private JsonNode bodyParams;
        private JsonNode formParams;
        private JsonNode pathParams;
        private JsonNode queryParams;
        private JsonNode headers;

        private Builder(HttpMethod method, String path) {
            this.method = method;
            this.path = path;
        }

        public Builder contentType(String contentType) {
            this.contentType = contentType;
            return this;
        }

        public Builder rawBody(byte[] rawBody) {
            this.rawBody = rawBody;
            return this;
        }

        public Builder bodyParams(JsonNode bodyParams) {
            this.bodyParams = bodyParams;
            return this;
        }

        public Builder formParams(JsonNode formParams) {
            this.formParams = formParams;
            return this;
        }

        public Builder pathParams(JsonNode pathParams) {
            this.pathParams = pathParams;
            return this;
        }

        public Builder queryParams(JsonNode queryParams) {
            this.queryParams = queryParams;
            return this;
        }

        public Builder headers(JsonNode headers) {
            this.headers = headers;
            return this;
        }

        public ApiRequest build() {
            return new ApiRequest(
                    method, path, contentType, rawBody, bodyParams, formParams, pathParams, queryParams, headers);
        }
    }
}
