package io.routecontract.core.interceptor;

import com.fasterxml.jackson.databind.JsonNode;
import io.routecontract.core.doc.ApiDocument;
import io.routecontract.core.route.Interceptor;
import java.util.Map;
import java.util.function.Function;

/** Factories for the built-in interceptors. */
public final class ContractInterceptors {

    private ContractInterceptors() {
        // utility class
    }

    public static Interceptor coerceRequest() {
        return coerceRequest(ContractStatuses.DEFAULT);
    }

    public static Interceptor coerceRequest(ContractStatuses statuses) {
        return new CoerceRequestInterceptor(statuses);
    }

    public static Interceptor validateResponse() {
        return validateResponse(ContractStatuses.DEFAULT);
    }

    public static Interceptor validateResponse(ContractStatuses statuses) {
        return new ValidateResponseInterceptor(statuses);
    }

    public static Interceptor bodyParams() {
        return bodyParams(ContractStatuses.DEFAULT);
    }

    public static Interceptor bodyParams(ContractStatuses statuses) {
        return new BodyParamsInterceptor(statuses);
    }

    public static Interceptor bodyParams(ContractStatuses statuses, Map<String, BodyParser> parsers) {
        return new BodyParamsInterceptor(statuses, parsers);
    }

    /** Serves the document as OpenAPI 3.0 JSON. */
    public static Interceptor apiDocs() {
        return new DocumentationInterceptor();
    }

    public static Interceptor apiDocs(Function<ApiDocument, JsonNode> serializer) {
        return new DocumentationInterceptor(serializer);
    }
}
