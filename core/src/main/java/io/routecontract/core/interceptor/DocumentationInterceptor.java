package io.routecontract.core.interceptor;

import com.fasterxml.jackson.databind.JsonNode;
import io.routecontract.core.doc.ApiDocument;
import io.routecontract.core.doc.OpenApiWriter;
import io.routecontract.core.model.ApiResponse;
import io.routecontract.core.model.Exchange;
import io.routecontract.core.route.Interceptor;
import java.util.Objects;
import java.util.function.Function;

/**
 * Terminal handler that serves the aggregate document. Left unannotated, so
 * the endpoint does not document itself.
 */
public final class DocumentationInterceptor implements Interceptor {

    public static final String NAME = "api-docs";

    private final Function<ApiDocument, JsonNode> serializer;

    public DocumentationInterceptor() {
        this(OpenApiWriter::toJson);
    }

    public DocumentationInterceptor(Function<ApiDocument, JsonNode> serializer) {
        this.serializer = Objects.requireNonNull(serializer, "serializer must not be null");
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void enter(Exchange exchange) {
        exchange.respond(ApiResponse.ok(serializer.apply(exchange.document())));
    }
}
