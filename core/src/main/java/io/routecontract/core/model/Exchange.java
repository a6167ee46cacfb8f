package io.routecontract.core.model;

import io.routecontract.core.doc.ApiDocument;
import io.routecontract.core.route.Route;
import java.util.Objects;

/**
 * Mutable state of one request/response exchange as it passes through an
 * interceptor chain. Owned by a single thread.
 */
public final class Exchange {

    private final Route route;
    private final ApiDocument document;
    private ApiRequest request;
    private ApiResponse response;

    public Exchange(Route route, ApiDocument document, ApiRequest request) {
        this.route = Objects.requireNonNull(route, "route must not be null");
        this.document = Objects.requireNonNull(document, "document must not be null");
        this.request = Objects.requireNonNull(request, "request must not be null");
    }

    /** The matched route, with its merged contract. */
    public Route route() {
        return route;
    }

    /** The aggregate document of the application the route belongs to. */
    public ApiDocument document() {
        return document;
    }

    public ApiRequest request() {
        return request;
    }

    public void request(ApiRequest request) {
        this.request = Objects.requireNonNull(request, "request must not be null");
    }

    /** The current response, or {@code null} if none has been produced. */
    public ApiResponse response() {
        return response;
    }

    /** Sets the response; entering stops once one is present. */
    public void respond(ApiResponse response) {
        this.response = Objects.requireNonNull(response, "response must not be null");
    }

    public boolean hasResponse() {
        return response != null;
    }
}
