package io.routecontract.core;

import io.routecontract.core.contract.Contract;
import io.routecontract.core.doc.ApiDocument;
import io.routecontract.core.doc.ApiInfo;
import io.routecontract.core.model.ApiRequest;
import io.routecontract.core.model.Exchange;
import io.routecontract.core.model.HttpMethod;
import io.routecontract.core.route.Interceptor;
import io.routecontract.core.route.Route;
import java.util.List;
import java.util.TreeMap;

/** Builds exchanges around ad-hoc routes for unit tests. */
public final class TestExchanges {

    public static final ApiDocument EMPTY_DOCUMENT = new ApiDocument(new ApiInfo("Test", "0.1"), new TreeMap<>());

    private TestExchanges() {}

    public static Route route(Contract contract, Interceptor... interceptors) {
        return new Route("/test", HttpMethod.GET, "test", List.of(interceptors), contract);
    }

    public static Exchange exchange(Route route, ApiRequest request) {
        return new Exchange(route, EMPTY_DOCUMENT, request);
    }

    public static ApiRequest get() {
        return ApiRequest.builder(HttpMethod.GET, "/test").build();
    }
}
