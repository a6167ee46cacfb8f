package io.routecontract.core.route;

import io.routecontract.core.doc.ApiDocument;
import io.routecontract.core.model.HttpMethod;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Compiled application: every expanded route carrying its merged contract,
 * plus the aggregate document. Immutable; built once before serving.
 *
 * @param routes   all routes, documented or not, in expansion order
 * @param document the aggregate API document
 */
public record RouteTable(List<Route> routes, ApiDocument document) {

    public RouteTable {
        routes = List.copyOf(routes);
        Objects.requireNonNull(document, "document must not be null");
    }

    /** Finds the route registered for {@code method} on the exact path template. */
    public Optional<Route> find(HttpMethod method, String pathTemplate) {
        return routes.stream()
                .filter(route -> route.method() == method && route.path().equals(pathTemplate))
                .findFirst();
    }
}
