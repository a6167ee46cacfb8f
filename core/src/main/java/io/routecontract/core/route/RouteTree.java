package io.routecontract.core.route;

import io.routecontract.core.error.ContractDefinitionException;
import io.routecontract.core.model.HttpMethod;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * An ordered forest of {@link RouteNode}s describing an application.
 *
 * @param roots top-level nodes
 */
public record RouteTree(List<RouteNode> roots) {

    public RouteTree {
        roots = List.copyOf(roots);
    }

    public static RouteTree of(RouteNode... roots) {
        return new RouteTree(List.of(roots));
    }

    /**
     * Flattens the tree into routes. Paths are concatenated and interceptor
     * lists joined outer to inner: node interceptors from the root down, then
     * route-local interceptors, then the handler.
     *
     * @throws ContractDefinitionException if two routes share a path and method
     */
    public List<Route> expand() {
        List<Route> routes = new ArrayList<>();
        for (RouteNode root : roots) {
            expand(root, "", List.of(), routes);
        }
        Set<String> seen = new HashSet<>();
        for (Route route : routes) {
            if (!seen.add(route.method() + " " + route.path())) {
                throw new ContractDefinitionException("Duplicate route: " + route.method() + " " + route.path());
            }
        }
        return List.copyOf(routes);
    }

    private static void expand(RouteNode node, String prefix, List<Interceptor> inherited, List<Route> out) {
        String path = prefix + node.segment();
        List<Interceptor> chain = new ArrayList<>(inherited);
        chain.addAll(node.interceptors());

        for (Map.Entry<HttpMethod, RouteNode.MethodHandler> entry : node.handlers().entrySet()) {
            RouteNode.MethodHandler methodHandler = entry.getValue();
            List<Interceptor> interceptors = new ArrayList<>(chain);
            interceptors.addAll(methodHandler.interceptors());
            interceptors.add(methodHandler.handler());
            out.add(new Route(
                    path.isEmpty() ? "/" : path, entry.getKey(), methodHandler.handler().name(), interceptors, null));
        }
        for (RouteNode child : node.children()) {
            expand(child, path, chain, out);
        }
    }
}
