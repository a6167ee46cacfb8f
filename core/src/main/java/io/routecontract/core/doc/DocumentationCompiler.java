package io.routecontract.core.doc;

import io.routecontract.core.contract.Contract;
import io.routecontract.core.model.HttpMethod;
import io.routecontract.core.route.Interceptor;
import io.routecontract.core.route.Interceptors;
import io.routecontract.core.route.Route;
import io.routecontract.core.route.RouteTable;
import io.routecontract.core.route.RouteTree;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compiles a {@link RouteTree} into its aggregate {@link ApiDocument} and a
 * {@link RouteTable} whose routes carry their merged contracts.
 *
 * <p>
 * A route's contract is the fold of every interceptor annotation along it,
 * outermost first, so ambient fragments (an auth middleware's header
 * requirement, the body parser's media types) combine with the handler's own
 * fragment. Only routes whose terminal handler is annotated appear in the
 * document; unannotated routes are still compiled and enforced.
 *
 * <p>
 * Compilation is pure and never mutates the tree. Thread-safe: stateless
 * utility class.
 */
public final class DocumentationCompiler {

    private static final Logger LOG = LoggerFactory.getLogger(DocumentationCompiler.class);

    private DocumentationCompiler() {
        // utility class
    }

    /**
     * Flattens the tree into routes.
     *
     * @throws io.routecontract.core.error.ContractDefinitionException on a
     *         duplicate path and method
     */
    public static List<Route> expand(RouteTree tree) {
        return tree.expand();
    }

    /** Folds the annotations of the route's interceptors, outer to inner. */
    public static Contract mergedContract(Route route) {
        Contract merged = Contract.EMPTY;
        for (Interceptor interceptor : route.interceptors()) {
            Contract fragment = interceptor.contract();
            if (fragment != null) {
                merged = merged.merge(fragment);
            }
        }
        return merged;
    }

    /** Path to method to merged contract, for documented routes only. */
    public static SortedMap<String, Map<HttpMethod, Contract>> generatePaths(RouteTree tree) {
        return generatePaths(expand(tree));
    }

    public static ApiDocument compile(RouteTree tree, ApiInfo info) {
        return new ApiDocument(info, generatePaths(tree));
    }

    /**
     * Compiles the tree into a route table: every route with its merged
     * contract attached, plus the aggregate document.
     */
    public static RouteTable inject(RouteTree tree, ApiInfo info) {
        List<Route> expanded = expand(tree);
        List<Route> routes = new ArrayList<>(expanded.size());
        for (Route route : expanded) {
            routes.add(route.withContract(mergedContract(route)));
        }
        ApiDocument document = new ApiDocument(info, generatePaths(expanded));
        LOG.info(
                "Compiled {} route(s), {} documented operation(s) across {} path(s) for '{}' {}",
                routes.size(),
                document.operationCount(),
                document.paths().size(),
                info.title(),
                info.version());
        return new RouteTable(routes, document);
    }

    // --- Private helpers ---

    private static SortedMap<String, Map<HttpMethod, Contract>> generatePaths(List<Route> routes) {
        SortedMap<String, Map<HttpMethod, Contract>> paths = new TreeMap<>();
        for (Route route : routes) {
            if (Interceptors.annotation(route.handler()).isEmpty()) {
                LOG.debug("Route {} has no documented handler; left out of the document", route);
                continue;
            }
            paths.computeIfAbsent(route.path(), path -> new EnumMap<>(HttpMethod.class))
                    .put(route.method(), mergedContract(route));
        }
        return paths;
    }
}
