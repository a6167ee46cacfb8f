package io.routecontract.core.route;

import io.routecontract.core.error.ContractDefinitionException;
import io.routecontract.core.model.HttpMethod;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A node of a declarative route tree.
 *
 * <p>
 * A node owns a path segment (for example {@code /pets} or {@code /:id}),
 * interceptors that apply to every route at or beneath it, handlers keyed by
 * method, and child nodes. Segments may contain {@code :name} placeholders.
 */
public final class RouteNode {

    /**
     * A handler registered for one method, with interceptors that apply only
     * to that route.
     */
    public record MethodHandler(Interceptor handler, List<Interceptor> interceptors) {

        public MethodHandler {
            Objects.requireNonNull(handler, "handler must not be null");
            interceptors = List.copyOf(interceptors);
        }
    }

    private final String segment;
    private final List<Interceptor> interceptors;
    private final Map<HttpMethod, MethodHandler> handlers;
    private final List<RouteNode> children;

    private RouteNode(Builder builder) {
        this.segment = builder.segment;
        this.interceptors = List.copyOf(builder.interceptors);
        this.handlers = Collections.unmodifiableMap(new EnumMap<>(builder.handlers));
        this.children = List.copyOf(builder.children);
    }

    /**
     * Starts a node for {@code segment}.
     *
     * @throws ContractDefinitionException if the segment is non-empty and does
     *         not start with {@code /}
     */
    public static Builder at(String segment) {
        Objects.requireNonNull(segment, "segment must not be null");
        if (!segment.isEmpty() && !segment.startsWith("/")) {
            throw new ContractDefinitionException("Path segment must start with '/': '" + segment + "'");
        }
        return new Builder(segment.equals("/") ? "" : segment);
    }

    public String segment() {
        return segment;
    }

    public List<Interceptor> interceptors() {
        return interceptors;
    }

    public Map<HttpMethod, MethodHandler> handlers() {
        return handlers;
    }

    public List<RouteNode> children() {
        return children;
    }

    /** Fluent builder for {@link RouteNode}. */
    public static final class Builder {

        private final String segment;
        private final List<Interceptor> interceptors = new ArrayList<>();
        private final Map<HttpMethod, MethodHandler> handlers = new EnumMap<>(HttpMethod.class);
        private final List<RouteNode> children = new ArrayList<>();

        private Builder(String segment) {
            this.segment = segment;
        }

        /** Adds interceptors applied to every route at or beneath this node. */
        public Builder intercept(Interceptor... interceptors) {
            Collections.addAll(this.interceptors, interceptors);
            return this;
        }

        /**
         * Registers the handler for {@code method}, preceded by route-local
         * interceptors.
         *
         * @throws ContractDefinitionException if the method already has a handler
         */
        public Builder handle(HttpMethod method, Interceptor handler, Interceptor... routeInterceptors) {
            if (handlers.containsKey(method)) {
                throw new ContractDefinitionException(
                        "Duplicate handler for " + method + " on segment '" + segment + "'");
            }
            handlers.put(method, new MethodHandler(handler, List.of(routeInterceptors)));
            return this;
        }

        public Builder get(Interceptor handler, Interceptor... routeInterceptors) {
            return handle(HttpMethod.GET, handler, routeInterceptors);
        }

        public Builder post(Interceptor handler, Interceptor... routeInterceptors) {
            return handle(HttpMethod.POST, handler, routeInterceptors);
        }

        public Builder put(Interceptor handler, Interceptor... routeInterceptors) {
            return handle(HttpMethod.PUT, handler, routeInterceptors);
        }

        public Builder delete(Interceptor handler, Interceptor... routeInterceptors) {
            return handle(HttpMethod.DELETE, handler, routeInterceptors);
        }

        public Builder patch(Interceptor handler, Interceptor... routeInterceptors) {
            return handle(HttpMethod.PATCH, handler, routeInterceptors);
        }

        public Builder head(Interceptor handler, Interceptor... routeInterceptors) {
            return handle(HttpMethod.HEAD, handler, routeInterceptors);
        }

        public Builder child(RouteNode child) {
            children.add(Objects.requireNonNull(child, "child must not be null"));
            return this;
        }

        public Builder child(Builder child) {
            return child(child.build());
        }

        public RouteNode build() {
            return new RouteNode(this);
        }
    }
}
