package io.routecontract.core.route;

import io.routecontract.core.contract.Contract;
import io.routecontract.core.model.ApiRequest;
import io.routecontract.core.model.ApiResponse;
import io.routecontract.core.model.Exchange;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.UnaryOperator;

/**
 * Attaches contracts to interceptors and builds interceptors from plain
 * functions.
 *
 * <p>
 * A contract travels with its interceptor as an ordinary field: annotating
 * returns a new interceptor with identical behaviour, and nothing is
 * registered anywhere else. Every factory takes a name, an optional contract
 * ({@code null} for none) and the behaviour.
 */
public final class Interceptors {

    private static final Consumer<Exchange> NOTHING = exchange -> {};

    private Interceptors() {
        // utility class
    }

    // ── Annotation ──

    /**
     * Returns an interceptor that behaves like {@code interceptor} and carries
     * {@code contract}, replacing any contract it already had.
     */
    public static Interceptor annotate(Contract contract, Interceptor interceptor) {
        Objects.requireNonNull(contract, "contract must not be null");
        Objects.requireNonNull(interceptor, "interceptor must not be null");
        Interceptor target = interceptor instanceof Annotated annotated ? annotated.delegate : interceptor;
        return new Annotated(target, contract);
    }

    /** The contract attached to {@code interceptor}, if any. */
    public static Optional<Contract> annotation(Interceptor interceptor) {
        return Optional.ofNullable(interceptor.contract());
    }

    // ── Factories ──

    /** Terminal handler: maps the request to a response. */
    public static Interceptor handler(String name, Contract contract, Function<ApiRequest, ApiResponse> body) {
        Objects.requireNonNull(body, "body must not be null");
        return of(name, contract, exchange -> exchange.respond(body.apply(exchange.request())), NOTHING);
    }

    public static Interceptor handler(String name, Function<ApiRequest, ApiResponse> body) {
        return handler(name, null, body);
    }

    /** Rewrites the request on enter. */
    public static Interceptor onRequest(String name, Contract contract, UnaryOperator<ApiRequest> fn) {
        Objects.requireNonNull(fn, "fn must not be null");
        return of(name, contract, exchange -> exchange.request(fn.apply(exchange.request())), NOTHING);
    }

    /** Rewrites the response on leave, when there is one. */
    public static Interceptor onResponse(String name, Contract contract, UnaryOperator<ApiResponse> fn) {
        Objects.requireNonNull(fn, "fn must not be null");
        return of(name, contract, NOTHING, exchange -> {
            if (exchange.hasResponse()) {
                exchange.respond(fn.apply(exchange.response()));
            }
        });
    }

    /** Runs {@code fn} on enter. */
    public static Interceptor before(String name, Contract contract, Consumer<Exchange> fn) {
        return of(name, contract, fn, NOTHING);
    }

    /** Runs {@code fn} on leave. */
    public static Interceptor after(String name, Contract contract, Consumer<Exchange> fn) {
        return of(name, contract, NOTHING, fn);
    }

    public static Interceptor around(
            String name, Contract contract, Consumer<Exchange> enter, Consumer<Exchange> leave) {
        return of(name, contract, enter, leave);
    }

    /** Request rewrite on enter paired with a response rewrite on leave. */
    public static Interceptor middleware(
            String name, Contract contract, UnaryOperator<ApiRequest> request, UnaryOperator<ApiResponse> response) {
        Interceptor onEnter = onRequest(name, null, request);
        Interceptor onLeave = onResponse(name, null, response);
        return of(name, contract, onEnter::enter, onLeave::leave);
    }

    private static Interceptor of(String name, Contract contract, Consumer<Exchange> enter, Consumer<Exchange> leave) {
        Interceptor plain = new Functional(name, enter, leave);
        return contract != null ? annotate(contract, plain) : plain;
    }

    // --- Implementations ---

    private static final class Functional implements Interceptor {

        private final String name;
        private final Consumer<Exchange> enter;
        private final Consumer<Exchange> leave;

        Functional(String name, Consumer<Exchange> enter, Consumer<Exchange> leave) {
            this.name = Objects.requireNonNull(name, "name must not be null");
            this.enter = Objects.requireNonNull(enter, "enter must not be null");
            this.leave = Objects.requireNonNull(leave, "leave must not be null");
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public void enter(Exchange exchange) {
            enter.accept(exchange);
        }

        @Override
        public void leave(Exchange exchange) {
            leave.accept(exchange);
        }

        @Override
        public String toString() {
            return "Interceptor[" + name + "]";
        }
    }

    private static final class Annotated implements Interceptor {

        private final Interceptor delegate;
        private final Contract contract;

        Annotated(Interceptor delegate, Contract contract) {
            this.delegate = delegate;
            this.contract = contract;
        }

        @Override
        public String name() {
            return delegate.name();
        }

        @Override
        public void enter(Exchange exchange) {
            delegate.enter(exchange);
        }

        @Override
        public void leave(Exchange exchange) {
            delegate.leave(exchange);
        }

        @Override
        public void error(Exchange exchange, RuntimeException failure) {
            delegate.error(exchange, failure);
        }

        @Override
        public Contract contract() {
            return contract;
        }

        @Override
        public String toString() {
            return delegate + " with " + contract;
        }
    }
}
