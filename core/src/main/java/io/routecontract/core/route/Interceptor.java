package io.routecontract.core.route;

import io.routecontract.core.contract.Contract;
import io.routecontract.core.model.Exchange;

/**
 * One stage of a route's processing chain.
 *
 * <p>
 * {@link InterceptorChain} calls {@link #enter} on each interceptor in order
 * until one produces a response or throws, then unwinds the entered
 * interceptors innermost-first through {@link #leave}, or {@link #error} while
 * a failure is pending. The last interceptor of a route is its terminal
 * handler.
 *
 * <p>
 * Implementations must be thread-safe: one instance serves every exchange of
 * the routes it is attached to.
 */
public interface Interceptor {

    /** Name used in logs and as the route name for terminal handlers. */
    String name();

    default void enter(Exchange exchange) {}

    default void leave(Exchange exchange) {}

    /**
     * Handles a failure raised by this interceptor or one entered after it.
     * Returning normally marks the failure as handled; unwinding resumes with
     * {@link #leave}. The default rethrows.
     */
    default void error(Exchange exchange, RuntimeException failure) {
        throw failure;
    }

    /**
     * The contract fragment this interceptor contributes to the routes it is
     * part of, or {@code null} if it contributes none.
     *
     * @see Interceptors#annotate(Contract, Interceptor)
     */
    default Contract contract() {
        return null;
    }
}
