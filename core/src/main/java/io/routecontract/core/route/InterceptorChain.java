package io.routecontract.core.route;

import io.routecontract.core.model.Exchange;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a route's interceptors against one exchange.
 *
 * <p>
 * Enter stages run in order until one throws or a response is present; the
 * interceptor whose enter is running counts as entered. The entered
 * interceptors then unwind innermost-first: {@code leave} when no failure is
 * pending, {@code error} otherwise. An {@code error} that returns normally
 * clears the failure. A {@code leave} that throws is offered to the same
 * interceptor's {@code error} first. A failure still pending after unwinding
 * is rethrown.
 *
 * <p>
 * Thread-safe: stateless utility class.
 */
public final class InterceptorChain {

    private static final Logger LOG = LoggerFactory.getLogger(InterceptorChain.class);

    private InterceptorChain() {
        // utility class
    }

    /** Runs the interceptors of the exchange's route. */
    public static void execute(Exchange exchange) {
        execute(exchange, exchange.route().interceptors());
    }

    public static void execute(Exchange exchange, List<Interceptor> interceptors) {
        Deque<Interceptor> entered = new ArrayDeque<>();
        RuntimeException failure = null;

        for (Interceptor interceptor : interceptors) {
            if (exchange.hasResponse()) {
                break;
            }
            entered.push(interceptor);
            try {
                interceptor.enter(exchange);
            } catch (RuntimeException e) {
                LOG.debug("Interceptor '{}' failed on enter: {}", interceptor.name(), e.toString());
                failure = e;
                break;
            }
        }

        while (!entered.isEmpty()) {
            Interceptor interceptor = entered.pop();
            if (failure == null) {
                try {
                    interceptor.leave(exchange);
                    continue;
                } catch (RuntimeException e) {
                    LOG.debug("Interceptor '{}' failed on leave: {}", interceptor.name(), e.toString());
                    failure = e;
                }
            }
            try {
                interceptor.error(exchange, failure);
                failure = null;
            } catch (RuntimeException e) {
                failure = e;
            }
        }

        if (failure != null) {
            throw failure;
        }
    }
}
