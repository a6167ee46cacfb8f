package io.routecontract.core.route;

import io.routecontract.core.contract.Contract;
import io.routecontract.core.model.HttpMethod;
import java.util.List;
import java.util.Objects;

/**
 * One expanded route: a full path template and method with every interceptor
 * that applies to it, outermost first. The last interceptor is the terminal
 * handler.
 *
 * @param path         full path template, e.g. {@code /pets/:id}
 * @param method       HTTP method
 * @param name         route name (the terminal handler's name)
 * @param interceptors interceptors in execution order
 * @param contract     merged contract; {@link Contract#EMPTY} until compiled
 */
public record Route(String path, HttpMethod method, String name, List<Interceptor> interceptors, Contract contract) {

    public Route {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(method, "method must not be null");
        Objects.requireNonNull(name, "name must not be null");
        interceptors = List.copyOf(interceptors);
        if (interceptors.isEmpty()) {
            throw new IllegalArgumentException("route " + method + " " + path + " has no handler");
        }
        contract = contract != null ? contract : Contract.EMPTY;
    }

    /** The terminal handler. */
    public Interceptor handler() {
        return interceptors.get(interceptors.size() - 1);
    }

    public Route withContract(Contract contract) {
        return new Route(path, method, name, interceptors, contract);
    }

    @Override
    public String toString() {
        return method + " " + path + " (" + name + ")";
    }
}
