package io.routecontract.javalin.server;

import io.javalin.http.Context;
import io.javalin.http.Handler;
import io.routecontract.core.doc.ApiDocument;
import io.routecontract.core.model.ApiResponse;
import io.routecontract.core.model.Exchange;
import io.routecontract.core.route.InterceptorChain;
import io.routecontract.core.route.Route;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Javalin handler for one compiled route: wraps the request, runs the
 * route's interceptor chain and writes the resulting response.
 *
 * <p>
 * A failure that escapes the chain is logged at ERROR and answered with
 * {@code 500 {"error":"Internal Server Error"}}. A chain that finishes without
 * a response is answered with {@code 404}.
 */
final class ExchangeHandler implements Handler {

    private static final Logger LOG = LoggerFactory.getLogger(ExchangeHandler.class);

    static final String INTERNAL_ERROR_BODY = "{\"error\":\"Internal Server Error\"}";
    static final String NOT_FOUND_BODY = "{\"error\":\"Not Found\"}";

    private final Route route;
    private final ApiDocument document;

    ExchangeHandler(Route route, ApiDocument document) {
        this.route = route;
        this.document = document;
    }

    @Override
    public void handle(Context ctx) {
        Exchange exchange;
        try {
            exchange = new Exchange(route, document, JavalinExchangeAdapter.toApiRequest(ctx));
            InterceptorChain.execute(exchange);
        } catch (RuntimeException e) {
            LOG.error("Unhandled failure on {}: {}", route, e.getMessage(), e);
            writeRaw(ctx, 500, INTERNAL_ERROR_BODY);
            return;
        }

        ApiResponse response = exchange.response();
        if (response == null) {
            LOG.debug("Route {} produced no response", route);
            writeRaw(ctx, 404, NOT_FOUND_BODY);
            return;
        }
        try {
            JavalinExchangeAdapter.writeResponse(ctx, response);
        } catch (IllegalStateException e) {
            LOG.error("Failed to write response for {}: {}", route, e.getMessage(), e);
            writeRaw(ctx, 500, INTERNAL_ERROR_BODY);
        }
    }

    private static void writeRaw(Context ctx, int status, String body) {
        ctx.status(status);
        ctx.contentType("application/json");
        ctx.result(body);
    }
}
