package io.routecontract.javalin.server;

import io.javalin.http.Context;
import io.javalin.http.Handler;

/**
 * Liveness check. Registered as a plain Javalin route, outside every route
 * tree, so no contract applies to it.
 */
public final class HealthHandler implements Handler {

    private static final String HEALTH_RESPONSE = "{\"status\":\"UP\"}";

    @Override
    public void handle(Context ctx) {
        ctx.status(200);
        ctx.contentType("application/json");
        ctx.result(HEALTH_RESPONSE);
    }
}
