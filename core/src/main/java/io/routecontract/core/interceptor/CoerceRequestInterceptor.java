package io.routecontract.core.interceptor;

import io.routecontract.core.coerce.Coercer;
import io.routecontract.core.coerce.CoercionMatchers;
import io.routecontract.core.coerce.CoercionResult;
import io.routecontract.core.coerce.SchemaExplainer;
import io.routecontract.core.coerce.SchemaMismatch;
import io.routecontract.core.contract.Contract;
import io.routecontract.core.contract.ExchangeSchemas;
import io.routecontract.core.contract.ParameterLocation;
import io.routecontract.core.contract.ResponseSpec;
import io.routecontract.core.error.SchemaMismatchException;
import io.routecontract.core.model.ApiResponse;
import io.routecontract.core.model.Exchange;
import io.routecontract.core.route.Interceptor;
import io.routecontract.core.schema.MapSchema;
import io.routecontract.core.schema.Schema;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Coerces the request's structured fields to the route's declared parameters.
 *
 * <p>
 * Textual path, query, header and form values are converted to the declared
 * scalar types. On success the coerced fields replace the request's; on a
 * mismatch the exchange is answered with the unprocessable status and
 * {@code {"error": <explanation>}}. Routes that declare no parameters pass
 * through untouched.
 */
public final class CoerceRequestInterceptor implements Interceptor {

    public static final String NAME = "coerce-request";

    private static final Logger LOG = LoggerFactory.getLogger(CoerceRequestInterceptor.class);

    private final ContractStatuses statuses;
    private final Coercer coercer;
    private final Contract contract;

    public CoerceRequestInterceptor(ContractStatuses statuses) {
        this.statuses = statuses;
        this.coercer = new Coercer(CoercionMatchers.string());
        this.contract = Contract.builder()
                .response(statuses.unprocessable(), ResponseSpec.empty())
                .build();
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Contract contract() {
        return contract;
    }

    @Override
    public void enter(Exchange exchange) {
        Map<ParameterLocation, Schema> parameters = exchange.route().contract().parameters();
        if (parameters.isEmpty()) {
            return;
        }
        MapSchema schema = ExchangeSchemas.toRequestSchema(parameters);
        CoercionResult result =
                coercer.coerce(schema, ExchangeSchemas.withRequestDefaults(exchange.request().toValue()));
        if (result.isCoerced()) {
            exchange.request(exchange.request().withValue(result.value()));
        } else {
            reject(exchange, result.mismatch());
        }
    }

    /** Answers mismatches thrown by wrapped code; rethrows anything else. */
    @Override
    public void error(Exchange exchange, RuntimeException failure) {
        if (failure instanceof SchemaMismatchException mismatch) {
            reject(exchange, mismatch.mismatch());
            return;
        }
        throw failure;
    }

    private void reject(Exchange exchange, SchemaMismatch mismatch) {
        LOG.debug("Request for route '{}' rejected: {}", exchange.route().name(), mismatch.errors());
        exchange.respond(ApiResponse.error(statuses.unprocessable(), SchemaExplainer.explain(mismatch.errors())));
    }
}
