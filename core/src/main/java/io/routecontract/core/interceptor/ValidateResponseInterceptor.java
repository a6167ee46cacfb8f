package io.routecontract.core.interceptor;

import io.routecontract.core.coerce.Coercer;
import io.routecontract.core.coerce.CoercionMatchers;
import io.routecontract.core.coerce.CoercionResult;
import io.routecontract.core.coerce.SchemaExplainer;
import io.routecontract.core.coerce.SchemaMismatch;
import io.routecontract.core.contract.Contract;
import io.routecontract.core.contract.ExchangeSchemas;
import io.routecontract.core.contract.ResponseSpec;
import io.routecontract.core.error.SchemaMismatchException;
import io.routecontract.core.model.ApiResponse;
import io.routecontract.core.model.Exchange;
import io.routecontract.core.route.Interceptor;
import io.routecontract.core.schema.MapSchema;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Validates the outgoing response against the spec declared for its status:
 * the exact code, otherwise {@code default}. Undeclared statuses are not
 * enforced.
 *
 * <p>
 * A conforming response is replaced by its validated copy; a mismatch is
 * answered with the internal-error status and
 * {@code {"error": <explanation>}}. The {@link #error} stage gives a
 * {@link SchemaMismatchException} thrown by wrapped code the same answer and
 * rethrows anything else.
 */
public final class ValidateResponseInterceptor implements Interceptor {

    public static final String NAME = "validate-response";

    private static final Logger LOG = LoggerFactory.getLogger(ValidateResponseInterceptor.class);

    private final ContractStatuses statuses;
    private final Coercer coercer;
    private final Contract contract;

    public ValidateResponseInterceptor(ContractStatuses statuses) {
        this.statuses = statuses;
        this.coercer = new Coercer(CoercionMatchers.none());
        this.contract = Contract.builder()
                .response(statuses.internalError(), ResponseSpec.empty())
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
    public void leave(Exchange exchange) {
        Optional<MapSchema> schema = responseSchema(exchange);
        if (schema.isEmpty()) {
            return;
        }
        ApiResponse response = exchange.response();
        CoercionResult result =
                coercer.coerce(schema.get(), ExchangeSchemas.withResponseDefaults(response.toValue()));
        if (result.isCoerced()) {
            exchange.respond(response.withValue(result.value()));
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

    // --- Private helpers ---

    private void reject(Exchange exchange, SchemaMismatch mismatch) {
        LOG.debug(
                "Response {} for route '{}' rejected: {}",
                exchange.hasResponse() ? exchange.response().status() : "(none)",
                exchange.route().name(),
                mismatch.errors());
        exchange.respond(ApiResponse.error(statuses.internalError(), SchemaExplainer.explain(mismatch.errors())));
    }

    private static Optional<MapSchema> responseSchema(Exchange exchange) {
        if (!exchange.hasResponse()) {
            return Optional.empty();
        }
        return ExchangeSchemas.selectResponse(
                        exchange.route().contract().responses(),
                        exchange.response().status())
                .map(ExchangeSchemas::toResponseSchema);
    }
}
