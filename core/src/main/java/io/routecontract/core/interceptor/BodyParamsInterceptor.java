package io.routecontract.core.interceptor;

import com.fasterxml.jackson.databind.node.TextNode;
import io.routecontract.core.contract.Contract;
import io.routecontract.core.contract.ResponseSpec;
import io.routecontract.core.error.DeserializationException;
import io.routecontract.core.model.ApiRequest;
import io.routecontract.core.model.ApiResponse;
import io.routecontract.core.model.Exchange;
import io.routecontract.core.route.Interceptor;
import java.io.IOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decodes the raw request body according to its content type.
 *
 * <p>
 * The media type is compared without parameters and case-insensitively.
 * Requests with no body or an unregistered type pass through. A body that
 * fails to decode raises {@link DeserializationException}, which this
 * interceptor's {@link #error} stage answers with the bad-request status and
 * {@code {"error": "Malformed request body"}}.
 *
 * <p>
 * The interceptor's contract documents the media types it accepts and the
 * bad-request response.
 */
public final class BodyParamsInterceptor implements Interceptor {

    public static final String NAME = "body-params";
    public static final String MALFORMED_BODY = "Malformed request body";

    private static final Logger LOG = LoggerFactory.getLogger(BodyParamsInterceptor.class);

    private final ContractStatuses statuses;
    private final Map<String, BodyParser> parsers;
    private final Contract contract;

    public BodyParamsInterceptor(ContractStatuses statuses) {
        this(statuses, BodyParsers.defaults());
    }

    public BodyParamsInterceptor(ContractStatuses statuses, Map<String, BodyParser> parsers) {
        this.statuses = statuses;
        Map<String, BodyParser> normalized = new LinkedHashMap<>();
        parsers.forEach((type, parser) -> normalized.put(mediaType(type), parser));
        this.parsers = Collections.unmodifiableMap(normalized);
        this.contract = Contract.builder()
                .consumes(this.parsers.keySet().toArray(new String[0]))
                .response(statuses.badRequest(), ResponseSpec.empty())
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
        ApiRequest request = exchange.request();
        if (!request.hasBody() || request.contentType() == null) {
            return;
        }
        String type = mediaType(request.contentType());
        BodyParser parser = parsers.get(type);
        if (parser == null) {
            return;
        }
        try {
            exchange.request(parser.parse(request));
        } catch (IOException e) {
            throw new DeserializationException("Failed to decode " + type + " request body", e, type);
        }
    }

    @Override
    public void error(Exchange exchange, RuntimeException failure) {
        if (failure instanceof DeserializationException e) {
            LOG.debug("Malformed {} body for route '{}': {}", e.contentType(), exchange.route().name(), e.getCause());
            exchange.respond(ApiResponse.error(statuses.badRequest(), TextNode.valueOf(MALFORMED_BODY)));
            return;
        }
        throw failure;
    }

    private static String mediaType(String contentType) {
        int semicolon = contentType.indexOf(';');
        String type = semicolon < 0 ? contentType : contentType.substring(0, semicolon);
        return type.trim().toLowerCase(Locale.ROOT);
    }
}
