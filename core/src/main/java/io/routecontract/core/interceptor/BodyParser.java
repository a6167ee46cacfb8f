package io.routecontract.core.interceptor;

import io.routecontract.core.model.ApiRequest;
import java.io.IOException;

/** Decodes a request's raw body into one of its structured fields. */
@FunctionalInterface
public interface BodyParser {

    /**
     * @param request a request with a non-empty raw body
     * @return the request with the decoded field set
     * @throws IOException if the body cannot be decoded
     */
    ApiRequest parse(ApiRequest request) throws IOException;
}
