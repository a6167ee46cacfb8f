package io.routecontract.core.interceptor;

/**
 * Status codes the built-in interceptors respond with. The same codes appear
 * in the interceptors' own contract annotations, so they are documented on
 * every route that uses them.
 *
 * @param badRequest    undecodable request body (default 400)
 * @param unprocessable request does not match its contract (default 422)
 * @param internalError response does not match its contract (default 500)
 */
public record ContractStatuses(int badRequest, int unprocessable, int internalError) {

    public static final ContractStatuses DEFAULT = new ContractStatuses(400, 422, 500);

    public ContractStatuses {
        requireStatus("badRequest", badRequest);
        requireStatus("unprocessable", unprocessable);
        requireStatus("internalError", internalError);
    }

    private static void requireStatus(String name, int status) {
        if (status < 100 || status > 599) {
            throw new IllegalArgumentException(name + " must be an HTTP status code, got " + status);
        }
    }
}
