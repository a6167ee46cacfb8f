package io.routecontract.core.error;

/**
 * Thrown while a route tree or contract is being assembled: an unknown
 * parameter location, a duplicate route, an unusable path template. These are
 * programmer errors and surface at startup, before any exchange runs.
 */
public final class ContractDefinitionException extends ContractException {

    private static final long serialVersionUID = 1L;

    public ContractDefinitionException(String message) {
        super(message, Phase.DEFINITION);
    }

    public ContractDefinitionException(String message, Throwable cause) {
        super(message, cause, Phase.DEFINITION);
    }
}
