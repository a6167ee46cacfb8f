package io.routecontract.core.error;

/**
 * Abstract base for all route-contract exceptions. Never thrown directly. Use
 * {@link ContractDefinitionException} for problems found while building a
 * route tree, or one of the exchange-time subclasses.
 */
public abstract class ContractException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        DEFINITION,
        EXCHANGE
    }

    private final Phase phase;

    protected ContractException(String message, Phase phase) {
        super(message);
        this.phase = phase;
    }

    protected ContractException(String message, Throwable cause, Phase phase) {
        super(message, cause);
        this.phase = phase;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }
}
