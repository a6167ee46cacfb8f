package io.routecontract.core.error;

import io.routecontract.core.coerce.SchemaMismatch;
import java.util.Objects;

/**
 * Raised when a value structurally disagrees with a schema and the caller
 * asked for an exception instead of a {@link io.routecontract.core.coerce.CoercionResult}.
 *
 * <p>
 * The coercion and validation interceptors recover from this exception and
 * turn it into a structured error response; it never reaches the transport.
 */
public final class SchemaMismatchException extends ContractException {

    private static final long serialVersionUID = 1L;

    private final transient SchemaMismatch mismatch;

    public SchemaMismatchException(SchemaMismatch mismatch) {
        super("Value does not match schema: " + Objects.requireNonNull(mismatch, "mismatch").errors(), Phase.EXCHANGE);
        this.mismatch = mismatch;
    }

    /** The rejected value, its schema and the structured error tree. */
    public SchemaMismatch mismatch() {
        return mismatch;
    }
}
