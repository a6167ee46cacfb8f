package io.routecontract.core.coerce;

import com.fasterxml.jackson.databind.JsonNode;
import io.routecontract.core.error.SchemaMismatchException;
import java.util.Objects;

/**
 * Outcome of {@link Coercer#coerce}. Exactly one of two states:
 *
 * <ul>
 * <li>{@link Type#COERCED}: the value conforms; {@link #value()} holds it
 * with scalar leaves converted.
 * <li>{@link Type#MISMATCH}: the value was rejected; {@link #mismatch()}
 * holds the schema, the original value and the error tree.
 * </ul>
 */
public final class CoercionResult {

    /** The type of coercion outcome. */
    public enum Type {
        COERCED,
        MISMATCH
    }

    private final Type type;
    private final JsonNode value;
    private final SchemaMismatch mismatch;

    private CoercionResult(Type type, JsonNode value, SchemaMismatch mismatch) {
        this.type = type;
        this.value = value;
        this.mismatch = mismatch;
    }

    /** Creates a COERCED result. */
    public static CoercionResult coerced(JsonNode value) {
        Objects.requireNonNull(value, "value must not be null for COERCED");
        return new CoercionResult(Type.COERCED, value, null);
    }

    /** Creates a MISMATCH result. */
    public static CoercionResult mismatch(SchemaMismatch mismatch) {
        Objects.requireNonNull(mismatch, "mismatch must not be null for MISMATCH");
        return new CoercionResult(Type.MISMATCH, null, mismatch);
    }

    public Type type() {
        return type;
    }

    /** Returns the coerced value. Only valid when {@code type() == COERCED}. */
    public JsonNode value() {
        return value;
    }

    /** Returns the mismatch. Only valid when {@code type() == MISMATCH}. */
    public SchemaMismatch mismatch() {
        return mismatch;
    }

    public boolean isCoerced() {
        return type == Type.COERCED;
    }

    public boolean isMismatch() {
        return type == Type.MISMATCH;
    }

    /**
     * Returns the coerced value, or throws for code that prefers to let an
     * enclosing interceptor answer the exchange.
     *
     * @throws SchemaMismatchException when this result is a mismatch
     */
    public JsonNode orElseThrow() {
        if (isMismatch()) {
            throw new SchemaMismatchException(mismatch);
        }
        return value;
    }

    @Override
    public String toString() {
        return switch (type) {
            case COERCED -> "CoercionResult[COERCED]";
            case MISMATCH -> "CoercionResult[MISMATCH, errors=" + mismatch.errors() + "]";
        };
    }
}
