package io.routecontract.core.contract;

/**
 * An HTTP status code or the {@code default} marker. Ordered numerically with
 * {@code default} last, so documents list responses in a stable order.
 */
public final class ResponseCode implements Comparable<ResponseCode> {

    private static final int DEFAULT_MARKER = Integer.MAX_VALUE;

    /** Matches any status that has no exact entry. */
    public static final ResponseCode DEFAULT = new ResponseCode(DEFAULT_MARKER);

    private final int status;

    private ResponseCode(int status) {
        this.status = status;
    }

    /**
     * @throws IllegalArgumentException if {@code status} is outside 100..599
     */
    public static ResponseCode of(int status) {
        if (!isValid(status)) {
            throw new IllegalArgumentException("Invalid HTTP status: " + status);
        }
        return new ResponseCode(status);
    }

    /** True when {@code status} is a declarable HTTP status (100..599). */
    public static boolean isValid(int status) {
        return status >= 100 && status <= 599;
    }

    public boolean isDefault() {
        return status == DEFAULT_MARKER;
    }

    /**
     * @throws IllegalStateException for {@link #DEFAULT}
     */
    public int status() {
        if (isDefault()) {
            throw new IllegalStateException("default response has no status");
        }
        return status;
    }

    /** The key used in documents: the status digits or {@code default}. */
    public String key() {
        return isDefault() ? "default" : Integer.toString(status);
    }

    @Override
    public int compareTo(ResponseCode other) {
        return Integer.compare(status, other.status);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ResponseCode other && other.status == status;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(status);
    }

    @Override
    public String toString() {
        return key();
    }
}
