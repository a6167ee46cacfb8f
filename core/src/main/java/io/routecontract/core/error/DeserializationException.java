package io.routecontract.core.error;

/**
 * Raised by body parsing when the raw request bytes cannot be decoded for the
 * declared content type. No structured value exists yet, so the error carries
 * only the content type and the decoder's cause.
 */
public final class DeserializationException extends ContractException {

    private static final long serialVersionUID = 1L;

    private final String contentType;

    public DeserializationException(String message, Throwable cause, String contentType) {
        super(message, cause, Phase.EXCHANGE);
        this.contentType = contentType;
    }

    /** The content type whose decoder failed. */
    public String contentType() {
        return contentType;
    }
}
