package io.routecontract.javalin.config;

/**
 * Thrown when configuration loading fails: missing file, invalid YAML or an
 * unusable value. The message is suitable for startup error output.
 */
public class ConfigLoadException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ConfigLoadException(String message) {
        super(message);
    }

    public ConfigLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
