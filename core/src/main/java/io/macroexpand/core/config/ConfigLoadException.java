package io.macroexpand.core.config;

/**
 * Thrown when engine configuration cannot be loaded: missing file, invalid YAML or an invalid
 * value. The message is suitable for startup error output.
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
