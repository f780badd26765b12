package me.golemcore.context.domain.exception;

/**
 * Invalid configuration value. Raised when a configuration record is built,
 * never clamped silently.
 */
public class ConfigurationException extends ContextEngineException {

    private static final long serialVersionUID = 1L;

    public ConfigurationException(String message) {
        super(message);
    }
}
