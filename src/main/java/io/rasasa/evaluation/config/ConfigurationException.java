package io.rasasa.evaluation.config;

/**
 * Invalid or incomplete run configuration. Always raised before any engine process is started.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
