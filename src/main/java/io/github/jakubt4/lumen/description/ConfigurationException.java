package io.github.jakubt4.lumen.description;

/**
 * Raised when a payload description is incomplete, ambiguous or asks for something
 * the model does not support. Always fatal for the channel being built.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(final String message) {
        super(message);
    }

    public ConfigurationException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
