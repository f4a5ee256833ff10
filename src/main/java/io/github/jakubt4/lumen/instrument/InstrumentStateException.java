package io.github.jakubt4.lumen.instrument;

/**
 * Operation not allowed in the current lifecycle state of a channel.
 */
public class InstrumentStateException extends IllegalStateException {

    public InstrumentStateException(final String message) {
        super(message);
    }
}
