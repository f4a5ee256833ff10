package io.github.jakubt4.lumen.foreground;

import io.github.jakubt4.lumen.signal.Signal;

import java.util.Optional;

/**
 * Diffuse light filling the field of view.
 */
public interface Foreground {

    String name();

    /**
     * Radiance [W m^-2 µm^-1 sr^-1].
     */
    Signal radiance();

    /**
     * Transmission of the medium emitting the foreground, if it attenuates the light
     * coming from behind it.
     */
    default Optional<Signal> transmission() {
        return Optional.empty();
    }
}
