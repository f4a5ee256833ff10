package io.github.jakubt4.lumen.foreground;

import io.github.jakubt4.lumen.description.ConfigurationException;
import io.github.jakubt4.lumen.description.TabulatedData;
import io.github.jakubt4.lumen.signal.Signal;
import io.github.jakubt4.lumen.signal.SpectralMath;

import java.util.Optional;

/**
 * Tabulated foreground emitted by a medium in front of the telescope, e.g. the
 * atmosphere, which also attenuates everything behind it.
 *
 * @param name         column prefix of the foreground signal
 * @param radiance     radiance [W m^-2 µm^-1 sr^-1], 0 outside the table
 * @param transmittance transmission of the medium, 1 outside the table
 */
public record SkyForeground(String name, Signal radiance, Signal transmittance) implements Foreground {

    /**
     * Resamples a {@code Wavelength}, {@code Radiance}, {@code Transmission} table onto
     * {@code wavelength}.
     *
     * @throws ConfigurationException if the table is missing or incomplete
     */
    public static SkyForeground of(final String name, final double[] wavelength, final TabulatedData data) {
        if (data == null) {
            throw new ConfigurationException("sky foreground [" + name + "] has no data table");
        }
        final var wl = data.column("Wavelength");
        final var radiance = SpectralMath.interpolate(wl, data.column("Radiance"), wavelength, 0.0);
        final var transmission = SpectralMath.interpolate(wl, data.column("Transmission"), wavelength, 1.0);
        return new SkyForeground(name, new Signal(wavelength, radiance), new Signal(wavelength, transmission));
    }

    @Override
    public Optional<Signal> transmission() {
        return Optional.of(transmittance);
    }
}
