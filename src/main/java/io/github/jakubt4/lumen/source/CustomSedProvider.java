package io.github.jakubt4.lumen.source;

import io.github.jakubt4.lumen.description.ConfigurationException;
import io.github.jakubt4.lumen.description.TabulatedData;
import io.github.jakubt4.lumen.signal.Signal;
import io.github.jakubt4.lumen.signal.SpectralMath;
import io.github.jakubt4.lumen.target.StarParameters;

/**
 * Tabulated stellar surface flux ({@code Wavelength} [µm], {@code Sed} [W m^-2 µm^-1]),
 * diluted by (R/D)^2. Zero outside the table.
 */
public class CustomSedProvider implements SedProvider {

    private final double[] wavelength;
    private final double[] surfaceFlux;

    public CustomSedProvider(final TabulatedData data) {
        if (data == null) {
            throw new ConfigurationException("custom source spectrum has no data table");
        }
        this.wavelength = data.column("Wavelength");
        this.surfaceFlux = data.column("Sed");
    }

    @Override
    public String model() {
        return "custom";
    }

    @Override
    public Signal sed(final StarParameters star, final double[] grid) {
        final var flux = SpectralMath.interpolate(wavelength, surfaceFlux, grid, 0.0);
        return new Signal(grid, flux).times(star.dilution());
    }
}
