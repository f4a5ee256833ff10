package io.github.jakubt4.lumen.source;

import io.github.jakubt4.lumen.signal.Signal;
import io.github.jakubt4.lumen.target.StarParameters;

/**
 * Stellar spectral energy distribution seen at the telescope.
 */
public interface SedProvider {

    /**
     * Model name written to the target metadata.
     */
    String model();

    /**
     * SED [W m^-2 µm^-1] of {@code star} at the telescope, sampled on {@code wavelength} [µm].
     */
    Signal sed(StarParameters star, double[] wavelength);
}
