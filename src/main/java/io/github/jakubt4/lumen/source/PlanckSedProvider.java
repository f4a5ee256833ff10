package io.github.jakubt4.lumen.source;

import io.github.jakubt4.lumen.signal.Planck;
import io.github.jakubt4.lumen.signal.Signal;
import io.github.jakubt4.lumen.target.StarParameters;

/**
 * Black body at the effective temperature, diluted by (R/D)^2.
 */
public class PlanckSedProvider implements SedProvider {

    @Override
    public String model() {
        return "Planck";
    }

    @Override
    public Signal sed(final StarParameters star, final double[] wavelength) {
        return Planck.spectrum(wavelength, star.temperature()).times(Math.PI * star.dilution());
    }
}
