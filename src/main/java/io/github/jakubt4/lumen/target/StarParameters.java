package io.github.jakubt4.lumen.target;

import io.github.jakubt4.lumen.signal.PhysicalConstants;
import lombok.Builder;

/**
 * Host star of a target.
 *
 * @param temperature effective temperature [K]
 * @param radius      radius [R_sun]
 * @param mass        mass [M_sun]
 * @param distance    distance [pc]
 * @param magK        K-band magnitude, informative only
 */
@Builder
public record StarParameters(Double temperature, Double radius, Double mass, Double distance, Double magK) {

    public StarParameters {
        if (temperature == null || radius == null || mass == null || distance == null) {
            throw new IllegalArgumentException("star temperature, radius, mass and distance are required");
        }
        if (temperature <= 0.0 || radius <= 0.0 || mass <= 0.0 || distance <= 0.0) {
            throw new IllegalArgumentException("star parameters must be positive");
        }
    }

    /**
     * Dilution factor (R/D)^2 between the stellar surface flux and the flux at the telescope.
     */
    public double dilution() {
        final var ratio = radius * PhysicalConstants.SOLAR_RADIUS / (distance * PhysicalConstants.PARSEC);
        return ratio * ratio;
    }

    /**
     * Bolometric luminosity [L_sun] from the Stefan-Boltzmann law.
     */
    public double luminosity() {
        final var r = radius * PhysicalConstants.SOLAR_RADIUS;
        final var watts = 4.0 * Math.PI * r * r * PhysicalConstants.STEFAN_BOLTZMANN * Math.pow(temperature, 4);
        return watts / PhysicalConstants.SOLAR_LUMINOSITY;
    }

    /**
     * Surface gravity, log10 of g in cm/s^2.
     */
    public double logg() {
        final var r = radius * PhysicalConstants.SOLAR_RADIUS;
        return Math.log10(mass * PhysicalConstants.SOLAR_GM / (r * r) * 100.0);
    }
}
