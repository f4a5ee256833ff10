package io.github.jakubt4.lumen.foreground;

import io.github.jakubt4.lumen.signal.Planck;
import io.github.jakubt4.lumen.signal.Signal;

/**
 * Zodiacal light: scattered sunlight plus thermal emission of the interplanetary dust,
 * modelled as two black bodies scaled by a single factor.
 *
 * @param name     column prefix of the foreground signal
 * @param factor   zodiacal scale factor, 1 at the ecliptic poles
 * @param radiance radiance [W m^-2 µm^-1 sr^-1]
 */
public record ZodiacalForeground(String name, double factor, Signal radiance) implements Foreground {

    static final double SCATTERED_WEIGHT = 3.5e-14;
    static final double SCATTERED_TEMPERATURE = 5500.0;
    static final double THERMAL_WEIGHT = 3.58e-8;
    static final double THERMAL_TEMPERATURE = 270.0;

    /**
     * Zodiacal radiance scaled by {@code factor} over {@code wavelength}.
     */
    public static ZodiacalForeground of(final String name, final double[] wavelength, final double factor) {
        final var data = new double[wavelength.length];
        for (int i = 0; i < wavelength.length; i++) {
            data[i] = factor * (SCATTERED_WEIGHT * Planck.radiance(wavelength[i], SCATTERED_TEMPERATURE)
                    + THERMAL_WEIGHT * Planck.radiance(wavelength[i], THERMAL_TEMPERATURE));
        }
        return new ZodiacalForeground(name, factor, new Signal(wavelength, data));
    }
}
