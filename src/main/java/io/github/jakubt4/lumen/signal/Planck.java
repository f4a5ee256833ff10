package io.github.jakubt4.lumen.signal;

/**
 * Black-body spectral radiance.
 */
public final class Planck {

    /** 2hc^2 for wavelengths in microns [W µm^4 m^-2 sr^-1]. */
    static final double FIRST_RADIATION_CONSTANT = 2.0 * PhysicalConstants.PLANCK
            * PhysicalConstants.SPEED_OF_LIGHT * PhysicalConstants.SPEED_OF_LIGHT * 1.0e24;

    /** hc/k for wavelengths in microns [µm K]. */
    static final double SECOND_RADIATION_CONSTANT = PhysicalConstants.PLANCK * PhysicalConstants.SPEED_OF_LIGHT
            / PhysicalConstants.BOLTZMANN * 1.0e6;

    private Planck() {
    }

    /**
     * @param wavelength  wavelength [µm]
     * @param temperature temperature [K]
     * @return spectral radiance [W m^-2 µm^-1 sr^-1]; 0 where the exponent overflows
     */
    public static double radiance(final double wavelength, final double temperature) {
        if (temperature <= 0.0) {
            return 0.0;
        }
        final var x = SECOND_RADIATION_CONSTANT / (wavelength * temperature);
        final var denominator = Math.expm1(x);
        if (Double.isInfinite(denominator)) {
            return 0.0;
        }
        return FIRST_RADIATION_CONSTANT / Math.pow(wavelength, 5) / denominator;
    }

    public static Signal spectrum(final double[] wavelength, final double temperature) {
        final var values = new double[wavelength.length];
        for (int i = 0; i < wavelength.length; i++) {
            values[i] = radiance(wavelength[i], temperature);
        }
        return new Signal(wavelength, values);
    }
}
