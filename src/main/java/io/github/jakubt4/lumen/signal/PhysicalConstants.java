package io.github.jakubt4.lumen.signal;

import org.orekit.utils.Constants;

/**
 * Physical constants used by the radiometric model, in SI units.
 *
 * <p>Astronomical values are taken from Orekit's {@link Constants} so that they match the
 * conventions used elsewhere in the flight-dynamics stack.
 */
public final class PhysicalConstants {

    /** Planck constant [J s] (2019 SI exact value). */
    public static final double PLANCK = 6.62607015e-34;

    /** Boltzmann constant [J/K] (2019 SI exact value). */
    public static final double BOLTZMANN = 1.380649e-23;

    /** Speed of light in vacuum [m/s]. */
    public static final double SPEED_OF_LIGHT = Constants.SPEED_OF_LIGHT;

    /** Parsec [m], derived from the IAU 2012 astronomical unit. */
    public static final double PARSEC = Constants.IAU_2012_ASTRONOMICAL_UNIT * 648_000.0 / Math.PI;

    /** Nominal solar radius [m]. */
    public static final double SOLAR_RADIUS = Constants.SUN_RADIUS;

    /** Solar gravitational parameter [m^3/s^2]. */
    public static final double SOLAR_GM = Constants.JPL_SSD_SUN_GM;

    /** IAU 2015 nominal solar luminosity [W]. */
    public static final double SOLAR_LUMINOSITY = 3.828e26;

    /** Stefan-Boltzmann constant [W m^-2 K^-4]. */
    public static final double STEFAN_BOLTZMANN = 5.670374419e-8;

    /** One micron [m]. */
    public static final double MICRON = 1.0e-6;

    private PhysicalConstants() {
    }

    /**
     * Photon count per joule at the given wavelength, λ/(hc).
     *
     * @param wavelength wavelength [µm]
     * @return photons per joule [1/J]
     */
    public static double photonsPerJoule(final double wavelength) {
        return wavelength * MICRON / (PLANCK * SPEED_OF_LIGHT);
    }
}
