package io.github.jakubt4.lumen.optics;

import io.github.jakubt4.lumen.description.ConfigurationException;
import io.github.jakubt4.lumen.description.OpticalElementDescription;
import io.github.jakubt4.lumen.description.TabulatedData;
import io.github.jakubt4.lumen.signal.Planck;
import io.github.jakubt4.lumen.signal.Signal;
import io.github.jakubt4.lumen.signal.SpectralMath;
import lombok.extern.slf4j.Slf4j;

import java.util.Arrays;
import java.util.Locale;
import java.util.OptionalDouble;

/**
 * One optical component sampled on a wavelength grid.
 *
 * <p>Transmission and emissivity are always defined over the whole grid. An element without
 * a temperature still attenuates the light passing through it but emits nothing.
 *
 * @param name         element name
 * @param type         element type
 * @param transmission transmission curve
 * @param emissivity   emissivity curve
 * @param temperature  temperature [K], {@code null} when not emitting
 * @param solidAngle   explicit acceptance solid angle [sr], {@code null} for the position default
 * @param slitWidth    slit width [µm], slit elements only
 */
@Slf4j
public record OpticalElement(String name, ElementType type, Signal transmission, Signal emissivity,
                             Double temperature, Double solidAngle, Double slitWidth) {

    private static final String[] WAVELENGTH_COLUMNS = {"Wavelength", "wavelength"};
    private static final String[] EMISSIVITY_COLUMNS = {"Emissivity", "emissivity"};

    /**
     * Builds an element from its description on the given grid.
     *
     * @throws ConfigurationException on ambiguous or incomplete transmission or emissivity data
     */
    public static OpticalElement create(final OpticalElementDescription description, final double[] wavelength) {
        final var transmission = transmission(description, wavelength);
        final var emissivity = emissivity(description, wavelength);
        log.debug("Optical element [{}] of type [{}] created, T={}", description.name(), description.type().label(),
                description.temperature());
        return new OpticalElement(description.name(), description.type(), transmission, emissivity,
                description.temperature(), description.solidAngle(), description.width());
    }

    /**
     * Same element sampled on {@code grid}; returned unchanged when already sampled on it.
     */
    static OpticalElement resample(final OpticalElement element, final double[] grid) {
        if (Arrays.equals(element.transmission.wavelength(), grid)) {
            return element;
        }
        return new OpticalElement(element.name, element.type,
                new Signal(grid, element.transmission.interpolate(grid, 0.0)),
                new Signal(grid, element.emissivity.interpolate(grid, 0.0)),
                element.temperature, element.solidAngle, element.slitWidth);
    }

    public ElementPosition position() {
        return type.position();
    }

    public boolean isSlit() {
        return type == ElementType.SLIT;
    }

    public OptionalDouble temperatureK() {
        return temperature == null ? OptionalDouble.empty() : OptionalDouble.of(temperature);
    }

    /**
     * Acceptance solid angle [sr]: the explicit override if present, otherwise the default
     * of the element position.
     */
    public double acceptance(final double omegaPix) {
        return solidAngle != null ? solidAngle : position().acceptance(omegaPix);
    }

    /**
     * Emitted radiance, emissivity times the Planck function at the element temperature.
     * Zero when the element has no temperature.
     */
    public Signal selfEmission() {
        if (temperature == null) {
            return Signal.constant(transmission.wavelength(), 0.0);
        }
        return Planck.spectrum(emissivity.wavelength(), temperature).times(emissivity);
    }

    private static Signal transmission(final OpticalElementDescription description, final double[] wavelength) {
        if (description.data() != null) {
            final var data = description.data();
            final var column = description.use() != null
                    ? description.use()
                    : data.firstPresent("Transmission", "Reflectivity")
                    .orElseThrow(() -> new ConfigurationException(
                            "no Transmission or Reflectivity column for element '" + description.name() + "'"));
            final var wl = wavelengthColumn(description, data);
            return new Signal(wavelength, SpectralMath.interpolate(wl, data.column(column), wavelength, 0.0));
        }

        final var transmission = description.transmission();
        final var reflectivity = description.reflectivity();
        if (transmission != null && reflectivity != null) {
            if (description.use() == null) {
                throw new ConfigurationException("element '" + description.name()
                        + "' defines both transmission and reflectivity: 'use' is required");
            }
            final var value = switch (description.use().toLowerCase(Locale.ROOT)) {
                case "transmission" -> transmission;
                case "reflectivity" -> reflectivity;
                default -> throw new ConfigurationException("element '" + description.name()
                        + "' has an invalid 'use' value: " + description.use());
            };
            return Signal.constant(wavelength, value);
        }
        if (transmission != null || reflectivity != null) {
            final var value = transmission != null ? transmission : reflectivity;
            final var min = description.wlMin() != null ? description.wlMin() : Double.NEGATIVE_INFINITY;
            final var max = description.wlMax() != null ? description.wlMax() : Double.POSITIVE_INFINITY;
            return Signal.constant(wavelength, value).zeroOutside(min, max);
        }
        return Signal.constant(wavelength, 1.0);
    }

    private static Signal emissivity(final OpticalElementDescription description, final double[] wavelength) {
        if (description.data() != null) {
            final var data = description.data();
            final var column = data.firstPresent(EMISSIVITY_COLUMNS)
                    .orElseThrow(() -> new ConfigurationException(
                            "no Emissivity column for element '" + description.name() + "'"));
            final var wl = wavelengthColumn(description, data);
            return new Signal(wavelength, SpectralMath.interpolate(wl, data.column(column), wavelength, 0.0));
        }
        if (description.emissivity() != null) {
            return Signal.constant(wavelength, description.emissivity());
        }
        return Signal.constant(wavelength, description.type() == ElementType.DETECTOR_BOX ? 1.0 : 0.0);
    }

    private static double[] wavelengthColumn(final OpticalElementDescription description, final TabulatedData data) {
        if (description.wlColumn() != null) {
            return data.column(description.wlColumn());
        }
        return data.column(data.firstPresent(WAVELENGTH_COLUMNS)
                .orElseThrow(() -> new ConfigurationException(
                        "no wavelength column for element '" + description.name() + "'")));
    }
}
