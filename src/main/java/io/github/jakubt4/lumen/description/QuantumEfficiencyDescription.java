package io.github.jakubt4.lumen.description;

/**
 * Detector quantum efficiency, either constant or tabulated against wavelength.
 */
public record QuantumEfficiencyDescription(Double value, TabulatedData data) {

    public static QuantumEfficiencyDescription constant(final double value) {
        return new QuantumEfficiencyDescription(value, null);
    }
}
