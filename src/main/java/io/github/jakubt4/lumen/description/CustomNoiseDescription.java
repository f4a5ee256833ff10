package io.github.jakubt4.lumen.description;

/**
 * Extra relative noise term added in quadrature to the total noise.
 *
 * @param name  column prefix of the term
 * @param value constant value [ppm]
 * @param data  tabulated relative noise against wavelength ({@code Wavelength}, {@code Noise})
 */
public record CustomNoiseDescription(String name, Double value, TabulatedData data) {
}
