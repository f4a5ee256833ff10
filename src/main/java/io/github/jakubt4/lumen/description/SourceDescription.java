package io.github.jakubt4.lumen.description;

/**
 * Stellar spectrum model: {@code planck} or {@code custom} with a
 * {@code Wavelength}/{@code Sed} surface-flux table [W m^-2 µm^-1].
 */
public record SourceDescription(String kind, TabulatedData data) {

    public static SourceDescription planck() {
        return new SourceDescription("planck", null);
    }
}
