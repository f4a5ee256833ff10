package io.github.jakubt4.lumen.description;

import io.github.jakubt4.lumen.foreground.ForegroundKind;
import lombok.Builder;

/**
 * A diffuse foreground registered for every target.
 *
 * @param name         column prefix of the foreground signal
 * @param kind         zodiacal or sky
 * @param zodiacFactor zodiacal scale factor of the single-factor model
 * @param zodiacalMap  fit the factor from a sky map using the target pointing
 * @param mapResource  classpath location of the zodiacal map ({@code ra, dec, coefficient} rows)
 * @param data         sky foreground table ({@code Wavelength}, {@code Radiance}, {@code Transmission})
 */
@Builder
public record ForegroundDescription(String name, ForegroundKind kind, Double zodiacFactor,
                                    Boolean zodiacalMap, String mapResource, TabulatedData data) {

    public ForegroundDescription {
        if (kind == null) {
            throw new ConfigurationException("foreground without a kind");
        }
        if (name == null || name.isBlank()) {
            name = kind.defaultName();
        }
    }
}
