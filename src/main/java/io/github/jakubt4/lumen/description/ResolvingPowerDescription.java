package io.github.jakubt4.lumen.description;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Spectral binning requested for a spectrometer channel: {@code "native"}, a number for a
 * constant resolving power, or a table {@code {"data": {"Wavelength": [...], "R": [...]}}}.
 */
public record ResolvingPowerDescription(Mode mode, Double value, TabulatedData data) {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public enum Mode {
        NATIVE,
        FIXED,
        TABULATED
    }

    public static ResolvingPowerDescription nativeSampling() {
        return new ResolvingPowerDescription(Mode.NATIVE, null, null);
    }

    public static ResolvingPowerDescription fixed(final double resolvingPower) {
        if (!(resolvingPower > 0.0)) {
            throw new ConfigurationException("resolving power must be positive, got " + resolvingPower);
        }
        return new ResolvingPowerDescription(Mode.FIXED, resolvingPower, null);
    }

    public static ResolvingPowerDescription tabulated(final TabulatedData data) {
        return new ResolvingPowerDescription(Mode.TABULATED, null, data);
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static ResolvingPowerDescription fromJson(final JsonNode node) {
        if (node == null || node.isNull()) {
            return nativeSampling();
        }
        if (node.isNumber()) {
            return fixed(node.doubleValue());
        }
        if (node.isTextual()) {
            final var text = node.asText().trim();
            if ("native".equalsIgnoreCase(text)) {
                return nativeSampling();
            }
            try {
                return fixed(Double.parseDouble(text));
            } catch (final NumberFormatException e) {
                throw new ConfigurationException("unsupported targetR value '" + text + "'", e);
            }
        }
        if (node.isObject() && node.has("data")) {
            return tabulated(MAPPER.convertValue(node.get("data"), TabulatedData.class));
        }
        throw new ConfigurationException("unsupported targetR format: " + node);
    }
}
