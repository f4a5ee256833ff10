package io.github.jakubt4.lumen.foreground;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.jakubt4.lumen.description.ForegroundDescription;
import io.github.jakubt4.lumen.target.Target;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Builds the foregrounds of a target from their descriptions, on a common wavelength grid.
 *
 * <p>Zodiacal maps are read once and shared between targets.
 */
@Slf4j
public class ForegroundFactory {

    private final double[] wavelength;
    private final ObjectMapper mapper;
    private final Map<String, ZodiacalMap> maps = new ConcurrentHashMap<>();

    public ForegroundFactory(final double[] wavelength, final ObjectMapper mapper) {
        this.wavelength = wavelength.clone();
        this.mapper = mapper;
    }

    public Foreground create(final ForegroundDescription description, final Target target) {
        return switch (description.kind()) {
            case ZODIACAL -> ZodiacalForeground.of(description.name(), wavelength, zodiacFactor(description, target));
            case SKY -> SkyForeground.of(description.name(), wavelength, description.data());
        };
    }

    /**
     * Scale factor fitted from the map when requested and possible, otherwise the
     * configured single factor.
     */
    double zodiacFactor(final ForegroundDescription description, final Target target) {
        if (Boolean.TRUE.equals(description.zodiacalMap()) && target.hasPointing()) {
            try {
                final var factor = map(description.mapResource()).coefficientAt(target.ra(), target.dec());
                log.debug("Zodiacal factor {} fitted for [{}] at ({}, {})", factor, target.name(), target.ra(),
                        target.dec());
                return factor;
            } catch (final RuntimeException e) {
                log.warn("Zodiacal map fit failed for [{}], using the single factor: {}", target.name(),
                        e.getMessage());
            }
        }
        if (description.zodiacFactor() != null) {
            return description.zodiacFactor();
        }
        log.warn("Zodiacal foreground [{}] has no zodiacFactor, radiance set to 0", description.name());
        return 0.0;
    }

    private ZodiacalMap map(final String resource) {
        if (resource == null) {
            throw new IllegalArgumentException("no zodiacal map resource configured");
        }
        return maps.computeIfAbsent(resource, key -> {
            try {
                final var map = ZodiacalMap.load(mapper, key);
                log.info("Zodiacal map loaded from classpath:{} ({} points)", key, map.size());
                return map;
            } catch (final IOException e) {
                throw new UncheckedIOException(e);
            }
        });
    }
}
