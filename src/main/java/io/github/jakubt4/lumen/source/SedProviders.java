package io.github.jakubt4.lumen.source;

import io.github.jakubt4.lumen.description.SourceDescription;
import lombok.extern.slf4j.Slf4j;

import java.util.Locale;

@Slf4j
public final class SedProviders {

    private SedProviders() {
    }

    /**
     * Provider for a source description; unknown kinds fall back to a black body.
     */
    public static SedProvider forDescription(final SourceDescription description) {
        final var kind = description == null || description.kind() == null
                ? "planck"
                : description.kind().toLowerCase(Locale.ROOT);
        return switch (kind) {
            case "planck" -> new PlanckSedProvider();
            case "custom" -> new CustomSedProvider(description.data());
            default -> {
                log.warn("Source spectrum '{}' is not supported, using a Planck spectrum", kind);
                yield new PlanckSedProvider();
            }
        };
    }
}
