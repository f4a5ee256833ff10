package io.github.jakubt4.lumen.description;

import lombok.Builder;

import java.util.List;

/**
 * Optical elements of a path, in light-path order (source side first).
 *
 * @param telescopeArea      collecting area [m^2], payload level only
 * @param forceChannelWlEdge zero the transmission outside each channel band, payload level only
 * @param elements           the elements
 */
@Builder
public record OpticsDescription(Double telescopeArea, Boolean forceChannelWlEdge,
                                List<OpticalElementDescription> elements) {

    public OpticsDescription {
        elements = elements == null ? List.of() : List.copyOf(elements);
    }

    public static OpticsDescription empty() {
        return new OpticsDescription(null, null, List.of());
    }

    public boolean forcesChannelEdges() {
        return Boolean.TRUE.equals(forceChannelWlEdge);
    }
}
