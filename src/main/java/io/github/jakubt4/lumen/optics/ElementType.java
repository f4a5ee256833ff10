package io.github.jakubt4.lumen.optics;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import io.github.jakubt4.lumen.description.ConfigurationException;

import java.util.Arrays;

/**
 * Kind of optical component. The type fixes where the element sits relative to the
 * detector and therefore which solid angle its emission is collected from.
 */
public enum ElementType {
    SURFACE("surface"),
    FILTER("filter"),
    DICHROIC("dichroic"),
    SLIT("slit"),
    OPTICS_BOX("optics box"),
    DETECTOR_BOX("detector box");

    private final String label;

    ElementType(final String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    @JsonCreator
    public static ElementType fromLabel(final String label) {
        return Arrays.stream(values())
                .filter(type -> type.label.equalsIgnoreCase(label) || type.name().equalsIgnoreCase(label))
                .findFirst()
                .orElseThrow(() -> new ConfigurationException("unknown optical element type '" + label + "'"));
    }

    public ElementPosition position() {
        return switch (this) {
            case DETECTOR_BOX -> ElementPosition.DETECTOR;
            case OPTICS_BOX -> ElementPosition.OPTICS_BOX;
            case SURFACE, FILTER, DICHROIC, SLIT -> ElementPosition.PATH;
        };
    }
}
