package io.github.jakubt4.lumen.foreground;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import io.github.jakubt4.lumen.description.ConfigurationException;

import java.util.Locale;

public enum ForegroundKind {
    ZODIACAL("zodi"),
    SKY("sky");

    private final String defaultName;

    ForegroundKind(final String defaultName) {
        this.defaultName = defaultName;
    }

    public String defaultName() {
        return defaultName;
    }

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ForegroundKind fromLabel(final String label) {
        for (final var kind : values()) {
            if (kind.name().equalsIgnoreCase(label)) {
                return kind;
            }
        }
        throw new ConfigurationException("unknown foreground kind '" + label + "'");
    }
}
