package io.github.jakubt4.lumen.instrument;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import io.github.jakubt4.lumen.description.ChannelDescription;
import io.github.jakubt4.lumen.description.ConfigurationException;
import io.github.jakubt4.lumen.description.PayloadDescription;
import io.github.jakubt4.lumen.table.ChannelTable;

import java.util.Locale;

/**
 * Closed set of channel kinds.
 */
public enum ChannelKind {
    PHOTOMETER,
    SPECTROMETER;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ChannelKind fromLabel(final String label) {
        for (final var kind : values()) {
            if (kind.name().equalsIgnoreCase(label)) {
                return kind;
            }
        }
        throw new ConfigurationException("unknown channel kind '" + label + "'");
    }

    /**
     * New, unbuilt channel of this kind.
     */
    public Instrument create(final ChannelDescription description, final PayloadDescription payload) {
        return switch (this) {
            case PHOTOMETER -> new Photometer(description, payload);
            case SPECTROMETER -> new Spectrometer(description, payload);
        };
    }

    /**
     * Channel of this kind restored from a persisted table and artifacts.
     */
    public Instrument restore(final ChannelDescription description, final PayloadDescription payload,
                              final ChannelTable table, final BuiltInstrument built) {
        return switch (this) {
            case PHOTOMETER -> new Photometer(description, payload, table, built);
            case SPECTROMETER -> new Spectrometer(description, payload, table, built);
        };
    }
}
