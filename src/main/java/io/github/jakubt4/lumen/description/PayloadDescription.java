package io.github.jakubt4.lumen.description;

import lombok.Builder;

import java.util.HashSet;
import java.util.List;

/**
 * Root of the payload description.
 *
 * @param common   settings shared by every channel
 * @param optics   telescope optics common to every channel, plus the collecting area
 * @param channels instrument channels in output order
 */
@Builder
public record PayloadDescription(CommonDescription common, OpticsDescription optics,
                                 List<ChannelDescription> channels) {

    public PayloadDescription {
        if (common == null) {
            throw new ConfigurationException("payload has no common section");
        }
        optics = optics == null ? OpticsDescription.empty() : optics;
        channels = channels == null ? List.of() : List.copyOf(channels);
        final var names = new HashSet<String>();
        for (final var channel : channels) {
            if (!names.add(channel.name())) {
                throw new ConfigurationException("duplicate channel name '" + channel.name() + "'");
            }
        }
    }

    /**
     * Telescope collecting area [m^2].
     */
    public double telescopeArea() {
        if (optics.telescopeArea() == null) {
            throw new ConfigurationException("payload optics has no telescopeArea");
        }
        return optics.telescopeArea();
    }
}
