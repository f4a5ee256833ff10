package io.github.jakubt4.lumen.service;

import io.github.jakubt4.lumen.description.PayloadDescription;
import io.github.jakubt4.lumen.instrument.Instrument;
import io.github.jakubt4.lumen.noise.NoiseModel;
import io.github.jakubt4.lumen.table.ChannelTable;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Built channels of the payload, in payload order, with their noise models. Created once
 * before any target is observed and read-only afterwards.
 */
@Slf4j
public final class ChannelRegistry {

    private final PayloadDescription payload;
    private final Map<String, Instrument> channels;
    private final Map<String, NoiseModel> noiseModels;

    private ChannelRegistry(final PayloadDescription payload, final Map<String, Instrument> channels,
                            final Map<String, NoiseModel> noiseModels) {
        this.payload = payload;
        this.channels = Collections.unmodifiableMap(channels);
        this.noiseModels = Collections.unmodifiableMap(noiseModels);
    }

    /**
     * Builds every channel of {@code payload}.
     *
     * @throws io.github.jakubt4.lumen.description.ConfigurationException if a channel cannot be built
     */
    public static ChannelRegistry build(final PayloadDescription payload) {
        final var channels = new LinkedHashMap<String, Instrument>();
        final var noiseModels = new LinkedHashMap<String, NoiseModel>();
        for (final var description : payload.channels()) {
            final var instrument = description.kind().create(description, payload);
            instrument.build();
            channels.put(description.name(), instrument);
            noiseModels.put(description.name(), new NoiseModel(description, payload.common().customNoise()));
        }
        log.info("Payload ready: {} channels {}", channels.size(), channels.keySet());
        return new ChannelRegistry(payload, channels, noiseModels);
    }

    public PayloadDescription payload() {
        return payload;
    }

    public List<Instrument> channels() {
        return new ArrayList<>(channels.values());
    }

    public Optional<Instrument> channel(final String name) {
        return Optional.ofNullable(channels.get(name));
    }

    public List<NoiseModel> noiseModels() {
        return new ArrayList<>(noiseModels.values());
    }

    /**
     * Tables of every channel stacked in payload order.
     */
    public ChannelTable stackedTable() {
        return ChannelTable.stack(channels.values().stream().map(Instrument::table).toList());
    }
}
