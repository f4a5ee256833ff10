package io.github.jakubt4.lumen.target;

import io.github.jakubt4.lumen.foreground.Foreground;
import io.github.jakubt4.lumen.signal.Signal;
import io.github.jakubt4.lumen.table.ChannelTable;
import lombok.Getter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;

/**
 * Working state of one target while it goes through the pipeline. Owned by a single
 * thread; never shared between targets.
 */
public final class TargetObservation {

    @Getter
    private final Target target;
    @Getter
    private ChannelTable table;
    private final LinkedHashMap<String, Foreground> foregrounds = new LinkedHashMap<>();
    private Signal skyTransmission;
    private Signal sed;

    public TargetObservation(final Target target, final ChannelTable table) {
        this.target = target;
        this.table = table;
    }

    public String name() {
        return target.name();
    }

    /**
     * Merges {@code columns} into the target table; existing columns are replaced.
     */
    public void updateTable(final ChannelTable columns) {
        table = table.merge(columns);
    }

    public void addMetadata(final String key, final Object value) {
        table = table.withMetadata(key, value);
    }

    /**
     * Registers a foreground. A foreground with a transmission also attenuates the target,
     * so its transmission is folded into the accumulated sky transmission.
     */
    public void registerForeground(final Foreground foreground) {
        foregrounds.put(foreground.name(), foreground);
        foreground.transmission().ifPresent(transmission -> skyTransmission = skyTransmission == null
                ? transmission
                : skyTransmission.times(transmission.interpolate(skyTransmission.wavelength(), 1.0)));
    }

    /**
     * Foregrounds in registration order.
     */
    public List<Foreground> foregrounds() {
        return new ArrayList<>(foregrounds.values());
    }

    public Optional<Signal> skyTransmission() {
        return Optional.ofNullable(skyTransmission);
    }

    /**
     * @throws IllegalStateException if the source spectrum has not been loaded yet
     */
    public Signal sed() {
        if (sed == null) {
            throw new IllegalStateException("source spectrum not loaded for target [" + name() + "]");
        }
        return sed;
    }

    public void setSed(final Signal sed) {
        this.sed = sed;
    }
}
