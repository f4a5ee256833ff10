package io.github.jakubt4.lumen.output;

import com.fasterxml.jackson.annotation.JsonValue;
import io.github.jakubt4.lumen.table.ChannelTable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@link OutputGroup} keeping everything in nested maps, serializable as JSON.
 */
public class InMemoryOutputGroup implements OutputGroup {

    private final Map<String, Object> entries = new LinkedHashMap<>();

    @Override
    public synchronized OutputGroup createGroup(final String name) {
        final var existing = entries.get(name);
        if (existing instanceof InMemoryOutputGroup group) {
            return group;
        }
        final var group = new InMemoryOutputGroup();
        entries.put(name, group);
        return group;
    }

    @Override
    public synchronized void writeTable(final String name, final ChannelTable table) {
        entries.put(name, table);
    }

    @Override
    public synchronized void writeArray(final String name, final double[] values) {
        entries.put(name, values.clone());
    }

    @Override
    public synchronized void writeArray(final String name, final double[][] values) {
        final var copy = new double[values.length][];
        for (int i = 0; i < values.length; i++) {
            copy[i] = values[i].clone();
        }
        entries.put(name, copy);
    }

    @Override
    public synchronized void writeScalar(final String name, final double value) {
        entries.put(name, value);
    }

    public synchronized Object get(final String name) {
        return entries.get(name);
    }

    @JsonValue
    public synchronized Map<String, Object> entries() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }
}
