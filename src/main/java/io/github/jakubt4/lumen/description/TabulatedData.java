package io.github.jakubt4.lumen.description;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Column-oriented numeric table embedded in a payload description, e.g.
 * {@code {"Wavelength": [...], "Transmission": [...]}}.
 */
public final class TabulatedData {

    private final Map<String, double[]> columns;

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public TabulatedData(final Map<String, double[]> columns) {
        final var copy = new LinkedHashMap<String, double[]>();
        var rows = -1;
        for (final var entry : columns.entrySet()) {
            final var values = entry.getValue();
            if (values == null) {
                throw new ConfigurationException("column '" + entry.getKey() + "' has no values");
            }
            if (rows >= 0 && values.length != rows) {
                throw new ConfigurationException("column '" + entry.getKey() + "' has " + values.length
                        + " rows, expected " + rows);
            }
            rows = values.length;
            copy.put(entry.getKey(), values.clone());
        }
        this.columns = Collections.unmodifiableMap(copy);
    }

    public static TabulatedData of(final String name, final double[] values, final String otherName,
                                   final double[] otherValues) {
        final var columns = new LinkedHashMap<String, double[]>();
        columns.put(name, values);
        columns.put(otherName, otherValues);
        return new TabulatedData(columns);
    }

    @JsonValue
    public Map<String, double[]> columns() {
        return columns;
    }

    public boolean has(final String name) {
        return columns.containsKey(name);
    }

    /**
     * @throws ConfigurationException if the column is missing
     */
    public double[] column(final String name) {
        final var values = columns.get(name);
        if (values == null) {
            throw new ConfigurationException("column '" + name + "' not found, available: " + columns.keySet());
        }
        return values.clone();
    }

    /**
     * First of {@code names} present in this table.
     */
    public Optional<String> firstPresent(final String... names) {
        return Arrays.stream(names).filter(columns::containsKey).findFirst();
    }

    public int rows() {
        return columns.values().stream().findFirst().map(values -> values.length).orElse(0);
    }

    @Override
    public String toString() {
        return "TabulatedData" + columns.keySet() + "[" + rows() + " rows]";
    }
}
