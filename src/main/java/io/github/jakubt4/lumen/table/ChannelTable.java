package io.github.jakubt4.lumen.table;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;

/**
 * Immutable column table with one row per output wavelength bin.
 *
 * <p>Every row carries the name of the channel it belongs to ({@value #CHANNEL_COLUMN});
 * the other columns are numeric. Operations return new tables.
 */
public final class ChannelTable {

    public static final String CHANNEL_COLUMN = "chName";

    private final String[] channelNames;
    private final LinkedHashMap<String, double[]> columns;
    private final LinkedHashMap<String, Object> metadata;

    private ChannelTable(final String[] channelNames, final LinkedHashMap<String, double[]> columns,
                         final LinkedHashMap<String, Object> metadata) {
        this.channelNames = channelNames;
        this.columns = columns;
        this.metadata = metadata;
    }

    /**
     * Empty table of {@code rows} rows, all belonging to {@code channel}.
     */
    public static ChannelTable forChannel(final String channel, final int rows) {
        final var names = new String[rows];
        Arrays.fill(names, channel);
        return new ChannelTable(names, new LinkedHashMap<>(), new LinkedHashMap<>());
    }

    /**
     * Stacks tables vertically. Columns missing from a table are filled with NaN; metadata
     * of later tables overrides earlier keys.
     */
    public static ChannelTable stack(final List<ChannelTable> tables) {
        final var names = new ArrayList<String>();
        final var columnNames = new LinkedHashSet<String>();
        final var metadata = new LinkedHashMap<String, Object>();
        for (final var table : tables) {
            names.addAll(Arrays.asList(table.channelNames));
            columnNames.addAll(table.columns.keySet());
            metadata.putAll(table.metadata);
        }
        final var columns = new LinkedHashMap<String, double[]>();
        for (final var column : columnNames) {
            final var values = new double[names.size()];
            var offset = 0;
            for (final var table : tables) {
                final var source = table.columns.get(column);
                if (source == null) {
                    Arrays.fill(values, offset, offset + table.rows(), Double.NaN);
                } else {
                    System.arraycopy(source, 0, values, offset, source.length);
                }
                offset += table.rows();
            }
            columns.put(column, values);
        }
        return new ChannelTable(names.toArray(String[]::new), columns, metadata);
    }

    public int rows() {
        return channelNames.length;
    }

    public String[] channelNames() {
        return channelNames.clone();
    }

    public List<String> columnNames() {
        return List.copyOf(columns.keySet());
    }

    public boolean has(final String column) {
        return columns.containsKey(column);
    }

    /**
     * @throws IllegalArgumentException if the column does not exist
     */
    public double[] column(final String column) {
        final var values = columns.get(column);
        if (values == null) {
            throw new IllegalArgumentException("column '" + column + "' not found, available: " + columns.keySet());
        }
        return values.clone();
    }

    public double value(final String column, final int row) {
        return column(column)[row];
    }

    /**
     * Copy with {@code column} added, or replaced in place when it already exists.
     */
    public ChannelTable with(final String column, final double[] values) {
        if (values.length != rows()) {
            throw new IllegalArgumentException("column '" + column + "' has " + values.length
                    + " rows, table has " + rows());
        }
        final var copy = new LinkedHashMap<>(columns);
        copy.put(column, values.clone());
        return new ChannelTable(channelNames, copy, metadata);
    }

    /**
     * Copy with the columns of {@code other} added; on repeated names {@code other} wins.
     */
    public ChannelTable merge(final ChannelTable other) {
        if (other.rows() != rows()) {
            throw new IllegalArgumentException("cannot merge tables of " + rows() + " and " + other.rows() + " rows");
        }
        final var copy = new LinkedHashMap<>(columns);
        other.columns.forEach((name, values) -> copy.put(name, values.clone()));
        final var meta = new LinkedHashMap<>(metadata);
        meta.putAll(other.metadata);
        return new ChannelTable(channelNames, copy, meta);
    }

    /**
     * Rows of one channel.
     */
    public ChannelTable select(final String channel) {
        final var rows = IntStream.range(0, rows()).filter(i -> channelNames[i].equals(channel)).toArray();
        final var copy = new LinkedHashMap<String, double[]>();
        columns.forEach((name, values) -> copy.put(name, Arrays.stream(rows).mapToDouble(i -> values[i]).toArray()));
        final var names = Arrays.stream(rows).mapToObj(i -> channelNames[i]).toArray(String[]::new);
        return new ChannelTable(names, copy, new LinkedHashMap<>(metadata));
    }

    public ChannelTable withMetadata(final String key, final Object value) {
        final var meta = new LinkedHashMap<>(metadata);
        meta.put(key, value);
        return new ChannelTable(channelNames, columns, meta);
    }

    public Map<String, Object> metadata() {
        return Collections.unmodifiableMap(metadata);
    }

    @JsonValue
    public Map<String, Object> toMap() {
        final var out = new LinkedHashMap<String, Object>();
        out.put(CHANNEL_COLUMN, channelNames.clone());
        columns.forEach((name, values) -> out.put(name, values.clone()));
        if (!metadata.isEmpty()) {
            out.put("metadata", metadata());
        }
        return out;
    }

    @Override
    public String toString() {
        return "ChannelTable[" + rows() + " rows, columns=" + columns.keySet() + "]";
    }
}
