package io.github.jakubt4.lumen.noise;

import io.github.jakubt4.lumen.table.ChannelTable;

/**
 * Total signal in the brightest pixel of each bin, summed over every contribution.
 */
public final class MaxSignalEstimator {

    public static final String MAX_SIGNAL_COLUMN = "MaxSignal_inPixel";

    private static final String CONTRIBUTION_SUFFIX = "_" + MAX_SIGNAL_COLUMN;

    private MaxSignalEstimator() {
    }

    /**
     * Adds (or replaces) the {@value #MAX_SIGNAL_COLUMN} column, the sum of every
     * {@code *_MaxSignal_inPixel} column. Missing values (NaN) count as zero.
     */
    public static ChannelTable estimate(final ChannelTable table) {
        final var total = new double[table.rows()];
        for (final var column : table.columnNames()) {
            if (!column.endsWith(CONTRIBUTION_SUFFIX)) {
                continue;
            }
            final var values = table.column(column);
            for (int i = 0; i < total.length; i++) {
                if (!Double.isNaN(values[i])) {
                    total[i] += values[i];
                }
            }
        }
        return table.with(MAX_SIGNAL_COLUMN, total);
    }
}
