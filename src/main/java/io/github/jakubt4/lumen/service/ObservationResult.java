package io.github.jakubt4.lumen.service;

import io.github.jakubt4.lumen.table.ChannelTable;

import java.util.Optional;

/**
 * Outcome of one target: its table, or the reason it was skipped.
 */
public record ObservationResult(String targetName, ChannelTable table, String failure) {

    public static ObservationResult observed(final String targetName, final ChannelTable table) {
        return new ObservationResult(targetName, table, null);
    }

    public static ObservationResult skipped(final String targetName, final String failure) {
        return new ObservationResult(targetName, null, failure);
    }

    public boolean isObserved() {
        return table != null;
    }

    public Optional<ChannelTable> result() {
        return Optional.ofNullable(table);
    }
}
