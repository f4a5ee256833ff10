package io.github.jakubt4.lumen.dto;

import io.github.jakubt4.lumen.instrument.Instrument;
import io.github.jakubt4.lumen.table.ChannelTable;

public record ChannelResponse(String name, String kind, String state, ChannelTable table) {

    public static ChannelResponse from(final Instrument instrument) {
        return new ChannelResponse(instrument.name(), instrument.kind().label(), instrument.state().name(),
                instrument.table());
    }
}
