package io.github.jakubt4.lumen.output;

import io.github.jakubt4.lumen.table.ChannelTable;

/**
 * Hierarchical sink for tables and arrays produced by the model. Implementations decide
 * the storage format.
 */
public interface OutputGroup {

    /**
     * Child group named {@code name}, created when missing.
     */
    OutputGroup createGroup(String name);

    void writeTable(String name, ChannelTable table);

    void writeArray(String name, double[] values);

    void writeArray(String name, double[][] values);

    void writeScalar(String name, double value);
}
