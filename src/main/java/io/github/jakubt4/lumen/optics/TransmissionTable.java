package io.github.jakubt4.lumen.optics;

import io.github.jakubt4.lumen.signal.Signal;

import java.util.Map;

/**
 * Transmission of each element of a path and of the whole path.
 *
 * @param elements per-element transmission, in path order
 * @param total    product of every element transmission
 */
public record TransmissionTable(Map<String, Signal> elements, Signal total) {
}
