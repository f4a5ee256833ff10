package io.github.jakubt4.lumen.optics;

import java.util.Map;

/**
 * Detected self-emission of a path.
 *
 * @param elements signal of each emitting element, in path order
 * @param total    sum over elements
 */
public record SelfEmission(Map<String, PropagatedSignal> elements, PropagatedSignal total) {
}
