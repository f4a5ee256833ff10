package io.github.jakubt4.lumen.dto;

import java.util.List;

/**
 * Inbound batch of targets.
 *
 * @param targets targets in output order
 * @param workers parallel workers for this batch, the configured default when {@code null}
 */
public record ObservationRequest(List<TargetRequest> targets, Integer workers) {
}
