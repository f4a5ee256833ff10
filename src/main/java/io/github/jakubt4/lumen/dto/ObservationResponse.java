package io.github.jakubt4.lumen.dto;

import java.util.List;

/**
 * Response to a batch of targets.
 *
 * @param status  {@code "COMPLETED"} once every target went through the pipeline (some may be
 *                skipped), {@code "REJECTED"} when the request itself is invalid
 * @param message human-readable detail about the result
 * @param targets one entry per requested target, empty on rejection
 */
public record ObservationResponse(String status, String message, List<TargetResult> targets) {

    public static ObservationResponse rejected(final String message) {
        return new ObservationResponse("REJECTED", message, List.of());
    }
}
