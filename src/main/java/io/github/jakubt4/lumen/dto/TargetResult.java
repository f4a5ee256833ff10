package io.github.jakubt4.lumen.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.github.jakubt4.lumen.service.ObservationResult;
import io.github.jakubt4.lumen.table.ChannelTable;

/**
 * @param name    target name
 * @param status  {@code "OBSERVED"} or {@code "SKIPPED"}
 * @param message reason a target was skipped
 * @param table   per-bin results of an observed target
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TargetResult(String name, String status, String message, ChannelTable table) {

    public static TargetResult from(final ObservationResult result) {
        return result.isObserved()
                ? new TargetResult(result.targetName(), "OBSERVED", null, result.table())
                : new TargetResult(result.targetName(), "SKIPPED", result.failure(), null);
    }
}
