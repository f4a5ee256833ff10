package io.github.jakubt4.lumen.controller;

import io.github.jakubt4.lumen.dto.ChannelResponse;
import io.github.jakubt4.lumen.dto.ObservationRequest;
import io.github.jakubt4.lumen.dto.ObservationResponse;
import io.github.jakubt4.lumen.dto.TargetRequest;
import io.github.jakubt4.lumen.dto.TargetResult;
import io.github.jakubt4.lumen.output.InMemoryOutputGroup;
import io.github.jakubt4.lumen.service.BatchObservationService;
import io.github.jakubt4.lumen.service.ChannelRegistry;
import io.github.jakubt4.lumen.service.RunConfiguration;
import io.github.jakubt4.lumen.target.Target;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.List;

/**
 * REST endpoints of the radiometric model.
 *
 * <p>{@code POST /api/observations} runs a batch of targets through every channel;
 * {@code GET /api/channels} exposes the built channel tables.
 */
@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class ObservationController {

    private final BatchObservationService batchObservationService;
    private final ChannelRegistry channelRegistry;
    private final RunConfiguration runConfiguration;

    /**
     * Observes a batch of targets.
     *
     * @param request targets and optional worker count
     * @return {@code 200 OK} with one result per target, {@code 400 Bad Request} when the
     *         batch is empty or a target is invalid
     */
    @PostMapping("/observations")
    public ResponseEntity<ObservationResponse> observe(@RequestBody final ObservationRequest request) {
        if (request.targets() == null || request.targets().isEmpty()) {
            return ResponseEntity.badRequest().body(ObservationResponse.rejected("At least one target is required"));
        }
        if (request.workers() != null && request.workers() < 1) {
            return ResponseEntity.badRequest().body(ObservationResponse.rejected("workers must be at least 1"));
        }

        final List<Target> targets = new ArrayList<>();
        for (final TargetRequest target : request.targets()) {
            try {
                targets.add(target.toTarget());
            } catch (final IllegalArgumentException e) {
                log.warn("Rejected target [{}]: {}", target.name(), e.getMessage());
                return ResponseEntity.badRequest()
                        .body(ObservationResponse.rejected("Invalid target: " + e.getMessage()));
            }
        }

        final var configuration = request.workers() != null
                ? runConfiguration.withWorkers(request.workers())
                : runConfiguration;
        final var results = batchObservationService.observeAll(targets, configuration).stream()
                .map(TargetResult::from)
                .toList();
        final var skipped = results.stream().filter(result -> "SKIPPED".equals(result.status())).count();
        log.info("Batch of {} targets done, {} skipped", results.size(), skipped);
        return ResponseEntity.ok(new ObservationResponse("COMPLETED",
                (results.size() - skipped) + " observed, " + skipped + " skipped", results));
    }

    @GetMapping("/channels")
    public List<ChannelResponse> channels() {
        return channelRegistry.channels().stream().map(ChannelResponse::from).toList();
    }

    /**
     * Built artifacts of one channel, as written through its output group.
     */
    @GetMapping("/channels/{name}/artifacts")
    public ResponseEntity<InMemoryOutputGroup> artifacts(@PathVariable final String name) {
        return channelRegistry.channel(name)
                .map(channel -> {
                    final var output = new InMemoryOutputGroup();
                    channel.write(output);
                    return ResponseEntity.ok(output);
                })
                .orElseGet(() -> ResponseEntity.notFound().build());
    }
}
