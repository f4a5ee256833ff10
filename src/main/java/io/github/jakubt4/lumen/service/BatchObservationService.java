package io.github.jakubt4.lumen.service;

import io.github.jakubt4.lumen.target.Target;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Observes a list of targets, one worker per target at most {@link RunConfiguration#workers()}
 * at a time. A failing target is logged and reported as skipped; it never stops the batch.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BatchObservationService {

    private final ObservationPipeline pipeline;

    /**
     * @return one result per target, in input order
     */
    public List<ObservationResult> observeAll(final List<Target> targets, final RunConfiguration configuration) {
        log.info("Observing {} targets with {} workers", targets.size(), configuration.workers());
        if (configuration.workers() == 1 || targets.size() < 2) {
            return targets.stream().map(target -> observeSafely(target, configuration)).toList();
        }
        final var executor = Executors.newFixedThreadPool(Math.min(configuration.workers(), targets.size()));
        try {
            final var futures = new ArrayList<Future<ObservationResult>>();
            for (final var target : targets) {
                futures.add(executor.submit(() -> observeSafely(target, configuration)));
            }
            final var results = new ArrayList<ObservationResult>();
            for (int i = 0; i < futures.size(); i++) {
                results.add(await(futures.get(i), targets.get(i)));
            }
            return results;
        } finally {
            executor.shutdownNow();
        }
    }

    private ObservationResult observeSafely(final Target target, final RunConfiguration configuration) {
        try {
            return pipeline.observe(target);
        } catch (final Exception e) {
            if (configuration.debug()) {
                log.error("Target [{}] skipped", target.name(), e);
            } else {
                log.error("Target [{}] skipped: {}", target.name(), e.getMessage());
            }
            return ObservationResult.skipped(target.name(), e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private ObservationResult await(final Future<ObservationResult> future, final Target target) {
        try {
            return future.get();
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("batch interrupted while observing [" + target.name() + "]", e);
        } catch (final ExecutionException e) {
            log.error("Target [{}] skipped: {}", target.name(), e.getCause().getMessage());
            return ObservationResult.skipped(target.name(), String.valueOf(e.getCause()));
        }
    }
}
