package io.github.jakubt4.lumen.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.jakubt4.lumen.foreground.ForegroundFactory;
import io.github.jakubt4.lumen.instrument.Instrument;
import io.github.jakubt4.lumen.noise.MaxSignalEstimator;
import io.github.jakubt4.lumen.noise.NoiseModel;
import io.github.jakubt4.lumen.optics.OpticalPath;
import io.github.jakubt4.lumen.signal.SpectralMath;
import io.github.jakubt4.lumen.source.SedProvider;
import io.github.jakubt4.lumen.source.SedProviders;
import io.github.jakubt4.lumen.table.ChannelTable;
import io.github.jakubt4.lumen.target.Target;
import io.github.jakubt4.lumen.target.TargetObservation;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.function.Function;

/**
 * Observes one target through every channel of the payload.
 *
 * <p>The steps run in a fixed order: the channel tables are stacked, foregrounds are
 * registered and propagated, the stellar SED is loaded and propagated, the signal in the
 * brightest pixel is summed and finally the noise of each channel is estimated. Built
 * channels are only read, so one pipeline serves concurrent targets.
 */
@Slf4j
@Service
public class ObservationPipeline {

    private final ChannelRegistry registry;
    private final ForegroundFactory foregroundFactory;
    private final SedProvider sedProvider;
    private final double[] wavelength;

    public ObservationPipeline(final ChannelRegistry registry, final ObjectMapper objectMapper) {
        this.registry = registry;
        final var common = registry.payload().common();
        this.wavelength = SpectralMath.logspace(common.wlMin(), common.wlMax(), OpticalPath.GRID_POINTS);
        this.foregroundFactory = new ForegroundFactory(wavelength, objectMapper);
        this.sedProvider = SedProviders.forDescription(common.sourceSpectrum());
    }

    public ObservationResult observe(final Target target) {
        log.info("Observing target [{}]", target.name());
        final var observation = prepare(target);
        registerForegrounds(observation);
        observation.updateTable(perChannel(channel -> channel.propagateDiffuseForeground(observation)));
        loadSource(observation);
        observation.updateTable(perChannel(channel -> channel.propagateTarget(observation)));
        observation.updateTable(MaxSignalEstimator.estimate(observation.getTable()));
        estimateNoise(observation);
        log.info("Target [{}] observed: {} bins", target.name(), observation.getTable().rows());
        return ObservationResult.observed(target.name(), observation.getTable());
    }

    private TargetObservation prepare(final Target target) {
        final var observation = new TargetObservation(target, registry.stackedTable());
        observation.addMetadata("name", target.name());
        return observation;
    }

    private void registerForegrounds(final TargetObservation observation) {
        for (final var description : registry.payload().common().foregrounds()) {
            final var foreground = foregroundFactory.create(description, observation.getTarget());
            observation.registerForeground(foreground);
            log.debug("Foreground [{}] registered for [{}]", foreground.name(), observation.name());
        }
    }

    private void loadSource(final TargetObservation observation) {
        final var star = observation.getTarget().star();
        observation.setSed(sedProvider.sed(star, wavelength));
        observation.addMetadata("starName", observation.name());
        observation.addMetadata("starM", star.mass());
        observation.addMetadata("starTeff", star.temperature());
        observation.addMetadata("starR", star.radius());
        observation.addMetadata("starDistance", star.distance());
        observation.addMetadata("starL", star.luminosity());
        observation.addMetadata("starModel", sedProvider.model());
        observation.addMetadata("starLogg", star.logg());
        if (star.magK() != null) {
            observation.addMetadata("starMagK", star.magK());
        }
    }

    private void estimateNoise(final TargetObservation observation) {
        final var tables = new ArrayList<ChannelTable>();
        for (final NoiseModel model : registry.noiseModels()) {
            tables.add(model.estimate(observation.getTable()));
        }
        observation.updateTable(ChannelTable.stack(tables));
    }

    private ChannelTable perChannel(final Function<Instrument, ChannelTable> step) {
        return ChannelTable.stack(registry.channels().stream().map(step).toList());
    }
}
