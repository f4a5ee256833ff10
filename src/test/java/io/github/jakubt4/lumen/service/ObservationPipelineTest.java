package io.github.jakubt4.lumen.service;

import io.github.jakubt4.lumen.Fixtures;
import io.github.jakubt4.lumen.target.StarParameters;
import io.github.jakubt4.lumen.target.Target;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class ObservationPipelineTest {

    @Autowired
    private ObservationPipeline observationPipeline;

    @Autowired
    private ChannelRegistry channelRegistry;

    @Autowired
    private BatchObservationService batchObservationService;

    @Test
    void examplePayloadIsBuiltAtStartup() {
        assertThat(channelRegistry.channels()).hasSize(2);
        assertThat(channelRegistry.noiseModels()).hasSize(2);
        assertThat(channelRegistry.stackedTable().rows()).isEqualTo(18);
    }

    @Test
    void observedTargetHasSignalAndNoiseInEveryBin() {
        final var result = observationPipeline.observe(Fixtures.sunLike("t1"));

        assertThat(result.isObserved()).isTrue();
        final var table = result.result().orElseThrow();
        assertThat(table.rows()).isEqualTo(18);
        assertThat(table.channelNames()).startsWith("Phot", "Spec");
        assertThat(table.columnNames()).contains("zodi_signal", "zodi_MaxSignal_inPixel", "instrument_signal",
                "starSignal", "star_signal_inAperture", "MaxSignal_inPixel", "frameTime", "darkcurrent_noise",
                "read_noise", "star_signal_inAperture_noise", "gain_drift_noise", "total_noise");
        for (final var noise : table.column("total_noise")) {
            assertThat(noise).isFinite().isPositive();
        }
        assertThat(table.value("starSignal", 0)).isPositive();
        assertThat(table.metadata())
                .containsEntry("name", "t1")
                .containsEntry("starModel", "Planck")
                .containsEntry("starTeff", 5772.0)
                .containsEntry("starMagK", 3.3)
                .containsKeys("starL", "starLogg");
    }

    @Test
    void fartherStarIsNoisier() {
        final var near = observationPipeline.observe(Fixtures.sunLike("near")).table();
        final var far = observationPipeline.observe(new Target("far", StarParameters.builder()
                .temperature(5772.0)
                .radius(1.0)
                .mass(1.0)
                .distance(40.0)
                .build())).table();

        assertThat(far.value("starSignal", 0)).isLessThan(near.value("starSignal", 0));
        assertThat(far.value("total_noise", 0)).isGreaterThan(near.value("total_noise", 0));
    }

    @Test
    void parallelBatchMatchesTheSequentialOne() {
        final var targets = List.of(Fixtures.sunLike("a"), Fixtures.sunLike("b"), Fixtures.sunLike("c"));

        final var sequential = batchObservationService.observeAll(targets, RunConfiguration.sequential());
        final var parallel = batchObservationService.observeAll(targets, new RunConfiguration(3, false));

        assertThat(parallel).extracting(ObservationResult::targetName).containsExactly("a", "b", "c");
        for (int i = 0; i < targets.size(); i++) {
            assertThat(Arrays.equals(parallel.get(i).table().column("total_noise"),
                    sequential.get(i).table().column("total_noise"))).isTrue();
        }
    }
}
