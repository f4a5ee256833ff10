package io.github.jakubt4.lumen.description;

import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.jakubt4.lumen.foreground.ForegroundKind;
import io.github.jakubt4.lumen.instrument.ChannelKind;
import io.github.jakubt4.lumen.optics.ElementType;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PayloadDescriptionTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void examplePayloadIsReadFromTheClasspath() throws IOException {
        final PayloadDescription payload;
        try (var in = getClass().getClassLoader().getResourceAsStream("payload/payload-example.json")) {
            payload = mapper.readValue(in, PayloadDescription.class);
        }

        assertThat(payload.telescopeArea()).isEqualTo(0.63);
        assertThat(payload.optics().forcesChannelEdges()).isTrue();
        assertThat(payload.optics().elements()).hasSize(3);
        assertThat(payload.common().foregrounds()).singleElement()
                .satisfies(zodi -> assertThat(zodi.kind()).isEqualTo(ForegroundKind.ZODIACAL));
        assertThat(payload.channels()).extracting(ChannelDescription::name).containsExactly("Phot", "Spec");

        final var phot = payload.channels().get(0);
        assertThat(phot.kind()).isEqualTo(ChannelKind.PHOTOMETER);
        assertThat(phot.aperture().encircledEnergy()).isEqualTo(0.83);
        assertThat(phot.detector().wellDepthFraction()).isEqualTo(0.9);
        assertThat(phot.detector().ndrFrequency()).isZero();
        assertThat(phot.optics().elements()).extracting(OpticalElementDescription::type)
                .containsExactly(ElementType.DICHROIC, ElementType.FILTER, ElementType.OPTICS_BOX,
                        ElementType.DETECTOR_BOX);

        final var spec = payload.channels().get(1);
        assertThat(spec.kind()).isEqualTo(ChannelKind.SPECTROMETER);
        assertThat(spec.targetR().mode()).isEqualTo(ResolvingPowerDescription.Mode.FIXED);
        assertThat(spec.targetR().value()).isEqualTo(20.0);
        assertThat(spec.wlSolution().rows()).isEqualTo(2);
        assertThat(spec.customNoise()).extracting(CustomNoiseDescription::name).containsExactly("gain_drift");
    }

    @Test
    void resolvingPowerAcceptsEveryWrittenForm() throws IOException {
        assertThat(mapper.readValue("\"native\"", ResolvingPowerDescription.class).mode())
                .isEqualTo(ResolvingPowerDescription.Mode.NATIVE);
        assertThat(mapper.readValue("\"50\"", ResolvingPowerDescription.class).value()).isEqualTo(50.0);
        assertThat(mapper.readValue("100", ResolvingPowerDescription.class).value()).isEqualTo(100.0);

        final var tabulated = mapper.readValue("""
                {"data": {"Wavelength": [1.0, 2.0], "R": [50, 100]}}
                """, ResolvingPowerDescription.class);
        assertThat(tabulated.mode()).isEqualTo(ResolvingPowerDescription.Mode.TABULATED);
        assertThat(tabulated.data().column("R")).containsExactly(50.0, 100.0);
    }

    @Test
    void unsupportedResolvingPowerIsRejected() {
        assertThatThrownBy(() -> mapper.readValue("\"high\"", ResolvingPowerDescription.class))
                .hasRootCauseInstanceOf(NumberFormatException.class);
        assertThatThrownBy(() -> ResolvingPowerDescription.fixed(0.0)).isInstanceOf(ConfigurationException.class);
    }

    @Test
    void duplicateChannelNamesAreRejected() {
        final var json = """
                {
                  "common": {"wlMin": 0.5, "wlMax": 1.0},
                  "channels": [
                    {"name": "A", "kind": "photometer", "wlMin": 0.5, "wlMax": 0.6, "fnumX": 10,
                     "detector": {"wlMin": 0.5, "cutOff": 1.0, "deltaPix": 18}},
                    {"name": "A", "kind": "photometer", "wlMin": 0.6, "wlMax": 0.7, "fnumX": 10,
                     "detector": {"wlMin": 0.5, "cutOff": 1.0, "deltaPix": 18}}
                  ]
                }
                """;

        assertThatThrownBy(() -> mapper.readValue(json, PayloadDescription.class))
                .isInstanceOf(JsonMappingException.class)
                .hasRootCauseInstanceOf(ConfigurationException.class)
                .hasMessageContaining("duplicate channel name 'A'");
    }

    @Test
    void missingFNumberYDefaultsToX() {
        final var channel = ChannelDescription.builder()
                .name("A")
                .kind(ChannelKind.PHOTOMETER)
                .wlMin(0.5)
                .wlMax(0.6)
                .fnumX(12.0)
                .detector(DetectorDescription.builder().wlMin(0.5).cutOff(1.0).deltaPix(18.0).build())
                .build();

        assertThat(channel.fnumY()).isEqualTo(12.0);
        assertThat(channel.customNoise()).isEmpty();
        assertThat(channel.optics().elements()).isEmpty();
    }

    @Test
    void tabulatedColumnsMustHaveTheSameLength() {
        assertThatThrownBy(() -> TabulatedData.of("Wavelength", new double[]{1.0, 2.0}, "T", new double[]{1.0}))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("expected 2");
        assertThatThrownBy(() -> TabulatedData.of("Wavelength", new double[]{1.0}, "T", new double[]{1.0})
                .column("R"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("not found");
    }
}
