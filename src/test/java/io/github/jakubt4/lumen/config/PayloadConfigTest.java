package io.github.jakubt4.lumen.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PayloadConfigTest {

    private final PayloadConfig config = new PayloadConfig();
    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void loadsThePayloadFromTheClasspath() {
        final var payload = config.payloadDescription(mapper, "payload/payload-example.json");

        assertThat(payload.channels()).hasSize(2);
    }

    @Test
    void missingPayloadStopsTheStartup() {
        assertThatThrownBy(() -> config.payloadDescription(mapper, "payload/absent.json"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("not found on classpath");
    }

    @Test
    void malformedPayloadStopsTheStartup() {
        assertThatThrownBy(() -> config.payloadDescription(mapper, "payload/malformed.json"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("cannot read payload description");
    }
}
