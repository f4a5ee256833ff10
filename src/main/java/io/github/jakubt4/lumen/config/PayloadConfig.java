package io.github.jakubt4.lumen.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.jakubt4.lumen.description.PayloadDescription;
import io.github.jakubt4.lumen.service.ChannelRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;

/**
 * Loads the payload description from the classpath and builds every channel once, before
 * any target is observed.
 */
@Slf4j
@Configuration
public class PayloadConfig {

    /**
     * Reads the payload JSON at {@code lumen.payload.location}.
     *
     * @throws IllegalStateException if the resource is not found on the classpath or is not
     *                               a valid payload
     */
    @Bean
    public PayloadDescription payloadDescription(final ObjectMapper objectMapper,
                                                 @Value("${lumen.payload.location:payload/payload-example.json}")
                                                 final String location) {
        try (var in = PayloadConfig.class.getClassLoader().getResourceAsStream(location)) {
            if (in == null) {
                throw new IllegalStateException(location + " not found on classpath");
            }
            final var payload = objectMapper.readValue(in, PayloadDescription.class);
            log.info("Payload description loaded from classpath:{} ({} channels)", location,
                    payload.channels().size());
            return payload;
        } catch (final IOException e) {
            throw new IllegalStateException("cannot read payload description " + location + ": " + e.getMessage(), e);
        }
    }

    @Bean
    public ChannelRegistry channelRegistry(final PayloadDescription payloadDescription) {
        return ChannelRegistry.build(payloadDescription);
    }
}
