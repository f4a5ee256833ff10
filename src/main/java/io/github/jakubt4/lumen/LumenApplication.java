package io.github.jakubt4.lumen;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Lumen: radiometric signal and noise budget of a multi-channel space instrument.
 *
 * <p>Builds the photometer and spectrometer channels described by the payload at start-up,
 * then propagates stars and diffuse foregrounds through them and estimates the detector
 * noise of every wavelength bin.
 *
 * @see io.github.jakubt4.lumen.service.ObservationPipeline
 * @see io.github.jakubt4.lumen.service.BatchObservationService
 */
@SpringBootApplication
public class LumenApplication {

    public static void main(String[] args) {
        SpringApplication.run(LumenApplication.class, args);
    }
}
