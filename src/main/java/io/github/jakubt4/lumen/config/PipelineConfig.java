package io.github.jakubt4.lumen.config;

import io.github.jakubt4.lumen.service.RunConfiguration;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class PipelineConfig {

    @Bean
    RunConfiguration runConfiguration(@Value("${lumen.pipeline.workers:1}") final int workers,
                                      @Value("${lumen.pipeline.debug:false}") final boolean debug) {
        return new RunConfiguration(workers, debug);
    }
}
