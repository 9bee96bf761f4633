package com.gridt.admin.infrastructure.config;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Random;

@Configuration
public class AdminConfig {

    private static final Logger log = LoggerFactory.getLogger(AdminConfig.class);

    /**
     * Shared by fixture generation, leader selection and random deletion, so a configured
     * seed reproduces a whole run.
     */
    @Bean
    public Random random(AdminProperties properties) {
        Long seed = properties.getFixtures().getSeed();
        if (seed != null) {
            log.info("Using fixed random seed {}", seed);
            return new Random(seed);
        }
        return new Random();
    }

    @Bean
    @ConditionalOnMissingBean
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }
}
