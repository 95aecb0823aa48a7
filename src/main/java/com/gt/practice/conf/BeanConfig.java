package com.gt.practice.conf;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Random;

@Configuration
public class BeanConfig {

    private static final Logger log = LoggerFactory.getLogger(BeanConfig.class);

    // Random source for shuffling composed sessions. A fixed seed makes compositions reproducible.
    @Bean
    public Random getCompositionRandom(@Value("${practice.composer.seed:}") String seed) {
        if (seed == null || seed.isBlank()) {
            return new Random();
        }

        log.info("Composing sessions with fixed seed {}", seed);
        return new Random(Long.parseLong(seed.strip()));
    }
}
