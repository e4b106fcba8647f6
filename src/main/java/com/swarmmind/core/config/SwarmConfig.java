package com.swarmmind.core.config;

import com.swarmmind.core.channel.DensityPolicy;
import com.swarmmind.core.channel.SaturatingDensityPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Random;
import java.util.random.RandomGenerator;

@Configuration
public class SwarmConfig {

    private static final Logger log = LoggerFactory.getLogger(SwarmConfig.class);

    /**
     * Single randomness source for movement, absorption, selection and
     * content choice. Seeded when {@code swarmmind.swarm.seed} is set.
     */
    @Bean
    public RandomGenerator swarmRandom(SwarmProperties properties) {
        Long seed = properties.getSeed();
        if (seed != null) {
            log.info("Using seeded random source (seed={})", seed);
            return new Random(seed);
        }
        return new Random();
    }

    @Bean
    public DensityPolicy densityPolicy(SwarmProperties properties) {
        return new SaturatingDensityPolicy(properties.getDensityScale());
    }
}
