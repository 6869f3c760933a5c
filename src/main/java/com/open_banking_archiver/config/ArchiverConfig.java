package com.open_banking_archiver.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.cfg.JsonNodeFeature;
import org.springframework.boot.autoconfigure.jackson.Jackson2ObjectMapperBuilderCustomizer;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(ArchiverProperties.class)
public class ArchiverConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Raw provider records are archived as received: decimals stay {@code BigDecimal} with their scale.
     */
    @Bean
    public Jackson2ObjectMapperBuilderCustomizer sourceDataPassthrough() {
        return builder -> builder
                .featuresToEnable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
                .postConfigurer(mapper -> mapper.configure(JsonNodeFeature.STRIP_TRAILING_BIGDECIMAL_ZEROES, false));
    }
}
