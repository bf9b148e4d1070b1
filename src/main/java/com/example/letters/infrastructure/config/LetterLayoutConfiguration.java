package com.example.letters.infrastructure.config;

import com.example.letters.domain.layout.PaginationSimulator;
import com.example.letters.domain.layout.TextMetrics;
import com.example.letters.domain.model.LetterConfiguration;
import com.example.letters.domain.render.LetterRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the framework-free layout core into the Spring context.
 */
@Configuration
@EnableConfigurationProperties(LetterLayoutProperties.class)
public class LetterLayoutConfiguration {

    private static final Logger log = LoggerFactory.getLogger(LetterLayoutConfiguration.class);

    @Bean
    public LetterConfiguration letterConfiguration(LetterLayoutProperties properties) {
        LetterConfiguration configuration = properties.toConfiguration();
        log.info("Letter layout defaults: {}x{}in page, {} {}pt, body starts at {}in",
                configuration.pageSize().width(), configuration.pageSize().height(),
                configuration.formatting().fontFamily().familyName(), configuration.formatting().fontSize(),
                configuration.positioning().bodyStartY());
        return configuration;
    }

    @Bean
    public PaginationSimulator paginationSimulator(TextMetrics textMetrics) {
        return new PaginationSimulator(textMetrics);
    }

    @Bean
    public LetterRenderer letterRenderer(TextMetrics textMetrics) {
        return new LetterRenderer(textMetrics);
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
