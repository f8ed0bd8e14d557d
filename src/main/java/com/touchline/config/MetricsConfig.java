package com.touchline.config;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.config.MeterFilter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Registry-wide meter settings. The engine's own meters are defined in
 * {@link com.touchline.observability.CustomMetricsService}.
 */
@Configuration
public class MetricsConfig {

    /** Distinct pattern types are a closed enum; anything past this is a bug upstream. */
    private static final int MAX_PATTERN_TYPE_TAGS = 16;

    @Bean
    public MeterRegistryCustomizer<MeterRegistry> commonTagsCustomizer(
            @Value("${spring.application.name:touchline-alerts}") String applicationName) {
        return registry -> registry.config().commonTags("application", applicationName);
    }

    @Bean
    public MeterFilter patternTypeCardinalityFilter() {
        return MeterFilter.maximumAllowableTags("patterns.detected", "type", MAX_PATTERN_TYPE_TAGS, MeterFilter.deny());
    }
}
