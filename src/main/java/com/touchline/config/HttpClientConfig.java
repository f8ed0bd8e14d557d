package com.touchline.config;

import com.touchline.matchdata.SportsApiConfig;
import java.time.Duration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

/**
 * RestTemplates for the two upstreams: API-Football and Twilio.
 */
@Configuration
@EnableConfigurationProperties(SportsApiConfig.class)
public class HttpClientConfig {

    @Bean("sportsApiRestTemplate")
    public RestTemplate sportsApiRestTemplate(RestTemplateBuilder builder, SportsApiConfig sportsApiConfig) {
        return builder.setConnectTimeout(Duration.ofMillis(sportsApiConfig.getConnectTimeoutMs()))
                .setReadTimeout(Duration.ofMillis(sportsApiConfig.getReadTimeoutMs()))
                .build();
    }

    @Bean("smsRestTemplate")
    public RestTemplate smsRestTemplate(RestTemplateBuilder builder) {
        return builder.setConnectTimeout(Duration.ofSeconds(5))
                .setReadTimeout(Duration.ofSeconds(10))
                .build();
    }
}
