package com.touchline.matchdata;

import com.touchline.domain.enums.MatchPhase;
import java.time.Duration;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration for the API-Football client under the {@code sports-api} prefix.
 *
 * <ul>
 *   <li>{@code maxConcurrentRequests} -- size of the statistics fetch pool</li>
 *   <li>{@code batchSize} / {@code requestDelayMs} -- fixtures per batch and the pause between batches</li>
 *   <li>{@code maxRetries} / {@code retryBaseDelayMs} -- attempts for the fixture list, delay doubling per attempt</li>
 *   <li>{@code *TtlSeconds} -- statistics cache lifetime per match phase</li>
 * </ul>
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "sports-api")
public class SportsApiConfig {

    @NotBlank
    private String baseUrl = "https://v3.football.api-sports.io";
    private String apiKey;

    @Min(1)
    private int maxConcurrentRequests = 5;
    @Min(1)
    private int batchSize = 15;
    private long requestDelayMs = 100;

    @Min(1)
    private int maxRetries = 3;
    private long retryBaseDelayMs = 5000;

    private int connectTimeoutMs = 5000;
    private int readTimeoutMs = 10000;

    private long liveTtlSeconds = 60;
    private long finishedTtlSeconds = 300;
    private long scheduledTtlSeconds = 600;
    private long defaultTtlSeconds = 300;

    public Duration ttlFor(MatchPhase phase) {
        long seconds = switch (phase) {
            case LIVE -> liveTtlSeconds;
            case FINISHED -> finishedTtlSeconds;
            case SCHEDULED -> scheduledTtlSeconds;
            case UNKNOWN -> defaultTtlSeconds;
        };
        return Duration.ofSeconds(seconds);
    }
}
