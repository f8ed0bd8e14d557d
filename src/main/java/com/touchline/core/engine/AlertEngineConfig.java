package com.touchline.core.engine;

import jakarta.validation.constraints.Min;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the alert engine under the {@code alert-engine} prefix.
 *
 * <ul>
 *   <li>{@code enabled} -- master toggle; when false the polling loop never starts</li>
 *   <li>{@code pollIntervalMs} -- pause between successful cycles (default 60s)</li>
 *   <li>{@code errorBackoffMs} -- shorter pause after a failed cycle (default 30s)</li>
 *   <li>{@code maxConditionDepth} -- deepest condition tree accepted and evaluated</li>
 *   <li>{@code fixtureStateRetentionHours} -- per-fixture state of matches no longer
 *       returned by the upstream is dropped after this long</li>
 * </ul>
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "alert-engine")
public class AlertEngineConfig {

    private boolean enabled = true;
    @Min(1000)
    private long pollIntervalMs = 60000;
    @Min(1000)
    private long errorBackoffMs = 30000;
    @Min(1)
    private int maxConditionDepth = 32;
    @Min(1)
    private int fixtureStateRetentionHours = 2;
}
