package com.touchline.pattern;

import com.touchline.domain.enums.PatternSeverity;
import com.touchline.domain.enums.PatternType;
import jakarta.validation.constraints.Min;
import java.util.EnumMap;
import java.util.Map;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties under the {@code pattern-recognition} prefix.
 *
 * <ul>
 *   <li>{@code enabled} -- toggles pattern detection in the polling cycle</li>
 *   <li>{@code bufferSize} -- capacity of each fixture's event ring</li>
 *   <li>{@code retentionHours} -- detected patterns older than this are purged</li>
 *   <li>{@code alerts} -- per pattern type notification setting; types not listed
 *       alert at MEDIUM and above</li>
 * </ul>
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "pattern-recognition")
public class PatternRecognitionConfig {

    private boolean enabled = true;
    @Min(1)
    private int bufferSize = 50;

    @Min(1)
    private int retentionHours = 2;
    private Map<PatternType, AlertSetting> alerts = new EnumMap<>(PatternType.class);

    @Getter
    @Setter
    public static class AlertSetting {
        private boolean enabled = true;
        private PatternSeverity severityThreshold = PatternSeverity.MEDIUM;
    }
}
