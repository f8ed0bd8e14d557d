package com.touchline.pattern;

import com.touchline.domain.enums.PatternSeverity;
import com.touchline.domain.enums.PatternType;
import com.touchline.domain.model.GamePattern;
import java.util.EnumMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Decides which detected patterns are worth a notification.
 *
 * <p>Starts from the {@code pattern-recognition.alerts} settings and can be changed
 * at runtime per pattern type. A pattern alerts when its type is enabled and its
 * severity is at or above the type's threshold.
 */
@Component
public class PatternAlertPolicy {

    private static final Logger log = LoggerFactory.getLogger(PatternAlertPolicy.class);

    private final Map<PatternType, PatternRecognitionConfig.AlertSetting> settings =
            new EnumMap<>(PatternType.class);

    public PatternAlertPolicy(PatternRecognitionConfig patternRecognitionConfig) {
        for (PatternType type : PatternType.values()) {
            settings.put(type, new PatternRecognitionConfig.AlertSetting());
        }
        settings.putAll(patternRecognitionConfig.getAlerts());
    }

    public synchronized void configure(PatternType type, PatternSeverity severityThreshold, boolean enabled) {
        PatternRecognitionConfig.AlertSetting setting = new PatternRecognitionConfig.AlertSetting();
        setting.setEnabled(enabled);
        setting.setSeverityThreshold(severityThreshold);
        settings.put(type, setting);
        log.info("Pattern alert for {} set to enabled={}, threshold={}", type, enabled, severityThreshold);
    }

    public synchronized boolean shouldAlert(GamePattern pattern) {
        PatternRecognitionConfig.AlertSetting setting = settings.get(pattern.getType());
        return setting != null
                && setting.isEnabled()
                && pattern.getSeverity().isAtLeast(setting.getSeverityThreshold());
    }
}
