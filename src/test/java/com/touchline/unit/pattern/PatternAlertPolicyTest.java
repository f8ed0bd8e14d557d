package com.touchline.unit.pattern;

import static org.assertj.core.api.Assertions.assertThat;

import com.touchline.domain.enums.PatternSeverity;
import com.touchline.domain.enums.PatternType;
import com.touchline.domain.model.GamePattern;
import com.touchline.pattern.PatternAlertPolicy;
import com.touchline.pattern.PatternRecognitionConfig;
import org.junit.jupiter.api.Test;

class PatternAlertPolicyTest {

    private static GamePattern pattern(PatternType type, PatternSeverity severity) {
        return GamePattern.builder().patternId("p").type(type).severity(severity).build();
    }

    @Test
    void defaults_alertFromMediumUp() {
        PatternAlertPolicy policy = new PatternAlertPolicy(new PatternRecognitionConfig());

        assertThat(policy.shouldAlert(pattern(PatternType.GOAL_SEQUENCE, PatternSeverity.LOW))).isFalse();
        assertThat(policy.shouldAlert(pattern(PatternType.GOAL_SEQUENCE, PatternSeverity.MEDIUM))).isTrue();
        assertThat(policy.shouldAlert(pattern(PatternType.TIME_BASED, PatternSeverity.CRITICAL))).isTrue();
    }

    @Test
    void configuredSettings_overrideDefaults() {
        PatternRecognitionConfig config = new PatternRecognitionConfig();
        PatternRecognitionConfig.AlertSetting highOnly = new PatternRecognitionConfig.AlertSetting();
        highOnly.setSeverityThreshold(PatternSeverity.HIGH);
        PatternRecognitionConfig.AlertSetting off = new PatternRecognitionConfig.AlertSetting();
        off.setEnabled(false);
        config.getAlerts().put(PatternType.POSSESSION_SWING, highOnly);
        config.getAlerts().put(PatternType.CARD_SEQUENCE, off);

        PatternAlertPolicy policy = new PatternAlertPolicy(config);

        assertThat(policy.shouldAlert(pattern(PatternType.POSSESSION_SWING, PatternSeverity.MEDIUM))).isFalse();
        assertThat(policy.shouldAlert(pattern(PatternType.POSSESSION_SWING, PatternSeverity.HIGH))).isTrue();
        assertThat(policy.shouldAlert(pattern(PatternType.CARD_SEQUENCE, PatternSeverity.CRITICAL))).isFalse();
    }

    @Test
    void configure_changesPolicyAtRuntime() {
        PatternAlertPolicy policy = new PatternAlertPolicy(new PatternRecognitionConfig());

        policy.configure(PatternType.MOMENTUM_SHIFT, PatternSeverity.CRITICAL, true);

        assertThat(policy.shouldAlert(pattern(PatternType.MOMENTUM_SHIFT, PatternSeverity.HIGH))).isFalse();
        assertThat(policy.shouldAlert(pattern(PatternType.MOMENTUM_SHIFT, PatternSeverity.CRITICAL))).isTrue();
    }
}
