package com.touchline.pattern;

import com.touchline.core.engine.FixtureState;
import com.touchline.core.engine.FixtureStateRegistry;
import com.touchline.domain.enums.PatternSeverity;
import com.touchline.domain.enums.PatternType;
import com.touchline.domain.model.GamePattern;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import org.springframework.stereotype.Service;

/**
 * Read side of pattern detection: retained patterns across the fixtures the engine
 * is tracking, newest first.
 */
@Service
public class PatternRecognitionService {

    private final FixtureStateRegistry fixtureStateRegistry;
    private final PatternAlertPolicy patternAlertPolicy;

    public PatternRecognitionService(
            FixtureStateRegistry fixtureStateRegistry, PatternAlertPolicy patternAlertPolicy) {
        this.fixtureStateRegistry = fixtureStateRegistry;
        this.patternAlertPolicy = patternAlertPolicy;
    }

    public List<GamePattern> getMatchPatterns(String fixtureId) {
        return fixtureStateRegistry
                .find(fixtureId)
                .map(state -> newestFirst(state.getPatternBook().getPatterns()))
                .orElse(List.of());
    }

    public List<GamePattern> getPatternsByType(PatternType type) {
        return newestFirst(allPatterns().stream()
                .filter(p -> p.getType() == type)
                .collect(Collectors.toList()));
    }

    /** HIGH and CRITICAL patterns of all tracked fixtures. */
    public List<GamePattern> getHighSeverityPatterns() {
        return newestFirst(allPatterns().stream()
                .filter(p -> p.getSeverity().isAtLeast(PatternSeverity.HIGH))
                .collect(Collectors.toList()));
    }

    public void configurePatternAlert(PatternType type, PatternSeverity severityThreshold, boolean enabled) {
        patternAlertPolicy.configure(type, severityThreshold, enabled);
    }

    private List<GamePattern> allPatterns() {
        return fixtureStateRegistry.all().stream()
                .map(FixtureState::getPatternBook)
                .flatMap(book -> book.getPatterns().stream())
                .collect(Collectors.toList());
    }

    private static List<GamePattern> newestFirst(List<GamePattern> patterns) {
        return patterns.stream()
                .sorted(Comparator.comparing(GamePattern::getEndTime).reversed())
                .collect(Collectors.toList());
    }
}
