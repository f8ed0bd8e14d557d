package com.touchline.api.controller;

import com.touchline.domain.enums.PatternSeverity;
import com.touchline.domain.enums.PatternType;
import com.touchline.domain.model.GamePattern;
import com.touchline.pattern.PatternRecognitionService;
import java.util.List;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for detected game patterns and their alert thresholds.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code GET /api/patterns/fixtures/{fixtureId}} -- patterns retained for one fixture</li>
 *   <li>{@code GET /api/patterns/types/{type}} -- patterns of one type across tracked fixtures</li>
 *   <li>{@code GET /api/patterns/high-severity} -- HIGH and CRITICAL patterns</li>
 *   <li>{@code PUT /api/patterns/alerts/{type}} -- change whether and from which severity a type is broadcast</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/patterns")
public class PatternController {

    private final PatternRecognitionService patternRecognitionService;

    public PatternController(PatternRecognitionService patternRecognitionService) {
        this.patternRecognitionService = patternRecognitionService;
    }

    @GetMapping("/fixtures/{fixtureId}")
    public List<GamePattern> getFixturePatterns(@PathVariable String fixtureId) {
        return patternRecognitionService.getMatchPatterns(fixtureId);
    }

    @GetMapping("/types/{type}")
    public List<GamePattern> getPatternsByType(@PathVariable PatternType type) {
        return patternRecognitionService.getPatternsByType(type);
    }

    @GetMapping("/high-severity")
    public List<GamePattern> getHighSeverityPatterns() {
        return patternRecognitionService.getHighSeverityPatterns();
    }

    @PutMapping("/alerts/{type}")
    public Map<String, Object> configurePatternAlert(
            @PathVariable PatternType type,
            @RequestParam PatternSeverity severity,
            @RequestParam(defaultValue = "true") boolean enabled) {
        patternRecognitionService.configurePatternAlert(type, severity, enabled);
        return Map.of("type", type, "severityThreshold", severity, "enabled", enabled);
    }
}
