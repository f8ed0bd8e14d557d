package com.touchline.core.engine;

import com.touchline.condition.ConditionEvaluator;
import com.touchline.condition.SequenceTracker;
import com.touchline.domain.enums.DispatchStatus;
import com.touchline.domain.model.AlertRule;
import com.touchline.domain.model.DerivedSignals;
import com.touchline.domain.model.EvaluationResult;
import com.touchline.domain.model.GamePattern;
import com.touchline.domain.model.MatchSnapshot;
import com.touchline.event.EventPublisherHelper;
import com.touchline.exception.StoreUnavailableException;
import com.touchline.matchdata.SnapshotSource;
import com.touchline.metrics.MetricsCalculator;
import com.touchline.notification.DispatchOutcome;
import com.touchline.notification.NotificationService;
import com.touchline.pattern.PatternDetector;
import com.touchline.pattern.PatternRecognitionConfig;
import com.touchline.store.FireHistoryStore;
import com.touchline.store.RuleStore;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs one polling cycle: fetch snapshots, load rules, then for every fixture derive
 * signals, detect patterns and evaluate each applicable rule.
 *
 * <p>Per (rule, fixture) pair the order is: skip if a fire record exists, advance
 * sequences, evaluate, claim the fire record, dispatch, record the dispatch outcome.
 * The claim is made before dispatch, so a rule fires at most once per fixture even if
 * dispatch or the outcome write fails; a failed dispatch is recorded and never
 * retried.
 *
 * <p>Failures are isolated per fixture: an exception while processing one fixture is
 * logged and the cycle moves on. Only an unreachable rule or fire-history store
 * aborts the cycle, by propagating {@link StoreUnavailableException} to the caller.
 *
 * <p>Snapshots that are not newer than the last one processed for their fixture are
 * skipped, so a stale fallback list never re-evaluates old data.
 */
@Service
public class AlertOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(AlertOrchestrator.class);

    private final SnapshotSource snapshotSource;
    private final RuleStore ruleStore;
    private final FireHistoryStore fireHistoryStore;
    private final MetricsCalculator metricsCalculator;
    private final ConditionEvaluator conditionEvaluator;
    private final SequenceTracker sequenceTracker;
    private final PatternDetector patternDetector;
    private final FixtureStateRegistry fixtureStateRegistry;
    private final NotificationService notificationService;
    private final EventPublisherHelper eventPublisherHelper;
    private final AlertEngineConfig alertEngineConfig;
    private final PatternRecognitionConfig patternRecognitionConfig;

    public AlertOrchestrator(
            SnapshotSource snapshotSource,
            RuleStore ruleStore,
            FireHistoryStore fireHistoryStore,
            MetricsCalculator metricsCalculator,
            ConditionEvaluator conditionEvaluator,
            SequenceTracker sequenceTracker,
            PatternDetector patternDetector,
            FixtureStateRegistry fixtureStateRegistry,
            NotificationService notificationService,
            EventPublisherHelper eventPublisherHelper,
            AlertEngineConfig alertEngineConfig,
            PatternRecognitionConfig patternRecognitionConfig) {
        this.snapshotSource = snapshotSource;
        this.ruleStore = ruleStore;
        this.fireHistoryStore = fireHistoryStore;
        this.metricsCalculator = metricsCalculator;
        this.conditionEvaluator = conditionEvaluator;
        this.sequenceTracker = sequenceTracker;
        this.patternDetector = patternDetector;
        this.fixtureStateRegistry = fixtureStateRegistry;
        this.notificationService = notificationService;
        this.eventPublisherHelper = eventPublisherHelper;
        this.alertEngineConfig = alertEngineConfig;
        this.patternRecognitionConfig = patternRecognitionConfig;
    }

    /**
     * Runs one cycle at the given wall-clock time.
     *
     * @throws StoreUnavailableException when the rule store or fire-history store is unreachable
     */
    public CycleReport runCycle(Instant now) {
        List<MatchSnapshot> snapshots = snapshotSource.fetchCurrentMatches();
        List<AlertRule> rules = ruleStore.loadActiveRules();
        Set<Long> activeRuleIds = rules.stream().map(AlertRule::getId).collect(Collectors.toSet());

        CycleTally tally = new CycleTally();
        for (MatchSnapshot snapshot : snapshots) {
            try {
                processFixture(snapshot, rules, activeRuleIds, now, tally);
            } catch (StoreUnavailableException e) {
                throw e;
            } catch (RuntimeException e) {
                tally.fixturesFailed++;
                log.error("Processing fixture {} failed: {}", snapshot.getFixtureId(), e.getMessage(), e);
            }
        }

        fixtureStateRegistry.evictIdle(now, Duration.ofHours(alertEngineConfig.getFixtureStateRetentionHours()));

        CycleReport report = CycleReport.builder()
                .startedAt(now)
                .fixturesFetched(snapshots.size())
                .fixturesEvaluated(tally.fixturesEvaluated)
                .staleSkipped(tally.staleSkipped)
                .fixturesFailed(tally.fixturesFailed)
                .rulesLoaded(rules.size())
                .alertsFired(tally.alertsFired)
                .dispatchFailures(tally.dispatchFailures)
                .patternsDetected(tally.patternsDetected)
                .build();
        log.info("Cycle complete: {} fixtures, {} rules, {} alerts fired, {} patterns, {} failed",
                report.getFixturesFetched(), report.getRulesLoaded(), report.getAlertsFired(),
                report.getPatternsDetected(), report.getFixturesFailed());
        return report;
    }

    private void processFixture(
            MatchSnapshot snapshot, List<AlertRule> rules, Set<Long> activeRuleIds, Instant now, CycleTally tally) {
        FixtureState state = fixtureStateRegistry.stateFor(snapshot.getFixtureId());
        if (!state.advanceTo(snapshot.getFetchedAt(), now)) {
            tally.staleSkipped++;
            log.debug("Skipping stale snapshot of fixture {} fetched at {}",
                    snapshot.getFixtureId(), snapshot.getFetchedAt());
            return;
        }
        state.getSequenceBook().retainRules(activeRuleIds);

        DerivedSignals signals = metricsCalculator.derive(snapshot);

        if (patternRecognitionConfig.isEnabled()) {
            List<GamePattern> patterns =
                    patternDetector.detect(snapshot.getFixtureId(), snapshot, signals, state.getPatternBook(), now);
            for (GamePattern pattern : patterns) {
                eventPublisherHelper.publishPatternDetected(this, pattern, snapshot);
            }
            tally.patternsDetected += patterns.size();
        }

        for (AlertRule rule : rules) {
            evaluateRule(rule, snapshot, signals, state, now, tally);
        }
        tally.fixturesEvaluated++;
    }

    private void evaluateRule(
            AlertRule rule,
            MatchSnapshot snapshot,
            DerivedSignals signals,
            FixtureState state,
            Instant now,
            CycleTally tally) {
        if (!rule.appliesTo(snapshot)) {
            return;
        }
        String matchId = snapshot.getFixtureId();
        if (fireHistoryStore.exists(rule.getId(), matchId)) {
            return;
        }

        sequenceTracker.observe(rule, snapshot, signals, state.getSequenceBook(), now);
        EvaluationResult result = conditionEvaluator.evaluate(rule, snapshot, signals, state.getSequenceBook());
        if (!result.isFired()) {
            return;
        }

        if (!fireHistoryStore.claim(rule.getId(), matchId, rule.getName(), result.getMessage())) {
            return;
        }
        log.info("Rule '{}' ({}) fired for fixture {}: {}", rule.getName(), rule.getId(), matchId, result.getMessage());

        DispatchOutcome outcome = dispatch(rule, snapshot, result.getMessage());
        tally.alertsFired++;
        if (outcome.getStatus() != DispatchStatus.SENT) {
            tally.dispatchFailures++;
        }

        try {
            fireHistoryStore.recordOutcome(rule.getId(), matchId, outcome);
        } catch (StoreUnavailableException e) {
            log.error("Could not record dispatch outcome {} for rule {} fixture {}: {}",
                    outcome.getStatus(), rule.getId(), matchId, e.getMessage());
        }

        eventPublisherHelper.publishAlertFired(this, rule, snapshot, result.getMessage(), outcome.getStatus());
    }

    private DispatchOutcome dispatch(AlertRule rule, MatchSnapshot snapshot, String message) {
        try {
            return notificationService.dispatchAlert(rule, snapshot, message);
        } catch (RuntimeException e) {
            log.error("Dispatch of rule {} for fixture {} failed: {}",
                    rule.getId(), snapshot.getFixtureId(), e.getMessage(), e);
            return DispatchOutcome.failed(e.getMessage());
        }
    }

    private static final class CycleTally {
        int fixturesEvaluated;
        int staleSkipped;
        int fixturesFailed;
        int alertsFired;
        int dispatchFailures;
        int patternsDetected;
    }
}
