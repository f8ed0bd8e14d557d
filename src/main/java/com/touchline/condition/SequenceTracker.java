package com.touchline.condition;

import com.touchline.domain.model.AlertRule;
import com.touchline.domain.model.DerivedSignals;
import com.touchline.domain.model.LeafCondition;
import com.touchline.domain.model.MatchSnapshot;
import com.touchline.domain.model.SequenceRule;
import com.touchline.domain.model.SequenceState;
import java.time.Instant;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Advances the sequence state machines of a rule for one fixture.
 *
 * <p>Called once per cycle per (fixture, rule). For each sequence of the rule the
 * tracker first checks the rolling window: if more than the time limit has passed
 * since the window started, progress is abandoned and the window restarts at
 * {@code now}. It then evaluates every trigger condition with the evaluator's leaf
 * logic and records the identity of each true one. A sequence is complete once all
 * its distinct triggers have been seen inside the current window, and stays complete
 * until the window next expires.
 *
 * <p>State lives in the caller's {@link SequenceBook}; the tracker itself is stateless.
 */
@Component
public class SequenceTracker {

    private static final Logger log = LoggerFactory.getLogger(SequenceTracker.class);

    private final ConditionEvaluator conditionEvaluator;

    public SequenceTracker(ConditionEvaluator conditionEvaluator) {
        this.conditionEvaluator = conditionEvaluator;
    }

    public void observe(
            AlertRule rule, MatchSnapshot snapshot, DerivedSignals signals, SequenceBook sequenceBook, Instant now) {
        if (!rule.hasSequences()) {
            return;
        }
        List<SequenceRule> sequences = rule.getSequences();
        for (int i = 0; i < sequences.size(); i++) {
            observe(rule.getId(), i, sequences.get(i), snapshot, signals, sequenceBook, now);
        }
    }

    /**
     * Advances a single sequence and returns its state after this observation.
     */
    public SequenceState observe(
            Long ruleId,
            int index,
            SequenceRule sequence,
            MatchSnapshot snapshot,
            DerivedSignals signals,
            SequenceBook sequenceBook,
            Instant now) {
        SequenceState state = sequenceBook.stateFor(ruleId, index, sequence, now);
        SequenceState.Status before = state.getStatus();

        if (state.expireIfNeeded(now, sequence.getTimeLimitSeconds())) {
            log.debug("Sequence {}:{} window expired for fixture {}, progress reset",
                    ruleId, index, snapshot.getFixtureId());
            before = SequenceState.Status.IDLE;
        }

        for (LeafCondition trigger : sequence.getEvents()) {
            if (conditionEvaluator.evaluateLeaf(trigger, snapshot, signals).isFired()
                    && state.observe(trigger.getIdentityKey())) {
                log.debug("Sequence {}:{} observed {} ({}/{})",
                        ruleId, index, trigger.getIdentityKey(),
                        state.getObservedKeys().size(), state.getRequiredCount());
            }
        }

        SequenceState.Status after = state.getStatus();
        if (after != before) {
            if (after == SequenceState.Status.COMPLETE) {
                log.info("Sequence {}:{} complete for fixture {}", ruleId, index, snapshot.getFixtureId());
            } else {
                log.debug("Sequence {}:{} {} -> {} for fixture {}", ruleId, index, before, after, snapshot.getFixtureId());
            }
        }
        return state;
    }
}
