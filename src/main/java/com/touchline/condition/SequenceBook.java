package com.touchline.condition;

import com.touchline.domain.model.SequenceRule;
import com.touchline.domain.model.SequenceState;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Sequence progress of one fixture, keyed by rule id and the sequence's position
 * in the rule. One book per fixture; the orchestrator owns it and hands it to the
 * evaluator and tracker for that fixture only.
 */
public class SequenceBook {

    private final Map<String, SequenceState> states = new ConcurrentHashMap<>();

    public SequenceState stateFor(Long ruleId, int index, SequenceRule sequence, Instant now) {
        return states.computeIfAbsent(
                key(ruleId, index), k -> new SequenceState(sequence.getDistinctTriggerCount(), now));
    }

    public Optional<SequenceState> find(Long ruleId, int index) {
        return Optional.ofNullable(states.get(key(ruleId, index)));
    }

    public boolean isComplete(Long ruleId, int index) {
        SequenceState state = states.get(key(ruleId, index));
        return state != null && state.isComplete();
    }

    /** Drops progress of rules that are no longer active. */
    public void retainRules(Set<Long> activeRuleIds) {
        states.keySet().removeIf(k -> activeRuleIds.stream().noneMatch(id -> k.startsWith(id + ":")));
    }

    public int size() {
        return states.size();
    }

    private static String key(Long ruleId, int index) {
        return ruleId + ":" + index;
    }
}
