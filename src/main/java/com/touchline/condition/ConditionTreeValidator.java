package com.touchline.condition;

import com.touchline.core.engine.AlertEngineConfig;
import com.touchline.domain.enums.LogicOperator;
import com.touchline.domain.model.AlertRule;
import com.touchline.domain.model.CompositeCondition;
import com.touchline.domain.model.ConditionNode;
import com.touchline.domain.model.LeafCondition;
import com.touchline.domain.model.SequenceRule;
import com.touchline.domain.model.TimeWindow;
import com.touchline.exception.InvalidConditionTreeException;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Structural checks run once when rules are loaded. A rule that fails is skipped
 * for the cycle instead of being evaluated.
 *
 * <p>Rejects: a missing root, nodes reachable twice (cycles or shared subtrees),
 * trees deeper than the configured bound, composites without a logic operator,
 * NOT with anything but exactly one child, leaves without signal, operator or value,
 * inverted time windows and sequences with no triggers or a non-positive time limit.
 */
@Component
public class ConditionTreeValidator {

    private final AlertEngineConfig alertEngineConfig;

    public ConditionTreeValidator(AlertEngineConfig alertEngineConfig) {
        this.alertEngineConfig = alertEngineConfig;
    }

    public void validate(AlertRule rule) {
        Long ruleId = rule.getId();
        if (rule.getRoot() == null) {
            throw new InvalidConditionTreeException(ruleId, "rule has no conditions");
        }

        Set<ConditionNode> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        validateNode(ruleId, rule.getRoot(), 1, seen);

        if (rule.getTimeWindows() != null) {
            for (TimeWindow window : rule.getTimeWindows()) {
                if (window == null || window.getStartMinute() > window.getEndMinute()) {
                    throw new InvalidConditionTreeException(ruleId, "time window start is after its end");
                }
            }
        }

        if (rule.getSequences() != null) {
            for (SequenceRule sequence : rule.getSequences()) {
                validateSequence(ruleId, sequence);
            }
        }
    }

    private void validateNode(Long ruleId, ConditionNode node, int depth, Set<ConditionNode> seen) {
        if (node == null) {
            throw new InvalidConditionTreeException(ruleId, "null condition node");
        }
        if (depth > alertEngineConfig.getMaxConditionDepth()) {
            throw new InvalidConditionTreeException(
                    ruleId, "tree deeper than " + alertEngineConfig.getMaxConditionDepth() + " levels");
        }
        if (!seen.add(node)) {
            throw new InvalidConditionTreeException(ruleId, "condition node reachable more than once");
        }

        switch (node.getNodeType()) {
            case LEAF -> validateLeaf(ruleId, (LeafCondition) node);
            case COMPOSITE -> {
                CompositeCondition composite = (CompositeCondition) node;
                if (composite.getLogic() == null) {
                    throw new InvalidConditionTreeException(ruleId, "composite condition without logic operator");
                }
                List<ConditionNode> children =
                        composite.getChildren() == null ? List.of() : composite.getChildren();
                if (composite.getLogic() == LogicOperator.NOT && children.size() != 1) {
                    throw new InvalidConditionTreeException(
                            ruleId, "NOT takes exactly one child, got " + children.size());
                }
                for (ConditionNode child : children) {
                    validateNode(ruleId, child, depth + 1, seen);
                }
            }
        }
    }

    private void validateLeaf(Long ruleId, LeafCondition leaf) {
        if (leaf.getSignal() == null || leaf.getOperator() == null || leaf.getValue() == null) {
            throw new InvalidConditionTreeException(ruleId, "leaf condition needs signal, operator and value");
        }
    }

    private void validateSequence(Long ruleId, SequenceRule sequence) {
        if (sequence == null || sequence.getEvents() == null || sequence.getEvents().isEmpty()) {
            throw new InvalidConditionTreeException(ruleId, "sequence without trigger conditions");
        }
        if (sequence.getTimeLimitSeconds() <= 0) {
            throw new InvalidConditionTreeException(ruleId, "sequence time limit must be positive");
        }
        for (LeafCondition trigger : sequence.getEvents()) {
            if (trigger == null) {
                throw new InvalidConditionTreeException(ruleId, "null sequence trigger");
            }
            validateLeaf(ruleId, trigger);
        }
    }
}
