package com.touchline.unit.condition;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.touchline.condition.ConditionTreeValidator;
import com.touchline.core.engine.AlertEngineConfig;
import com.touchline.domain.enums.ComparisonOperator;
import com.touchline.domain.enums.LogicOperator;
import com.touchline.domain.enums.SignalKind;
import com.touchline.domain.model.AlertRule;
import com.touchline.domain.model.CompositeCondition;
import com.touchline.domain.model.ConditionNode;
import com.touchline.domain.model.LeafCondition;
import com.touchline.domain.model.SequenceRule;
import com.touchline.domain.model.TimeWindow;
import com.touchline.exception.InvalidConditionTreeException;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ConditionTreeValidatorTest {

    private ConditionTreeValidator conditionTreeValidator;
    private AlertEngineConfig alertEngineConfig;

    @BeforeEach
    void setUp() {
        alertEngineConfig = new AlertEngineConfig();
        conditionTreeValidator = new ConditionTreeValidator(alertEngineConfig);
    }

    private static LeafCondition goals(int value) {
        return LeafCondition.builder()
                .signal(SignalKind.GOALS).team("Arsenal").operator(ComparisonOperator.GREATER_THAN_OR_EQUAL).value(value)
                .build();
    }

    private static AlertRule rule(ConditionNode root) {
        return AlertRule.builder().id(42L).name("Rule").root(root).build();
    }

    @Test
    @DisplayName("Accepts a well-formed tree with windows and sequences")
    void acceptsValidRule() {
        AlertRule rule = rule(CompositeCondition.and(goals(1), CompositeCondition.not(goals(3))));
        rule.setTimeWindows(List.of(new TimeWindow(0, 45, null)));
        rule.setSequences(List.of(SequenceRule.builder().events(List.of(goals(1))).timeLimitSeconds(300).build()));

        assertThatCode(() -> conditionTreeValidator.validate(rule)).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Rejects a rule without conditions")
    void rejectsMissingRoot() {
        assertThatThrownBy(() -> conditionTreeValidator.validate(rule(null)))
                .isInstanceOf(InvalidConditionTreeException.class)
                .hasMessageContaining("42");
    }

    @Test
    @DisplayName("Rejects NOT with two children")
    void rejectsWideNot() {
        CompositeCondition not = new CompositeCondition(LogicOperator.NOT, List.of(goals(1), goals(2)));

        assertThatThrownBy(() -> conditionTreeValidator.validate(rule(not)))
                .isInstanceOf(InvalidConditionTreeException.class)
                .hasMessageContaining("NOT");
    }

    @Test
    @DisplayName("Rejects cycles")
    void rejectsCycle() {
        CompositeCondition root = CompositeCondition.builder().logic(LogicOperator.OR).build();
        root.getChildren().add(goals(1));
        root.getChildren().add(root);

        assertThatThrownBy(() -> conditionTreeValidator.validate(rule(root)))
                .isInstanceOf(InvalidConditionTreeException.class);
    }

    @Test
    @DisplayName("Rejects trees deeper than the configured bound")
    void rejectsDeepTree() {
        alertEngineConfig.setMaxConditionDepth(2);
        ConditionNode root = CompositeCondition.and(CompositeCondition.and(goals(1)));

        assertThatThrownBy(() -> conditionTreeValidator.validate(rule(root)))
                .isInstanceOf(InvalidConditionTreeException.class)
                .hasMessageContaining("deeper");
    }

    @Test
    @DisplayName("Rejects a leaf without a value")
    void rejectsIncompleteLeaf() {
        LeafCondition leaf = LeafCondition.builder().signal(SignalKind.XG).operator(ComparisonOperator.GREATER_THAN).build();

        assertThatThrownBy(() -> conditionTreeValidator.validate(rule(leaf)))
                .isInstanceOf(InvalidConditionTreeException.class);
    }

    @Test
    @DisplayName("Rejects an inverted time window")
    void rejectsInvertedWindow() {
        AlertRule rule = rule(goals(1));
        rule.setTimeWindows(List.of(new TimeWindow(80, 70, null)));

        assertThatThrownBy(() -> conditionTreeValidator.validate(rule))
                .isInstanceOf(InvalidConditionTreeException.class);
    }

    @Test
    @DisplayName("Rejects sequences without triggers or with a non-positive limit")
    void rejectsBadSequences() {
        AlertRule empty = rule(goals(1));
        empty.setSequences(List.of(SequenceRule.builder().timeLimitSeconds(60).build()));
        AlertRule zeroLimit = rule(goals(1));
        zeroLimit.setSequences(List.of(SequenceRule.builder().events(List.of(goals(1))).timeLimitSeconds(0).build()));

        assertThatThrownBy(() -> conditionTreeValidator.validate(empty)).isInstanceOf(InvalidConditionTreeException.class);
        assertThatThrownBy(() -> conditionTreeValidator.validate(zeroLimit))
                .isInstanceOf(InvalidConditionTreeException.class);
    }
}
