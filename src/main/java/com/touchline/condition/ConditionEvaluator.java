package com.touchline.condition;

import com.touchline.core.engine.AlertEngineConfig;
import com.touchline.domain.enums.ComparisonOperator;
import com.touchline.domain.enums.TeamSide;
import com.touchline.domain.model.AlertRule;
import com.touchline.domain.model.CompositeCondition;
import com.touchline.domain.model.ConditionNode;
import com.touchline.domain.model.DerivedSignals;
import com.touchline.domain.model.EvaluationResult;
import com.touchline.domain.model.LeafCondition;
import com.touchline.domain.model.MatchSnapshot;
import com.touchline.domain.model.TimeWindow;
import com.touchline.exception.ConditionEvaluationException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Evaluates an alert rule's condition tree against one snapshot and its derived signals.
 *
 * <p><b>Evaluation order:</b>
 * <ol>
 *   <li>Time windows gate everything: if the rule has windows and the elapsed minute is
 *       in none of them the result is not-fired and the tree is not touched.</li>
 *   <li>The tree is evaluated recursively. Leaves resolve their signal for the target
 *       team and compare; composites combine children with AND, OR or NOT.</li>
 *   <li>A true result of a rule with sequences is suppressed unless at least one of its
 *       sequences is complete in the fixture's {@link SequenceBook}.</li>
 * </ol>
 *
 * <p><b>Failure handling:</b> any problem inside a leaf (missing fields, non-numeric
 * comparison value, unknown combination) makes that leaf false and is logged; siblings
 * are still evaluated. Nothing propagates out of {@link #evaluate}.
 *
 * <p><b>Messages:</b> a true leaf renders e.g. {@code "Arsenal goals: 2 >= 2"}. AND joins
 * its children's messages with {@code " AND "} only when all are true. OR joins the
 * messages of its true children with {@code " OR "}. NOT negates its first (only) child
 * and, when true, renders {@code "NOT "} followed by a description of the child.
 *
 * <p>The evaluator keeps no state between calls; repeated evaluation of the same inputs
 * gives the same result.
 */
@Component
@EnableConfigurationProperties(AlertEngineConfig.class)
public class ConditionEvaluator {

    private static final Logger log = LoggerFactory.getLogger(ConditionEvaluator.class);

    private final AlertEngineConfig alertEngineConfig;

    public ConditionEvaluator(AlertEngineConfig alertEngineConfig) {
        this.alertEngineConfig = alertEngineConfig;
    }

    /**
     * Evaluates a rule that is not expected to carry sequences. A rule that does carry
     * them is never fired by this overload since no sequence progress is available.
     */
    public EvaluationResult evaluate(AlertRule rule, MatchSnapshot snapshot, DerivedSignals signals) {
        return evaluate(rule, snapshot, signals, null);
    }

    public EvaluationResult evaluate(
            AlertRule rule, MatchSnapshot snapshot, DerivedSignals signals, SequenceBook sequenceBook) {
        try {
            if (!isWithinTimeWindows(rule, snapshot.getElapsed())) {
                return EvaluationResult.notFired();
            }

            EvaluationResult result = evaluateNode(rule.getRoot(), snapshot, signals, 1);
            if (!result.isFired()) {
                return EvaluationResult.notFired();
            }

            if (rule.hasSequences() && !anySequenceComplete(rule, sequenceBook)) {
                log.debug("Rule {} conditions met but no sequence complete yet", rule.getId());
                return EvaluationResult.notFired();
            }
            return result;
        } catch (RuntimeException e) {
            log.error("Evaluation of rule {} failed: {}", rule.getId(), e.getMessage(), e);
            return EvaluationResult.notFired();
        }
    }

    /**
     * True when the rule has no windows or the elapsed minute falls in at least one
     * inclusive window.
     */
    public boolean isWithinTimeWindows(AlertRule rule, int elapsedMinute) {
        if (!rule.hasTimeWindows()) {
            return true;
        }
        for (TimeWindow window : rule.getTimeWindows()) {
            if (window.contains(elapsedMinute)) {
                return true;
            }
        }
        return false;
    }

    public EvaluationResult evaluateNode(ConditionNode node, MatchSnapshot snapshot, DerivedSignals signals) {
        return evaluateNode(node, snapshot, signals, 1);
    }

    private EvaluationResult evaluateNode(
            ConditionNode node, MatchSnapshot snapshot, DerivedSignals signals, int depth) {
        if (node == null) {
            return EvaluationResult.notFired();
        }
        if (depth > alertEngineConfig.getMaxConditionDepth()) {
            log.warn("Condition tree exceeds max depth {}, treating subtree as false",
                    alertEngineConfig.getMaxConditionDepth());
            return EvaluationResult.notFired();
        }

        return switch (node.getNodeType()) {
            case LEAF -> evaluateLeaf((LeafCondition) node, snapshot, signals);
            case COMPOSITE -> evaluateComposite((CompositeCondition) node, snapshot, signals, depth);
        };
    }

    private EvaluationResult evaluateComposite(
            CompositeCondition composite, MatchSnapshot snapshot, DerivedSignals signals, int depth) {
        List<ConditionNode> children = composite.getChildren();
        if (children == null || children.isEmpty() || composite.getLogic() == null) {
            return EvaluationResult.notFired();
        }

        return switch (composite.getLogic()) {
            case AND -> {
                boolean allTrue = true;
                List<String> messages = new ArrayList<>();
                for (ConditionNode child : children) {
                    EvaluationResult childResult = evaluateNode(child, snapshot, signals, depth + 1);
                    allTrue &= childResult.isFired();
                    if (!childResult.getMessage().isEmpty()) {
                        messages.add(childResult.getMessage());
                    }
                }
                yield allTrue ? EvaluationResult.fired(String.join(" AND ", messages)) : EvaluationResult.notFired();
            }
            case OR -> {
                boolean anyTrue = false;
                List<String> messages = new ArrayList<>();
                for (ConditionNode child : children) {
                    EvaluationResult childResult = evaluateNode(child, snapshot, signals, depth + 1);
                    if (childResult.isFired()) {
                        anyTrue = true;
                        if (!childResult.getMessage().isEmpty()) {
                            messages.add(childResult.getMessage());
                        }
                    }
                }
                yield anyTrue ? EvaluationResult.fired(String.join(" OR ", messages)) : EvaluationResult.notFired();
            }
            case NOT -> {
                // Single-child operator; extra children are rejected when the rule is loaded
                ConditionNode child = children.get(0);
                EvaluationResult childResult = evaluateNode(child, snapshot, signals, depth + 1);
                yield childResult.isFired()
                        ? EvaluationResult.notFired()
                        : EvaluationResult.fired("NOT " + describe(child));
            }
        };
    }

    /**
     * Evaluates one leaf. Never throws; failures are logged and yield not-fired.
     */
    public EvaluationResult evaluateLeaf(LeafCondition leaf, MatchSnapshot snapshot, DerivedSignals signals) {
        try {
            if (leaf.getSignal() == null || leaf.getOperator() == null) {
                throw new ConditionEvaluationException("Leaf condition is missing its signal or operator");
            }
            String team = leaf.getTeam() == null ? "" : leaf.getTeam();
            TeamSide side = snapshot.resolveSide(team);
            ComparisonOperator operator = leaf.getOperator();
            Object expected = leaf.getValue();

            return switch (leaf.getSignal()) {
                case GOALS -> {
                    int goals = snapshot.score(side);
                    yield leafResult(
                            compare(goals, operator, expected),
                            () -> team + " goals: " + goals + " " + operator.getSymbol() + " " + expected);
                }
                case SCORE_DIFFERENCE -> {
                    int difference = snapshot.score(side) - snapshot.score(side.opponent());
                    yield leafResult(
                            compare(difference, operator, expected),
                            () -> team + " lead: " + difference + " " + operator.getSymbol() + " " + expected);
                }
                case TIME_ELAPSED -> {
                    int elapsed = snapshot.getElapsed();
                    yield leafResult(
                            compare(elapsed, operator, expected),
                            () -> "Match time: " + elapsed + " " + operator.getSymbol() + " " + expected + " minutes");
                }
                case XG -> {
                    double xg = signals.xg(side);
                    yield leafResult(
                            compare(xg, operator, expected),
                            () -> String.format(Locale.ROOT, "%s xG: %.2f %s %s", team, xg, operator.getSymbol(), expected));
                }
                case MOMENTUM -> {
                    double momentum = signals.momentum(side);
                    yield leafResult(
                            compare(momentum, operator, expected),
                            () -> String.format(
                                    Locale.ROOT, "%s momentum: %.1f %s %s", team, momentum, operator.getSymbol(), expected));
                }
                case PRESSURE -> {
                    double pressure = signals.pressure(side);
                    yield leafResult(
                            compare(pressure, operator, expected),
                            () -> String.format(
                                    Locale.ROOT, "%s pressure: %.2f %s %s", team, pressure, operator.getSymbol(), expected));
                }
                case WIN_PROBABILITY -> {
                    double probability = signals.winProbability(side);
                    boolean fired = compare(probability, operator, expected);
                    double threshold = requireNumber(expected).doubleValue();
                    yield leafResult(
                            fired,
                            () -> String.format(
                                    Locale.ROOT,
                                    "%s win probability: %.1f%% %s %.1f%%",
                                    team,
                                    probability * 100,
                                    operator.getSymbol(),
                                    threshold * 100));
                }
            };
        } catch (RuntimeException e) {
            log.warn("Leaf condition {} evaluated as false: {}", describe(leaf), e.getMessage());
            return EvaluationResult.notFired();
        }
    }

    /**
     * Applies an operator. Ordering operators require numbers on both sides; equality
     * compares numerically when both sides are numbers and by value otherwise;
     * the substring operators compare lower-cased string forms.
     */
    public boolean compare(Object actual, ComparisonOperator operator, Object expected) {
        return switch (operator) {
            case EQUALS -> valueEquals(actual, expected);
            case NOT_EQUALS -> !valueEquals(actual, expected);
            case GREATER_THAN -> numericCompare(actual, expected) > 0;
            case GREATER_THAN_OR_EQUAL -> numericCompare(actual, expected) >= 0;
            case LESS_THAN -> numericCompare(actual, expected) < 0;
            case LESS_THAN_OR_EQUAL -> numericCompare(actual, expected) <= 0;
            case CONTAINS -> lowerString(actual).contains(lowerString(expected));
            case NOT_CONTAINS -> !lowerString(actual).contains(lowerString(expected));
        };
    }

    /** Human-readable form of a subtree, used for NOT messages and logging. */
    public String describe(ConditionNode node) {
        if (node == null) {
            return "<empty>";
        }
        return switch (node.getNodeType()) {
            case LEAF -> {
                LeafCondition leaf = (LeafCondition) node;
                String signal = leaf.getSignal() == null
                        ? "?"
                        : leaf.getSignal().name().toLowerCase(Locale.ROOT).replace('_', ' ');
                String operator = leaf.getOperator() == null ? "?" : leaf.getOperator().getSymbol();
                yield (leaf.getTeam() == null || leaf.getTeam().isEmpty() ? "" : leaf.getTeam() + " ")
                        + signal + " " + operator + " " + leaf.getValue();
            }
            case COMPOSITE -> {
                CompositeCondition composite = (CompositeCondition) node;
                List<ConditionNode> children = composite.getChildren() == null ? List.of() : composite.getChildren();
                yield "(" + children.stream()
                        .map(this::describe)
                        .collect(Collectors.joining(" " + composite.getLogic() + " ")) + ")";
            }
        };
    }

    private boolean anySequenceComplete(AlertRule rule, SequenceBook sequenceBook) {
        if (sequenceBook == null) {
            return false;
        }
        for (int i = 0; i < rule.getSequences().size(); i++) {
            if (sequenceBook.isComplete(rule.getId(), i)) {
                return true;
            }
        }
        return false;
    }

    private static EvaluationResult leafResult(boolean fired, Supplier<String> message) {
        return fired ? EvaluationResult.fired(message.get()) : EvaluationResult.notFired();
    }

    private static boolean valueEquals(Object actual, Object expected) {
        if (actual instanceof Number a && expected instanceof Number e) {
            return a.doubleValue() == e.doubleValue();
        }
        return Objects.equals(actual, expected);
    }

    private static int numericCompare(Object actual, Object expected) {
        return Double.compare(requireNumber(actual).doubleValue(), requireNumber(expected).doubleValue());
    }

    private static Number requireNumber(Object value) {
        if (value instanceof Number number) {
            return number;
        }
        throw new ConditionEvaluationException("Expected a numeric operand but got "
                + (value == null ? "null" : value.getClass().getSimpleName() + " '" + value + "'"));
    }

    private static String lowerString(Object value) {
        return String.valueOf(value).toLowerCase(Locale.ROOT);
    }
}
