package com.touchline.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Comparison operators available to leaf conditions.
 *
 * <p>Ordering operators need numeric operands on both sides. Equality compares
 * numerically when both operands are numbers and by string value otherwise.
 * CONTAINS/NOT_CONTAINS compare the lower-cased string forms.
 */
@Getter
@RequiredArgsConstructor
public enum ComparisonOperator {
    EQUALS("=="),
    NOT_EQUALS("!="),
    GREATER_THAN(">"),
    GREATER_THAN_OR_EQUAL(">="),
    LESS_THAN("<"),
    LESS_THAN_OR_EQUAL("<="),
    CONTAINS("contains"),
    NOT_CONTAINS("not_contains");

    /** Symbol used when rendering fired-condition messages. */
    private final String symbol;
}
