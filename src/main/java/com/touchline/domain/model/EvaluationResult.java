package com.touchline.domain.model;

import lombok.Value;

/**
 * Outcome of evaluating a rule or a subtree. The message is empty whenever
 * {@code fired} is false.
 */
@Value
public class EvaluationResult {

    private static final EvaluationResult NOT_FIRED = new EvaluationResult(false, "");

    boolean fired;
    String message;

    public static EvaluationResult notFired() {
        return NOT_FIRED;
    }

    public static EvaluationResult fired(String message) {
        return new EvaluationResult(true, message);
    }

    public static EvaluationResult of(boolean fired, String message) {
        return new EvaluationResult(fired, message);
    }
}
