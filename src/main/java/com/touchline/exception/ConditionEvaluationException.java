package com.touchline.exception;

/**
 * Raised while resolving or comparing a single leaf condition. Never escapes the
 * evaluator: the leaf is treated as false and evaluation of its siblings continues.
 */
public class ConditionEvaluationException extends BaseException {

    public ConditionEvaluationException(String message) {
        super(ErrorCode.EVALUATION_ERROR, message);
    }

    public ConditionEvaluationException(String message, Throwable cause) {
        super(ErrorCode.EVALUATION_ERROR, message, cause);
    }
}
