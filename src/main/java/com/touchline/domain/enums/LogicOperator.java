package com.touchline.domain.enums;

/**
 * Boolean combinators for composite conditions.
 */
public enum LogicOperator {
    /** All children must be true. */
    AND,
    /** At least one child must be true. */
    OR,
    /** Negates the single child. Trees with more than one NOT child are rejected at load time. */
    NOT
}
