package com.touchline.domain.enums;

/** Tag of a condition tree node. */
public enum ConditionNodeType {
    LEAF,
    COMPOSITE
}
