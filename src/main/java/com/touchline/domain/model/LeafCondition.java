package com.touchline.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.touchline.domain.enums.ComparisonOperator;
import com.touchline.domain.enums.ConditionNodeType;
import com.touchline.domain.enums.SignalKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Single comparison of one signal for one team against a constant.
 *
 * <p>{@code value} keeps the JSON type it was stored with (Integer, Double or String)
 * so fired messages print it back the way the rule author wrote it.
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LeafCondition implements ConditionNode {

    private SignalKind signal;

    /** Free-text team reference, matched against the home and away names. */
    private String team;

    private ComparisonOperator operator;
    private Object value;

    @Override
    @JsonIgnore
    public ConditionNodeType getNodeType() {
        return ConditionNodeType.LEAF;
    }

    /**
     * Identity of this condition inside a sequence. Two triggers with the same key
     * count once towards completion.
     */
    @JsonIgnore
    public String getIdentityKey() {
        return signal + "_" + team + "_" + operator + "_" + value;
    }
}
