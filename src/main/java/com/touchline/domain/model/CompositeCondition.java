package com.touchline.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.touchline.domain.enums.ConditionNodeType;
import com.touchline.domain.enums.LogicOperator;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CompositeCondition implements ConditionNode {

    private LogicOperator logic;

    @Builder.Default
    private List<ConditionNode> children = new ArrayList<>();

    @Override
    @JsonIgnore
    public ConditionNodeType getNodeType() {
        return ConditionNodeType.COMPOSITE;
    }

    public static CompositeCondition and(ConditionNode... children) {
        return new CompositeCondition(LogicOperator.AND, List.of(children));
    }

    public static CompositeCondition or(ConditionNode... children) {
        return new CompositeCondition(LogicOperator.OR, List.of(children));
    }

    public static CompositeCondition not(ConditionNode child) {
        return new CompositeCondition(LogicOperator.NOT, List.of(child));
    }
}
