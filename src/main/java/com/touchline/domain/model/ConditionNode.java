package com.touchline.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.touchline.domain.enums.ConditionNodeType;

/**
 * A node of an alert rule's boolean condition tree: either a {@link LeafCondition}
 * or a {@link CompositeCondition}. The evaluator switches on {@link #getNodeType()}.
 *
 * <p>Trees are parsed from the rule's JSON column once per load and treated as
 * read-only afterwards. The {@code @type} property selects the variant; a node
 * without one is read as a leaf, which is how sequence triggers are usually stored.
 */
@JsonTypeInfo(
        use = JsonTypeInfo.Id.NAME,
        include = JsonTypeInfo.As.PROPERTY,
        property = "@type",
        defaultImpl = LeafCondition.class)
@JsonSubTypes({
    @JsonSubTypes.Type(value = LeafCondition.class, name = "LEAF"),
    @JsonSubTypes.Type(value = CompositeCondition.class, name = "COMPOSITE"),
})
public interface ConditionNode {

    @JsonIgnore
    ConditionNodeType getNodeType();
}
