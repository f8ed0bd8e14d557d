package com.touchline.mapper;

import com.touchline.domain.model.AlertRule;
import com.touchline.domain.model.ConditionNode;
import com.touchline.domain.model.SequenceRule;
import com.touchline.domain.model.TimeWindow;
import com.touchline.entity.AlertRuleEntity;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Named;

/**
 * MapStruct mapper between the AlertRule domain model and AlertRuleEntity.
 *
 * <p>The condition tree, time windows and sequences are JSON columns in the entity.
 * Missing window and sequence columns map to empty lists.
 */
@Mapper
public interface AlertRuleMapper {

    @Mapping(source = "conditionTree", target = "root", qualifiedByName = "jsonToConditionTree")
    @Mapping(source = "timeWindows", target = "timeWindows", qualifiedByName = "jsonToTimeWindows")
    @Mapping(source = "sequences", target = "sequences", qualifiedByName = "jsonToSequences")
    AlertRule toDomain(AlertRuleEntity entity);

    @Mapping(source = "root", target = "conditionTree", qualifiedByName = "conditionTreeToJson")
    @Mapping(source = "timeWindows", target = "timeWindows", qualifiedByName = "timeWindowsToJson")
    @Mapping(source = "sequences", target = "sequences", qualifiedByName = "sequencesToJson")
    AlertRuleEntity toEntity(AlertRule rule);

    List<AlertRule> toDomainList(List<AlertRuleEntity> entities);

    @Named("jsonToConditionTree")
    default ConditionNode jsonToConditionTree(String json) {
        return JsonHelper.read(json, ConditionNode.class);
    }

    @Named("conditionTreeToJson")
    default String conditionTreeToJson(ConditionNode root) {
        return JsonHelper.write(root, ConditionNode.class);
    }

    @Named("jsonToTimeWindows")
    default List<TimeWindow> jsonToTimeWindows(String json) {
        return JsonHelper.readList(json, TimeWindow.class);
    }

    @Named("timeWindowsToJson")
    default String timeWindowsToJson(List<TimeWindow> windows) {
        return JsonHelper.writeList(windows, TimeWindow.class);
    }

    @Named("jsonToSequences")
    default List<SequenceRule> jsonToSequences(String json) {
        return JsonHelper.readList(json, SequenceRule.class);
    }

    @Named("sequencesToJson")
    default String sequencesToJson(List<SequenceRule> sequences) {
        return JsonHelper.writeList(sequences, SequenceRule.class);
    }
}
