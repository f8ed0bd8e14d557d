package com.touchline.store;

import com.touchline.condition.ConditionTreeValidator;
import com.touchline.domain.model.AlertRule;
import com.touchline.entity.AlertRuleEntity;
import com.touchline.exception.InvalidConditionTreeException;
import com.touchline.exception.StoreUnavailableException;
import com.touchline.mapper.AlertRuleMapper;
import com.touchline.repository.jpa.AlertRuleJpaRepository;
import java.util.ArrayList;
import java.util.List;
import org.mapstruct.factory.Mappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

/**
 * Rule store backed by the alert_rules table.
 *
 * <p>Each row is mapped and validated on its own. A row with an unparseable or
 * invalid condition tree is logged and skipped so one bad rule never blocks the rest.
 * Database failures surface as {@link StoreUnavailableException}.
 */
@Component
public class JpaRuleStore implements RuleStore {

    private static final Logger log = LoggerFactory.getLogger(JpaRuleStore.class);

    private final AlertRuleJpaRepository alertRuleJpaRepository;
    private final ConditionTreeValidator conditionTreeValidator;
    private final AlertRuleMapper alertRuleMapper = Mappers.getMapper(AlertRuleMapper.class);

    public JpaRuleStore(AlertRuleJpaRepository alertRuleJpaRepository, ConditionTreeValidator conditionTreeValidator) {
        this.alertRuleJpaRepository = alertRuleJpaRepository;
        this.conditionTreeValidator = conditionTreeValidator;
    }

    @Override
    public List<AlertRule> loadActiveRules() {
        List<AlertRuleEntity> entities;
        try {
            entities = alertRuleJpaRepository.findByActiveTrue();
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("alert_rules", e);
        }

        List<AlertRule> rules = new ArrayList<>(entities.size());
        for (AlertRuleEntity entity : entities) {
            try {
                AlertRule rule = alertRuleMapper.toDomain(entity);
                conditionTreeValidator.validate(rule);
                rules.add(rule);
            } catch (InvalidConditionTreeException e) {
                log.error("Skipping rule {} ({}): {}", entity.getId(), entity.getName(), e.getMessage());
            } catch (IllegalStateException e) {
                log.error("Skipping rule {} ({}): stored JSON could not be read", entity.getId(), entity.getName(), e);
            }
        }

        log.debug("Loaded {} active rules ({} skipped)", rules.size(), entities.size() - rules.size());
        return rules;
    }

    @Override
    public void verifyAvailable() {
        try {
            alertRuleJpaRepository.count();
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("alert_rules", e);
        }
    }
}
