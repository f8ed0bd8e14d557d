package com.touchline.repository.jpa;

import com.touchline.entity.AlertRuleEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the alert_rules table.
 */
@Repository
public interface AlertRuleJpaRepository extends JpaRepository<AlertRuleEntity, Long> {

    List<AlertRuleEntity> findByActiveTrue();
}
