package com.touchline.store;

import com.touchline.domain.enums.DispatchStatus;
import com.touchline.domain.model.FireRecord;
import com.touchline.entity.FireRecordEntity;
import com.touchline.exception.StoreUnavailableException;
import com.touchline.mapper.FireRecordMapper;
import com.touchline.notification.DispatchOutcome;
import com.touchline.repository.jpa.FireRecordJpaRepository;
import java.time.LocalDateTime;
import java.util.List;
import org.mapstruct.factory.Mappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Fire-history store backed by the alert_history table.
 *
 * <p>The (rule_id, match_id) unique constraint turns {@link #claim} into an atomic
 * check-and-insert: a duplicate insert is rejected by the database and reported as
 * a lost claim.
 */
@Component
public class JpaFireHistoryStore implements FireHistoryStore {

    private static final Logger log = LoggerFactory.getLogger(JpaFireHistoryStore.class);

    private static final String TABLE = "alert_history";

    private final FireRecordJpaRepository fireRecordJpaRepository;
    private final FireRecordMapper fireRecordMapper = Mappers.getMapper(FireRecordMapper.class);

    public JpaFireHistoryStore(FireRecordJpaRepository fireRecordJpaRepository) {
        this.fireRecordJpaRepository = fireRecordJpaRepository;
    }

    @Override
    public boolean exists(Long ruleId, String matchId) {
        try {
            return fireRecordJpaRepository.existsByRuleIdAndMatchId(ruleId, matchId);
        } catch (DataAccessException e) {
            throw new StoreUnavailableException(TABLE, e);
        }
    }

    @Override
    public boolean claim(Long ruleId, String matchId, String ruleName, String message) {
        FireRecordEntity entity = FireRecordEntity.builder()
                .ruleId(ruleId)
                .matchId(matchId)
                .ruleName(ruleName)
                .message(truncate(message, 1024))
                .dispatchStatus(DispatchStatus.PENDING)
                .firedAt(LocalDateTime.now())
                .build();
        try {
            fireRecordJpaRepository.saveAndFlush(entity);
            return true;
        } catch (DataIntegrityViolationException e) {
            log.info("Rule {} already fired for match {}, claim lost", ruleId, matchId);
            return false;
        } catch (DataAccessException e) {
            throw new StoreUnavailableException(TABLE, e);
        }
    }

    @Override
    @Transactional
    public void recordOutcome(Long ruleId, String matchId, DispatchOutcome outcome) {
        try {
            int updated = fireRecordJpaRepository.updateDispatchOutcome(
                    ruleId, matchId, outcome.getStatus(), outcome.primaryChannel());
            if (updated == 0) {
                log.warn("No pending fire record for rule {} match {}, outcome {} not recorded",
                        ruleId, matchId, outcome.getStatus());
            }
        } catch (DataAccessException e) {
            throw new StoreUnavailableException(TABLE, e);
        }
    }

    @Override
    public List<FireRecord> findByRule(Long ruleId) {
        return fireRecordMapper.toDomainList(fireRecordJpaRepository.findByRuleIdOrderByFiredAtDesc(ruleId));
    }

    @Override
    public List<FireRecord> findRecent() {
        return fireRecordMapper.toDomainList(fireRecordJpaRepository.findTop50ByOrderByFiredAtDesc());
    }

    @Override
    public void verifyAvailable() {
        try {
            fireRecordJpaRepository.count();
        } catch (DataAccessException e) {
            throw new StoreUnavailableException(TABLE, e);
        }
    }

    private static String truncate(String value, int max) {
        return value != null && value.length() > max ? value.substring(0, max) : value;
    }
}
