package com.touchline.repository.jpa;

import com.touchline.domain.enums.DispatchStatus;
import com.touchline.domain.enums.NotificationChannel;
import com.touchline.entity.FireRecordEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the alert_history table.
 *
 * <p>Rows are inserted once per (rule, match) by the fire-history store. The only
 * update is the one-time dispatch outcome, restricted to rows still PENDING.
 */
@Repository
public interface FireRecordJpaRepository extends JpaRepository<FireRecordEntity, Long> {

    boolean existsByRuleIdAndMatchId(Long ruleId, String matchId);

    List<FireRecordEntity> findByRuleIdOrderByFiredAtDesc(Long ruleId);

    List<FireRecordEntity> findTop50ByOrderByFiredAtDesc();

    @Modifying
    @Query("UPDATE FireRecordEntity f SET f.dispatchStatus = :status, f.sentVia = :sentVia "
            + "WHERE f.ruleId = :ruleId AND f.matchId = :matchId "
            + "AND f.dispatchStatus = com.touchline.domain.enums.DispatchStatus.PENDING")
    int updateDispatchOutcome(
            @Param("ruleId") Long ruleId,
            @Param("matchId") String matchId,
            @Param("status") DispatchStatus status,
            @Param("sentVia") NotificationChannel sentVia);
}
