package com.touchline.store;

import com.touchline.domain.model.FireRecord;
import com.touchline.notification.DispatchOutcome;
import java.util.List;

/**
 * Durable record of which rules fired for which matches.
 *
 * <p>{@link #claim} is the atomic check-and-insert that guarantees a rule fires at
 * most once per match. Callers dispatch only after winning the claim.
 */
public interface FireHistoryStore {

    boolean exists(Long ruleId, String matchId);

    /**
     * Inserts a PENDING fire record for (ruleId, matchId).
     *
     * @return true if this call created the record, false if one already existed
     */
    boolean claim(Long ruleId, String matchId, String ruleName, String message);

    /** Writes the dispatch status once. Records no longer PENDING are left alone. */
    void recordOutcome(Long ruleId, String matchId, DispatchOutcome outcome);

    List<FireRecord> findByRule(Long ruleId);

    List<FireRecord> findRecent();

    void verifyAvailable();
}
