package com.touchline.store;

import com.touchline.domain.model.AlertRule;
import java.util.List;

/**
 * Source of the active alert rules. Read at the start of every polling cycle.
 */
public interface RuleStore {

    /**
     * Loads every active rule with its condition tree, time windows and sequences.
     * Rules whose stored tree is malformed are left out and logged.
     *
     * @throws com.touchline.exception.StoreUnavailableException when the store cannot be read
     */
    List<AlertRule> loadActiveRules();

    /** Probes the store once. Throws StoreUnavailableException when it is unreachable. */
    void verifyAvailable();
}
