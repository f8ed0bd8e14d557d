package com.touchline.api.controller;

import com.touchline.domain.model.FireRecord;
import com.touchline.store.FireHistoryStore;
import java.util.List;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read-only REST API over the fire history.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code GET /api/alerts/history} -- the 50 most recent fires across all rules</li>
 *   <li>{@code GET /api/alerts/{ruleId}/history} -- every fire of one rule, newest first</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/alerts")
public class AlertHistoryController {

    private final FireHistoryStore fireHistoryStore;

    public AlertHistoryController(FireHistoryStore fireHistoryStore) {
        this.fireHistoryStore = fireHistoryStore;
    }

    @GetMapping("/history")
    public List<FireRecord> getRecentHistory() {
        return fireHistoryStore.findRecent();
    }

    @GetMapping("/{ruleId}/history")
    public List<FireRecord> getRuleHistory(@PathVariable Long ruleId) {
        return fireHistoryStore.findByRule(ruleId);
    }
}
