package com.touchline.domain.model;

import com.touchline.domain.enums.LogicOperator;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * A user-authored alert: a condition tree, optional time and sequence gates, and
 * the notification target.
 *
 * <p>Rules are reloaded from the rule store at the start of every polling cycle and
 * not modified while the cycle runs. Deactivation happens outside the engine by
 * clearing {@code active}; inactive rules are never returned by the store.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AlertRule {

    private Long id;
    private String name;
    private String description;

    // Conditions
    private ConditionNode root;

    @Builder.Default
    private List<TimeWindow> timeWindows = new ArrayList<>();

    @Builder.Default
    private List<SequenceRule> sequences = new ArrayList<>();

    // Applicability filters, both optional
    private String teamFilter;
    private String leagueFilter;

    // Notification target
    private String userId;
    private String userPhone;

    @Builder.Default
    private boolean active = true;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    /** Logic of the root composite, or null when the root is a single leaf. */
    public LogicOperator getLogicMode() {
        return root instanceof CompositeCondition composite ? composite.getLogic() : null;
    }

    public boolean hasTimeWindows() {
        return timeWindows != null && !timeWindows.isEmpty();
    }

    public boolean hasSequences() {
        return sequences != null && !sequences.isEmpty();
    }

    /**
     * Whether the team and league filters admit this match. Unset filters admit
     * everything; matching is a case-insensitive substring test.
     */
    public boolean appliesTo(MatchSnapshot snapshot) {
        if (teamFilter != null && !teamFilter.isBlank()) {
            String team = teamFilter.toLowerCase(Locale.ROOT);
            boolean home = snapshot.getHomeTeam() != null
                    && snapshot.getHomeTeam().toLowerCase(Locale.ROOT).contains(team);
            boolean away = snapshot.getAwayTeam() != null
                    && snapshot.getAwayTeam().toLowerCase(Locale.ROOT).contains(team);
            if (!home && !away) {
                return false;
            }
        }
        if (leagueFilter != null && !leagueFilter.isBlank()) {
            return snapshot.getLeague() != null
                    && snapshot.getLeague().toLowerCase(Locale.ROOT).contains(leagueFilter.toLowerCase(Locale.ROOT));
        }
        return true;
    }
}
