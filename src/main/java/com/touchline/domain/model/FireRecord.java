package com.touchline.domain.model;

import com.touchline.domain.enums.DispatchStatus;
import com.touchline.domain.enums.NotificationChannel;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * The fact that a rule fired for a match. At most one exists per (ruleId, matchId).
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class FireRecord {

    private Long id;
    private Long ruleId;
    private String matchId;
    private String ruleName;
    private String message;

    // Dispatch outcome, written once after delivery was attempted
    private DispatchStatus dispatchStatus;
    private NotificationChannel sentVia;

    private LocalDateTime firedAt;
}
