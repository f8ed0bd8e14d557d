package com.touchline.entity;

import com.touchline.domain.enums.DispatchStatus;
import com.touchline.domain.enums.NotificationChannel;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the alert_history table.
 *
 * <p>One row per (rule, match) that fired. The unique constraint is what makes the
 * insert an atomic claim: a second insert for the same pair fails instead of
 * creating a duplicate, so a rule can fire at most once per match even when two
 * cycles or workers race.
 */
@Entity
@Table(
        name = "alert_history",
        uniqueConstraints = @UniqueConstraint(name = "uk_alert_history_rule_match", columnNames = {"rule_id", "match_id"}))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class FireRecordEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "rule_id", nullable = false)
    private Long ruleId;

    @Column(name = "match_id", nullable = false, length = 64)
    private String matchId;

    @Column(name = "rule_name")
    private String ruleName;

    @Column(name = "message", length = 1024)
    private String message;

    @Enumerated(EnumType.STRING)
    @Column(name = "dispatch_status", columnDefinition = "varchar(20)", nullable = false)
    private DispatchStatus dispatchStatus;

    @Enumerated(EnumType.STRING)
    @Column(name = "sent_via", columnDefinition = "varchar(20)")
    private NotificationChannel sentVia;

    @Column(name = "fired_at", nullable = false)
    private LocalDateTime firedAt;
}
