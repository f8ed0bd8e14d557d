package com.touchline.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the alert_rules table.
 *
 * <p>The condition tree, time windows and sequences are stored as JSON documents;
 * the tree uses an {@code @type} discriminator of LEAF or COMPOSITE per node.
 */
@Entity
@Table(name = "alert_rules")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AlertRuleEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "description")
    private String description;

    @Column(name = "condition_tree", columnDefinition = "JSON", nullable = false)
    private String conditionTree;

    @Column(name = "time_windows", columnDefinition = "JSON")
    private String timeWindows;

    @Column(name = "sequences", columnDefinition = "JSON")
    private String sequences;

    @Column(name = "team_filter")
    private String teamFilter;

    @Column(name = "league_filter")
    private String leagueFilter;

    @Column(name = "user_id")
    private String userId;

    @Column(name = "user_phone", length = 32)
    private String userPhone;

    @Column(name = "active", nullable = false)
    private boolean active;

    @Column(name = "created_at")
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;
}
