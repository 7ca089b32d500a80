package com.budgetpacing.entity;

import jakarta.persistence.*;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Operator-facing alert. {@code openKey} is populated only while the alert is open, so the unique
 * constraint on it allows a single open alert per campaign and type while keeping resolved history.
 */
@Data
@Entity
@Table(
        name = "alerts",
        uniqueConstraints = {
            @UniqueConstraint(
                    name = "uk_alert_open_key",
                    columnNames = {"open_key"})
        },
        indexes = {
            @Index(name = "idx_alert_campaign_created", columnList = "campaign_id, created_at"),
            @Index(name = "idx_alert_resolved", columnList = "resolved_at")
        })
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Alert {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "campaign_id", nullable = false, updatable = false, length = 64)
    private String campaignId;

    @Enumerated(EnumType.STRING)
    @Column(name = "type", nullable = false, updatable = false, length = 40)
    private AlertType type;

    @Enumerated(EnumType.STRING)
    @Column(name = "severity", nullable = false, length = 20)
    private AlertSeverity severity;

    @Column(name = "message", nullable = false, length = 1000)
    private String message;

    @Column(name = "recommended_action", length = 500)
    private String recommendedAction;

    @Column(name = "current_spend", precision = 14, scale = 2)
    private BigDecimal currentSpend;

    @Column(name = "budget_limit", precision = 14, scale = 2)
    private BigDecimal budgetLimit;

    @Column(name = "projected_spend", precision = 14, scale = 2)
    private BigDecimal projectedSpend;

    @Column(name = "open_key", length = 120)
    private String openKey;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "resolved_at")
    private LocalDateTime resolvedAt;

    @Column(name = "resolved_by", length = 100)
    private String resolvedBy;

    public static String openKey(String campaignId, AlertType type) {
        return campaignId + ":" + type.name();
    }

    public boolean isOpen() {
        return resolvedAt == null;
    }

    public void resolve(String resolvedBy, LocalDateTime at) {
        this.resolvedAt = at;
        this.resolvedBy = resolvedBy;
        this.openKey = null;
    }
}
