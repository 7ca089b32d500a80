package com.budgetpacing.entity;

import jakarta.persistence.*;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;

/**
 * A proposed change to a campaign's daily budget. At most one adjustment exists per campaign per
 * evaluation bucket, enforced by a unique constraint rather than by the caller. Adjustments made
 * outside a monitoring cycle (the resume at the start of a period) carry no bucket.
 */
@Data
@Entity
@Table(
        name = "budget_adjustments",
        uniqueConstraints = {
            @UniqueConstraint(
                    name = "uk_adjustment_campaign_bucket",
                    columnNames = {"campaign_id", "evaluation_bucket"})
        },
        indexes = {
            @Index(name = "idx_adjustment_status_expires", columnList = "status, expires_at"),
            @Index(name = "idx_adjustment_campaign_created", columnList = "campaign_id, created_at")
        })
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BudgetAdjustment {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "campaign_id", nullable = false, updatable = false, length = 64)
    private String campaignId;

    @Column(name = "plan_id", nullable = false, updatable = false)
    private Long planId;

    @Column(name = "evaluation_bucket", updatable = false)
    private Long evaluationBucket;

    @Enumerated(EnumType.STRING)
    @Column(name = "kind", nullable = false, updatable = false, length = 30)
    private AdjustmentKind kind;

    @Column(name = "previous_amount", nullable = false, precision = 14, scale = 2)
    private BigDecimal previousAmount;

    @Column(name = "proposed_amount", nullable = false, precision = 14, scale = 2)
    private BigDecimal proposedAmount;

    @Column(name = "pacing_ratio")
    private Double pacingRatio;

    @Column(name = "reason", nullable = false, length = 500)
    private String reason;

    @Column(name = "requires_approval", nullable = false)
    private boolean requiresApproval;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    @Builder.Default
    private AdjustmentStatus status = AdjustmentStatus.PENDING;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "expires_at")
    private LocalDateTime expiresAt;

    @Column(name = "decided_by", length = 100)
    private String decidedBy;

    @Column(name = "decided_at")
    private LocalDateTime decidedAt;

    @Column(name = "decision_note", length = 500)
    private String decisionNote;

    @Column(name = "commit_started_at")
    private LocalDateTime commitStartedAt;

    @Column(name = "commit_attempts", nullable = false)
    @Builder.Default
    private int commitAttempts = 0;

    @Column(name = "applied_at")
    private LocalDateTime appliedAt;

    @Column(name = "failure_reason", length = 1000)
    private String failureReason;

    @Version
    @Column(name = "version")
    private Long version;

    public BigDecimal delta() {
        return proposedAmount.subtract(previousAmount);
    }

    public boolean isExpired(LocalDateTime now) {
        return status == AdjustmentStatus.PENDING && expiresAt != null && !now.isBefore(expiresAt);
    }

    public String idempotencyKey() {
        return "adjustment-" + id;
    }
}
