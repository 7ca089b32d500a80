package com.budgetpacing.entity;

import jakarta.persistence.*;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Append-only trail of every status change an adjustment goes through. */
@Data
@Entity
@Table(
        name = "adjustment_audit_log",
        indexes = {
            @Index(name = "idx_adjustment_audit_adjustment", columnList = "adjustment_id"),
            @Index(name = "idx_adjustment_audit_campaign", columnList = "campaign_id, created_at")
        })
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AdjustmentAuditLog {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "adjustment_id", nullable = false)
    private Long adjustmentId;

    @Column(name = "campaign_id", nullable = false, length = 64)
    private String campaignId;

    @Enumerated(EnumType.STRING)
    @Column(name = "action", nullable = false, length = 30)
    private AuditAction action;

    @Enumerated(EnumType.STRING)
    @Column(name = "status_after", nullable = false, length = 20)
    private AdjustmentStatus statusAfter;

    @Column(name = "amount", precision = 14, scale = 2)
    private BigDecimal amount;

    @Column(name = "actor", length = 100)
    private String actor;

    @Column(name = "details", length = 1000)
    private String details;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;
}
