package com.budgetpacing.entity;

import jakarta.persistence.*;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.CreationTimestamp;

/** Append-only spend ledger entry. One row per campaign per timestamp bucket. */
@Entity
@Table(
        name = "spend_snapshots",
        uniqueConstraints = {
            @UniqueConstraint(
                    name = "uk_spend_snapshot_bucket",
                    columnNames = {"campaign_id", "bucket_start"})
        },
        indexes = {
            @Index(
                    name = "idx_spend_snapshot_campaign_captured",
                    columnList = "campaign_id, captured_at")
        })
@Getter
@ToString
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class SpendSnapshot {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "campaign_id", nullable = false, updatable = false, length = 64)
    private String campaignId;

    @Column(name = "captured_at", nullable = false, updatable = false)
    private LocalDateTime capturedAt;

    @Column(name = "bucket_start", nullable = false, updatable = false)
    private LocalDateTime bucketStart;

    @Column(
            name = "cumulative_spend_mtd",
            nullable = false,
            updatable = false,
            precision = 14,
            scale = 2)
    private BigDecimal cumulativeSpendMonthToDate;

    @Column(name = "daily_spend", nullable = false, updatable = false, precision = 14, scale = 2)
    private BigDecimal dailySpend;

    @Column(name = "source_confidence", nullable = false, updatable = false)
    private double sourceConfidence;

    @Enumerated(EnumType.STRING)
    @Column(name = "source", nullable = false, updatable = false, length = 10)
    private SnapshotSource source;

    @CreationTimestamp
    @Column(name = "received_at", updatable = false)
    private LocalDateTime receivedAt;
}
