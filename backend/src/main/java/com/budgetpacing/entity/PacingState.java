package com.budgetpacing.entity;

import jakarta.persistence.*;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.UpdateTimestamp;

/**
 * Live pacing state, one row per campaign. Only the lifecycle controller writes it, always through
 * the {@link Version} column so concurrent operator overrides are detected instead of overwritten.
 */
@Data
@Entity
@Table(
        name = "pacing_states",
        indexes = {@Index(name = "idx_pacing_state_phase", columnList = "phase")})
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PacingState {

    @Id
    @Column(name = "campaign_id", length = 64)
    private String campaignId;

    @Column(name = "plan_id")
    private Long planId;

    @Enumerated(EnumType.STRING)
    @Column(name = "phase", nullable = false, length = 20)
    @Builder.Default
    private PacingPhase phase = PacingPhase.ACTIVE;

    /** Band phase to return to once a blocking approval is resolved */
    @Enumerated(EnumType.STRING)
    @Column(name = "resume_phase", length = 20)
    private PacingPhase resumePhase;

    @Column(name = "pacing_ratio")
    @Builder.Default
    private double pacingRatio = 0.0;

    @Column(name = "target_daily_spend", precision = 14, scale = 2)
    private BigDecimal targetDailySpend;

    @Column(name = "last_evaluated_at")
    private LocalDateTime lastEvaluatedAt;

    @Column(name = "last_evaluation_bucket")
    private Long lastEvaluationBucket;

    @Column(name = "last_applied_budget", precision = 14, scale = 2)
    private BigDecimal lastAppliedBudget;

    @Column(name = "last_applied_at")
    private LocalDateTime lastAppliedAt;

    @Column(name = "blocking_adjustment_id")
    private Long blockingAdjustmentId;

    @Column(name = "consecutive_out_of_band")
    @Builder.Default
    private int consecutiveOutOfBandCycles = 0;

    @Version
    @Column(name = "version")
    private Long version;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;
}
