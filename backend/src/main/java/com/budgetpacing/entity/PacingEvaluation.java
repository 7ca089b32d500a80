package com.budgetpacing.entity;

import jakarta.persistence.*;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Record of one evaluation cycle; doubles as the ratio history for adaptive pacing. */
@Data
@Entity
@Table(
        name = "pacing_evaluations",
        uniqueConstraints = {
            @UniqueConstraint(
                    name = "uk_evaluation_campaign_bucket",
                    columnNames = {"campaign_id", "evaluation_bucket"})
        },
        indexes = {
            @Index(
                    name = "idx_evaluation_campaign_evaluated",
                    columnList = "campaign_id, evaluated_at")
        })
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PacingEvaluation {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "campaign_id", nullable = false, updatable = false, length = 64)
    private String campaignId;

    @Column(name = "plan_id")
    private Long planId;

    @Column(name = "evaluation_bucket", nullable = false, updatable = false)
    private Long evaluationBucket;

    @Column(name = "evaluated_at", nullable = false)
    private LocalDateTime evaluatedAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "outcome", nullable = false, length = 30)
    private EvaluationOutcome outcome;

    @Column(name = "pacing_ratio")
    private Double pacingRatio;

    @Column(name = "smoothed_ratio")
    private Double smoothedRatio;

    @Column(name = "cumulative_spend", precision = 14, scale = 2)
    private BigDecimal cumulativeSpend;

    @Column(name = "target_daily_spend", precision = 14, scale = 2)
    private BigDecimal targetDailySpend;

    @Column(name = "projected_spend", precision = 14, scale = 2)
    private BigDecimal projectedSpend;

    @Enumerated(EnumType.STRING)
    @Column(name = "budget_status", length = 20)
    private BudgetStatus budgetStatus;

    @Enumerated(EnumType.STRING)
    @Column(name = "phase_before", length = 20)
    private PacingPhase phaseBefore;

    @Enumerated(EnumType.STRING)
    @Column(name = "phase_after", length = 20)
    private PacingPhase phaseAfter;

    @Column(name = "adjustment_id")
    private Long adjustmentId;

    @Column(name = "detail", length = 500)
    private String detail;
}
