package com.budgetpacing.entity;

import jakarta.persistence.*;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.CreationTimestamp;

/**
 * Monthly budget target for one campaign. Immutable within its period; the only change a plan
 * ever sees is being retired when the next period's plan takes over.
 */
@Entity
@Table(
        name = "budget_plans",
        uniqueConstraints = {
            @UniqueConstraint(
                    name = "uk_budget_plan_campaign_period",
                    columnNames = {"campaign_id", "period_start"})
        },
        indexes = {
            @Index(name = "idx_budget_plan_campaign", columnList = "campaign_id"),
            @Index(name = "idx_budget_plan_current", columnList = "current_plan")
        })
@Getter
@ToString
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class BudgetPlan {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "campaign_id", nullable = false, updatable = false, length = 64)
    private String campaignId;

    @Column(
            name = "monthly_budget",
            nullable = false,
            updatable = false,
            precision = 14,
            scale = 2)
    private BigDecimal monthlyBudget;

    @Column(name = "period_start", nullable = false, updatable = false)
    private LocalDate periodStart;

    /** Last day of the period, inclusive */
    @Column(name = "period_end", nullable = false, updatable = false)
    private LocalDate periodEnd;

    @Enumerated(EnumType.STRING)
    @Column(name = "strategy", nullable = false, updatable = false, length = 20)
    private PacingStrategy strategy;

    @Column(name = "current_plan", nullable = false)
    @Builder.Default
    private boolean current = true;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    public int daysInPeriod() {
        return (int) ChronoUnit.DAYS.between(periodStart, periodEnd) + 1;
    }

    /** 1-based position of {@code date} in the period, or 0 when the date falls outside it */
    public int dayOfPeriod(LocalDate date) {
        if (!contains(date)) {
            return 0;
        }
        return (int) ChronoUnit.DAYS.between(periodStart, date) + 1;
    }

    public boolean contains(LocalDate date) {
        return !date.isBefore(periodStart) && !date.isAfter(periodEnd);
    }

    /** Even-distribution daily budget, used until a budget has been applied */
    public BigDecimal baselineDailyBudget() {
        int days = daysInPeriod();
        if (days <= 0) {
            return BigDecimal.ZERO;
        }
        return monthlyBudget.divide(BigDecimal.valueOf(days), 2, RoundingMode.HALF_UP);
    }

    public boolean isWellFormed() {
        return monthlyBudget != null
                && monthlyBudget.signum() >= 0
                && periodStart != null
                && periodEnd != null
                && periodEnd.isAfter(periodStart)
                && strategy != null;
    }

    public void retire() {
        this.current = false;
    }
}
