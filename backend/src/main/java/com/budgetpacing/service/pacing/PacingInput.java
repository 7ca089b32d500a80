package com.budgetpacing.service.pacing;

import java.math.BigDecimal;

/**
 * Calendar position and spend figures for one evaluation.
 *
 * @param monthlyBudget B, the plan's budget for the whole period
 * @param spendToDate S, cumulative spend since the period started
 * @param dayOfPeriod d, 1-based
 * @param daysInPeriod D
 */
public record PacingInput(
        String campaignId,
        BigDecimal monthlyBudget,
        BigDecimal spendToDate,
        int dayOfPeriod,
        int daysInPeriod) {}
