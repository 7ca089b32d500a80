package com.budgetpacing.service.lifecycle;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Value;

/** What one evaluation cycle concluded, handed to the lifecycle controller to persist. */
@Value
@Builder
public class EvaluationUpdate {
    long evaluationBucket;
    LocalDateTime evaluatedAt;
    Long planId;
    double pacingRatio;
    BigDecimal targetDailySpend;
    boolean outsideBand;
    boolean exhausted;

    /** Adjustment awaiting operator approval that now blocks auto-adjustments, if any */
    Long blockingAdjustmentId;
}
