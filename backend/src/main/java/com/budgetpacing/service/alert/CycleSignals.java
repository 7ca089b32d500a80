package com.budgetpacing.service.alert;

import com.budgetpacing.service.pacing.PacingResult;
import java.time.Duration;
import lombok.Builder;
import lombok.Value;

/** Per-cycle observations the threshold rules are evaluated against. */
@Value
@Builder
public class CycleSignals {
    String campaignId;
    PacingResult pacing;
    double effectiveRatio;
    boolean outsideBand;
    int consecutiveOutOfBandCycles;

    /** How long cumulative spend has not grown; null when unknown */
    Duration zeroSpendDuration;
}
