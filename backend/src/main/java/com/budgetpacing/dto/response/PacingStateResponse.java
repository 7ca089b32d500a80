package com.budgetpacing.dto.response;

import com.budgetpacing.entity.PacingPhase;
import com.budgetpacing.entity.PacingState;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Read-only snapshot of a campaign's pacing state for dashboards. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PacingStateResponse {
    private String campaignId;
    private Long planId;
    private PacingPhase phase;
    private double pacingRatio;
    private BigDecimal targetDailySpend;
    private BigDecimal lastAppliedBudget;
    private LocalDateTime lastAppliedAt;
    private LocalDateTime lastEvaluatedAt;
    private Long blockingAdjustmentId;
    private int consecutiveOutOfBandCycles;

    /** Pass back as the expected version of a phase override */
    private Long version;

    public static PacingStateResponse from(PacingState state) {
        return PacingStateResponse.builder()
                .campaignId(state.getCampaignId())
                .planId(state.getPlanId())
                .phase(state.getPhase())
                .pacingRatio(state.getPacingRatio())
                .targetDailySpend(state.getTargetDailySpend())
                .lastAppliedBudget(state.getLastAppliedBudget())
                .lastAppliedAt(state.getLastAppliedAt())
                .lastEvaluatedAt(state.getLastEvaluatedAt())
                .blockingAdjustmentId(state.getBlockingAdjustmentId())
                .consecutiveOutOfBandCycles(state.getConsecutiveOutOfBandCycles())
                .version(state.getVersion())
                .build();
    }
}
