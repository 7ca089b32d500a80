package com.budgetpacing.service.lifecycle;

import com.budgetpacing.entity.PacingPhase;
import lombok.Builder;
import lombok.Data;

@Builder
@Data
public class PhaseTransitionResult {
    private final String campaignId;
    private final boolean success;
    private final PacingPhase fromPhase;
    private final PacingPhase toPhase;
    private final String errorMessage;

    public static PhaseTransitionResult success(
            String campaignId, PacingPhase fromPhase, PacingPhase toPhase) {
        return PhaseTransitionResult.builder()
                .campaignId(campaignId)
                .success(true)
                .fromPhase(fromPhase)
                .toPhase(toPhase)
                .build();
    }

    public static PhaseTransitionResult failed(
            String campaignId, PacingPhase fromPhase, PacingPhase toPhase, String errorMessage) {
        return PhaseTransitionResult.builder()
                .campaignId(campaignId)
                .success(false)
                .fromPhase(fromPhase)
                .toPhase(toPhase)
                .errorMessage(errorMessage)
                .build();
    }

    public boolean isChange() {
        return success && fromPhase != toPhase;
    }
}
