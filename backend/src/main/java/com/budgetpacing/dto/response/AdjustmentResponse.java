package com.budgetpacing.dto.response;

import com.budgetpacing.entity.AdjustmentKind;
import com.budgetpacing.entity.AdjustmentStatus;
import com.budgetpacing.entity.BudgetAdjustment;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AdjustmentResponse {
    private Long id;
    private String campaignId;
    private Long planId;
    private AdjustmentKind kind;
    private AdjustmentStatus status;
    private BigDecimal previousAmount;
    private BigDecimal proposedAmount;
    private Double pacingRatio;
    private String reason;
    private boolean requiresApproval;
    private LocalDateTime createdAt;
    private LocalDateTime expiresAt;
    private String decidedBy;
    private LocalDateTime decidedAt;
    private String decisionNote;
    private LocalDateTime appliedAt;
    private int commitAttempts;
    private String failureReason;

    public static AdjustmentResponse from(BudgetAdjustment adjustment) {
        return AdjustmentResponse.builder()
                .id(adjustment.getId())
                .campaignId(adjustment.getCampaignId())
                .planId(adjustment.getPlanId())
                .kind(adjustment.getKind())
                .status(adjustment.getStatus())
                .previousAmount(adjustment.getPreviousAmount())
                .proposedAmount(adjustment.getProposedAmount())
                .pacingRatio(adjustment.getPacingRatio())
                .reason(adjustment.getReason())
                .requiresApproval(adjustment.isRequiresApproval())
                .createdAt(adjustment.getCreatedAt())
                .expiresAt(adjustment.getExpiresAt())
                .decidedBy(adjustment.getDecidedBy())
                .decidedAt(adjustment.getDecidedAt())
                .decisionNote(adjustment.getDecisionNote())
                .appliedAt(adjustment.getAppliedAt())
                .commitAttempts(adjustment.getCommitAttempts())
                .failureReason(adjustment.getFailureReason())
                .build();
    }
}
