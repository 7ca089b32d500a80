package com.budgetpacing.event;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Operator decision received from the approval queue. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ApprovalDecisionEvent {
    private Long adjustmentId;
    private boolean approved;
    private String decidedBy;
    private String note;
}
