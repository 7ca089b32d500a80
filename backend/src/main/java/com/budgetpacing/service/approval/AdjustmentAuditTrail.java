package com.budgetpacing.service.approval;

import com.budgetpacing.entity.AdjustmentAuditLog;
import com.budgetpacing.entity.AuditAction;
import com.budgetpacing.entity.BudgetAdjustment;
import com.budgetpacing.repository.jpa.AdjustmentAuditLogRepository;
import java.time.Clock;
import java.time.LocalDateTime;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Writes an audit row for every status change of an adjustment, in the caller's transaction. */
@Component
@RequiredArgsConstructor
public class AdjustmentAuditTrail {

    private final AdjustmentAuditLogRepository auditLogRepository;
    private final Clock clock;

    public void record(
            BudgetAdjustment adjustment, AuditAction action, String actor, String details) {
        auditLogRepository.save(
                AdjustmentAuditLog.builder()
                        .adjustmentId(adjustment.getId())
                        .campaignId(adjustment.getCampaignId())
                        .action(action)
                        .statusAfter(adjustment.getStatus())
                        .amount(adjustment.getProposedAmount())
                        .actor(actor)
                        .details(details)
                        .createdAt(LocalDateTime.now(clock))
                        .build());
    }
}
