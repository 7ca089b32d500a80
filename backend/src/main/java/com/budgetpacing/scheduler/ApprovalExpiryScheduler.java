package com.budgetpacing.scheduler;

import com.budgetpacing.service.approval.ApprovalGate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class ApprovalExpiryScheduler {

    private final ApprovalGate approvalGate;

    @Scheduled(fixedDelayString = "${app.pacing.approval.expiry-check-interval:PT5M}")
    public void expireOverdueApprovals() {
        try {
            approvalGate.expireOverdue();
        } catch (Exception e) {
            log.error("Approval expiry check failed: {}", e.getMessage(), e);
        }
    }
}
