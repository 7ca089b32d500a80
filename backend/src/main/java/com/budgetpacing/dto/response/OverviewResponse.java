package com.budgetpacing.dto.response;

import com.budgetpacing.entity.PacingPhase;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Portfolio-wide counts for the dashboard header. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OverviewResponse {
    private long totalCampaigns;
    private Map<PacingPhase, Long> campaignsByPhase;
    private long openAlerts;
    private long pendingApprovals;
    private long unpublishedEvents;
    private long undeliverableEvents;
}
