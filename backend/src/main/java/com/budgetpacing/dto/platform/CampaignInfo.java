package com.budgetpacing.dto.platform;

import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Campaign identity as known to the registry. Read-only. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CampaignInfo {
    private String campaignId;
    private CampaignStatus status;
    private LocalDateTime createdAt;

    public boolean isRunning() {
        return status == CampaignStatus.ACTIVE;
    }
}
