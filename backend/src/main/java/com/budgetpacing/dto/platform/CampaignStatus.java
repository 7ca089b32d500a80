package com.budgetpacing.dto.platform;

public enum CampaignStatus {
    ACTIVE,
    PAUSED,
    REMOVED
}
