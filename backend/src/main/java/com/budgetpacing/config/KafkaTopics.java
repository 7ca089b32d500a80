package com.budgetpacing.config;

public final class KafkaTopics {

    public static final String ADJUSTMENTS_READY = "pacing.adjustments.ready";
    public static final String APPROVAL_REQUESTED = "pacing.adjustments.approval-requested";
    public static final String ALERTS_RAISED = "pacing.alerts.raised";
    public static final String APPROVAL_DECISIONS = "pacing.approval.decisions";
    public static final String SPEND_REPORTS = "pacing.spend.reports";

    private KafkaTopics() {}
}
