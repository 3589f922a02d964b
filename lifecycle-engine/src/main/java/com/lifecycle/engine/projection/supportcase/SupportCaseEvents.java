package com.lifecycle.engine.projection.supportcase;

import java.util.Set;

/**
 * Event and value names of the support_case aggregate.
 */
public final class SupportCaseEvents {

    public static final String AGGREGATE_TYPE = "support_case";

    public static final String CREATED = "SupportCaseCreated";
    public static final String ASSIGNED = "SupportCaseAssigned";
    public static final String STATUS_CHANGED = "SupportCaseStatusChanged";
    public static final String SEVERITY_CHANGED = "SupportCaseSeverityChanged";
    public static final String ESCALATED = "SupportCaseEscalated";
    public static final String RESOLVED = "SupportCaseResolved";
    public static final String CLOSED = "SupportCaseClosed";
    public static final String REOPENED = "SupportCaseReopened";
    public static final String TAG_ADDED = "TagAdded";
    public static final String TAG_REMOVED = "TagRemoved";

    public static final String STATUS_OPEN = "open";
    public static final String STATUS_IN_PROGRESS = "in_progress";
    public static final String STATUS_WAITING_ON_CUSTOMER = "waiting_on_customer";
    public static final String STATUS_WAITING_ON_INTERNAL = "waiting_on_internal";
    public static final String STATUS_ESCALATED = "escalated";
    public static final String STATUS_RESOLVED = "resolved";
    public static final String STATUS_CLOSED = "closed";

    public static final Set<String> HIGH_AND_ABOVE = Set.of("high", "urgent", "critical");
    public static final String SEVERITY_CRITICAL = "critical";

    private SupportCaseEvents() {
    }

    public static boolean isOpenStatus(String status) {
        return status != null && !STATUS_RESOLVED.equals(status) && !STATUS_CLOSED.equals(status);
    }
}
