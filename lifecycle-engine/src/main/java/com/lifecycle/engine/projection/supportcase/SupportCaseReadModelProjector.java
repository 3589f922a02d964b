package com.lifecycle.engine.projection.supportcase;

import com.lifecycle.core.model.Event;
import com.lifecycle.core.projection.EventSubscription;
import com.lifecycle.core.projection.Projector;
import com.lifecycle.core.projection.ReadModelStore;
import com.lifecycle.core.projection.ReadModelTable;
import com.lifecycle.engine.projection.Rows;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.stream.Collectors;

import static com.lifecycle.engine.projection.supportcase.SupportCaseEvents.*;

/**
 * Current state of each support case, one row per case.
 * 
 * Rows remember the aggregate sequence of the last event applied; an event
 * at or below it is skipped, which makes re-application a no-op.
 */
public class SupportCaseReadModelProjector implements Projector {

    private static final Logger log = LoggerFactory.getLogger(SupportCaseReadModelProjector.class);

    public static final String NAME = "support_case_read_model";
    public static final String TABLE = "support_case_read_model";
    public static final String KEY = "support_case_id";

    private static final Set<EventSubscription> SUBSCRIPTIONS = Set.of(
        EventSubscription.of(AGGREGATE_TYPE, CREATED),
        EventSubscription.of(AGGREGATE_TYPE, ASSIGNED),
        EventSubscription.of(AGGREGATE_TYPE, STATUS_CHANGED),
        EventSubscription.of(AGGREGATE_TYPE, SEVERITY_CHANGED),
        EventSubscription.of(AGGREGATE_TYPE, ESCALATED),
        EventSubscription.of(AGGREGATE_TYPE, RESOLVED),
        EventSubscription.of(AGGREGATE_TYPE, CLOSED),
        EventSubscription.of(AGGREGATE_TYPE, REOPENED),
        EventSubscription.of(AGGREGATE_TYPE, TAG_ADDED),
        EventSubscription.of(AGGREGATE_TYPE, TAG_REMOVED)
    );

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Set<EventSubscription> subscriptions() {
        return SUBSCRIPTIONS;
    }

    @Override
    public List<ReadModelTable> outputs() {
        return List.of(ReadModelTable.of(TABLE, KEY));
    }

    @Override
    public void apply(Event event, ReadModelStore store) {
        UUID caseId = event.aggregateId();
        Optional<Map<String, Object>> current = store.find(TABLE, Map.of(KEY, caseId));

        if (current.isPresent() && Rows.longValue(current.get(), "last_event_sequence") >= event.sequenceNumber()) {
            log.debug("Skipping {} for case {}: already applied", event.eventType(), caseId);
            return;
        }
        if (current.isEmpty() && !CREATED.equals(event.eventType())) {
            log.warn("Support case {} has no row, skipping {}", caseId, event.describe());
            return;
        }

        Map<String, Object> row = new LinkedHashMap<>();
        row.put(KEY, caseId);

        switch (event.eventType()) {
            case CREATED -> {
                row.put("company_id", event.dataUuid("companyId"));
                row.put("company_product_id", event.dataUuid("companyProductId"));
                row.put("title", event.dataText("title"));
                row.put("description", event.dataText("description"));
                row.put("source", event.dataText("source"));
                row.put("status", STATUS_OPEN);
                row.put("severity", event.dataText("severity"));
                row.put("category", event.dataText("category"));
                row.put("owner_id", null);
                row.put("owner_name", null);
                row.put("assigned_team", null);
                row.put("tags", "");
                row.put("escalation_count", 0);
                row.put("reopen_count", 0);
                row.put("opened_at", event.createdAt());
                row.put("resolved_at", null);
                row.put("closed_at", null);
                row.put("resolution_summary", null);
                row.put("root_cause", null);
                row.put("engagement_impact", null);
            }
            case ASSIGNED -> {
                row.put("owner_id", event.dataText("toOwnerId"));
                row.put("owner_name", event.dataText("toOwnerName"));
                row.put("assigned_team", event.dataText("team"));
            }
            case STATUS_CHANGED -> row.put("status", event.dataText("toStatus"));
            case SEVERITY_CHANGED -> row.put("severity", event.dataText("toSeverity"));
            case ESCALATED -> {
                row.put("status", STATUS_ESCALATED);
                row.put("escalation_count", Rows.intValue(current.get(), "escalation_count") + 1);
                if (event.dataText("escalatedToUserId") != null) {
                    row.put("owner_id", event.dataText("escalatedToUserId"));
                    row.put("owner_name", event.dataText("escalatedToUserName"));
                }
                if (event.dataText("escalatedToTeam") != null) {
                    row.put("assigned_team", event.dataText("escalatedToTeam"));
                }
            }
            case RESOLVED -> {
                row.put("status", STATUS_RESOLVED);
                row.put("resolved_at", event.createdAt());
                row.put("resolution_summary", event.dataText("resolutionSummary"));
                row.put("root_cause", event.dataText("rootCause"));
            }
            case CLOSED -> {
                row.put("status", STATUS_CLOSED);
                row.put("closed_at", event.createdAt());
                String closeReason = event.dataText("closeReason");
                if ("no_response".equals(closeReason) || "cancelled".equals(closeReason)) {
                    row.put("engagement_impact", "neutral");
                }
            }
            case REOPENED -> {
                row.put("status", STATUS_OPEN);
                row.put("closed_at", null);
                row.put("resolved_at", null);
                row.put("resolution_summary", null);
                row.put("reopen_count", Rows.intValue(current.get(), "reopen_count") + 1);
            }
            case TAG_ADDED -> {
                SortedSet<String> tags = tags(current.get());
                String tag = event.dataText("tag");
                if (tag != null && !tag.isBlank()) {
                    tags.add(tag.trim());
                }
                row.put("tags", String.join(",", tags));
            }
            case TAG_REMOVED -> {
                SortedSet<String> tags = tags(current.get());
                String tag = event.dataText("tag");
                if (tag != null) {
                    tags.remove(tag.trim());
                }
                row.put("tags", String.join(",", tags));
            }
            default -> {
                // metadata columns only
            }
        }

        row.put("last_event_type", event.eventType());
        row.put("last_event_at", event.createdAt());
        row.put("last_event_sequence", event.sequenceNumber());
        store.upsert(TABLE, row);
    }

    private static SortedSet<String> tags(Map<String, Object> row) {
        String tags = Rows.text(row, "tags");
        if (tags == null || tags.isEmpty()) {
            return new TreeSet<>();
        }
        return Arrays.stream(tags.split(","))
            .filter(tag -> !tag.isEmpty())
            .collect(Collectors.toCollection(TreeSet::new));
    }
}
