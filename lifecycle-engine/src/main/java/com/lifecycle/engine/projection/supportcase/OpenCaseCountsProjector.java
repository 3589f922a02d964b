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

import static com.lifecycle.engine.projection.supportcase.SupportCaseEvents.*;

/**
 * Open support case counts per company product and per company.
 * 
 * Keeps one membership row per case (status, severity, open flag) and
 * recomputes the affected count rows from the membership rows after every
 * change, so the counts never drift from the cases they summarize.
 */
public class OpenCaseCountsProjector implements Projector {

    private static final Logger log = LoggerFactory.getLogger(OpenCaseCountsProjector.class);

    public static final String NAME = "open_case_counts";
    public static final String MEMBERS = "open_case_members";
    public static final String PRODUCT_COUNTS = "company_product_open_case_counts";
    public static final String COMPANY_COUNTS = "company_open_case_counts";

    private static final List<String> SEVERITIES = List.of("low", "medium", "high", "urgent", "critical");

    private static final Set<EventSubscription> SUBSCRIPTIONS = Set.of(
        EventSubscription.of(AGGREGATE_TYPE, CREATED),
        EventSubscription.of(AGGREGATE_TYPE, STATUS_CHANGED),
        EventSubscription.of(AGGREGATE_TYPE, SEVERITY_CHANGED),
        EventSubscription.of(AGGREGATE_TYPE, RESOLVED),
        EventSubscription.of(AGGREGATE_TYPE, CLOSED),
        EventSubscription.of(AGGREGATE_TYPE, REOPENED)
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
        return List.of(
            ReadModelTable.of(MEMBERS, "support_case_id"),
            ReadModelTable.of(PRODUCT_COUNTS, "company_product_id"),
            ReadModelTable.of(COMPANY_COUNTS, "company_id")
        );
    }

    @Override
    public void apply(Event event, ReadModelStore store) {
        UUID caseId = event.aggregateId();
        Optional<Map<String, Object>> current = store.find(MEMBERS, Map.of("support_case_id", caseId));

        if (current.isPresent() && Rows.longValue(current.get(), "last_event_sequence") >= event.sequenceNumber()) {
            return;
        }
        if (current.isEmpty() && !CREATED.equals(event.eventType())) {
            log.warn("Support case {} is not tracked, skipping {}", caseId, event.describe());
            return;
        }

        Map<String, Object> member = new LinkedHashMap<>();
        if (current.isPresent()) {
            member.putAll(current.get());
        } else {
            member.put("support_case_id", caseId);
            member.put("company_id", event.dataUuid("companyId"));
            member.put("company_product_id", event.dataUuid("companyProductId"));
            member.put("status", STATUS_OPEN);
            member.put("severity", event.dataText("severity"));
        }

        switch (event.eventType()) {
            case STATUS_CHANGED -> member.put("status", event.dataText("toStatus"));
            case SEVERITY_CHANGED -> member.put("severity", event.dataText("toSeverity"));
            case RESOLVED -> member.put("status", STATUS_RESOLVED);
            case CLOSED -> member.put("status", STATUS_CLOSED);
            case REOPENED -> member.put("status", STATUS_OPEN);
            default -> {
            }
        }
        member.put("is_open", isOpenStatus(Rows.text(member, "status")));
        member.put("last_event_sequence", event.sequenceNumber());

        UUID companyId = Rows.uuid(member, "company_id");
        UUID companyProductId = Rows.uuid(member, "company_product_id");

        List<Map<String, Object>> productMembers = companyProductId == null
            ? List.of()
            : openMembers(store, "company_product_id", companyProductId, member);
        List<Map<String, Object>> companyMembers = companyId == null
            ? List.of()
            : openMembers(store, "company_id", companyId, member);

        store.upsert(MEMBERS, member);
        if (companyProductId != null) {
            store.upsert(PRODUCT_COUNTS, productCounts(companyProductId, companyId, productMembers));
        }
        if (companyId != null) {
            store.upsert(COMPANY_COUNTS, companyCounts(companyId, companyMembers));
        }
    }

    /**
     * Open members matching the column, with the pending change to this case
     * taking the place of its stored row.
     */
    private static List<Map<String, Object>> openMembers(ReadModelStore store, String column, UUID value,
                                                         Map<String, Object> changed) {
        Object caseId = changed.get("support_case_id");
        List<Map<String, Object>> members = new ArrayList<>();
        for (Map<String, Object> row : store.findWhere(MEMBERS, column, value)) {
            if (!caseId.equals(Rows.uuid(row, "support_case_id")) && Boolean.TRUE.equals(row.get("is_open"))) {
                members.add(row);
            }
        }
        if (Boolean.TRUE.equals(changed.get("is_open"))) {
            members.add(changed);
        }
        return members;
    }

    private static Map<String, Object> productCounts(UUID companyProductId, UUID companyId,
                                                     List<Map<String, Object>> open) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("company_product_id", companyProductId);
        row.put("company_id", companyId);
        row.put("total_open_count", open.size());
        row.put("open_count", countStatus(open, STATUS_OPEN));
        row.put("in_progress_count", countStatus(open, STATUS_IN_PROGRESS));
        row.put("waiting_count",
            countStatus(open, STATUS_WAITING_ON_CUSTOMER) + countStatus(open, STATUS_WAITING_ON_INTERNAL));
        row.put("escalated_count", countStatus(open, STATUS_ESCALATED));
        for (String severity : SEVERITIES) {
            row.put(severity + "_count", (int) open.stream()
                .filter(member -> severity.equals(Rows.text(member, "severity")))
                .count());
        }
        return row;
    }

    private static Map<String, Object> companyCounts(UUID companyId, List<Map<String, Object>> open) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("company_id", companyId);
        row.put("total_open_count", open.size());
        row.put("unassigned_product_count", (int) open.stream()
            .filter(member -> member.get("company_product_id") == null)
            .count());
        row.put("high_and_above_count", (int) open.stream()
            .filter(member -> isHighOrAbove(Rows.text(member, "severity")))
            .count());
        row.put("critical_count", (int) open.stream()
            .filter(member -> SEVERITY_CRITICAL.equals(Rows.text(member, "severity")))
            .count());
        return row;
    }

    private static boolean isHighOrAbove(String severity) {
        return severity != null && HIGH_AND_ABOVE.contains(severity);
    }

    private static int countStatus(List<Map<String, Object>> open, String status) {
        return (int) open.stream().filter(member -> status.equals(Rows.text(member, "status"))).count();
    }
}
