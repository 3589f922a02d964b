package com.lifecycle.engine.projection.companyproduct;

import com.lifecycle.core.model.Event;
import com.lifecycle.core.projection.EventSubscription;
import com.lifecycle.core.projection.Projector;
import com.lifecycle.core.projection.ReadModelStore;
import com.lifecycle.core.projection.ReadModelTable;
import com.lifecycle.engine.projection.Rows;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.*;

import static com.lifecycle.engine.projection.companyproduct.CompanyProductEvents.*;

/**
 * One fact row per stage a company product entered, closed when the product
 * leaves the stage.
 * 
 * Facts are keyed by the id of the entering event, so an entry is written at
 * most once. A stage is only closed by an event later in the stream than the
 * one that opened it, which keeps replays over existing rows from closing the
 * wrong fact.
 */
public class CompanyProductStageFactsProjector implements Projector {

    public static final String NAME = "company_product_stage_facts";
    public static final String TABLE = "company_product_stage_facts";
    public static final String KEY = "entry_event_id";

    private static final Set<EventSubscription> SUBSCRIPTIONS = Set.of(
        EventSubscription.of(AGGREGATE_TYPE, PROCESS_SET),
        EventSubscription.of(AGGREGATE_TYPE, STAGE_SET),
        EventSubscription.of(AGGREGATE_TYPE, PROCESS_COMPLETED)
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
        if (store.find(TABLE, Map.of(KEY, event.eventId())).isPresent()) {
            return;
        }

        List<Map<String, Object>> facts = store.findWhere(TABLE, "company_product_id", event.aggregateId());
        List<Map<String, Object>> earlier = facts.stream()
            .filter(fact -> Rows.longValue(fact, "entry_sequence") < event.sequenceNumber())
            .sorted(Comparator.comparingLong(fact -> Rows.longValue(fact, "entry_sequence")))
            .toList();
        Map<String, Object> latest = earlier.isEmpty() ? null : earlier.get(earlier.size() - 1);

        List<Map<String, Object>> writes = new ArrayList<>();
        switch (event.eventType()) {
            case PROCESS_SET -> {
                closeOpen(earlier, event, EXIT_PROGRESSED, writes);
                if (event.dataText("initialStageId") != null) {
                    writes.add(entry(event, latest,
                        event.dataText("toProcessId"),
                        event.dataText("toProcessType"),
                        event.dataText("initialStageId"),
                        event.dataText("initialStageName"),
                        event.dataInt("initialStageOrder")));
                }
            }
            case STAGE_SET -> {
                Integer toOrder = event.dataInt("toStageOrder");
                Integer fromOrder = event.dataInt("fromStageOrder");
                if (fromOrder == null && latest != null) {
                    fromOrder = Rows.integer(latest, "stage_order");
                }
                String reason = fromOrder != null && toOrder != null && toOrder < fromOrder
                    ? EXIT_REGRESSED
                    : EXIT_PROGRESSED;
                closeOpen(earlier, event, reason, writes);

                String processId = event.dataText("processId");
                String processType = event.dataText("processType");
                if (processId == null && latest != null) {
                    processId = Rows.text(latest, "process_id");
                }
                if (processType == null && latest != null) {
                    processType = Rows.text(latest, "process_type");
                }
                writes.add(entry(event, latest, processId, processType,
                    event.dataText("toStageId"), event.dataText("toStageName"), toOrder));
            }
            case PROCESS_COMPLETED -> closeOpen(earlier, event, EXIT_COMPLETED, writes);
            default -> {
            }
        }

        writes.forEach(row -> store.upsert(TABLE, row));
    }

    private static Map<String, Object> entry(Event event, Map<String, Object> latest,
                                             String processId, String processType,
                                             String stageId, String stageName, Integer stageOrder) {
        UUID companyId = event.dataUuid("companyId");
        if (companyId == null && latest != null) {
            companyId = Rows.uuid(latest, "company_id");
        }
        Map<String, Object> row = new LinkedHashMap<>();
        row.put(KEY, event.eventId());
        row.put("company_product_id", event.aggregateId());
        row.put("company_id", companyId);
        row.put("entry_sequence", event.sequenceNumber());
        row.put("process_id", processId);
        row.put("process_type", processType);
        row.put("stage_id", stageId);
        row.put("stage_name", stageName);
        row.put("stage_order", stageOrder);
        row.put("sla_days", event.dataInt("slaDays"));
        row.put("entered_at", event.createdAt());
        row.put("exited_at", null);
        row.put("exit_reason", null);
        row.put("duration_seconds", null);
        row.put("sla_met", null);
        return row;
    }

    private static void closeOpen(List<Map<String, Object>> earlier, Event exit, String reason,
                                  List<Map<String, Object>> writes) {
        for (Map<String, Object> fact : earlier) {
            if (fact.get("exited_at") != null) {
                continue;
            }
            Instant enteredAt = Rows.instant(fact, "entered_at");
            Instant exitedAt = exit.createdAt();
            Integer slaDays = Rows.integer(fact, "sla_days");

            Map<String, Object> update = new LinkedHashMap<>();
            update.put(KEY, Rows.uuid(fact, KEY));
            update.put("company_product_id", Rows.uuid(fact, "company_product_id"));
            update.put("entry_sequence", Rows.longValue(fact, "entry_sequence"));
            update.put("exited_at", exitedAt);
            update.put("exit_reason", reason);
            update.put("duration_seconds", Duration.between(enteredAt, exitedAt).getSeconds());
            update.put("sla_met", slaDays == null ? null : businessDays(enteredAt, exitedAt) <= slaDays);
            writes.add(update);
        }
    }

    /**
     * Weekdays between two instants, counted in whole days from the start, in UTC.
     */
    static int businessDays(Instant start, Instant end) {
        int count = 0;
        ZonedDateTime current = start.atZone(ZoneOffset.UTC);
        ZonedDateTime until = end.atZone(ZoneOffset.UTC);
        while (current.isBefore(until)) {
            DayOfWeek day = current.getDayOfWeek();
            if (day != DayOfWeek.SATURDAY && day != DayOfWeek.SUNDAY) {
                count++;
            }
            current = current.plusDays(1);
        }
        return count;
    }
}
