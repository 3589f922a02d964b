package com.lifecycle.engine.projection.companyproduct;

import com.lifecycle.core.model.Event;
import com.lifecycle.core.projection.EventSubscription;
import com.lifecycle.core.projection.Projector;
import com.lifecycle.core.projection.ReadModelStore;
import com.lifecycle.core.projection.ReadModelTable;
import com.lifecycle.engine.projection.Rows;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.*;

import static com.lifecycle.engine.projection.companyproduct.CompanyProductEvents.*;

/**
 * Current process, stage, health and owner of each company product, plus
 * kanban counts per product, process and stage.
 * 
 * Events at or below the row's last applied sequence are skipped. The stage
 * counts are recomputed from the read model rows of the buckets a change
 * leaves and enters, in the same transaction. SLA state and days in stage
 * come from the SLA events, never from the clock, so a rebuild reproduces
 * the counts exactly.
 */
public class CompanyProductReadModelProjector implements Projector {

    public static final String NAME = "company_product_read_model";
    public static final String TABLE = "company_product_read_model";
    public static final String STAGE_COUNTS = "product_pipeline_stage_counts";
    public static final String KEY = "company_product_id";

    private static final Set<EventSubscription> SUBSCRIPTIONS = Set.of(
        EventSubscription.of(AGGREGATE_TYPE, PROCESS_SET),
        EventSubscription.of(AGGREGATE_TYPE, STAGE_SET),
        EventSubscription.of(AGGREGATE_TYPE, PROCESS_COMPLETED),
        EventSubscription.of(AGGREGATE_TYPE, HEALTH_UPDATED),
        EventSubscription.of(AGGREGATE_TYPE, RISK_LEVEL_SET),
        EventSubscription.of(AGGREGATE_TYPE, OWNER_SET),
        EventSubscription.of(AGGREGATE_TYPE, SLA_WARNING),
        EventSubscription.of(AGGREGATE_TYPE, SLA_BREACHED)
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
            ReadModelTable.of(TABLE, KEY),
            ReadModelTable.of(STAGE_COUNTS, "product_id", "process_id", "stage_id")
        );
    }

    @Override
    public void apply(Event event, ReadModelStore store) {
        UUID companyProductId = event.aggregateId();
        Optional<Map<String, Object>> current = store.find(TABLE, Map.of(KEY, companyProductId));
        if (current.isPresent() && Rows.longValue(current.get(), "last_event_sequence") >= event.sequenceNumber()) {
            return;
        }

        Map<String, Object> row = new LinkedHashMap<>();
        row.put(KEY, companyProductId);
        UUID companyId = event.dataUuid("companyId");
        if (companyId != null || current.isEmpty()) {
            row.put("company_id", companyId);
        }
        UUID productId = event.dataUuid("productId");
        if (productId != null || current.isEmpty()) {
            row.put("product_id", productId);
        }

        switch (event.eventType()) {
            case PROCESS_SET -> {
                row.put("current_process_id", event.dataText("toProcessId"));
                row.put("current_process_type", event.dataText("toProcessType"));
                row.put("process_version", event.dataInt("processVersion"));
                row.put("process_completed_at", null);
                row.put("process_outcome", null);
                String initialStageId = event.dataText("initialStageId");
                row.put("current_stage_id", initialStageId);
                row.put("current_stage_name", initialStageId == null ? null : event.dataText("initialStageName"));
                row.put("current_stage_order", initialStageId == null ? null : event.dataInt("initialStageOrder"));
                row.put("stage_entered_at", initialStageId == null ? null : event.createdAt());
                clearSla(row);
            }
            case STAGE_SET -> {
                row.put("current_stage_id", event.dataText("toStageId"));
                row.put("current_stage_name", event.dataText("toStageName"));
                row.put("current_stage_order", event.dataInt("toStageOrder"));
                row.put("stage_entered_at", event.createdAt());
                clearSla(row);
            }
            case PROCESS_COMPLETED -> {
                row.put("process_completed_at", event.createdAt());
                row.put("process_outcome", event.dataText("outcome"));
            }
            case HEALTH_UPDATED -> {
                row.put("health_score", event.dataInt("toScore"));
                if (event.dataText("riskLevel") != null) {
                    row.put("risk_level", event.dataText("riskLevel"));
                }
            }
            case RISK_LEVEL_SET -> row.put("risk_level", event.dataText("toRiskLevel"));
            case OWNER_SET -> {
                row.put("owner_id", event.dataText("toOwnerId"));
                row.put("owner_name", event.dataText("toOwnerName"));
            }
            case SLA_WARNING, SLA_BREACHED -> {
                if (concernsCurrentStage(event, current.orElse(Map.of()))) {
                    row.put("is_sla_warning", true);
                    if (SLA_BREACHED.equals(event.eventType())) {
                        row.put("is_sla_breached", true);
                    }
                    row.put("days_in_current_stage", event.dataInt("actualDays"));
                }
            }
            default -> {
            }
        }

        row.put("last_event_type", event.eventType());
        row.put("last_event_at", event.createdAt());
        row.put("last_event_sequence", event.sequenceNumber());

        Map<String, Object> merged = new HashMap<>(current.orElse(Map.of()));
        merged.putAll(row);
        Optional<List<Object>> left = current.flatMap(CompanyProductReadModelProjector::bucketOf);
        Optional<List<Object>> entered = bucketOf(merged);
        List<Map<String, Object>> siblings = new ArrayList<>();
        UUID bucketProduct = Rows.uuid(merged, "product_id");
        if (bucketProduct != null) {
            siblings.addAll(store.findWhere(TABLE, "product_id", bucketProduct));
        }
        if (left.isPresent() && !left.get().get(0).equals(bucketProduct)) {
            siblings.addAll(store.findWhere(TABLE, "product_id", left.get().get(0)));
        }
        siblings.removeIf(sibling -> companyProductId.equals(Rows.uuid(sibling, KEY)));
        siblings.add(merged);

        store.upsert(TABLE, row);
        Set<List<Object>> affected = new LinkedHashSet<>();
        left.ifPresent(affected::add);
        entered.ifPresent(affected::add);
        for (List<Object> bucket : affected) {
            recount(store, bucket, siblings, merged);
        }
    }

    private static void clearSla(Map<String, Object> row) {
        row.put("is_sla_warning", false);
        row.put("is_sla_breached", false);
        row.put("days_in_current_stage", null);
    }

    private static boolean concernsCurrentStage(Event event, Map<String, Object> row) {
        String stageId = event.dataText("stageId");
        return row.get("current_stage_id") != null
            && (stageId == null || stageId.equals(Rows.text(row, "current_stage_id")));
    }

    /**
     * Product, process and stage a row is counted under, if it is in a stage
     * of a running process.
     */
    private static Optional<List<Object>> bucketOf(Map<String, Object> row) {
        UUID productId = Rows.uuid(row, "product_id");
        String processId = Rows.text(row, "current_process_id");
        String stageId = Rows.text(row, "current_stage_id");
        if (productId == null || processId == null || stageId == null || row.get("process_completed_at") != null) {
            return Optional.empty();
        }
        return Optional.of(List.of(productId, processId, stageId));
    }

    private static void recount(ReadModelStore store, List<Object> bucket,
                                List<Map<String, Object>> candidates, Map<String, Object> changed) {
        Map<String, Object> key = new LinkedHashMap<>();
        key.put("product_id", bucket.get(0));
        key.put("process_id", bucket.get(1));
        key.put("stage_id", bucket.get(2));

        List<Map<String, Object>> members = candidates.stream()
            .filter(candidate -> bucketOf(candidate).filter(bucket::equals).isPresent())
            .toList();
        if (members.isEmpty()) {
            store.delete(STAGE_COUNTS, key);
            return;
        }

        Optional<Map<String, Object>> existing = store.find(STAGE_COUNTS, key);
        int active = 0;
        int stalled = 0;
        int breached = 0;
        long daysSum = 0;
        int daysCount = 0;
        for (Map<String, Object> member : members) {
            if (Boolean.TRUE.equals(member.get("is_sla_breached"))) {
                breached++;
            } else if (Boolean.TRUE.equals(member.get("is_sla_warning"))) {
                stalled++;
            } else {
                active++;
            }
            Integer days = Rows.integer(member, "days_in_current_stage");
            if (days != null) {
                daysSum += days;
                daysCount++;
            }
        }

        Map<String, Object> counts = new LinkedHashMap<>(key);
        if (existing.isEmpty()) {
            // labels come from the row that opened the bucket and are kept while it stays non-empty
            String stageName = Rows.text(changed, "current_stage_name");
            counts.put("process_type", Rows.text(changed, "current_process_type"));
            counts.put("stage_name", stageName == null ? "Unknown" : stageName);
            counts.put("stage_order", Rows.intValue(changed, "current_stage_order"));
        }
        counts.put("total_count", members.size());
        counts.put("active_count", active);
        counts.put("stalled_count", stalled);
        counts.put("breached_count", breached);
        counts.put("avg_days_in_stage", daysCount == 0
            ? null
            : BigDecimal.valueOf(daysSum).divide(BigDecimal.valueOf(daysCount), 2, RoundingMode.HALF_UP));
        store.upsert(STAGE_COUNTS, counts);
    }
}
