package com.lifecycle.engine.projection.supportcase;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.lifecycle.engine.test.InMemoryEventStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.UUID;

import static com.lifecycle.engine.projection.supportcase.SupportCaseEvents.*;
import static com.lifecycle.engine.test.InMemoryEventStore.data;
import static org.assertj.core.api.Assertions.*;

@DisplayName("Support case projectors")
class SupportCaseProjectorsTest {

    private InMemoryEventStore engine;
    private UUID companyId;
    private UUID productId;

    @BeforeEach
    void setUp() {
        engine = InMemoryEventStore.withDefaultProjectors();
        companyId = UUID.randomUUID();
        productId = UUID.randomUUID();
    }

    // ========== Read model ==========

    @Test
    @DisplayName("Created event opens a case row with zeroed counters")
    void testCreated() {
        UUID caseId = createCase("high");
        engine.dispatcher.dispatchAll();

        Map<String, Object> row = caseRow(caseId);
        assertThat(row)
            .containsEntry("status", STATUS_OPEN)
            .containsEntry("severity", "high")
            .containsEntry("title", "Login broken")
            .containsEntry("company_id", companyId)
            .containsEntry("company_product_id", productId)
            .containsEntry("tags", "")
            .containsEntry("escalation_count", 0)
            .containsEntry("reopen_count", 0)
            .containsEntry("last_event_type", CREATED)
            .containsEntry("last_event_sequence", 1L);
        assertThat(row.get("opened_at")).isEqualTo(InMemoryEventStore.START.plusSeconds(60));
    }

    @Test
    @DisplayName("Lifecycle events update the row and keep counters")
    void testLifecycle() {
        UUID caseId = createCase("medium");
        append(caseId, ASSIGNED, data("toOwnerId", "u-1", "toOwnerName", "Ada", "team", "support"));
        append(caseId, ESCALATED, data("escalatedToTeam", "tier2"));
        append(caseId, RESOLVED, data("resolutionSummary", "Restarted", "rootCause", "config"));
        append(caseId, CLOSED, data("closeReason", "cancelled"));
        append(caseId, REOPENED, data());
        engine.dispatcher.dispatchAll();

        Map<String, Object> row = caseRow(caseId);
        assertThat(row)
            .containsEntry("status", STATUS_OPEN)
            .containsEntry("owner_id", "u-1")
            .containsEntry("owner_name", "Ada")
            .containsEntry("assigned_team", "tier2")
            .containsEntry("escalation_count", 1)
            .containsEntry("reopen_count", 1)
            .containsEntry("root_cause", "config")
            .containsEntry("engagement_impact", "neutral")
            .containsEntry("last_event_sequence", 6L);
        assertThat(row.get("resolved_at")).isNull();
        assertThat(row.get("closed_at")).isNull();
        assertThat(row.get("resolution_summary")).isNull();
    }

    @Test
    @DisplayName("Tags are kept sorted and de-duplicated")
    void testTags() {
        UUID caseId = createCase("low");
        append(caseId, TAG_ADDED, data("tag", "billing"));
        append(caseId, TAG_ADDED, data("tag", "api"));
        append(caseId, TAG_ADDED, data("tag", "billing"));
        append(caseId, TAG_ADDED, data("tag", " "));
        append(caseId, TAG_REMOVED, data("tag", "missing"));
        engine.dispatcher.dispatchAll();
        assertThat(caseRow(caseId)).containsEntry("tags", "api,billing");

        append(caseId, TAG_REMOVED, data("tag", "api"));
        engine.dispatcher.dispatchAll();
        assertThat(caseRow(caseId)).containsEntry("tags", "billing");
    }

    @Test
    @DisplayName("Events for a case without a Created event are skipped")
    void testOrphanEventSkipped() {
        UUID orphan = UUID.randomUUID();
        append(orphan, STATUS_CHANGED, data("toStatus", STATUS_IN_PROGRESS));
        engine.dispatcher.dispatchAll();

        assertThat(engine.store.find(SupportCaseReadModelProjector.TABLE,
            Map.of(SupportCaseReadModelProjector.KEY, orphan))).isEmpty();
        assertThat(engine.checkpoints.findByName(SupportCaseReadModelProjector.NAME).orElseThrow().cursor())
            .isEqualTo(1L);
    }

    @Test
    @DisplayName("Replaying from the start after a reset leaves the row unchanged")
    void testReplayIsNoOp() {
        UUID caseId = createCase("medium");
        append(caseId, ESCALATED, data());
        append(caseId, REOPENED, data());
        engine.dispatcher.dispatchAll();
        Map<String, Object> before = caseRow(caseId);

        engine.checkpointService.reset(SupportCaseReadModelProjector.NAME);
        engine.dispatcher.dispatch(SupportCaseReadModelProjector.NAME);

        assertThat(caseRow(caseId)).isEqualTo(before);
    }

    // ========== Open counts ==========

    @Test
    @DisplayName("Counts follow open cases by status and severity")
    void testCounts() {
        UUID first = createCase("critical");
        UUID second = createCase("low");
        createCase("high");
        append(second, STATUS_CHANGED, data("toStatus", STATUS_WAITING_ON_CUSTOMER));
        append(first, STATUS_CHANGED, data("toStatus", STATUS_ESCALATED));
        engine.dispatcher.dispatchAll();

        Map<String, Object> product = productCounts();
        assertThat(product)
            .containsEntry("total_open_count", 3)
            .containsEntry("open_count", 1)
            .containsEntry("escalated_count", 1)
            .containsEntry("waiting_count", 1)
            .containsEntry("critical_count", 1)
            .containsEntry("low_count", 1)
            .containsEntry("high_count", 1)
            .containsEntry("medium_count", 0);
        assertThat(companyCounts())
            .containsEntry("total_open_count", 3)
            .containsEntry("high_and_above_count", 2)
            .containsEntry("critical_count", 1)
            .containsEntry("unassigned_product_count", 0);
    }

    @Test
    @DisplayName("Resolving and reopening moves a case out of and back into the counts")
    void testResolveAndReopen() {
        UUID caseId = createCase("urgent");
        append(caseId, RESOLVED, data());
        engine.dispatcher.dispatchAll();

        assertThat(productCounts()).containsEntry("total_open_count", 0).containsEntry("urgent_count", 0);
        assertThat(companyCounts()).containsEntry("high_and_above_count", 0);

        append(caseId, REOPENED, data());
        engine.dispatcher.dispatchAll();

        assertThat(productCounts()).containsEntry("total_open_count", 1).containsEntry("urgent_count", 1);
        assertThat(companyCounts()).containsEntry("high_and_above_count", 1);
    }

    @Test
    @DisplayName("A case without a product counts as unassigned at company level only")
    void testUnassignedProduct() {
        UUID caseId = UUID.randomUUID();
        append(caseId, CREATED, data("companyId", companyId, "severity", "medium", "title", "No product"));
        engine.dispatcher.dispatchAll();

        assertThat(engine.store.count(OpenCaseCountsProjector.PRODUCT_COUNTS)).isZero();
        assertThat(companyCounts())
            .containsEntry("total_open_count", 1)
            .containsEntry("unassigned_product_count", 1);
    }

    @Test
    @DisplayName("A case with no severity is counted without failing")
    void testMissingSeverity() {
        UUID caseId = UUID.randomUUID();
        append(caseId, CREATED, data("companyId", companyId, "companyProductId", productId, "title", "?"));
        engine.dispatcher.dispatchAll();

        assertThat(companyCounts()).containsEntry("total_open_count", 1).containsEntry("high_and_above_count", 0);
    }

    private UUID createCase(String severity) {
        UUID caseId = UUID.randomUUID();
        append(caseId, CREATED, data(
            "companyId", companyId,
            "companyProductId", productId,
            "title", "Login broken",
            "severity", severity,
            "source", "email"));
        return caseId;
    }

    private void append(UUID caseId, String eventType, ObjectNode payload) {
        engine.append(AGGREGATE_TYPE, caseId, eventType, payload);
    }

    private Map<String, Object> caseRow(UUID caseId) {
        return engine.store.find(SupportCaseReadModelProjector.TABLE,
            Map.of(SupportCaseReadModelProjector.KEY, caseId)).orElseThrow();
    }

    private Map<String, Object> productCounts() {
        return engine.store.find(OpenCaseCountsProjector.PRODUCT_COUNTS,
            Map.of("company_product_id", productId)).orElseThrow();
    }

    private Map<String, Object> companyCounts() {
        return engine.store.find(OpenCaseCountsProjector.COMPANY_COUNTS,
            Map.of("company_id", companyId)).orElseThrow();
    }
}
