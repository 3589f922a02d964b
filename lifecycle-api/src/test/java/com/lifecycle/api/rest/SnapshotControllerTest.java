package com.lifecycle.api.rest;

import com.lifecycle.api.LifecycleApplication;
import com.lifecycle.core.projection.ReadModelStore;
import com.lifecycle.engine.projection.ProjectorDispatcher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Map;
import java.util.UUID;

import static org.hamcrest.Matchers.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest(classes = LifecycleApplication.class,
    properties = "lifecycle.projectors.scheduling-enabled=false")
@AutoConfigureMockMvc
@ActiveProfiles("memory")
@DisplayName("Snapshot REST API")
class SnapshotControllerTest {

    private static final String READ_MODEL = "support_case_read_model";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ProjectorDispatcher dispatcher;

    @Autowired
    private ReadModelStore readModelStore;

    @BeforeEach
    void setUp() throws Exception {
        mockMvc.perform(post("/api/v1/events")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"aggregateType":"support_case","aggregateId":"%s",
                     "eventType":"SupportCaseCreated",
                     "eventData":{"title":"Invoice missing","severity":"low"},
                     "actorType":"user","actorId":"agent-2"}
                    """.formatted(UUID.randomUUID())))
            .andExpect(status().isCreated());
        dispatcher.dispatchAll();
    }

    // ========== Snapshots ==========

    @Test
    @DisplayName("POST /snapshots summarises the requested tables")
    void testSnapshot() throws Exception {
        mockMvc.perform(post("/api/v1/snapshots")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"tables\":[\"support_case_read_model\"]}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.takenAt").isString())
            .andExpect(jsonPath("$.tables", hasSize(1)))
            .andExpect(jsonPath("$.tables[0].tableName").value(READ_MODEL))
            .andExpect(jsonPath("$.tables[0].rowCount", greaterThan(0)))
            .andExpect(jsonPath("$.tables[0].checksum").isString());
    }

    @Test
    @DisplayName("Without a body every read model table is included")
    void testSnapshotAllTables() throws Exception {
        mockMvc.perform(post("/api/v1/snapshots"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.tables[*].tableName", hasItems(
                "support_case_read_model", "company_product_read_model", "company_product_stage_facts")));
    }

    @Test
    @DisplayName("Unknown tables are a 404")
    void testSnapshotUnknownTable() throws Exception {
        mockMvc.perform(post("/api/v1/snapshots")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"tables\":[\"no_such_table\"]}"))
            .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("Compare reports row count and checksum differences")
    void testCompare() throws Exception {
        mockMvc.perform(post("/api/v1/snapshots/compare")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"before":{"takenAt":"2026-01-05T09:00:00Z",
                               "tables":[{"tableName":"t","rowCount":1,"checksum":"aa"}]},
                     "after":{"takenAt":"2026-01-05T10:00:00Z",
                              "tables":[{"tableName":"t","rowCount":2,"checksum":"bb"}]}}
                    """))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.equal").value(false))
            .andExpect(jsonPath("$.differences", hasSize(2)));
    }

    // ========== Verification ==========

    @Test
    @DisplayName("Verify rebuilds and finds the tables unchanged")
    void testVerify() throws Exception {
        mockMvc.perform(post("/api/v1/snapshots/verify")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"projectors\":[\"support_case_read_model\"]}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.differences", empty()))
            .andExpect(jsonPath("$.rebuilds[0].status").value("COMPLETED"));
    }

    @Test
    @DisplayName("Determinism mode rebuilds twice")
    void testVerifyDeterminism() throws Exception {
        mockMvc.perform(post("/api/v1/snapshots/verify")
                .param("mode", "determinism")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"projectors\":[\"support_case_read_model\"]}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.rebuilds", hasSize(2)));
    }

    @Test
    @DisplayName("A row the log cannot reproduce is a 422")
    void testVerifyMismatch() throws Exception {
        readModelStore.upsert(READ_MODEL, Map.of("support_case_id", UUID.randomUUID(), "title", "ghost"));

        mockMvc.perform(post("/api/v1/snapshots/verify")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"projectors\":[\"support_case_read_model\"]}"))
            .andExpect(status().isUnprocessableEntity())
            .andExpect(jsonPath("$.errorCode").value("REBUILD_VERIFICATION_MISMATCH"));
    }
}
