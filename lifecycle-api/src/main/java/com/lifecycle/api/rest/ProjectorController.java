package com.lifecycle.api.rest;

import com.lifecycle.core.model.ActorType;
import com.lifecycle.core.model.ProjectorCheckpoint;
import com.lifecycle.core.model.RebuildRecord;
import com.lifecycle.engine.projection.CheckpointService;
import com.lifecycle.engine.projection.DispatchResult;
import com.lifecycle.engine.projection.ProjectorDispatcher;
import com.lifecycle.engine.projection.ProjectorState;
import com.lifecycle.engine.rebuild.RebuildService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * REST API for projector administration: status, pause, resume, reset,
 * on-demand dispatch and rebuilds.
 */
@RestController
@RequestMapping("/api/v1/projectors")
public class ProjectorController {

    private static final String DEFAULT_ACTOR_TYPE = "user";
    private static final String DEFAULT_ACTOR_ID = "api";

    private final CheckpointService checkpointService;
    private final ProjectorDispatcher dispatcher;
    private final RebuildService rebuildService;

    public ProjectorController(CheckpointService checkpointService, ProjectorDispatcher dispatcher,
                               RebuildService rebuildService) {
        this.checkpointService = checkpointService;
        this.dispatcher = dispatcher;
        this.rebuildService = rebuildService;
    }

    /**
     * All checkpoints with their lag behind the head of the log.
     */
    @GetMapping
    public ResponseEntity<List<ProjectorResponse>> listProjectors() {
        return ResponseEntity.ok(checkpointService.list().stream()
            .map(ProjectorResponse::from)
            .toList());
    }

    @GetMapping("/{name}")
    public ResponseEntity<ProjectorResponse> getProjector(@PathVariable String name) {
        return ResponseEntity.ok(ProjectorResponse.from(checkpointService.get(name)));
    }

    @PostMapping("/{name}/pause")
    public ResponseEntity<ProjectorResponse> pause(@PathVariable String name) {
        checkpointService.pause(name);
        return ResponseEntity.ok(ProjectorResponse.from(checkpointService.get(name)));
    }

    @PostMapping("/{name}/resume")
    public ResponseEntity<ProjectorResponse> resume(@PathVariable String name) {
        checkpointService.resume(name);
        return ResponseEntity.ok(ProjectorResponse.from(checkpointService.get(name)));
    }

    /**
     * Rewind to cursor 0 and clear the recorded error.
     */
    @PostMapping("/{name}/reset")
    public ResponseEntity<ProjectorResponse> reset(@PathVariable String name) {
        checkpointService.reset(name);
        return ResponseEntity.ok(ProjectorResponse.from(checkpointService.get(name)));
    }

    /**
     * Run one dispatch pass now instead of waiting for the scheduler.
     */
    @PostMapping("/{name}/dispatch")
    public ResponseEntity<DispatchResponse> dispatch(@PathVariable String name) {
        return ResponseEntity.ok(DispatchResponse.from(dispatcher.dispatch(name)));
    }

    /**
     * Rebuild one projector, or continue an interrupted rebuild with
     * {@code resume=true}. Runs on the request thread.
     */
    @PostMapping("/{name}/rebuild")
    public ResponseEntity<RebuildResponse> rebuild(
            @PathVariable String name,
            @RequestParam(defaultValue = "false") boolean resume,
            @RequestBody(required = false) ActorRequest request) {

        ActorType actorType = actorType(request);
        String actorId = actorId(request);
        RebuildRecord record = resume
            ? rebuildService.resume(name, actorType, actorId)
            : rebuildService.rebuild(name, actorType, actorId);
        return ResponseEntity.ok(RebuildResponse.from(record));
    }

    /**
     * Rebuild every projector in registration order.
     */
    @PostMapping("/rebuild")
    public ResponseEntity<List<RebuildResponse>> rebuildAll(@RequestBody(required = false) ActorRequest request) {
        List<RebuildRecord> records = rebuildService.rebuildAll(actorType(request), actorId(request));
        return ResponseEntity.ok(records.stream().map(RebuildResponse::from).toList());
    }

    @GetMapping("/rebuilds")
    public ResponseEntity<List<RebuildResponse>> rebuildHistory(@RequestParam(defaultValue = "50") int limit) {
        return ResponseEntity.ok(rebuildService.history(limit).stream()
            .map(RebuildResponse::from)
            .toList());
    }

    @GetMapping("/rebuilds/{rebuildId}")
    public ResponseEntity<RebuildResponse> getRebuild(@PathVariable UUID rebuildId) {
        return ResponseEntity.ok(RebuildResponse.from(rebuildService.find(rebuildId)));
    }

    /**
     * Ask a running rebuild to stop at its next event.
     */
    @PostMapping("/rebuilds/{rebuildId}/cancel")
    public ResponseEntity<Map<String, Object>> cancelRebuild(@PathVariable UUID rebuildId) {
        boolean accepted = rebuildService.cancel(rebuildId);
        return ResponseEntity.ok(Map.of(
            "rebuildId", rebuildId,
            "accepted", accepted
        ));
    }

    private static ActorType actorType(ActorRequest request) {
        String value = request != null && request.actorType() != null ? request.actorType() : DEFAULT_ACTOR_TYPE;
        return ActorType.fromValue(value);
    }

    private static String actorId(ActorRequest request) {
        return request != null && request.actorId() != null ? request.actorId() : DEFAULT_ACTOR_ID;
    }

    // ========== DTOs ==========

    public record ActorRequest(String actorType, String actorId) {}

    public record ProjectorResponse(
        String name,
        String status,
        long cursor,
        long head,
        long lag,
        long eventsProcessed,
        int errorCount,
        String lastError,
        UUID lastErrorEventId,
        Instant updatedAt
    ) {
        public static ProjectorResponse from(ProjectorState state) {
            ProjectorCheckpoint checkpoint = state.checkpoint();
            return new ProjectorResponse(
                checkpoint.projectorName(),
                checkpoint.status().value(),
                checkpoint.cursor(),
                state.head(),
                state.lag(),
                checkpoint.eventsProcessed(),
                checkpoint.errorCount(),
                checkpoint.lastError(),
                checkpoint.lastErrorEventId(),
                checkpoint.updatedAt()
            );
        }
    }

    public record DispatchResponse(
        String projector,
        String outcome,
        long eventsProcessed,
        long eventsApplied,
        long cursor,
        String detail
    ) {
        public static DispatchResponse from(DispatchResult result) {
            return new DispatchResponse(
                result.projectorName(),
                result.outcome().name(),
                result.eventsProcessed(),
                result.eventsApplied(),
                result.cursor(),
                result.detail()
            );
        }
    }

    public record RebuildResponse(
        UUID rebuildId,
        String projector,
        String status,
        String actorType,
        String actorId,
        Instant startedAt,
        Instant completedAt,
        long eventsReplayed,
        String error
    ) {
        public static RebuildResponse from(RebuildRecord record) {
            return new RebuildResponse(
                record.rebuildId(),
                record.projectorName(),
                record.status().name(),
                record.actorType().value(),
                record.actorId(),
                record.startedAt(),
                record.completedAt(),
                record.eventsReplayed(),
                record.error()
            );
        }
    }
}
