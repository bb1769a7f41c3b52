package com.z254.sentinel.responder.api.v1;

import com.z254.sentinel.responder.api.dto.ActionRequest;
import com.z254.sentinel.responder.api.dto.ActionResponse;
import com.z254.sentinel.responder.api.dto.CommentRequest;
import com.z254.sentinel.responder.api.dto.IncidentDto;
import com.z254.sentinel.responder.api.dto.IncidentListResponse;
import com.z254.sentinel.responder.api.mapper.IncidentMapper;
import com.z254.sentinel.responder.domain.exception.AuthorizationException;
import com.z254.sentinel.responder.domain.exception.IncidentNotFoundException;
import com.z254.sentinel.responder.domain.exception.IncidentValidationException;
import com.z254.sentinel.responder.domain.exception.InvariantViolationException;
import com.z254.sentinel.responder.domain.model.ActivityLogEntry;
import com.z254.sentinel.responder.domain.model.ApprovalAction;
import com.z254.sentinel.responder.domain.model.ApprovalRecord;
import com.z254.sentinel.responder.domain.model.Comment;
import com.z254.sentinel.responder.domain.model.Incident;
import com.z254.sentinel.responder.domain.model.IncidentStatus;
import com.z254.sentinel.responder.domain.repository.IncidentRepository;
import com.z254.sentinel.responder.domain.service.ActivityLogService;
import com.z254.sentinel.responder.lifecycle.ApprovalWorkflow;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

/**
 * REST API controller for incidents and the human actions on them.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/incidents")
@Tag(name = "Incidents", description = "Incident querying and human actions")
public class IncidentController {

    private final IncidentRepository incidentRepository;
    private final ApprovalWorkflow approvalWorkflow;
    private final ActivityLogService activityLog;

    public IncidentController(IncidentRepository incidentRepository,
                              ApprovalWorkflow approvalWorkflow,
                              ActivityLogService activityLog) {
        this.incidentRepository = incidentRepository;
        this.approvalWorkflow = approvalWorkflow;
        this.activityLog = activityLog;
    }

    @GetMapping
    @Operation(summary = "List incidents", description = "List incidents, newest first, with optional status filter")
    public Mono<ResponseEntity<IncidentListResponse>> listIncidents(
            @Parameter(description = "Filter by status, e.g. awaiting_approval")
            @RequestParam(required = false) String status,
            @Parameter(description = "Page number")
            @RequestParam(defaultValue = "0") int page,
            @Parameter(description = "Page size")
            @RequestParam(defaultValue = "20") int size) {

        return Mono.fromCallable(() -> {
            IncidentStatus filter = status != null ? IncidentStatus.fromWire(status) : null;
            List<Incident> matching = incidentRepository.findAll().stream()
                    .filter(i -> filter == null || i.getStatus() == filter)
                    .toList();

            return ResponseEntity.ok(IncidentListResponse.builder()
                    .incidents(matching.stream()
                            .skip((long) page * size)
                            .limit(size)
                            .map(IncidentMapper::toDto)
                            .toList())
                    .total(matching.size())
                    .page(page)
                    .size(size)
                    .build());
        }).onErrorResume(IllegalArgumentException.class,
                e -> Mono.just(ResponseEntity.badRequest().build()));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get incident", description = "Get incident details by ID")
    public Mono<ResponseEntity<IncidentDto>> getIncident(
            @Parameter(description = "Incident ID") @PathVariable String id) {

        return Mono.fromCallable(() -> incidentRepository.findById(id))
                .flatMap(Mono::justOrEmpty)
                .map(IncidentMapper::toDto)
                .map(ResponseEntity::ok)
                .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @PostMapping("/{id}/actions")
    @Operation(summary = "Submit action",
               description = "Approve, reject, override or request changes. Approve and override are role-gated "
                       + "by the incident's approval severity.")
    public Mono<ResponseEntity<ActionResponse>> submitAction(
            @Parameter(description = "Incident ID") @PathVariable String id,
            @Valid @RequestBody ActionRequest request) {

        return Mono.fromCallable(() -> approvalWorkflow.submitAction(id, request.getActor(),
                        ApprovalAction.fromWire(request.getAction()), request.getComment()))
                .subscribeOn(Schedulers.boundedElastic())
                .map(outcome -> ResponseEntity.ok(ActionResponse.builder()
                        .incidentId(outcome.getIncidentId())
                        .status(outcome.getStatus().wireName())
                        .build()))
                .onErrorResume(IncidentNotFoundException.class,
                        e -> error(HttpStatus.NOT_FOUND, id, e.getMessage(), null))
                .onErrorResume(IncidentValidationException.class,
                        e -> error(HttpStatus.BAD_REQUEST, id, e.getMessage(), null))
                .onErrorResume(IllegalArgumentException.class,
                        e -> error(HttpStatus.BAD_REQUEST, id, "Unknown action: " + request.getAction(), null))
                .onErrorResume(AuthorizationException.class,
                        e -> error(HttpStatus.FORBIDDEN, id, e.getMessage(), e.getRequiredRole().wireName()))
                .onErrorResume(InvariantViolationException.class,
                        e -> error(HttpStatus.CONFLICT, id, e.getMessage(), null));
    }

    @GetMapping("/{id}/approvals")
    @Operation(summary = "Get approvals", description = "Human actions recorded on an incident, oldest first")
    public Mono<ResponseEntity<List<ApprovalRecord>>> getApprovals(
            @Parameter(description = "Incident ID") @PathVariable String id) {

        return Mono.fromCallable(() -> ResponseEntity.ok(approvalWorkflow.approvals(id)));
    }

    @GetMapping("/{id}/comments")
    @Operation(summary = "Get comments", description = "Discussion on an incident, oldest first")
    public Mono<ResponseEntity<List<Comment>>> getComments(
            @Parameter(description = "Incident ID") @PathVariable String id) {

        return Mono.fromCallable(() -> ResponseEntity.ok(approvalWorkflow.comments(id)));
    }

    @PostMapping("/{id}/comments")
    @Operation(summary = "Add comment", description = "Add a comment to an incident")
    public Mono<ResponseEntity<Comment>> addComment(
            @Parameter(description = "Incident ID") @PathVariable String id,
            @Valid @RequestBody CommentRequest request) {

        return Mono.fromCallable(() -> approvalWorkflow.addComment(id, request.getAuthor(), request.getContent()))
                .map(comment -> ResponseEntity.status(HttpStatus.CREATED).body(comment))
                .onErrorResume(IncidentNotFoundException.class,
                        e -> Mono.just(ResponseEntity.notFound().build()))
                .onErrorResume(IncidentValidationException.class,
                        e -> Mono.just(ResponseEntity.badRequest().build()));
    }

    @GetMapping("/{id}/activity")
    @Operation(summary = "Get incident activity", description = "Activity log entries for an incident, oldest first")
    public Mono<ResponseEntity<List<ActivityLogEntry>>> getActivity(
            @Parameter(description = "Incident ID") @PathVariable String id) {

        return Mono.fromCallable(() -> ResponseEntity.ok(activityLog.forIncident(id)));
    }

    private static Mono<ResponseEntity<ActionResponse>> error(HttpStatus status, String incidentId,
                                                              String message, String requiredRole) {
        log.debug("Action on {} refused with {}: {}", incidentId, status.value(), message);
        return Mono.just(ResponseEntity.status(status).body(ActionResponse.builder()
                .incidentId(incidentId)
                .error(message)
                .requiredRole(requiredRole)
                .build()));
    }
}
