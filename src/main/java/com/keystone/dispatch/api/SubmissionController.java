package com.keystone.dispatch.api;

import com.keystone.core.engine.PipelineEngine;
import com.keystone.core.error.InvalidSubmissionStateException;
import com.keystone.core.error.UnknownSubmissionException;
import com.keystone.core.model.DeploymentStrategy;
import com.keystone.core.model.IntegrationAttempt;
import com.keystone.core.model.QualityReport;
import com.keystone.core.model.Submission;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.Map;

/**
 * REST controller for the submission lifecycle: intake, verification, integration,
 * cancellation, status and live events.
 */
@RestController
@RequestMapping("/api/v1/submissions")
public class SubmissionController {

    private static final Logger log = LoggerFactory.getLogger(SubmissionController.class);

    private final PipelineEngine engine;
    private final SseStreamingService sseStreamingService;

    public SubmissionController(PipelineEngine engine, SseStreamingService sseStreamingService) {
        this.engine = engine;
        this.sseStreamingService = sseStreamingService;
    }

    /**
     * POST /api/v1/submissions: accept an artifact; verification runs asynchronously.
     */
    @PostMapping
    public ResponseEntity<Map<String, String>> submit(@RequestBody SubmissionRequest request) {
        if (request.projectId() == null || request.projectId().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "project_id is required"));
        }
        if (request.files() == null || request.files().isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of("error", "files must not be empty"));
        }
        Submission submission = engine.submit(request.projectId(), request.files(), request.metadata());
        return ResponseEntity.accepted().body(Map.of(
                "submission_id", submission.id(),
                "status", submission.status().name()
        ));
    }

    /**
     * GET /api/v1/submissions/{id}: status with latest report and attempt.
     */
    @GetMapping("/{id}")
    public ResponseEntity<?> status(@PathVariable String id) {
        try {
            return ResponseEntity.ok(SubmissionResponse.of(engine.getStatus(id)));
        } catch (UnknownSubmissionException e) {
            return notFound(e);
        }
    }

    /**
     * POST /api/v1/submissions/{id}/verify: the quality report, waiting for verification if needed.
     */
    @PostMapping("/{id}/verify")
    public ResponseEntity<?> verify(@PathVariable String id,
                                    @RequestParam(name = "force", defaultValue = "false") boolean force) {
        try {
            QualityReport report = engine.verifySubmission(id, force);
            return ResponseEntity.ok(SubmissionResponse.ReportSummary.of(report));
        } catch (UnknownSubmissionException e) {
            return notFound(e);
        } catch (InvalidSubmissionStateException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", e.getMessage()));
        }
    }

    /**
     * POST /api/v1/submissions/{id}/integrate: open an attempt and run it asynchronously.
     */
    @PostMapping("/{id}/integrate")
    public ResponseEntity<?> integrate(@PathVariable String id,
                                       @RequestBody(required = false) IntegrateRequest request) {
        DeploymentStrategy hint = null;
        if (request != null && request.strategy() != null && !request.strategy().isBlank()) {
            try {
                hint = DeploymentStrategy.valueOf(request.strategy().toUpperCase());
            } catch (IllegalArgumentException e) {
                return ResponseEntity.badRequest().body(Map.of("error", "Invalid strategy: " + request.strategy()));
            }
        }
        try {
            IntegrationAttempt attempt = engine.startIntegration(id, hint);
            log.info("Integration attempt {} started for submission {}", attempt.id(), id);
            return ResponseEntity.accepted().body(SubmissionResponse.AttemptSummary.of(attempt));
        } catch (UnknownSubmissionException e) {
            return notFound(e);
        } catch (InvalidSubmissionStateException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", e.getMessage()));
        }
    }

    /**
     * POST /api/v1/submissions/{id}/cancel: cancel the current attempt if it has not started deploying.
     */
    @PostMapping("/{id}/cancel")
    public ResponseEntity<?> cancel(@PathVariable String id) {
        try {
            boolean cancelled = engine.cancelIntegration(id);
            return ResponseEntity.ok(Map.of("submission_id", id, "cancelled", cancelled));
        } catch (UnknownSubmissionException e) {
            return notFound(e);
        }
    }

    /**
     * GET /api/v1/submissions/{id}/events: SSE stream of pipeline events.
     */
    @GetMapping(value = "/{id}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public ResponseEntity<SseEmitter> events(@PathVariable String id) {
        try {
            engine.getStatus(id);
        } catch (UnknownSubmissionException e) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(sseStreamingService.createEmitter(id));
    }

    private static ResponseEntity<Map<String, String>> notFound(UnknownSubmissionException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
    }
}
