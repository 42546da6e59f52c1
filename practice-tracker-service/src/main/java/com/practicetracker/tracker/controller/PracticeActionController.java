package com.practicetracker.tracker.controller;

import com.fasterxml.jackson.databind.node.NullNode;
import com.practicetracker.tracker.dto.ActionWithStats;
import com.practicetracker.tracker.dto.CreateActionRequest;
import com.practicetracker.tracker.dto.FinishActionRequest;
import com.practicetracker.tracker.entity.PracticeAction;
import com.practicetracker.tracker.entity.PracticeRecord;
import com.practicetracker.tracker.security.TokenService;
import com.practicetracker.tracker.service.ActionStatsService;
import com.practicetracker.tracker.service.CompletionService;
import com.practicetracker.tracker.service.PracticeActionService;
import jakarta.validation.Valid;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/actions")
@CrossOrigin(origins = "${cors.allowed.origins}")
public class PracticeActionController {

    private final PracticeActionService actionService;
    private final ActionStatsService statsService;
    private final CompletionService completionService;
    private final TokenService tokenService;

    public PracticeActionController(PracticeActionService actionService,
                                    ActionStatsService statsService,
                                    CompletionService completionService,
                                    TokenService tokenService) {
        this.actionService = actionService;
        this.statsService = statsService;
        this.completionService = completionService;
        this.tokenService = tokenService;
    }

    /**
     * POST /api/actions
     * Create a practice action
     */
    @PostMapping
    public ResponseEntity<PracticeAction> createAction(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authHeader,
            @Valid @RequestBody CreateActionRequest request) {

        Long userId = tokenService.resolveBearer(authHeader);
        return ResponseEntity.ok(actionService.create(userId, request.getName()));
    }

    /**
     * GET /api/actions
     * List the user's actions with completion statistics, pending ones first
     */
    @GetMapping
    public ResponseEntity<List<ActionWithStats>> listActions(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authHeader) {

        Long userId = tokenService.resolveBearer(authHeader);
        return ResponseEntity.ok(statsService.listWithStats(userId));
    }

    /**
     * GET /api/actions/{id}
     * The action, or JSON null when it is unknown or not owned
     */
    @GetMapping("/{id}")
    public ResponseEntity<?> getAction(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authHeader,
            @PathVariable("id") Long id) {

        Long userId = tokenService.resolveBearer(authHeader);
        return actionService.find(userId, id)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.ok(NullNode.getInstance()));
    }

    /**
     * GET /api/actions/{id}/records
     * Completion history, newest first
     */
    @GetMapping("/{id}/records")
    public ResponseEntity<List<PracticeRecord>> getActionRecords(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authHeader,
            @PathVariable("id") Long id) {

        Long userId = tokenService.resolveBearer(authHeader);
        return ResponseEntity.ok(actionService.records(userId, id));
    }

    /**
     * POST /api/actions/{id}/finish
     * Mark the action as done for today
     */
    @PostMapping("/{id}/finish")
    public ResponseEntity<PracticeRecord> finishAction(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authHeader,
            @PathVariable("id") Long id,
            @RequestBody(required = false) FinishActionRequest request) {

        Long userId = tokenService.resolveBearer(authHeader);
        String note = request != null ? request.getNote() : null;
        return ResponseEntity.ok(completionService.finish(userId, id, note));
    }
}
