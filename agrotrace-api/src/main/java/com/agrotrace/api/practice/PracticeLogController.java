package com.agrotrace.api.practice;

import com.agrotrace.api.web.ApiResponses;
import com.agrotrace.api.web.ApiResult;
import com.agrotrace.api.web.CallerHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST API of the practice log.
 */
@RestController
@RequestMapping("/api/v1")
public class PracticeLogController {

    private final PracticeLogService practiceLogService;

    public PracticeLogController(PracticeLogService practiceLogService) {
        this.practiceLogService = practiceLogService;
    }

    /**
     * Log a practice for the caller.
     * POST /api/v1/practices
     */
    @PostMapping("/practices")
    public ResponseEntity<ApiResult<Long>> log(
            @RequestHeader(CallerHeaders.CALLER_ID) String callerId,
            @RequestBody LogRequest request) {
        return ApiResponses.created(practiceLogService.log(
                callerId, request.practiceType(), request.category(), request.details(), request.evidenceHash()));
    }

    /**
     * All entries of a farmer, oldest first.
     * GET /api/v1/practices/{farmer}
     */
    @GetMapping("/practices/{farmer}")
    public ResponseEntity<ApiResult<FarmerLogView>> listEntries(@PathVariable String farmer) {
        return ResponseEntity.ok(ApiResult.ok(practiceLogService.getFarmerLog(farmer)));
    }

    /**
     * GET /api/v1/practices/{farmer}/{sequence}
     */
    @GetMapping("/practices/{farmer}/{sequence}")
    public ResponseEntity<ApiResult<PracticeLogEntryView>> getEntry(
            @PathVariable String farmer,
            @PathVariable long sequence) {
        return practiceLogService.getEntry(farmer, sequence)
                .map(entry -> ResponseEntity.ok(ApiResult.ok(entry)))
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND)
                        .body(ApiResult.absent("No practice " + sequence + " logged by " + farmer)));
    }

    /**
     * Revise one of the caller's pending entries.
     * PUT /api/v1/practices/me/{sequence}
     */
    @PutMapping("/practices/me/{sequence}")
    public ResponseEntity<ApiResult<Boolean>> update(
            @RequestHeader(CallerHeaders.CALLER_ID) String callerId,
            @PathVariable long sequence,
            @RequestBody UpdateRequest request) {
        return ApiResponses.of(practiceLogService.update(callerId, sequence, request.details(), request.evidenceHash()));
    }

    /**
     * Moderator decision.
     * POST /api/v1/practices/{farmer}/{sequence}/moderation
     */
    @PostMapping("/practices/{farmer}/{sequence}/moderation")
    public ResponseEntity<ApiResult<Boolean>> moderate(
            @RequestHeader(CallerHeaders.CALLER_ID) String callerId,
            @PathVariable String farmer,
            @PathVariable long sequence,
            @RequestBody ModerationRequest request) {
        return ApiResponses.of(practiceLogService.moderate(callerId, farmer, sequence, request.status(), request.notes()));
    }

    // ==================== Practice log settings ====================

    /**
     * GET /api/v1/practice-log/settings
     */
    @GetMapping("/practice-log/settings")
    public ResponseEntity<ApiResult<PracticeLogSettingsView>> getSettings() {
        return ResponseEntity.ok(ApiResult.ok(practiceLogService.getSettings()));
    }

    /**
     * PUT /api/v1/practice-log/moderator
     */
    @PutMapping("/practice-log/moderator")
    public ResponseEntity<ApiResult<Boolean>> setModerator(
            @RequestHeader(CallerHeaders.CALLER_ID) String callerId,
            @RequestBody AccountRequest request) {
        return ApiResponses.of(practiceLogService.setModerator(callerId, request.account()));
    }

    /**
     * PUT /api/v1/practice-log/owner
     */
    @PutMapping("/practice-log/owner")
    public ResponseEntity<ApiResult<Boolean>> transferOwnership(
            @RequestHeader(CallerHeaders.CALLER_ID) String callerId,
            @RequestBody AccountRequest request) {
        return ApiResponses.of(practiceLogService.transferOwnership(callerId, request.account()));
    }

    // Request DTOs
    public record LogRequest(String practiceType, String category, String details, String evidenceHash) {}

    public record UpdateRequest(String details, String evidenceHash) {}

    public record ModerationRequest(String status, String notes) {}

    public record AccountRequest(String account) {}
}
