package com.yava.intent.controller;

import com.yava.intent.model.BulkUploadRequest;
import com.yava.intent.model.IntentRecordInput;
import com.yava.intent.model.UpdateResult;
import com.yava.intent.model.ValidationReport;
import com.yava.intent.service.IntentConfigurationService;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Configuration updates: upload (stage) then reload (activate) for bulk sheets,
 * PUT for single intents, and dry-run validation.
 */
@RestController
@RequestMapping("/admin/intents")
@CrossOrigin(origins = "*")
@Slf4j
public class IntentAdminController {

    private final IntentConfigurationService configurationService;

    public IntentAdminController(IntentConfigurationService configurationService) {
        this.configurationService = configurationService;
    }

    /**
     * Endpoint: /api/admin/intents/upload
     * Stage a full replacement set. Nothing becomes active until /reload.
     */
    @PostMapping("/upload")
    public ResponseEntity<ValidationReport> upload(@Valid @RequestBody BulkUploadRequest request) {
        log.info("Received /upload with {} rows", request.getRows().size());
        try {
            ValidationReport report = configurationService.stageBulk(request.getRows());
            return report.isValid()
                ? ResponseEntity.ok(report)
                : ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(report);
        } catch (Exception e) {
            log.error("Error in /upload: {}", e.getMessage(), e);
            throw e;
        }
    }

    /**
     * Endpoint: /api/admin/intents/reload
     * Activate the staged set.
     */
    @PostMapping("/reload")
    public ResponseEntity<UpdateResult> reload() {
        log.info("Received /reload request");
        UpdateResult result = configurationService.activateStaged();
        return ResponseEntity.status(statusOf(result)).body(result);
    }

    /**
     * Endpoint: /api/admin/intents
     * Add or update a single intent.
     */
    @PutMapping
    public ResponseEntity<UpdateResult> applySingle(@RequestBody IntentRecordInput input) {
        log.info("Received add/update for intent {}", input.getIntentId());
        UpdateResult result = configurationService.applySingle(input);
        return ResponseEntity.status(statusOf(result)).body(result);
    }

    /**
     * Endpoint: /api/admin/intents/validate
     * Dry run. Validates the given rows, or the active configuration when no body is sent.
     */
    @PostMapping("/validate")
    public ResponseEntity<ValidationReport> validate(@RequestBody(required = false) BulkUploadRequest request) {
        if (request == null || request.getRows() == null) {
            return ResponseEntity.ok(configurationService.validateActive());
        }
        return ResponseEntity.ok(configurationService.validateRows(request.getRows()));
    }

    /**
     * Endpoint: /api/admin/intents/validate/single
     * Dry run of a single-intent merge.
     */
    @PostMapping("/validate/single")
    public ResponseEntity<ValidationReport> validateSingle(@RequestBody IntentRecordInput input) {
        return ResponseEntity.ok(configurationService.validateSingle(input));
    }

    /**
     * Endpoint: /api/admin/intents/staged
     */
    @GetMapping("/staged")
    public ResponseEntity<ValidationReport> staged() {
        return configurationService.stagedReport()
            .map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.notFound().build());
    }

    private static HttpStatus statusOf(UpdateResult result) {
        switch (result.getReason()) {
            case PUBLISHED:
                return HttpStatus.OK;
            case INVALID:
                return HttpStatus.UNPROCESSABLE_ENTITY;
            default:
                return HttpStatus.CONFLICT;
        }
    }
}
