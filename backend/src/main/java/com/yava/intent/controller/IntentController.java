package com.yava.intent.controller;

import com.yava.intent.model.ClassificationDecision;
import com.yava.intent.model.ClassifyRequest;
import com.yava.intent.model.IntentRecord;
import com.yava.intent.model.MultiIntentDecision;
import com.yava.intent.model.RegistrySnapshot;
import com.yava.intent.service.ClassificationMetricsService;
import com.yava.intent.service.IntentClassificationService;
import com.yava.intent.service.IntentConfigurationService;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/intents")
@CrossOrigin(origins = "*")
@Slf4j
public class IntentController {

    private final IntentClassificationService classificationService;
    private final IntentConfigurationService configurationService;
    private final ClassificationMetricsService metricsService;

    public IntentController(IntentClassificationService classificationService,
                            IntentConfigurationService configurationService,
                            ClassificationMetricsService metricsService) {
        this.classificationService = classificationService;
        this.configurationService = configurationService;
        this.metricsService = metricsService;
    }

    /**
     * Endpoint: /api/intents/classify
     * Classify one utterance against the active registry.
     */
    @PostMapping("/classify")
    public ResponseEntity<ClassificationDecision> classify(@Valid @RequestBody ClassifyRequest request) {
        long start = System.currentTimeMillis();
        String requestId = UUID.randomUUID().toString().substring(0, 8);
        log.info("[REQUEST-{}] /classify: '{}'", requestId, request.getUtterance());
        try {
            ClassificationDecision decision = classificationService.classify(request.getUtterance());
            long duration = System.currentTimeMillis() - start;
            metricsService.recordClassification(requestId, decision, duration);
            log.info("[REQUEST-{}] intent={}, agent={}, confidence={}, clarification={} ({}ms)",
                    requestId, decision.getIntentName(), decision.getAgent(), decision.getConfidence(),
                    decision.isNeedsClarification(), duration);
            return ResponseEntity.ok(decision);
        } catch (Exception e) {
            log.error("[REQUEST-{}] Error in /classify: {}", requestId, e.getMessage(), e);
            throw e;
        }
    }

    /**
     * Endpoint: /api/intents/classify/multi
     * Classify an utterance that may contain several requests.
     */
    @PostMapping("/classify/multi")
    public ResponseEntity<MultiIntentDecision> classifyMulti(@Valid @RequestBody ClassifyRequest request) {
        long start = System.currentTimeMillis();
        String requestId = UUID.randomUUID().toString().substring(0, 8);
        log.info("[REQUEST-{}] /classify/multi: '{}'", requestId, request.getUtterance());
        try {
            MultiIntentDecision decision = classificationService.classifyMulti(request.getUtterance());
            long duration = System.currentTimeMillis() - start;
            metricsService.recordClassification(requestId, decision.getDecision(), duration);
            log.info("[REQUEST-{}] multi_intent={}, segments={} ({}ms)",
                    requestId, decision.isMultiIntent(), decision.getSegments().size(), duration);
            return ResponseEntity.ok(decision);
        } catch (Exception e) {
            log.error("[REQUEST-{}] Error in /classify/multi: {}", requestId, e.getMessage(), e);
            throw e;
        }
    }

    /**
     * Endpoint: /api/intents
     * List the active intents.
     */
    @GetMapping
    public ResponseEntity<Map<String, Object>> listIntents() {
        RegistrySnapshot snapshot = configurationService.activeSnapshot();
        return ResponseEntity.ok(Map.of(
            "version", snapshot.getVersion(),
            "count", snapshot.size(),
            "intents", snapshot.getRecords()));
    }

    /**
     * Endpoint: /api/intents/{intentId}
     */
    @GetMapping("/{intentId}")
    public ResponseEntity<IntentRecord> getIntent(@PathVariable String intentId) {
        return configurationService.findIntent(intentId)
            .map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.notFound().build());
    }
}
