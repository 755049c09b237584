package com.yava.intent.controller;

import com.yava.intent.service.ClassificationMetricsService;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * Monitoring endpoints for the classifier:
 * - classification analytics
 * - health summary with the active registry version
 */
@RestController
@RequestMapping("/monitoring")
@CrossOrigin(origins = "*")
@Slf4j
public class MonitoringController {

    private final ClassificationMetricsService metricsService;

    public MonitoringController(ClassificationMetricsService metricsService) {
        this.metricsService = metricsService;
    }

    /**
     * Get classification analytics
     * Returns count, latency percentiles, outcome distribution, clarification and no-match rates.
     */
    @GetMapping("/analytics/classifications")
    public ResponseEntity<ClassificationAnalytics> getClassificationAnalytics(
            @RequestParam(required = false) Integer hours) {
        int lookbackHours = hours != null ? hours : 24;  // Default: last 24 hours

        return ResponseEntity.ok(metricsService.getClassificationAnalytics(lookbackHours));
    }

    /**
     * Get system health summary
     */
    @GetMapping("/health/summary")
    public ResponseEntity<HealthSummary> getHealthSummary() {
        return ResponseEntity.ok(metricsService.getHealthSummary());
    }

    // Data classes

    @Data
    public static class ClassificationAnalytics {
        private long totalClassifications;
        private double averageLatencyMs;
        private double p50LatencyMs;
        private double p95LatencyMs;
        private double p99LatencyMs;
        private Map<String, Long> classificationsByOutcome;
        private double clarificationRate;
        private double noMatchRate;
        private double averageConfidence;
    }

    @Data
    public static class HealthSummary {
        private String overallStatus;
        private Map<String, String> componentStatus;
        private LocalDateTime lastCheck;
        private Map<String, Object> metrics;
    }
}
