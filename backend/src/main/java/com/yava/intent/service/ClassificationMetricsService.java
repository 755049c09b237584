package com.yava.intent.service;

import com.yava.intent.controller.MonitoringController;
import com.yava.intent.model.ClassificationDecision;
import com.yava.intent.model.RegistrySnapshot;
import com.yava.intent.registry.IntentRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.*;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * In-memory metrics over recent classification decisions.
 * Keeps the last {@value #MAX_RETAINED} decisions.
 */
@Service
@Slf4j
public class ClassificationMetricsService {

    static final int MAX_RETAINED = 1000;
    static final String NO_MATCH = "no_match";
    static final String CLARIFICATION = "clarification";

    private final IntentRegistry registry;

    private final Deque<ClassificationMetric> recent = new ConcurrentLinkedDeque<>();
    private final AtomicInteger retained = new AtomicInteger();

    private final AtomicLong totalClassifications = new AtomicLong(0);
    private final AtomicLong matchedClassifications = new AtomicLong(0);
    private final AtomicLong clarifications = new AtomicLong(0);
    private final AtomicLong noMatches = new AtomicLong(0);

    public ClassificationMetricsService(IntentRegistry registry) {
        this.registry = registry;
    }

    /**
     * Record one classification decision
     */
    public void recordClassification(String requestId, ClassificationDecision decision, long latencyMs) {
        String outcome = decision.isNeedsClarification() ? CLARIFICATION
            : decision.getIntentName() != null ? decision.getIntentName() : NO_MATCH;

        recent.addLast(new ClassificationMetric(requestId, outcome, decision.getConfidence(), latencyMs, LocalDateTime.now()));
        if (retained.incrementAndGet() > MAX_RETAINED && recent.pollFirst() != null) {
            retained.decrementAndGet();
        }

        totalClassifications.incrementAndGet();
        if (decision.isNeedsClarification()) {
            clarifications.incrementAndGet();
        } else if (decision.getIntentName() != null) {
            matchedClassifications.incrementAndGet();
        } else {
            noMatches.incrementAndGet();
        }
    }

    /**
     * Get classification analytics for the last N hours
     */
    public MonitoringController.ClassificationAnalytics getClassificationAnalytics(int lookbackHours) {
        LocalDateTime cutoff = LocalDateTime.now().minusHours(lookbackHours);

        List<ClassificationMetric> window = recent.stream()
            .filter(m -> m.getTimestamp().isAfter(cutoff))
            .collect(Collectors.toList());

        MonitoringController.ClassificationAnalytics analytics = new MonitoringController.ClassificationAnalytics();
        analytics.setTotalClassifications(window.size());
        if (window.isEmpty()) {
            analytics.setClassificationsByOutcome(Collections.emptyMap());
            return analytics;
        }

        List<Long> latencies = window.stream()
            .map(ClassificationMetric::getLatencyMs)
            .sorted()
            .collect(Collectors.toList());
        analytics.setAverageLatencyMs(latencies.stream().mapToLong(Long::longValue).average().orElse(0.0));
        analytics.setP50LatencyMs(percentile(latencies, 0.50));
        analytics.setP95LatencyMs(percentile(latencies, 0.95));
        analytics.setP99LatencyMs(percentile(latencies, 0.99));

        Map<String, Long> byOutcome = new TreeMap<>();
        for (ClassificationMetric metric : window) {
            byOutcome.merge(metric.getOutcome(), 1L, Long::sum);
        }
        analytics.setClassificationsByOutcome(byOutcome);

        long clarificationCount = byOutcome.getOrDefault(CLARIFICATION, 0L);
        long noMatchCount = byOutcome.getOrDefault(NO_MATCH, 0L);
        analytics.setClarificationRate((double) clarificationCount / window.size());
        analytics.setNoMatchRate((double) noMatchCount / window.size());
        analytics.setAverageConfidence(window.stream().mapToDouble(ClassificationMetric::getConfidence).average().orElse(0.0));

        return analytics;
    }

    /**
     * Get health summary
     */
    public MonitoringController.HealthSummary getHealthSummary() {
        MonitoringController.HealthSummary summary = new MonitoringController.HealthSummary();

        Map<String, String> componentStatus = new HashMap<>();
        Map<String, Object> metrics = new HashMap<>();
        if (registry.isInitialized()) {
            RegistrySnapshot snapshot = registry.current();
            componentStatus.put("registry", "UP");
            metrics.put("registry_version", snapshot.getVersion());
            metrics.put("intent_count", snapshot.size());
        } else {
            componentStatus.put("registry", "DOWN");
        }
        componentStatus.put("backend", "UP");

        summary.setComponentStatus(componentStatus);
        summary.setOverallStatus(componentStatus.containsValue("DOWN") ? "DOWN" : "UP");
        summary.setLastCheck(LocalDateTime.now());

        metrics.put("total_classifications", totalClassifications.get());
        metrics.put("matched_classifications", matchedClassifications.get());
        metrics.put("clarifications", clarifications.get());
        metrics.put("no_matches", noMatches.get());
        metrics.put("match_rate", totalClassifications.get() > 0
            ? (double) matchedClassifications.get() / totalClassifications.get() : 0.0);
        summary.setMetrics(metrics);

        return summary;
    }

    private double percentile(List<Long> values, double percentile) {
        if (values.isEmpty()) return 0.0;
        int index = (int) Math.ceil(percentile * values.size()) - 1;
        index = Math.max(0, Math.min(index, values.size() - 1));
        return values.get(index);
    }

    private static class ClassificationMetric {
        private final String requestId;
        private final String outcome;
        private final double confidence;
        private final long latencyMs;
        private final LocalDateTime timestamp;

        ClassificationMetric(String requestId, String outcome, double confidence, long latencyMs, LocalDateTime timestamp) {
            this.requestId = requestId;
            this.outcome = outcome;
            this.confidence = confidence;
            this.latencyMs = latencyMs;
            this.timestamp = timestamp;
        }

        public String getRequestId() { return requestId; }
        public String getOutcome() { return outcome; }
        public double getConfidence() { return confidence; }
        public long getLatencyMs() { return latencyMs; }
        public LocalDateTime getTimestamp() { return timestamp; }
    }
}
