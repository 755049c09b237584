package com.yava.intent.model;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

/**
 * Request model for /api/intents/classify. A blank utterance is accepted and yields no match.
 */
@Data
public class ClassifyRequest {
    @NotNull(message = "Utterance is required")
    private String utterance;
}
