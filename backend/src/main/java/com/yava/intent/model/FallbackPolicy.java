package com.yava.intent.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/**
 * What the classifier says when it cannot commit to an intent.
 */
@Value
public class FallbackPolicy {

    @JsonProperty("fallback_agent")
    String fallbackAgent;

    @JsonProperty("clarification_prompt")
    String clarificationPrompt;

    @JsonProperty("no_match_message")
    String noMatchMessage;
}
