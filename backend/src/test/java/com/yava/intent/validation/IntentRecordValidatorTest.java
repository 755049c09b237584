package com.yava.intent.validation;

import com.yava.intent.IntentFixtures;
import com.yava.intent.model.IntentRecord;
import com.yava.intent.model.ValidationIssue;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class IntentRecordValidatorTest {

    private final IntentRecordValidator validator = new IntentRecordValidator();

    @Test
    @DisplayName("a complete record has no issues")
    void wellFormedRecord() {
        assertThat(validator.check(IntentFixtures.pharmacy())).isEmpty();
    }

    @ParameterizedTest
    @ValueSource(strings = {"PHR-0001", "INT-PHR-001", "INT-phr-0001", "INT--0001", "int-PHR-0001", "INT-PHR-00012"})
    @DisplayName("intent ids outside INT-<CODE>-<4 digits> are rejected")
    void badIntentId(String id) {
        List<ValidationIssue> issues = validator.check(IntentFixtures.pharmacy().toBuilder().intentId(id).build());

        assertThat(issues).singleElement().satisfies(issue -> {
            assertThat(issue.getField()).isEqualTo("intent_id");
            assertThat(issue.getIntentId()).isEqualTo(id);
        });
    }

    @Test
    @DisplayName("missing required fields are each reported")
    void missingRequiredFields() {
        IntentRecord record = IntentRecord.builder()
            .intentId("INT-PHR-0001")
            .intentName(" ")
            .trainingUtterances(List.of())
            .build();

        assertThat(validator.check(record))
            .extracting(ValidationIssue::getField)
            .containsExactlyInAnyOrder("intent_name", "category", "agent_routing", "description_short",
                "training_utterances");
    }

    @ParameterizedTest
    @ValueSource(ints = {0, 6, -1})
    void priorityOutOfRange(int priority) {
        List<ValidationIssue> issues = validator.check(IntentFixtures.pharmacy().toBuilder().priority(priority).build());

        assertThat(issues).extracting(ValidationIssue::getField).containsExactly("priority");
    }

    @ParameterizedTest
    @ValueSource(doubles = {0.0, -0.2, 1.01, Double.NaN})
    void thresholdOutOfRange(double threshold) {
        List<ValidationIssue> issues = validator.check(
            IntentFixtures.pharmacy().toBuilder().confidenceThreshold(threshold).build());

        assertThat(issues).extracting(ValidationIssue::getField).containsExactly("confidence_threshold");
    }

    @Test
    void thresholdOfExactlyOneIsAllowed() {
        assertThat(validator.check(IntentFixtures.pharmacy().toBuilder().confidenceThreshold(1.0).build())).isEmpty();
    }

    @Test
    void blankTrainingUtteranceIsReported() {
        IntentRecord record = IntentFixtures.pharmacy().toBuilder()
            .trainingUtterances(Arrays.asList("refill please", "  ", null))
            .build();

        assertThat(validator.check(record))
            .extracting(ValidationIssue::getMessage)
            .containsExactly("training utterance #2 is empty", "training utterance #3 is empty");
    }
}
