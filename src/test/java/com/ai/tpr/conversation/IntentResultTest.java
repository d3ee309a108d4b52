package com.ai.tpr.conversation;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class IntentResultTest {

    @Test
    void confidenceMustBeAProbability() {
        assertThat(IntentResult.selection("Kano", 0.0).isWellFormed()).isTrue();
        assertThat(IntentResult.selection("Kano", 1.0).isWellFormed()).isTrue();
        assertThat(IntentResult.selection("Kano", -0.1).isWellFormed()).isFalse();
        assertThat(IntentResult.selection("Kano", Double.NaN).isWellFormed()).isFalse();
        assertThat(new IntentResult(null, "Kano", 0.9, null).isWellFormed()).isFalse();
    }

    @Test
    void navigationValuesRoundTripThroughCommandParsing() {
        for (NavigationCommand command : NavigationCommand.values()) {
            assertThat(NavigationCommand.fromValue(IntentResult.navigation(command).getExtractedValue())).contains(command);
        }
        assertThat(NavigationCommand.fromValue(" Go Back ")).contains(NavigationCommand.BACK);
        assertThat(NavigationCommand.fromValue("forward")).isEmpty();
    }

    @Test
    void readsClassifierJson() throws Exception {
        IntentResult result = new ObjectMapper().readValue(
                "{\"kind\":\"DATA_INQUIRY\",\"extractedValue\":\"how many wards\",\"confidence\":0.7,\"rationale\":\"count\"}",
                IntentResult.class);

        assertThat(result.getKind()).isEqualTo(IntentKind.DATA_INQUIRY);
        assertThat(result.getConfidence()).isEqualTo(0.7);
        assertThat(result.isWellFormed()).isTrue();
    }

    @Test
    void missingConfidenceIsMalformed() throws Exception {
        IntentResult result = new ObjectMapper().readValue("{\"kind\":\"SELECTION\",\"extractedValue\":\"1\"}",
                IntentResult.class);

        assertThat(result.getConfidence()).isNull();
        assertThat(result.isWellFormed()).isFalse();
    }
}
