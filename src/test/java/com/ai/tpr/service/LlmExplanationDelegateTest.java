package com.ai.tpr.service;

import com.ai.tpr.conversation.IntentKind;
import com.ai.tpr.conversation.IntentResult;
import com.ai.tpr.conversation.Selections;
import com.ai.tpr.conversation.Session;
import com.ai.tpr.conversation.WorkflowStage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.web.client.MockServerRestTemplateCustomizer;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class LlmExplanationDelegateTest {

    private static final String URL = "http://llm.test/v1/chat/completions";

    private MockServerRestTemplateCustomizer server;
    private Session session;

    @BeforeEach
    void setUp() {
        server = new MockServerRestTemplateCustomizer();
        session = new Session("s1");
        session.setStage(WorkflowStage.FACILITY_LEVEL_SELECTION);
        session.setSelections(Selections.none().withState("Kano"));
    }

    private LlmExplanationDelegate delegate(String apiKey) {
        return new LlmExplanationDelegate(new RestTemplateBuilder(server), apiKey, "test-model", URL);
    }

    @Test
    void answersFromTheStageWithoutAKey() {
        String answer = delegate("").explain(session, IntentResult.of(IntentKind.INFORMATION, "which one should I pick", 0.9));

        assertThat(answer).contains("Primary facilities");
    }

    @Test
    void explainsTprAndAlternativeMethod() {
        LlmExplanationDelegate delegate = delegate("");

        assertThat(delegate.explain(session, IntentResult.of(IntentKind.INFORMATION, "what is TPR?", 0.9)))
                .contains("positive / tested");
        assertThat(delegate.explain(session, IntentResult.of(IntentKind.INFORMATION, "why urban wards?", 0.9)))
                .contains("outpatient attendance");
    }

    @Test
    void dataQuestionsMentionSelections() {
        String answer = delegate("").explain(session, IntentResult.of(IntentKind.DATA_INQUIRY, "how many records", 0.9));

        assertThat(answer).contains("Kano");
    }

    @Test
    void usesModelAnswerWhenConfigured() {
        LlmExplanationDelegate delegate = delegate("sk-test");
        server.getServer().expect(requestTo(URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("Authorization", "Bearer sk-test"))
                .andRespond(withSuccess("{\"choices\":[{\"message\":{\"content\":\" Secondary means hospitals. \"}}]}",
                        MediaType.APPLICATION_JSON));

        String answer = delegate.explain(session, IntentResult.of(IntentKind.INFORMATION, "what is secondary?", 0.9));

        assertThat(answer).isEqualTo("Secondary means hospitals.");
        server.getServer().verify();
    }

    @Test
    void fallsBackWhenTheModelFails() {
        LlmExplanationDelegate delegate = delegate("sk-test");
        server.getServer().expect(requestTo(URL)).andRespond(withServerError());

        String answer = delegate.explain(session, IntentResult.of(IntentKind.INFORMATION, "what is TPR?", 0.9));

        assertThat(answer).contains("positive / tested");
    }
}
