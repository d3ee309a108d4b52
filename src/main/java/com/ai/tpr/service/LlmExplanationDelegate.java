package com.ai.tpr.service;

import com.ai.tpr.conversation.IntentKind;
import com.ai.tpr.conversation.IntentResult;
import com.ai.tpr.conversation.Selections;
import com.ai.tpr.conversation.Session;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Answers questions with OpenAI Chat Completions when an API key is configured,
 * otherwise (or when the call fails) with fixed explanations for the current stage.
 */
@Service
public class LlmExplanationDelegate implements ExplanationDelegate {

    private static final Logger log = LoggerFactory.getLogger(LlmExplanationDelegate.class);

    private static final String TPR = "Test positivity rate (TPR) is the share of malaria tests that came back positive: "
            + "positive / tested x 100. For each facility the larger of the RDT and microscopy counts is used, "
            + "since one person tested both ways is still one person.";
    private static final String ALTERNATIVE = "In urban wards a TPR above the urban threshold usually means only the sickest "
            + "patients were tested. When outpatient attendance is reported, those wards use positive / outpatient attendance x 100 instead.";
    private static final String FACILITY_LEVELS = "Primary facilities are health centres and clinics, where most community "
            + "testing happens. Secondary facilities are general hospitals, tertiary facilities are teaching hospitals and "
            + "federal medical centres. Primary is recommended because it best reflects community burden.";
    private static final String AGE_GROUPS = "Under 5 is the most sensitive indicator of transmission, over 5 covers older children "
            + "and adults, and pregnant women are tested at antenatal visits. All ages combines the three cohorts.";
    private static final String STATES = "Each state is analysed separately so wards can be matched to that state's boundaries. "
            + "States with the most test data are listed first.";

    private final RestTemplate restTemplate;
    private final ObjectMapper mapper = new ObjectMapper();
    private final String apiKey;
    private final String model;
    private final String url;

    public LlmExplanationDelegate(RestTemplateBuilder builder,
                                  @Value("${tpr.explanation.api-key:}") String apiKey,
                                  @Value("${tpr.explanation.model:gpt-4o-mini}") String model,
                                  @Value("${tpr.explanation.url:https://api.openai.com/v1/chat/completions}") String url) {
        this.restTemplate = builder.build();
        this.apiKey = apiKey;
        this.model = model;
        this.url = url;
    }

    @Override
    public String explain(Session session, IntentResult intent) {
        if (StringUtils.isBlank(apiKey)) {
            return cannedAnswer(session, intent);
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(apiKey);
        headers.setContentType(MediaType.APPLICATION_JSON);

        List<Map<String, String>> messages = new ArrayList<>();
        Map<String, String> systemMsg = new HashMap<>();
        systemMsg.put("role", "system");
        systemMsg.put("content", systemPrompt(session));
        messages.add(systemMsg);
        Map<String, String> userMsg = new HashMap<>();
        userMsg.put("role", "user");
        userMsg.put("content", StringUtils.defaultIfBlank(intent.getExtractedValue(), intent.getKind().name()));
        messages.add(userMsg);

        Map<String, Object> body = new HashMap<>();
        body.put("model", model);
        body.put("temperature", 0.2);
        body.put("messages", messages);

        try {
            ResponseEntity<String> response = restTemplate.postForEntity(url, new HttpEntity<>(body, headers), String.class);
            JsonNode root = mapper.readTree(response.getBody());
            String text = root.path("choices").path(0).path("message").path("content").asText("").trim();
            if (!text.isEmpty()) return text;
            log.warn("[{}] empty explanation from model, using fixed answer", session.getSessionId());
        } catch (RestClientException | JsonProcessingException ex) {
            log.warn("[{}] explanation request failed, using fixed answer: {}", session.getSessionId(), ex.getMessage());
        }
        return cannedAnswer(session, intent);
    }

    String cannedAnswer(Session session, IntentResult intent) {
        String question = Objects.toString(intent.getExtractedValue(), "").toLowerCase(Locale.ROOT);
        if (question.contains("urban") || question.contains("alternative") || question.contains("outpatient")) {
            return ALTERNATIVE;
        }
        if (question.contains("tpr") || question.contains("positivity")) {
            return TPR;
        }
        if (intent.getKind() == IntentKind.DATA_INQUIRY || intent.getKind() == IntentKind.ANALYSIS_REQUEST) {
            return dataAnswer(session.getSelections());
        }
        switch (session.getStage()) {
            case STATE_SELECTION:
                return STATES;
            case FACILITY_LEVEL_SELECTION:
                return FACILITY_LEVELS;
            case AGE_GROUP_SELECTION:
                return AGE_GROUPS;
            default:
                return TPR;
        }
    }

    private static String dataAnswer(Selections selections) {
        if (selections.getState() == null) {
            return "Once you pick a state I can describe what the data covers there. " + TPR;
        }
        return "So far the analysis covers " + selections.getState()
                + (selections.getFacilityLevel() != null ? ", " + selections.getFacilityLevel().getLabel().toLowerCase(Locale.ROOT) + " facilities" : "")
                + ". The options below show how many tests each choice includes.";
    }

    private static String systemPrompt(Session session) {
        StringBuilder context = new StringBuilder();
        context.append("You explain a malaria test positivity rate (TPR) analysis to a health programme officer.\n");
        context.append("Answer in at most three sentences. Do not make selections for the user.\n\n");
        context.append(TPR).append('\n').append(ALTERNATIVE).append('\n');
        context.append("\nCURRENT STEP: ").append(session.getStage()).append('\n');
        session.getSelections().toMap().forEach((k, v) -> context.append(k).append(": ").append(v).append('\n'));
        return context.toString();
    }
}
