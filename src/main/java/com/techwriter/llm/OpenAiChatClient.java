package com.techwriter.llm;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.techwriter.runtime.AppConfig;

import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

/**
 * Summarizer, drafter and grader backed by an OpenAI-compatible chat completions endpoint.
 */
public class OpenAiChatClient implements Summarizer, Drafter, Grader {
    private static final Logger log = LoggerFactory.getLogger(OpenAiChatClient.class);
    private static final MediaType JSON = MediaType.parse("application/json");
    private static final int MAX_INPUT_CHARS = 6000;
    private static final double SUMMARY_CONFIDENCE = 0.7;
    private static final Pattern SUPPORTED = Pattern.compile("\\bsupported\\b");
    private static final Pattern NEGATED_SUPPORT = Pattern.compile("\\b(not|un)\\s*supported\\b");

    static final String REPORT_SYSTEM_PROMPT = "Write a concise technical report. Every claim or paragraph must include "
            + "a citation in the format [path:start-end]. Do not invent citations; only cite evidence you have.";
    static final String GRADE_INSTRUCTIONS = "State if the evidence supports the claim. Respond with 'supported', "
            + "'contradicted' or 'uncertain' and a short rationale.";

    private final OkHttpClient httpClient;
    private final ObjectMapper mapper;
    private final String endpoint;
    private final String model;
    private final String apiKey;
    private final double temperature;

    public OpenAiChatClient(OkHttpClient httpClient, String endpoint, String model, String apiKey, double temperature) {
        this.httpClient = httpClient;
        this.mapper = new ObjectMapper();
        this.endpoint = endpoint;
        this.model = model;
        this.apiKey = apiKey;
        this.temperature = temperature;
    }

    public static OpenAiChatClient fromConfig(AppConfig.LlmConfig config) {
        OkHttpClient client = new OkHttpClient.Builder()
                .callTimeout(Duration.ofMillis(config.getTimeoutMs()))
                .build();
        return new OpenAiChatClient(client, config.getEndpoint(), config.getModel(),
                System.getenv(config.getApiKeyEnv()), config.getTemperature());
    }

    @Override
    public SummaryDraft summarize(String text, String instructions) throws IOException {
        String prompt = instructions + "\n\n" + truncate(text);
        String content = complete(List.of(message("user", prompt)));
        return new SummaryDraft(content, SUMMARY_CONFIDENCE, List.of());
    }

    @Override
    public String draft(String prompt, List<EvidenceBlock> evidence) throws IOException {
        StringBuilder user = new StringBuilder(prompt).append("\n\nEvidence (cite only these):");
        for (EvidenceBlock block : evidence) {
            user.append("\n\n[").append(block.citation()).append("]\n").append(block.text());
        }
        return complete(List.of(message("system", REPORT_SYSTEM_PROMPT), message("user", user.toString())));
    }

    @Override
    public Grade grade(String claimText, String evidenceText) throws IOException {
        String prompt = GRADE_INSTRUCTIONS + "\n\nClaim: " + claimText + "\n\nEvidence:\n" + truncate(evidenceText);
        return parseGrade(complete(List.of(message("user", prompt))));
    }

    /**
     * Reads a verdict out of free text. Contradiction wins, and a negated "supported" does not count.
     */
    static Grade parseGrade(String reply) {
        String lower = reply == null ? "" : reply.toLowerCase(Locale.ROOT);
        if (lower.contains("contradict")) {
            return Grade.contradicted(reply.strip());
        }
        String withoutNegations = NEGATED_SUPPORT.matcher(lower).replaceAll("");
        if (SUPPORTED.matcher(withoutNegations).find()) {
            return Grade.supported(reply.strip());
        }
        return Grade.uncertain(lower.isBlank() ? "Empty grader reply" : reply.strip());
    }

    private String complete(List<Map<String, String>> messages) throws IOException {
        if (apiKey == null || apiKey.isBlank()) {
            throw new IOException("No API key configured for " + endpoint);
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model);
        body.put("messages", new ArrayList<>(messages));
        body.put("temperature", temperature);
        Request request = new Request.Builder()
                .url(endpoint)
                .header("Authorization", "Bearer " + apiKey)
                .post(RequestBody.create(mapper.writeValueAsString(body), JSON))
                .build();
        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful() || response.body() == null) {
                throw new IOException("Chat completion failed with HTTP " + response.code());
            }
            JsonNode root = mapper.readTree(response.body().string());
            JsonNode content = root.path("choices").path(0).path("message").path("content");
            if (!content.isTextual()) {
                throw new IOException("Chat completion returned no message content");
            }
            log.debug("llm.complete model={} chars={}", model, content.asText().length());
            return content.asText();
        }
    }

    private static Map<String, String> message(String role, String content) {
        Map<String, String> message = new LinkedHashMap<>();
        message.put("role", role);
        message.put("content", content);
        return message;
    }

    private static String truncate(String text) {
        return text.length() <= MAX_INPUT_CHARS ? text : text.substring(0, MAX_INPUT_CHARS);
    }
}
