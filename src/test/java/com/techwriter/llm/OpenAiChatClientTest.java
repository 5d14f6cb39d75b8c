package com.techwriter.llm;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.techwriter.store.ClaimStatus;

import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Protocol;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.Buffer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OpenAiChatClientTest {

    private static final String ENDPOINT = "http://llm.test/v1/chat/completions";

    @Test
    void shouldParseVerdictsFromFreeText() {
        assertEquals(ClaimStatus.SUPPORTED, OpenAiChatClient.parseGrade("Supported: the docstring says so.").status());
        assertEquals(ClaimStatus.CONTRADICTED, OpenAiChatClient.parseGrade("This is contradicted by line 3.").status());
        assertEquals(ClaimStatus.UNCERTAIN, OpenAiChatClient.parseGrade("The claim is not supported here.").status());
        assertEquals(ClaimStatus.UNCERTAIN, OpenAiChatClient.parseGrade("Unsupported.").status());
        assertEquals(ClaimStatus.UNCERTAIN, OpenAiChatClient.parseGrade("").status());
        assertEquals("Empty grader reply", OpenAiChatClient.parseGrade(null).rationale());
    }

    @Test
    void shouldSendEvidenceAndReturnMessageContent() throws Exception {
        List<JsonNode> requests = new ArrayList<>();
        OpenAiChatClient client = new OpenAiChatClient(stub(200, "{\"choices\":[{\"message\":{\"content\":\"Report body\"}}]}", requests),
                ENDPOINT, "test-model", "secret", 0.0);

        String draft = client.draft("Explain parsing", List.of(new EvidenceBlock("src/a.py:1-3", "def parse(): pass")));

        assertEquals("Report body", draft);
        JsonNode body = requests.get(0);
        assertEquals("test-model", body.path("model").asText());
        assertEquals(OpenAiChatClient.REPORT_SYSTEM_PROMPT, body.path("messages").path(0).path("content").asText());
        assertTrue(body.path("messages").path(1).path("content").asText().contains("[src/a.py:1-3]\ndef parse(): pass"));
    }

    @Test
    void shouldGradeThroughEndpoint() throws Exception {
        OpenAiChatClient client = new OpenAiChatClient(stub(200, "{\"choices\":[{\"message\":{\"content\":\"supported\"}}]}",
                new ArrayList<>()), ENDPOINT, "test-model", "secret", 0.0);

        assertEquals(ClaimStatus.SUPPORTED, client.grade("Parses input", "def parse(): pass").status());
    }

    @Test
    void shouldFailOnHttpErrorsAndMissingKey() {
        OpenAiChatClient failing = new OpenAiChatClient(stub(500, "{}", new ArrayList<>()), ENDPOINT, "m", "secret", 0.0);
        OpenAiChatClient keyless = new OpenAiChatClient(stub(200, "{}", new ArrayList<>()), ENDPOINT, "m", null, 0.0);
        OpenAiChatClient empty = new OpenAiChatClient(stub(200, "{\"choices\":[]}", new ArrayList<>()), ENDPOINT, "m", "k", 0.0);

        assertThrows(IOException.class, () -> failing.summarize("text", "Summarize"));
        assertThrows(IOException.class, () -> keyless.summarize("text", "Summarize"));
        assertThrows(IOException.class, () -> empty.grade("claim", "evidence"));
    }

    private static OkHttpClient stub(int code, String json, List<JsonNode> requests) {
        ObjectMapper mapper = new ObjectMapper();
        return new OkHttpClient.Builder()
                .addInterceptor(chain -> {
                    Buffer buffer = new Buffer();
                    chain.request().body().writeTo(buffer);
                    requests.add(mapper.readTree(buffer.readUtf8()));
                    return new Response.Builder()
                            .request(chain.request())
                            .protocol(Protocol.HTTP_1_1)
                            .code(code)
                            .message(code == 200 ? "OK" : "Error")
                            .body(ResponseBody.create(json, MediaType.get("application/json")))
                            .build();
                })
                .build();
    }
}
