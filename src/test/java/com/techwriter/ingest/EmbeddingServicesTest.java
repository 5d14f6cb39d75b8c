package com.techwriter.ingest;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import okhttp3.OkHttpClient;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EmbeddingServicesTest {

    private final OkHttpClient httpClient = new OkHttpClient();

    @Test
    void shouldUseHashingEmbeddingsWithoutEndpoint() {
        EmbeddingService service = EmbeddingServices.fromEnvironment(httpClient, Map.of());

        assertInstanceOf(HashingEmbeddingService.class, service);
        assertEquals(EmbeddingServices.DEFAULT_DIMENSION, service.dimension());
    }

    @Test
    void shouldUseExternalProviderWhenEndpointConfigured() {
        EmbeddingService service = EmbeddingServices.fromEnvironment(httpClient, Map.of(
                "TECHWRITER_EMBEDDING_URL", "http://127.0.0.1:9/embed",
                "TECHWRITER_EMBEDDING_PROVIDER", "local"));

        assertInstanceOf(ExternalProviderEmbeddingService.class, service);
    }

    @Test
    void shouldFallBackToHashingWhenProviderUnreachable() {
        EmbeddingService service = EmbeddingServices.fromEnvironment(httpClient, Map.of(
                "TECHWRITER_EMBEDDING_URL", "http://127.0.0.1:9/embed"));

        float[] vector = service.embed("parse input tokens");

        assertEquals(EmbeddingServices.DEFAULT_DIMENSION, vector.length);
        assertEquals(1.0, EmbeddingService.cosine(vector, new HashingEmbeddingService(256).embed("parse input tokens")),
                1e-6);
    }

    @Test
    void shouldProduceNormalizedDeterministicVectors() {
        HashingEmbeddingService service = new HashingEmbeddingService(64);

        float[] first = service.embed("Parser reads input");
        float[] second = service.embed("parser READS input");
        double norm = 0;
        for (float v : first) {
            norm += v * v;
        }

        assertEquals(1.0, norm, 1e-5);
        assertEquals(1.0, EmbeddingService.cosine(first, second), 1e-6);
        assertTrue(EmbeddingService.cosine(first, service.embed("unrelated words entirely")) < 1.0);
        assertEquals(0.0, EmbeddingService.cosine(first, service.embed("")));
    }

    @Test
    void shouldPlaceIdentifiersNearTheirWords() {
        HashingEmbeddingService service = new HashingEmbeddingService(128);

        assertEquals(List.of("parse", "Input"), HashingEmbeddingService.parts("parseInput"));
        assertEquals(List.of("max", "file", "bytes"), HashingEmbeddingService.parts("max_file_bytes"));
        assertEquals(List.of("render"), HashingEmbeddingService.parts("render"));

        float[] words = service.embed("parse input");
        assertTrue(EmbeddingService.cosine(service.embed("parseInput"), words) > 0.5);
        assertTrue(EmbeddingService.cosine(service.embed("parse_input"), words) > 0.5);
    }
}
