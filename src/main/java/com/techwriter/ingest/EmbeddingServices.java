package com.techwriter.ingest;

import java.util.Map;

import okhttp3.OkHttpClient;

public final class EmbeddingServices {
    public static final int DEFAULT_DIMENSION = 256;

    private EmbeddingServices() {
    }

    public static EmbeddingService fromEnvironment(OkHttpClient httpClient) {
        return fromEnvironment(httpClient, System.getenv());
    }

    static EmbeddingService fromEnvironment(OkHttpClient httpClient, Map<String, String> environment) {
        EmbeddingService local = new HashingEmbeddingService(DEFAULT_DIMENSION);
        String endpoint = environment.get("TECHWRITER_EMBEDDING_URL");
        if (endpoint == null || endpoint.isBlank()) {
            return local;
        }
        String provider = environment.getOrDefault("TECHWRITER_EMBEDDING_PROVIDER", "custom");
        String apiKey = environment.get("TECHWRITER_EMBEDDING_API_KEY");
        return new ExternalProviderEmbeddingService(httpClient, endpoint, provider, apiKey, local);
    }
}
