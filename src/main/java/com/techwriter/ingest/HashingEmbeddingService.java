package com.techwriter.ingest;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Deterministic feature-hashing embedding tuned for source text. Each identifier is hashed whole, and
 * its camelCase or snake_case parts are hashed again at half weight, so {@code parseInput} lands near
 * "parse input". The vector is L2 normalized.
 */
public class HashingEmbeddingService implements EmbeddingService {
    private static final Pattern SEPARATORS = Pattern.compile("[^\\p{L}\\p{N}_]+");
    private static final Pattern WORD_PARTS = Pattern.compile("_+|(?<=\\p{Ll})(?=\\p{Lu})|(?<=\\p{L})(?=\\p{N})");
    static final float PART_WEIGHT = 0.5f;

    private final int dimension;

    public HashingEmbeddingService(int dimension) {
        this.dimension = dimension;
    }

    @Override
    public float[] embed(String text) {
        float[] buckets = new float[dimension];
        if (text == null || text.isBlank()) {
            return buckets;
        }
        for (String identifier : SEPARATORS.split(text)) {
            if (identifier.isBlank()) {
                continue;
            }
            bump(buckets, identifier, 1f);
            List<String> parts = parts(identifier);
            if (parts.size() > 1) {
                parts.forEach(part -> bump(buckets, part, PART_WEIGHT));
            }
        }
        normalize(buckets);
        return buckets;
    }

    static List<String> parts(String identifier) {
        List<String> out = new ArrayList<>();
        for (String part : WORD_PARTS.split(identifier)) {
            if (!part.isEmpty()) {
                out.add(part);
            }
        }
        return out;
    }

    private void bump(float[] buckets, String token, float weight) {
        buckets[Math.floorMod(token.toLowerCase(Locale.ROOT).hashCode(), dimension)] += weight;
    }

    private static void normalize(float[] buckets) {
        double sum = 0;
        for (float value : buckets) {
            sum += value * value;
        }
        if (sum == 0) {
            return;
        }
        float length = (float) Math.sqrt(sum);
        for (int i = 0; i < buckets.length; i++) {
            buckets[i] /= length;
        }
    }

    @Override
    public int dimension() {
        return dimension;
    }
}
