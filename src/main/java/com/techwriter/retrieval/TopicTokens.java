package com.techwriter.retrieval;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

public final class TopicTokens {
    private static final Set<String> STOPWORDS = Set.of(
            "a", "an", "and", "are", "as", "at", "be", "by", "does", "do", "for", "from", "how", "in", "into",
            "is", "it", "its", "of", "on", "or", "that", "the", "this", "to", "what", "when", "where", "which",
            "who", "why", "with", "about", "describe", "explain", "document", "documentation", "write");

    private TopicTokens() {
    }

    /**
     * Lowercase word tokens of at least two characters, stopwords removed, first occurrence order.
     */
    public static List<String> of(String text) {
        Set<String> tokens = new LinkedHashSet<>();
        if (text == null) {
            return List.of();
        }
        for (String token : text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+")) {
            if (token.length() >= 2 && !STOPWORDS.contains(token)) {
                tokens.add(token);
            }
        }
        return new ArrayList<>(tokens);
    }

    public static List<String> ofPath(String path) {
        return of(path.replaceAll("([a-z])([A-Z])", "$1 $2"));
    }

    public static int literalHits(List<String> tokens, String text) {
        String haystack = text.toLowerCase(Locale.ROOT);
        int hits = 0;
        for (String token : tokens) {
            if (haystack.contains(token)) {
                hits++;
            }
        }
        return hits;
    }
}
