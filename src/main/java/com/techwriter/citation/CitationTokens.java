package com.techwriter.citation;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds bracketed {@code [token]} groups in report text.
 */
public final class CitationTokens {
    public static final Pattern BRACKETED = Pattern.compile("\\[([^\\]\\[]+)\\]");

    private CitationTokens() {
    }

    public static List<String> bracketed(String text) {
        List<String> tokens = new ArrayList<>();
        if (text == null) {
            return tokens;
        }
        Matcher matcher = BRACKETED.matcher(text);
        while (matcher.find()) {
            tokens.add(matcher.group(1).trim());
        }
        return tokens;
    }

    /**
     * Bracketed tokens that parse as citations, in order of appearance. Malformed tokens are dropped.
     */
    public static List<Citation> citations(String text) {
        List<Citation> out = new ArrayList<>();
        for (String token : bracketed(text)) {
            if (Citation.isValid(token)) {
                out.add(Citation.parse(token));
            }
        }
        return out;
    }

    public static boolean hasBracketed(String text) {
        return text != null && BRACKETED.matcher(text).find();
    }

    public static String stripBracketed(String text) {
        return BRACKETED.matcher(text).replaceAll("").replaceAll("[ \\t]{2,}", " ").strip();
    }
}
