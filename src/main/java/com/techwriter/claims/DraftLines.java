package com.techwriter.claims;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Line classification shared by claim extraction and citation enforcement. Blank lines, headers
 * and fenced code never carry claims.
 */
public final class DraftLines {
    private static final Pattern BULLET = Pattern.compile("^([-*+]|\\d+[.)])\\s+.*");
    private static final int MIN_PROSE_WORDS = 5;

    private DraftLines() {
    }

    public static List<String> split(String draft) {
        return List.of(draft.split("\\R", -1));
    }

    /**
     * For each line, whether it is prose that may carry citations.
     */
    public static List<Boolean> proseMask(List<String> lines) {
        List<Boolean> mask = new ArrayList<>(lines.size());
        boolean inFence = false;
        for (String line : lines) {
            String trimmed = line.strip();
            if (trimmed.startsWith("```") || trimmed.startsWith("~~~")) {
                inFence = !inFence;
                mask.add(false);
                continue;
            }
            mask.add(!inFence && !trimmed.isEmpty() && !isHeader(trimmed));
        }
        return mask;
    }

    public static boolean isHeader(String trimmed) {
        return trimmed.startsWith("#");
    }

    public static boolean isBullet(String trimmed) {
        return BULLET.matcher(trimmed).matches();
    }

    /**
     * A claim is a bullet, or any other prose line of at least five words.
     */
    public static boolean isClaimCandidate(String trimmed) {
        return isBullet(trimmed) || trimmed.split("\\s+").length >= MIN_PROSE_WORDS;
    }
}
