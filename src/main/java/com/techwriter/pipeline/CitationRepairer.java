package com.techwriter.pipeline;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.techwriter.citation.CitationTokens;
import com.techwriter.claims.DraftLines;
import com.techwriter.retrieval.RetrievalEngine;
import com.techwriter.retrieval.ScoredChunk;
import com.techwriter.store.ClaimRecord;

/**
 * Writes citations back into the report lines of claims that ended verification uncited in the text.
 * A claim that verification grounded through retrieval gets that citation; a claim with none gets
 * the best allowed chunk for its own text, if any.
 */
public class CitationRepairer {
    private static final Logger log = LoggerFactory.getLogger(CitationRepairer.class);

    private final RetrievalEngine retrieval;

    public CitationRepairer(RetrievalEngine retrieval) {
        this.retrieval = retrieval;
    }

    public record Result(String report, int repairedLines) {
        public boolean changed() {
            return repairedLines > 0;
        }
    }

    public static boolean needsRepair(List<ClaimRecord> claims) {
        return claims.stream().anyMatch(claim -> !claim.hasCitations());
    }

    /**
     * @param allowed citations the report may use, or null for any
     */
    public Result repair(String report, List<ClaimRecord> claims, Set<String> allowed) {
        List<String> lines = new ArrayList<>(DraftLines.split(report));
        List<Boolean> prose = DraftLines.proseMask(lines);
        int repaired = 0;
        for (ClaimRecord claim : claims) {
            int index = lineOf(lines, prose, claim.text());
            if (index < 0 || !CitationTokens.citations(lines.get(index)).isEmpty()) {
                continue;
            }
            Set<String> citations = new LinkedHashSet<>();
            for (String ref : claim.citationRefs()) {
                if (allowed == null || allowed.contains(ref)) {
                    citations.add(ref);
                }
            }
            if (citations.isEmpty()) {
                bestAllowed(CitationTokens.stripBracketed(claim.text()), allowed).ifPresent(citations::add);
            }
            if (citations.isEmpty()) {
                log.debug("repair.skip claim=\"{}\"", claim.text());
                continue;
            }
            String line = lines.get(index);
            lines.set(index, CitationEnforcer.withCitations(
                    line.substring(0, line.length() - line.stripLeading().length()) + CitationTokens.stripBracketed(line),
                    citations));
            repaired++;
        }
        log.info("repair.done claims={} repaired={}", claims.size(), repaired);
        return new Result(String.join("\n", lines), repaired);
    }

    private Optional<String> bestAllowed(String text, Set<String> allowed) {
        if (text.isBlank()) {
            return Optional.empty();
        }
        for (ScoredChunk candidate : retrieval.retrieve(text).chunks()) {
            if (allowed == null || allowed.contains(candidate.citation())) {
                return Optional.of(candidate.citation());
            }
        }
        return Optional.empty();
    }

    private static int lineOf(List<String> lines, List<Boolean> prose, String claimText) {
        for (int i = 0; i < lines.size(); i++) {
            if (prose.get(i) && lines.get(i).strip().equals(claimText)) {
                return i;
            }
        }
        return -1;
    }
}
