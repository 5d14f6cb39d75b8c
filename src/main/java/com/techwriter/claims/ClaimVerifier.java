package com.techwriter.claims;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.techwriter.citation.Citation;
import com.techwriter.citation.CitationResolution;
import com.techwriter.citation.CitationResolver;
import com.techwriter.citation.CitationTokens;
import com.techwriter.llm.Grade;
import com.techwriter.llm.Grader;
import com.techwriter.retrieval.EvidenceBundle;
import com.techwriter.retrieval.RetrievalEngine;
import com.techwriter.retrieval.ScoredChunk;
import com.techwriter.store.ClaimRecord;
import com.techwriter.store.ClaimStatus;
import com.techwriter.store.KnowledgeStore;

/**
 * Grades each claim against the chunks it cites, or against retrieval results when it cites nothing
 * that resolves. Grader failures count as uncertain.
 */
public class ClaimVerifier {
    private static final Logger log = LoggerFactory.getLogger(ClaimVerifier.class);
    static final int RETRIEVAL_CANDIDATES = 5;

    private final CitationResolver resolver;
    private final RetrievalEngine retrieval;
    private final Grader grader;

    public ClaimVerifier(KnowledgeStore store, RetrievalEngine retrieval, Grader grader) {
        this.resolver = new CitationResolver(store);
        this.retrieval = retrieval;
        this.grader = grader;
    }

    public List<ClaimRecord> verifyAll(List<ClaimRecord> claims, Set<String> disallowed) {
        List<ClaimRecord> verified = new ArrayList<>(claims.size());
        for (ClaimRecord claim : claims) {
            verified.add(verify(claim, disallowed));
        }
        return verified;
    }

    public ClaimRecord verify(ClaimRecord claim, Set<String> disallowed) {
        String statement = CitationTokens.stripBracketed(claim.text());
        List<CitationResolution> resolved = new ArrayList<>();
        for (String token : claim.citationRefs()) {
            if (disallowed.contains(token) || !Citation.isValid(token)) {
                continue;
            }
            CitationResolution resolution = resolver.resolve(token);
            if (resolution.isResolved()) {
                resolved.add(resolution);
            } else {
                log.debug("claims.drop citation={} reason={}", token, resolution.failure());
            }
        }

        if (!resolved.isEmpty()) {
            List<String> kept = resolved.stream().map(r -> r.citation().format()).distinct().toList();
            Grade last = null;
            for (CitationResolution resolution : resolved) {
                last = safeGrade(statement, resolution.chunk().text());
                if (last.isDecisive()) {
                    break;
                }
            }
            return claim.withVerdict(kept, last.status(), last.rationale());
        }

        EvidenceBundle bundle = retrieval.retrieve(statement, RETRIEVAL_CANDIDATES);
        for (ScoredChunk candidate : bundle.chunks()) {
            if (disallowed.contains(candidate.citation())) {
                continue;
            }
            Grade grade = safeGrade(statement, candidate.chunk().text());
            if (grade.isDecisive()) {
                return claim.withVerdict(List.of(candidate.citation()), grade.status(),
                        grade.rationale().isBlank() ? "Graded via retrieval chunk " + candidate.citation() : grade.rationale());
            }
        }
        return claim.withVerdict(List.of(), ClaimStatus.MISSING, "No supporting chunk found");
    }

    private Grade safeGrade(String statement, String evidence) {
        try {
            Grade grade = grader.grade(statement, evidence);
            return grade == null ? Grade.uncertain("Grader returned nothing") : grade;
        } catch (Exception e) {
            log.warn("claims.grade.failed reason={}", e.toString());
            return Grade.uncertain("Grader failed: " + e.getMessage());
        }
    }
}
