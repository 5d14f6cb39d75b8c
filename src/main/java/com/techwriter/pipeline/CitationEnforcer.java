package com.techwriter.pipeline;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.techwriter.citation.Citation;
import com.techwriter.citation.CitationResolver;
import com.techwriter.citation.CitationTokens;
import com.techwriter.claims.DraftLines;
import com.techwriter.retrieval.RetrievalEngine;
import com.techwriter.retrieval.ScoredChunk;
import com.techwriter.store.KnowledgeStore;

/**
 * Rewrites a draft so every prose line carries only citations that parse, resolve and are allowed.
 * Uncited lines get the best retrieved citation for their own text; a line for which retrieval finds
 * nothing allowed is left uncited.
 */
public class CitationEnforcer {
    private static final Logger log = LoggerFactory.getLogger(CitationEnforcer.class);
    static final int RETRIEVAL_CANDIDATES = 5;

    private final CitationResolver resolver;
    private final RetrievalEngine retrieval;

    public CitationEnforcer(KnowledgeStore store, RetrievalEngine retrieval) {
        this.resolver = new CitationResolver(store);
        this.retrieval = retrieval;
    }

    /**
     * @param allowed citations the report may use, or null for any resolvable citation
     */
    public String enforce(String draft, Set<String> allowed) {
        List<String> lines = DraftLines.split(draft);
        List<Boolean> prose = DraftLines.proseMask(lines);
        List<String> out = new ArrayList<>(lines.size());
        int appended = 0;
        int uncited = 0;
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (!prose.get(i)) {
                out.add(line);
                continue;
            }
            List<String> tokens = CitationTokens.bracketed(line);
            List<String> kept = tokens.stream()
                    .filter(token -> acceptable(token, allowed))
                    .map(token -> Citation.parse(token).format())
                    .distinct()
                    .toList();
            if (!tokens.isEmpty() && kept.size() == tokens.size()) {
                out.add(canonicalized(line));
                continue;
            }
            String text = tokens.isEmpty() ? line.stripTrailing() : indentOf(line) + CitationTokens.stripBracketed(line);
            Set<String> citations = new LinkedHashSet<>(kept);
            if (citations.isEmpty()) {
                Optional<String> found = bestCitation(CitationTokens.stripBracketed(line), allowed);
                if (found.isPresent()) {
                    citations.add(found.get());
                    appended++;
                } else {
                    uncited++;
                    log.warn("enforce.unresolved line=\"{}\"", line.strip());
                }
            }
            out.add(withCitations(text, citations));
        }
        log.debug("enforce.done lines={} appended={} uncited={}", lines.size(), appended, uncited);
        return String.join("\n", out);
    }

    /**
     * Best retrieved citation for the text, restricted to the allowed set when one is given.
     */
    Optional<String> bestCitation(String text, Set<String> allowed) {
        if (text.isBlank()) {
            return Optional.empty();
        }
        for (ScoredChunk candidate : retrieval.retrieve(text, RETRIEVAL_CANDIDATES).chunks()) {
            if (allowed == null || allowed.contains(candidate.citation())) {
                return Optional.of(candidate.citation());
            }
        }
        return Optional.empty();
    }

    private boolean acceptable(String token, Set<String> allowed) {
        if (!Citation.isValid(token)) {
            return false;
        }
        String canonical = Citation.parse(token).format();
        if (allowed != null && !allowed.contains(canonical)) {
            return false;
        }
        return resolver.resolve(canonical).isResolved();
    }

    /**
     * Rewrites every bracketed citation into its canonical form, leaving it where the author put it.
     */
    static String canonicalized(String line) {
        Matcher matcher = CitationTokens.BRACKETED.matcher(line);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            String canonical = "[" + Citation.parse(matcher.group(1).trim()).format() + "]";
            matcher.appendReplacement(out, Matcher.quoteReplacement(canonical));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    static String withCitations(String text, Set<String> citations) {
        StringBuilder line = new StringBuilder(text);
        for (String citation : citations) {
            line.append(" [").append(citation).append(']');
        }
        return line.toString();
    }

    private static String indentOf(String line) {
        int i = 0;
        while (i < line.length() && Character.isWhitespace(line.charAt(i))) {
            i++;
        }
        return line.substring(0, i);
    }
}
