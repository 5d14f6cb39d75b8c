package com.techwriter.pipeline;

import java.util.ArrayList;
import java.util.List;

import com.techwriter.citation.CitationFormatException;
import com.techwriter.citation.CitationResolution;
import com.techwriter.citation.CitationResolver;
import com.techwriter.citation.CitationTokens;
import com.techwriter.citation.UnverifiableCitationException;
import com.techwriter.claims.DraftLines;
import com.techwriter.store.KnowledgeStore;

/**
 * Checks that every bracketed token on a prose line of a report resolves to a stored chunk.
 */
public class ReportValidator {
    private final CitationResolver resolver;

    public ReportValidator(KnowledgeStore store) {
        this.resolver = new CitationResolver(store);
    }

    /**
     * @return the resolved citations in order of appearance
     * @throws UnverifiableCitationException on the first token that does not parse or resolve
     */
    public List<CitationResolution> validate(String report) {
        List<String> lines = DraftLines.split(report);
        List<Boolean> prose = DraftLines.proseMask(lines);
        List<CitationResolution> resolved = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            if (!prose.get(i)) {
                continue;
            }
            for (String token : CitationTokens.bracketed(lines.get(i))) {
                resolved.add(require(token));
            }
        }
        return resolved;
    }

    CitationResolution require(String token) {
        CitationResolution resolution;
        try {
            resolution = resolver.resolve(token);
        } catch (CitationFormatException e) {
            throw new UnverifiableCitationException(token, e);
        }
        if (!resolution.isResolved()) {
            throw new UnverifiableCitationException(token, resolution.failure());
        }
        return resolution;
    }
}
