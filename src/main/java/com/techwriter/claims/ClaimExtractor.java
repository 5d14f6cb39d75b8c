package com.techwriter.claims;

import java.util.ArrayList;
import java.util.List;

import com.techwriter.citation.Citation;
import com.techwriter.citation.CitationTokens;
import com.techwriter.store.ClaimRecord;

public class ClaimExtractor {

    public List<ClaimRecord> extract(long reportVersionId, String draft) {
        List<String> lines = DraftLines.split(draft);
        List<Boolean> prose = DraftLines.proseMask(lines);
        List<ClaimRecord> claims = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            String text = lines.get(i).strip();
            if (!prose.get(i) || !DraftLines.isClaimCandidate(text)) {
                continue;
            }
            List<String> citations = CitationTokens.citations(text).stream()
                    .map(Citation::format)
                    .distinct()
                    .toList();
            claims.add(ClaimRecord.unchecked(reportVersionId, text, citations));
        }
        return claims;
    }
}
