package com.techwriter.retrieval;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.techwriter.citation.CitationTokens;
import com.techwriter.store.EdgeRecord;
import com.techwriter.store.SummaryRecord;
import com.techwriter.store.SymbolRecord;

/**
 * What retrieval found for one topic, best chunk first.
 */
public record EvidenceBundle(
        String topic,
        List<ScoredChunk> chunks,
        List<SummaryRecord> summaries,
        List<SymbolRecord> symbols,
        List<EdgeRecord> edges) {

    public EvidenceBundle {
        chunks = List.copyOf(chunks);
        summaries = List.copyOf(summaries);
        symbols = List.copyOf(symbols);
        edges = List.copyOf(edges);
    }

    public boolean isEmpty() {
        return chunks.isEmpty() && summaries.isEmpty();
    }

    /**
     * Citations a draft may use: every retrieved chunk plus whatever the retrieved summaries cite.
     */
    public Set<String> allowedCitations() {
        Set<String> allowed = new LinkedHashSet<>();
        chunks.forEach(chunk -> allowed.add(chunk.citation()));
        for (SummaryRecord summary : summaries) {
            CitationTokens.citations(summary.text()).forEach(citation -> allowed.add(citation.format()));
        }
        return allowed;
    }
}
