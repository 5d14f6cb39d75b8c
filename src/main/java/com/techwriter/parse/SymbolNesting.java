package com.techwriter.parse;

import java.util.List;

public final class SymbolNesting {
    private SymbolNesting() {
    }

    /**
     * For each symbol, the index of the smallest other symbol whose span contains it, or -1.
     * Identical spans nest by list order so two symbols never parent each other.
     */
    public static int[] parents(List<SymbolCandidate> symbols) {
        int[] parents = new int[symbols.size()];
        for (int i = 0; i < symbols.size(); i++) {
            SymbolCandidate child = symbols.get(i);
            int best = -1;
            for (int j = 0; j < symbols.size(); j++) {
                if (i == j) {
                    continue;
                }
                SymbolCandidate candidate = symbols.get(j);
                if (!candidate.encloses(child)) {
                    continue;
                }
                if (candidate.span() == child.span() && j > i) {
                    continue;
                }
                if (best < 0 || candidate.span() < symbols.get(best).span()) {
                    best = j;
                }
            }
            parents[i] = best;
        }
        return parents;
    }
}
