package com.techwriter.parse;

import java.util.List;
import java.util.Optional;

/**
 * Turns file text into chunk, symbol, import and edge candidates. Unsupported languages yield
 * empty results and the caller stores the file whole.
 */
public interface ParserAdapter {

    boolean supports(String language);

    Optional<ParsedSource> parse(String text, String language);

    List<ChunkCandidate> chunks(ParsedSource parsed);

    List<SymbolCandidate> symbols(ParsedSource parsed);

    List<ImportCandidate> imports(ParsedSource parsed);

    List<EdgeCandidate> edges(ParsedSource parsed, List<SymbolCandidate> symbols);

    /**
     * Edges plus references to names the file does not declare, left for cross-file resolution.
     */
    default List<EdgeCandidate> references(ParsedSource parsed, List<SymbolCandidate> symbols) {
        return edges(parsed, symbols);
    }
}
