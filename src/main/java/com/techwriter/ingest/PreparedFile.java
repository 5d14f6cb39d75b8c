package com.techwriter.ingest;

import java.time.Instant;
import java.util.List;

import com.techwriter.parse.ChunkCandidate;
import com.techwriter.parse.EdgeCandidate;
import com.techwriter.parse.ImportCandidate;
import com.techwriter.parse.SymbolCandidate;

/**
 * Everything a worker derives from one file before the single writer stores it.
 */
record PreparedFile(
        String path,
        String hash,
        String lang,
        long size,
        Instant mtime,
        boolean parsed,
        boolean unchanged,
        List<ChunkCandidate> chunks,
        List<SymbolCandidate> symbols,
        List<ImportCandidate> imports,
        List<EdgeCandidate> references) {

    static PreparedFile unchanged(String path, String hash) {
        return new PreparedFile(path, hash, "", 0, Instant.EPOCH, false, true, List.of(), List.of(), List.of(), List.of());
    }
}
