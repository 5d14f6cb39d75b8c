package com.techwriter.citation;

import java.util.Optional;

import com.techwriter.store.ChunkRecord;
import com.techwriter.store.FileRecord;
import com.techwriter.store.KnowledgeStore;

public class CitationResolver {
    private final KnowledgeStore store;

    public CitationResolver(KnowledgeStore store) {
        this.store = store;
    }

    public CitationResolution resolve(Citation citation) {
        Optional<FileRecord> file = store.findFileByPath(citation.path());
        if (file.isEmpty()) {
            return CitationResolution.failed(citation, null, CitationResolution.Failure.UNKNOWN_FILE);
        }
        Optional<ChunkRecord> chunk = store.findChunkCovering(file.get().id(), citation.startLine(), citation.endLine());
        return chunk
                .map(found -> CitationResolution.resolved(citation, file.get(), found))
                .orElseGet(() -> CitationResolution.failed(citation, file.get(), CitationResolution.Failure.UNKNOWN_RANGE));
    }

    /**
     * Parses and resolves in one step.
     *
     * @throws CitationFormatException when the token is not a citation
     */
    public CitationResolution resolve(String token) {
        return resolve(Citation.parse(token));
    }

    public String citationFor(ChunkRecord chunk) {
        FileRecord file = store.findFile(chunk.fileId())
                .orElseThrow(() -> new IllegalStateException("Chunk " + chunk.id() + " has no file"));
        return Citation.format(file.path(), chunk.startLine(), chunk.endLine());
    }
}
