package com.techwriter.ingest;

public record IngestionReport(
        int processedFiles,
        int skippedFiles,
        int removedFiles,
        int totalFiles,
        int chunks,
        int symbols,
        int edges,
        int resolvedImports,
        int resolvedReferences) {
}
