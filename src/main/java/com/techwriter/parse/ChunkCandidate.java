package com.techwriter.parse;

public record ChunkCandidate(int startLine, int endLine, String text, String kind) {
}
