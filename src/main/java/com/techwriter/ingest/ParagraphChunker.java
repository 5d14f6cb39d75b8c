package com.techwriter.ingest;

import java.util.ArrayList;
import java.util.List;

import com.techwriter.parse.ChunkCandidate;

/**
 * Splits prose on blank lines. A text with no blank line becomes a single block.
 */
public class ParagraphChunker {

    public List<ChunkCandidate> chunk(String text) {
        String[] lines = text.split("\\R", -1);
        int total = text.endsWith("\n") ? lines.length - 1 : lines.length;
        List<ChunkCandidate> chunks = new ArrayList<>();
        if (text.isEmpty() || total == 0) {
            return chunks;
        }

        List<String> buffer = new ArrayList<>();
        boolean sawBlank = false;
        int start = 1;
        for (int lineNumber = 1; lineNumber <= total; lineNumber++) {
            String line = lines[lineNumber - 1];
            if (line.isBlank()) {
                sawBlank = true;
                if (!buffer.isEmpty()) {
                    chunks.add(new ChunkCandidate(start, lineNumber - 1, String.join("\n", buffer), "paragraph"));
                    buffer.clear();
                }
                continue;
            }
            if (buffer.isEmpty()) {
                start = lineNumber;
            }
            buffer.add(line);
        }
        if (!buffer.isEmpty()) {
            String kind = sawBlank ? "paragraph" : "block";
            chunks.add(new ChunkCandidate(start, total, String.join("\n", buffer), kind));
        }
        return chunks;
    }
}
