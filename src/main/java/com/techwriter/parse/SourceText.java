package com.techwriter.parse;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import org.treesitter.TSNode;

/**
 * Source text with both views tree-sitter needs: UTF-8 bytes for node offsets, lines for spans.
 */
public final class SourceText {
    private final String text;
    private final byte[] bytes;
    private final String[] lines;

    public SourceText(String text) {
        this.text = text;
        this.bytes = text.getBytes(StandardCharsets.UTF_8);
        this.lines = text.split("\\R", -1);
    }

    public String text() {
        return text;
    }

    public int lineCount() {
        if (text.isEmpty()) {
            return 0;
        }
        return text.endsWith("\n") ? lines.length - 1 : lines.length;
    }

    public String line(int lineNumber) {
        return lines[lineNumber - 1];
    }

    /**
     * Inclusive, 1-indexed line slice joined with {@code \n}.
     */
    public String lines(int startLine, int endLine) {
        int from = Math.max(0, startLine - 1);
        int to = Math.min(lines.length, endLine);
        return String.join("\n", Arrays.copyOfRange(lines, from, Math.max(from, to)));
    }

    public String text(TSNode node) {
        int start = Math.max(0, node.getStartByte());
        int end = Math.min(bytes.length, node.getEndByte());
        if (end <= start) {
            return "";
        }
        return new String(bytes, start, end - start, StandardCharsets.UTF_8);
    }

    public static int startLine(TSNode node) {
        return node.getStartPoint().getRow() + 1;
    }

    /**
     * Last line that holds part of the node. A node ending at column 0 ends on the previous line.
     */
    public static int endLine(TSNode node) {
        int startRow = node.getStartPoint().getRow();
        int endRow = node.getEndPoint().getRow();
        if (node.getEndPoint().getColumn() == 0 && endRow > startRow) {
            endRow--;
        }
        return endRow + 1;
    }
}
