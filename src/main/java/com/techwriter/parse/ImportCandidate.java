package com.techwriter.parse;

/**
 * An imported name, dotted from its module down to the imported member when there is one.
 */
public record ImportCandidate(String moduleName, int line) {
}
