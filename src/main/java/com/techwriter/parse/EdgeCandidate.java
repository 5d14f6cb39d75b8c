package com.techwriter.parse;

import com.techwriter.store.EdgeType;

/**
 * A relation found in one file. The source is pinned by name and start line so overloads and
 * same-named members of different classes stay apart. The destination is only a name.
 */
public record EdgeCandidate(String srcName, int srcStartLine, String dstName, EdgeType type) {
}
