package com.techwriter.llm;

import java.io.IOException;
import java.util.List;

@FunctionalInterface
public interface Drafter {
    String draft(String prompt, List<EvidenceBlock> evidence) throws IOException;
}
