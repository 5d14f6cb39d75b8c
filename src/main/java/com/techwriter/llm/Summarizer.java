package com.techwriter.llm;

import java.io.IOException;

@FunctionalInterface
public interface Summarizer {
    SummaryDraft summarize(String text, String instructions) throws IOException;
}
