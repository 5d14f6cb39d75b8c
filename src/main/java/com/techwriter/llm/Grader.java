package com.techwriter.llm;

import java.io.IOException;

@FunctionalInterface
public interface Grader {
    Grade grade(String claimText, String evidenceText) throws IOException;
}
