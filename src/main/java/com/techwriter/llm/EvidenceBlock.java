package com.techwriter.llm;

/**
 * One citable piece of evidence handed to the drafter.
 */
public record EvidenceBlock(String citation, String text) {
}
