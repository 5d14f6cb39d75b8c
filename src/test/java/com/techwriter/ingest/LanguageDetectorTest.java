package com.techwriter.ingest;

import java.nio.file.Path;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LanguageDetectorTest {

    @Test
    void shouldMapKnownExtensions() {
        assertEquals("python", LanguageDetector.detect(Path.of("pkg/mod.py")));
        assertEquals("java", LanguageDetector.detect(Path.of("src/Main.java")));
        assertEquals("javascript", LanguageDetector.detect(Path.of("web/app.mjs")));
        assertEquals("markdown", LanguageDetector.detect(Path.of("README.MD")));
    }

    @Test
    void shouldFallBackToExtensionOrUnknown() {
        assertEquals("lua", LanguageDetector.detect(Path.of("init.lua")));
        assertEquals("unknown", LanguageDetector.detect(Path.of("Makefile")));
        assertEquals("unknown", LanguageDetector.detect(Path.of("trailing.")));
    }

    @Test
    void shouldTreatDocumentationAsProse() {
        assertTrue(LanguageDetector.isProse("markdown"));
        assertTrue(LanguageDetector.isProse("text"));
        assertFalse(LanguageDetector.isProse("python"));
    }
}
