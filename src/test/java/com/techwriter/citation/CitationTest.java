package com.techwriter.citation;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CitationTest {

    @Test
    void shouldParseAndFormatExactly() {
        Citation citation = Citation.parse("lib/core.py:10-25");

        assertEquals("lib/core.py", citation.path());
        assertEquals(10, citation.startLine());
        assertEquals(25, citation.endLine());
        assertEquals("lib/core.py:10-25", Citation.format("lib/core.py", 10, 25));
        assertEquals("lib/core.py:10-25", citation.format());
    }

    @Test
    void shouldAcceptSingleLineRange() {
        assertEquals(new Citation("a.md", 3, 3), Citation.parse("a.md:3-3"));
    }

    @Test
    void shouldRejectMalformedCitations() {
        assertThrows(CitationFormatException.class, () -> Citation.parse("lib/core.py"));
        assertThrows(CitationFormatException.class, () -> Citation.parse("lib/core.py:10"));
        assertThrows(CitationFormatException.class, () -> Citation.parse("lib/core.py:a-b"));
        assertThrows(CitationFormatException.class, () -> Citation.parse("lib/core.py:0-4"));
        assertThrows(CitationFormatException.class, () -> Citation.parse("lib/core.py:9-4"));
        assertThrows(CitationFormatException.class, () -> Citation.parse("lib/core.py:+1-4"));
        assertThrows(CitationFormatException.class, () -> Citation.parse(":1-4"));
        assertThrows(CitationFormatException.class, () -> Citation.parse("c:/x.py:1-4"));
        assertThrows(CitationFormatException.class, () -> Citation.parse("[x.py:1-4"));
    }

    @Test
    void shouldRejectInvalidComponentsOnFormat() {
        assertThrows(CitationFormatException.class, () -> Citation.format("a.py", 5, 4));
        assertThrows(CitationFormatException.class, () -> Citation.format("a.py", -1, 4));
        assertThrows(CitationFormatException.class, () -> Citation.format("a:b.py", 1, 4));
    }

    @Test
    void shouldReportValidity() {
        assertTrue(Citation.isValid("src/Main.java:1-200"));
        assertFalse(Citation.isValid("bad"));
    }

    @Test
    void shouldRoundTripSampledTriples() {
        String[] paths = { "a.py", "docs/guide.md", "src/main/java/X.java" };
        for (String path : paths) {
            for (int start = 1; start < 40; start += 13) {
                int end = start + start % 7;
                assertEquals(new Citation(path, start, end), Citation.parse(Citation.format(path, start, end)));
            }
        }
    }
}
