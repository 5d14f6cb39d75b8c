package com.techwriter.parse;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.techwriter.store.EdgeType;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class TreeSitterParserAdapterTest {

    private TreeSitterParserAdapter adapter;

    @BeforeEach
    void setUp() {
        adapter = new TreeSitterParserAdapter();
    }

    @Test
    void shouldChunkSingleTopLevelFunction() {
        assumeTrue(adapter.supports("python"), "python grammar not loadable on this platform");
        String text = """
                import os


                def parse_input(raw):
                    \"\"\"Split raw input.\"\"\"
                    return raw.split()
                """;
        ParsedSource parsed = adapter.parse(text, "python").orElseThrow();

        List<ChunkCandidate> chunks = adapter.chunks(parsed);
        List<SymbolCandidate> symbols = adapter.symbols(parsed);

        assertEquals(1, chunks.size());
        assertEquals("function", chunks.get(0).kind());
        assertEquals(4, chunks.get(0).startLine());
        assertEquals(6, chunks.get(0).endLine());
        assertTrue(chunks.get(0).text().startsWith("def parse_input(raw):"));
        assertEquals(1, symbols.size());
        assertEquals("parse_input", symbols.get(0).name());
        assertEquals("Split raw input.", symbols.get(0).doc());
        assertEquals(List.of(new ImportCandidate("os", 1)), adapter.imports(parsed));
    }

    @Test
    void shouldNestMethodsAndEmitEdges() {
        assumeTrue(adapter.supports("python"), "python grammar not loadable on this platform");
        String text = """
                from lib.base import Base


                class Parser(Base):
                    def run(self):
                        return helper()


                def helper():
                    return 1
                """;
        ParsedSource parsed = adapter.parse(text, "python").orElseThrow();
        List<SymbolCandidate> symbols = adapter.symbols(parsed);

        assertEquals(List.of("Parser", "run", "helper"), symbols.stream().map(SymbolCandidate::name).toList());
        assertEquals("class", symbols.get(0).kind());
        assertEquals("method", symbols.get(1).kind());
        assertEquals("function", symbols.get(2).kind());
        int[] parents = SymbolNesting.parents(symbols);
        assertEquals(-1, parents[0]);
        assertEquals(0, parents[1]);
        assertEquals(-1, parents[2]);

        List<EdgeCandidate> edges = adapter.edges(parsed, symbols);
        assertTrue(edges.contains(new EdgeCandidate("run", 5, "Parser", EdgeType.MEMBER_OF)));
        assertTrue(edges.contains(new EdgeCandidate("run", 5, "helper", EdgeType.CALLS)));

        List<EdgeCandidate> references = adapter.references(parsed, symbols);
        assertTrue(references.contains(new EdgeCandidate("Parser", 4, "Base", EdgeType.INHERITS)));
        assertFalse(edges.contains(new EdgeCandidate("Parser", 4, "Base", EdgeType.INHERITS)));
        assertEquals(List.of(new ImportCandidate("lib.base.Base", 1)), adapter.imports(parsed));
    }

    @Test
    void shouldParseJavaDeclarations() {
        assumeTrue(adapter.supports("java"), "java grammar not loadable on this platform");
        String text = """
                package demo;

                import java.util.List;

                public class Greeter implements Runnable {
                    private final String name = "x";

                    public void run() {
                        greet();
                    }

                    void greet() {
                    }
                }
                """;
        ParsedSource parsed = adapter.parse(text, "java").orElseThrow();
        List<SymbolCandidate> symbols = adapter.symbols(parsed);

        assertEquals("Greeter", symbols.get(0).name());
        assertEquals("class", symbols.get(0).kind());
        assertTrue(symbols.stream().anyMatch(s -> s.name().equals("run") && s.kind().equals("method")));
        assertTrue(symbols.stream().anyMatch(s -> s.name().equals("name") && s.kind().equals("field")));
        assertEquals("java.util.List", adapter.imports(parsed).get(0).moduleName());
        assertEquals(3, adapter.chunks(parsed).size());

        List<EdgeCandidate> edges = adapter.edges(parsed, symbols);
        assertTrue(edges.contains(new EdgeCandidate("run", 8, "greet", EdgeType.CALLS)));
        assertTrue(adapter.references(parsed, symbols)
                .contains(new EdgeCandidate("Greeter", 5, "Runnable", EdgeType.IMPLEMENTS)));
    }

    @Test
    void shouldReturnNothingForUnsupportedLanguage() {
        assertFalse(adapter.supports("cobol"));
        assertTrue(adapter.parse("IDENTIFICATION DIVISION.", "cobol").isEmpty());
    }
}
