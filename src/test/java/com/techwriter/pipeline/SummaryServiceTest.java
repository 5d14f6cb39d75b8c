package com.techwriter.pipeline;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.techwriter.citation.UnverifiableCitationException;
import com.techwriter.llm.SummaryDraft;
import com.techwriter.store.ChunkRecord;
import com.techwriter.store.FileRecord;
import com.techwriter.store.KnowledgeStore;
import com.techwriter.store.SummaryLevel;
import com.techwriter.store.SummaryRecord;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SummaryServiceTest {

    @TempDir
    Path tempDir;

    private KnowledgeStore store;
    private long sourceFile;

    @BeforeEach
    void setUp() throws Exception {
        store = KnowledgeStore.ephemeral();
        sourceFile = store.upsertFile(new FileRecord(null, "src/app.py", "h1", "python", 120, Instant.now(), true));
        store.addChunk(new ChunkRecord(null, sourceFile, 1, 3, "function", "def main():\n    run()\n", "a1", null));
        store.addChunk(new ChunkRecord(null, sourceFile, 5, 7, "function", "def run():\n    return 0\n", "a2", null));
        long notes = store.upsertFile(new FileRecord(null, "NOTES.md", "h2", "markdown", 20, Instant.now(), false));
        store.addChunk(new ChunkRecord(null, notes, 1, 1, "block", "Release notes.", "n1", null));
    }

    @AfterEach
    void tearDown() throws Exception {
        store.close();
    }

    @Test
    void shouldBuildCitedHierarchyForParsedFiles() {
        List<String> instructions = new ArrayList<>();
        SummaryService service = new SummaryService(store, (text, instruction) -> {
            instructions.add(instruction);
            return new SummaryDraft("Entry point   that runs\nthe app.", 0.8, List.of("src/app.py:5-7"));
        });

        SummaryService.Hierarchy hierarchy = service.summarizeProject(tempDir, true);

        assertEquals(2, hierarchy.chunkSummaries().size());
        assertEquals(1, hierarchy.fileSummaries().size());
        assertNotNull(hierarchy.moduleSummary());
        assertNotNull(hierarchy.packageSummary());
        assertEquals(5, hierarchy.size());
        assertEquals("Entry point that runs the app. [src/app.py:1-3] [src/app.py:5-7]",
                hierarchy.fileSummaries().get(0).text());
        assertTrue(hierarchy.moduleSummary().text().contains("[src/app.py:1-3]"));
        assertEquals(SummaryService.PACKAGE_INSTRUCTIONS, instructions.get(instructions.size() - 1));

        long moduleId = store.findModuleId(tempDir.toAbsolutePath().normalize().toString()).orElseThrow();
        assertEquals(List.of(sourceFile), store.moduleFileIds(moduleId));
        assertEquals(5, store.listSummaries(null).size());
    }

    @Test
    void shouldReuseExistingFileSummary() {
        SummaryService service = new SummaryService(store, (text, instruction) -> new SummaryDraft("Runs the app.", 0.5, List.of()));

        SummaryRecord first = service.summarizeFile(store.findFile(sourceFile).orElseThrow()).orElseThrow();
        SummaryRecord second = service.summarizeFile(store.findFile(sourceFile).orElseThrow()).orElseThrow();

        assertEquals(first.id(), second.id());
        assertEquals(1, store.summariesFor(SummaryLevel.FILE, sourceFile).size());
    }

    @Test
    void shouldRejectSummariesWithUnresolvableCitations() {
        SummaryService service = new SummaryService(store,
                (text, instruction) -> new SummaryDraft("Runs the app.", 0.5, List.of("src/app.py:40-44")));

        SummaryService.Hierarchy hierarchy = service.summarizeProject(tempDir, false);

        assertEquals(0, hierarchy.size());
        assertTrue(store.listSummaries(null).isEmpty());
    }

    @Test
    void shouldSkipSummariesWhenSummarizerFails() {
        SummaryService service = new SummaryService(store, (text, instruction) -> {
            throw new IOException("model offline");
        });

        assertEquals(0, service.summarizeProject(tempDir, true).size());
    }

    @Test
    void shouldValidateSummaryText() {
        SummaryService service = new SummaryService(store, (text, instruction) -> new SummaryDraft("", 0, List.of()));

        assertDoesNotThrow(() -> service.validate("Runs the app. [src/app.py:1-3]"));
        assertThrows(IllegalArgumentException.class, () -> service.validate("Runs the app."));
        assertThrows(IllegalArgumentException.class, () -> service.validate("[src/app.py:1-3]"));
        assertThrows(IllegalArgumentException.class, () -> service.validate("Runs the app. [app]"));
        assertThrows(UnverifiableCitationException.class, () -> service.validate("Runs the app. [lib/gone.py:1-2]"));
    }
}
