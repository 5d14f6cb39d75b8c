package com.techwriter.ingest;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SourceFileWalkerTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldApplyExcludesGitignoreAndBinaryDetection() throws Exception {
        write("src/app.py", "print('hi')\n");
        write("node_modules/dep/index.js", "module.exports = 1;\n");
        write("generated/out.txt", "generated\n");
        write("notes.log", "log line\n");
        write(".gitignore", "# comment\ngenerated/\n*.log\n!keep.log\n");
        Files.write(tempDir.resolve("image.bin"), new byte[] {1, 2, 0, 3});

        SourceFileWalker walker = new SourceFileWalker(List.of("node_modules/**"), true, 0, 0);

        assertEquals(List.of(".gitignore", "src/app.py"), relative(walker.walk(tempDir)));
    }

    @Test
    void shouldIgnoreGitignoreWhenDisabled() throws Exception {
        write("notes.log", "log line\n");
        write(".gitignore", "*.log\n");

        SourceFileWalker walker = new SourceFileWalker(List.of(), false, 0, 0);

        assertTrue(relative(walker.walk(tempDir)).contains("notes.log"));
    }

    @Test
    void shouldEnforceSizeAndCountLimits() throws Exception {
        write("a.md", "short\n");
        write("b.md", "x".repeat(200));
        write("c.md", "short too\n");
        write("d.md", "also short\n");

        SourceFileWalker walker = new SourceFileWalker(List.of(), false, 100, 2);

        assertEquals(List.of("a.md", "c.md"), relative(walker.walk(tempDir)));
    }

    @Test
    void shouldMatchUnanchoredPatternsAtAnyDepth() {
        assertTrue(SourceFileWalker.matchersFor("__pycache__/").stream()
                .anyMatch(matcher -> matcher.matches(Path.of("pkg/__pycache__/mod.pyc"))));
        assertFalse(SourceFileWalker.matchersFor("/build").stream()
                .anyMatch(matcher -> matcher.matches(Path.of("pkg/build/out.txt"))));
    }

    private void write(String relative, String content) throws Exception {
        Path file = tempDir.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }

    private List<String> relative(List<Path> files) {
        return files.stream()
                .map(file -> tempDir.relativize(file).toString().replace('\\', '/'))
                .toList();
    }
}
