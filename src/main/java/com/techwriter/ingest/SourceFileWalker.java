package com.techwriter.ingest;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lists the files ingestion should read: regular, not excluded, not binary, within the size cap.
 */
public class SourceFileWalker {
    private static final Logger log = LoggerFactory.getLogger(SourceFileWalker.class);
    private static final int BINARY_PROBE_BYTES = 8000;

    private final List<String> excludes;
    private final boolean respectGitignore;
    private final long maxFileBytes;
    private final int maxFiles;

    public SourceFileWalker(List<String> excludes, boolean respectGitignore, long maxFileBytes, int maxFiles) {
        this.excludes = List.copyOf(excludes);
        this.respectGitignore = respectGitignore;
        this.maxFileBytes = maxFileBytes;
        this.maxFiles = maxFiles;
    }

    public List<Path> walk(Path root) throws IOException {
        List<PathMatcher> matchers = new ArrayList<>();
        excludes.forEach(pattern -> matchers.addAll(matchersFor(pattern)));
        if (respectGitignore) {
            for (String pattern : gitignorePatterns(root)) {
                matchers.addAll(matchersFor(pattern));
            }
        }

        List<Path> files;
        try (Stream<Path> stream = Files.walk(root)) {
            files = stream
                    .filter(Files::isRegularFile)
                    .sorted()
                    .toList();
        }

        List<Path> accepted = new ArrayList<>();
        for (Path file : files) {
            Path relative = root.relativize(file);
            if (matchers.stream().anyMatch(matcher -> matcher.matches(relative))) {
                continue;
            }
            if (maxFileBytes > 0 && Files.size(file) > maxFileBytes) {
                log.debug("ingest.skip path={} reason=too-large", relative);
                continue;
            }
            if (isBinary(file)) {
                log.debug("ingest.skip path={} reason=binary", relative);
                continue;
            }
            if (maxFiles > 0 && accepted.size() >= maxFiles) {
                log.info("ingest.limit maxFiles={}", maxFiles);
                break;
            }
            accepted.add(file);
        }
        return accepted;
    }

    static boolean isBinary(Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            byte[] probe = in.readNBytes(BINARY_PROBE_BYTES);
            for (byte b : probe) {
                if (b == 0) {
                    return true;
                }
            }
            return false;
        }
    }

    /**
     * Plain patterns from the root {@code .gitignore}. Negations are not supported and are skipped.
     */
    static List<String> gitignorePatterns(Path root) throws IOException {
        Path gitignore = root.resolve(".gitignore");
        if (!Files.isRegularFile(gitignore)) {
            return List.of();
        }
        List<String> patterns = new ArrayList<>();
        for (String line : Files.readAllLines(gitignore)) {
            String trimmed = line.strip();
            if (trimmed.isEmpty() || trimmed.startsWith("#") || trimmed.startsWith("!")) {
                continue;
            }
            patterns.add(trimmed);
        }
        return patterns;
    }

    /**
     * Glob matchers for a gitignore-style pattern. A pattern without an inner slash matches at any
     * depth, and every pattern also matches everything beneath a directory it names.
     */
    static List<PathMatcher> matchersFor(String pattern) {
        String glob = pattern.replace('\\', '/');
        if (glob.endsWith("/")) {
            glob = glob.substring(0, glob.length() - 1) + "/**";
        }
        boolean anchored = glob.startsWith("/") || glob.replaceFirst("/\\*\\*$", "").contains("/");
        if (glob.startsWith("/")) {
            glob = glob.substring(1);
        }
        List<String> globs = new ArrayList<>();
        globs.add(glob);
        if (!glob.endsWith("/**")) {
            globs.add(glob + "/**");
        }
        if (!anchored && !glob.startsWith("**/")) {
            List.copyOf(globs).forEach(g -> globs.add("**/" + g));
        }
        return globs.stream()
                .map(g -> FileSystems.getDefault().getPathMatcher("glob:" + g))
                .toList();
    }
}
