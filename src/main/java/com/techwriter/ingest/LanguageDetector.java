package com.techwriter.ingest;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

public final class LanguageDetector {
    private static final Map<String, String> BY_EXTENSION = Map.ofEntries(
            Map.entry("py", "python"),
            Map.entry("java", "java"),
            Map.entry("js", "javascript"),
            Map.entry("jsx", "javascript"),
            Map.entry("mjs", "javascript"),
            Map.entry("cjs", "javascript"),
            Map.entry("ts", "typescript"),
            Map.entry("tsx", "tsx"),
            Map.entry("go", "go"),
            Map.entry("rs", "rust"),
            Map.entry("c", "c"),
            Map.entry("h", "c"),
            Map.entry("cc", "cpp"),
            Map.entry("cpp", "cpp"),
            Map.entry("hpp", "cpp"),
            Map.entry("cs", "c_sharp"),
            Map.entry("rb", "ruby"),
            Map.entry("php", "php"),
            Map.entry("kt", "kotlin"),
            Map.entry("json", "json"),
            Map.entry("yml", "yaml"),
            Map.entry("yaml", "yaml"),
            Map.entry("toml", "toml"),
            Map.entry("xml", "xml"),
            Map.entry("sh", "shell"),
            Map.entry("md", "markdown"),
            Map.entry("markdown", "markdown"),
            Map.entry("txt", "text"),
            Map.entry("rst", "rst"));

    private static final Set<String> PROSE = Set.of("markdown", "text", "rst");

    private LanguageDetector() {
    }

    /**
     * Language label from the file extension, the bare extension when unknown, or {@code unknown}.
     */
    public static String detect(Path path) {
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        if (dot < 0 || dot == name.length() - 1) {
            return "unknown";
        }
        String extension = name.substring(dot + 1).toLowerCase(Locale.ROOT);
        return BY_EXTENSION.getOrDefault(extension, extension);
    }

    public static boolean isProse(String language) {
        return PROSE.contains(language);
    }
}
