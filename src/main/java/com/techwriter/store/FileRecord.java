package com.techwriter.store;

import java.time.Instant;
import java.util.Objects;

public record FileRecord(Long id, String path, String hash, String lang, long size, Instant mtime, boolean parsed) {
    public FileRecord {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(hash, "hash");
        Objects.requireNonNull(lang, "lang");
        Objects.requireNonNull(mtime, "mtime");
    }

    public FileRecord withId(long newId) {
        return new FileRecord(newId, path, hash, lang, size, mtime, parsed);
    }
}
