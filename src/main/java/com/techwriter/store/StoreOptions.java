package com.techwriter.store;

import java.nio.file.Path;

/**
 * How a {@link KnowledgeStore} acquires its backing file. A null path means an ephemeral temp file.
 */
public record StoreOptions(Path path, boolean persist, boolean allowExisting, boolean readOnly) {

    public static StoreOptions ephemeral() {
        return new StoreOptions(null, false, false, false);
    }

    public static StoreOptions at(Path path, boolean persist) {
        return new StoreOptions(path, persist, false, false);
    }

    public static StoreOptions reuse(Path path) {
        return new StoreOptions(path, true, true, false);
    }

    public static StoreOptions audit(Path path) {
        return new StoreOptions(path, true, true, true);
    }
}
