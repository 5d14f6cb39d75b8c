package com.techwriter.ingest;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.techwriter.store.EdgeRecord;
import com.techwriter.store.EdgeType;
import com.techwriter.store.KnowledgeStore;
import com.techwriter.store.ReferenceRecord;
import com.techwriter.store.SymbolRecord;

/**
 * The one step that needs every file in the store: resolve import symbols and leftover references
 * against a name index of all declared symbols.
 */
public class CrossFileResolver {
    private static final Logger log = LoggerFactory.getLogger(CrossFileResolver.class);

    private final KnowledgeStore store;

    public CrossFileResolver(KnowledgeStore store) {
        this.store = store;
    }

    public record Result(int resolvedImports, int resolvedReferences) {
    }

    /**
     * Replays every stored import and reference, so edges into re-ingested files are rebuilt even when
     * the referring file was skipped as unchanged.
     */
    public Result resolve() {
        Map<String, List<Long>> index = nameIndex();
        int imports = store.inTransaction(() -> resolveImports(index));
        int references = store.inTransaction(() -> resolveReferences(index));
        log.info("ingest.resolve importsResolved={} referencesResolved={}", imports, references);
        return new Result(imports, references);
    }

    /**
     * Each import symbol is linked to every declared symbol matching its full dotted name, or failing
     * that its last segment.
     */
    private int resolveImports(Map<String, List<Long>> index) {
        int created = 0;
        for (SymbolRecord imported : store.importSymbols()) {
            List<Long> targets = index.get(imported.name());
            if (targets == null) {
                targets = index.get(lastSegment(imported.name()));
            }
            if (targets == null) {
                continue;
            }
            for (Long target : targets) {
                if (store.addEdge(new EdgeRecord(imported.id(), target, EdgeType.IMPORTS_RESOLVED))) {
                    created++;
                }
            }
        }
        return created;
    }

    /**
     * A reference resolves only when exactly one declared symbol carries the name.
     */
    private int resolveReferences(Map<String, List<Long>> index) {
        int created = 0;
        for (ReferenceRecord reference : store.listReferences()) {
            List<Long> targets = index.get(reference.dstName());
            if (targets == null || targets.size() != 1 || targets.get(0) == reference.srcSymbolId()) {
                continue;
            }
            if (store.addEdge(new EdgeRecord(reference.srcSymbolId(), targets.get(0), reference.type()))) {
                created++;
            }
        }
        return created;
    }

    private Map<String, List<Long>> nameIndex() {
        Map<String, List<Long>> index = new HashMap<>();
        for (SymbolRecord symbol : store.declaredSymbols()) {
            index.computeIfAbsent(symbol.name(), key -> new ArrayList<>()).add(symbol.id());
        }
        return index;
    }

    static String lastSegment(String name) {
        String[] parts = name.split("[./:#\\\\]+");
        for (int i = parts.length - 1; i >= 0; i--) {
            if (!parts[i].isBlank()) {
                return parts[i];
            }
        }
        return name;
    }
}
