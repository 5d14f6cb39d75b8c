package com.techwriter.store;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;
import org.springframework.transaction.support.TransactionTemplate;
import org.sqlite.SQLiteConfig;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * SQLite-backed knowledge base for one pipeline run.
 *
 * <p>One connection, one writer. Full-text indexes over chunk and summary text are maintained by
 * triggers, and every integrity rule is enforced by the database at write time.
 */
public class KnowledgeStore implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(KnowledgeStore.class);
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };

    private final Path file;
    private final boolean deleteOnClose;
    private final boolean readOnly;
    private final SingleConnectionDataSource dataSource;
    private final JdbcTemplate jdbc;
    private final TransactionTemplate transactions;
    private final ObjectMapper mapper;
    private boolean closed;

    private KnowledgeStore(Path file, boolean deleteOnClose, boolean readOnly, Connection connection) {
        this.file = file;
        this.deleteOnClose = deleteOnClose;
        this.readOnly = readOnly;
        this.dataSource = new SingleConnectionDataSource(connection, true);
        this.jdbc = new JdbcTemplate(dataSource);
        this.jdbc.setExceptionTranslator(new SqliteExceptionTranslator());
        this.transactions = new TransactionTemplate(new DataSourceTransactionManager(dataSource));
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public static KnowledgeStore ephemeral() throws IOException {
        return open(StoreOptions.ephemeral());
    }

    public static KnowledgeStore open(StoreOptions options) throws IOException {
        Path target;
        boolean ephemeral = options.path() == null;
        if (ephemeral) {
            target = Files.createTempFile("tech-writer-", ".sqlite");
            Files.delete(target);
        } else {
            target = options.path().toAbsolutePath();
            boolean exists = Files.exists(target);
            if (options.readOnly() && !exists) {
                throw new NoSuchFileException(target.toString());
            }
            if (exists && !options.allowExisting()) {
                throw new FileAlreadyExistsException(target.toString(), null,
                        "store already exists; reuse must be allowed explicitly");
            }
            if (target.getParent() != null) {
                Files.createDirectories(target.getParent());
            }
        }

        SQLiteConfig config = new SQLiteConfig();
        config.enforceForeignKeys(true);
        if (options.readOnly()) {
            config.setReadOnly(true);
        } else {
            config.setJournalMode(SQLiteConfig.JournalMode.WAL);
            config.setSynchronous(SQLiteConfig.SynchronousMode.NORMAL);
        }

        Connection connection;
        try {
            connection = DriverManager.getConnection("jdbc:sqlite:" + target, config.toProperties());
        } catch (SQLException e) {
            throw new IOException("Failed to open store at " + target, e);
        }

        KnowledgeStore store = new KnowledgeStore(target, ephemeral || !options.persist(), options.readOnly(), connection);
        if (!options.readOnly()) {
            store.initializeSchema();
        }
        log.debug("store.open path={} ephemeral={} persist={} readOnly={}",
                target, ephemeral, options.persist(), options.readOnly());
        return store;
    }

    private void initializeSchema() {
        transactions.executeWithoutResult(status -> StoreSchema.STATEMENTS.forEach(jdbc::execute));
    }

    public Path path() {
        return file;
    }

    public boolean isReadOnly() {
        return readOnly;
    }

    public <T> T inTransaction(Supplier<T> work) {
        return transactions.execute(status -> work.get());
    }

    public void runInTransaction(Runnable work) {
        transactions.executeWithoutResult(status -> work.run());
    }

    /**
     * Inserts the file, or updates the existing row for the same path in place so its id is kept.
     */
    public long upsertFile(FileRecord record) {
        Optional<FileRecord> existing = findFileByPath(record.path());
        if (existing.isPresent()) {
            long id = existing.get().id();
            jdbc.update("UPDATE files SET hash = ?, lang = ?, size = ?, mtime = ?, parsed = ? WHERE id = ?",
                    record.hash(), record.lang(), record.size(), record.mtime().toString(), record.parsed() ? 1 : 0, id);
            return id;
        }
        jdbc.update("INSERT INTO files (path, hash, lang, size, mtime, parsed) VALUES (?, ?, ?, ?, ?, ?)",
                record.path(), record.hash(), record.lang(), record.size(), record.mtime().toString(), record.parsed() ? 1 : 0);
        return lastInsertId();
    }

    public Optional<FileRecord> findFileByPath(String path) {
        return first(jdbc.query("SELECT * FROM files WHERE path = ?", FILE_MAPPER, path));
    }

    public Optional<FileRecord> findFile(long id) {
        return first(jdbc.query("SELECT * FROM files WHERE id = ?", FILE_MAPPER, id));
    }

    public List<FileRecord> listFiles() {
        return jdbc.query("SELECT * FROM files ORDER BY path", FILE_MAPPER);
    }

    /**
     * Removes a file and everything derived from it. Chunks are deleted explicitly so the full-text index
     * stays in step.
     */
    public void deleteFile(long fileId) {
        clearFileContents(fileId);
        jdbc.update("DELETE FROM files WHERE id = ?", fileId);
    }

    public int countFiles() {
        return count("SELECT COUNT(*) FROM files");
    }

    /**
     * Drops chunks and symbols of a file ahead of re-ingesting changed content. Edges and embeddings
     * go with them through cascading foreign keys.
     */
    public void clearFileContents(long fileId) {
        jdbc.update("DELETE FROM chunks WHERE file_id = ?", fileId);
        jdbc.update("DELETE FROM symbols WHERE file_id = ?", fileId);
    }

    public long addChunk(ChunkRecord chunk) {
        jdbc.update("INSERT INTO chunks (file_id, start_line, end_line, kind, text, hash, symbol_id) VALUES (?, ?, ?, ?, ?, ?, ?)",
                chunk.fileId(), chunk.startLine(), chunk.endLine(), chunk.kind(), chunk.text(), chunk.hash(), chunk.symbolId());
        return lastInsertId();
    }

    public Optional<ChunkRecord> findChunk(long id) {
        return first(jdbc.query("SELECT * FROM chunks WHERE id = ?", CHUNK_MAPPER, id));
    }

    public List<ChunkRecord> chunksForFile(long fileId) {
        return jdbc.query("SELECT * FROM chunks WHERE file_id = ? ORDER BY start_line, id", CHUNK_MAPPER, fileId);
    }

    public List<ChunkRecord> chunksForSymbol(long symbolId) {
        return jdbc.query("SELECT * FROM chunks WHERE symbol_id = ? ORDER BY id", CHUNK_MAPPER, symbolId);
    }

    public List<ChunkRecord> chunksByKind(Collection<String> kinds, int limit) {
        if (kinds.isEmpty()) {
            return List.of();
        }
        String placeholders = kinds.stream().map(kind -> "?").collect(Collectors.joining(", "));
        List<Object> args = new ArrayList<>(kinds);
        args.add(limit);
        return jdbc.query("SELECT * FROM chunks WHERE kind IN (" + placeholders + ") ORDER BY id LIMIT ?",
                CHUNK_MAPPER, args.toArray());
    }

    /**
     * First chunk of the file whose span contains the whole requested range.
     */
    public Optional<ChunkRecord> findChunkCovering(long fileId, int startLine, int endLine) {
        return first(jdbc.query(
                "SELECT * FROM chunks WHERE file_id = ? AND start_line <= ? AND end_line >= ? ORDER BY id LIMIT 1",
                CHUNK_MAPPER, fileId, startLine, endLine));
    }

    public void attachChunkToSymbol(long chunkId, Long symbolId) {
        jdbc.update("UPDATE chunks SET symbol_id = ? WHERE id = ?", symbolId, chunkId);
    }

    public void updateChunkText(long chunkId, String text, String hash) {
        jdbc.update("UPDATE chunks SET text = ?, hash = ? WHERE id = ?", text, hash, chunkId);
    }

    public void deleteChunk(long chunkId) {
        jdbc.update("DELETE FROM chunks WHERE id = ?", chunkId);
    }

    public int countChunks() {
        return count("SELECT COUNT(*) FROM chunks");
    }

    public List<ChunkRecord> searchChunks(String text, int limit) {
        return searchChunks(queryTerms(text), limit);
    }

    /**
     * Full-text search over chunk text, best match first. Terms are OR-ed together.
     */
    public List<ChunkRecord> searchChunks(Collection<String> terms, int limit) {
        String match = matchExpression(terms);
        if (match.isEmpty() || limit <= 0) {
            return List.of();
        }
        return jdbc.query("""
                SELECT c.* FROM chunks c
                JOIN (SELECT rowid AS rid, rank AS score FROM chunks_fts WHERE chunks_fts MATCH ? ORDER BY rank LIMIT ?) m
                  ON c.id = m.rid
                ORDER BY m.score, c.id""", CHUNK_MAPPER, match, limit);
    }

    public long addSymbol(SymbolRecord symbol) {
        jdbc.update("""
                INSERT INTO symbols (file_id, name, kind, signature, start_line, end_line, doc, parent_symbol_id)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?)""",
                symbol.fileId(), symbol.name(), symbol.kind(), symbol.signature(), symbol.startLine(), symbol.endLine(),
                symbol.doc(), symbol.parentSymbolId());
        return lastInsertId();
    }

    public Optional<SymbolRecord> findSymbol(long id) {
        return first(jdbc.query("SELECT * FROM symbols WHERE id = ?", SYMBOL_MAPPER, id));
    }

    public List<SymbolRecord> symbolsForFile(long fileId) {
        return jdbc.query("SELECT * FROM symbols WHERE file_id = ? ORDER BY start_line, id", SYMBOL_MAPPER, fileId);
    }

    public List<SymbolRecord> listSymbols() {
        return jdbc.query("SELECT * FROM symbols ORDER BY file_id, start_line, id", SYMBOL_MAPPER);
    }

    public List<SymbolRecord> importSymbols() {
        return jdbc.query("SELECT * FROM symbols WHERE kind = ? ORDER BY id", SYMBOL_MAPPER, SymbolRecord.IMPORT_KIND);
    }

    public List<SymbolRecord> declaredSymbols() {
        return jdbc.query("SELECT * FROM symbols WHERE kind <> ? ORDER BY id", SYMBOL_MAPPER, SymbolRecord.IMPORT_KIND);
    }

    /**
     * Non-import symbols whose name contains any of the terms, case-insensitively.
     */
    public List<SymbolRecord> findSymbolsByName(Collection<String> terms, int limit) {
        Set<Long> seen = new LinkedHashSet<>();
        List<SymbolRecord> out = new ArrayList<>();
        for (String term : terms) {
            if (term.isBlank()) {
                continue;
            }
            List<SymbolRecord> hits = jdbc.query(
                    "SELECT * FROM symbols WHERE kind <> ? AND lower(name) LIKE ? ESCAPE '\\' ORDER BY id LIMIT ?",
                    SYMBOL_MAPPER, SymbolRecord.IMPORT_KIND, "%" + escapeLike(term.toLowerCase(Locale.ROOT)) + "%", limit);
            for (SymbolRecord hit : hits) {
                if (seen.add(hit.id())) {
                    out.add(hit);
                }
            }
            if (out.size() >= limit) {
                break;
            }
        }
        return out.size() > limit ? out.subList(0, limit) : out;
    }

    public void updateSymbolParent(long symbolId, Long parentSymbolId) {
        jdbc.update("UPDATE symbols SET parent_symbol_id = ? WHERE id = ?", parentSymbolId, symbolId);
    }

    /**
     * @return false when the (src, dst, type) triple already exists
     */
    public boolean addEdge(EdgeRecord edge) {
        return jdbc.update("INSERT OR IGNORE INTO edges (src_symbol_id, dst_symbol_id, edge_type) VALUES (?, ?, ?)",
                edge.srcSymbolId(), edge.dstSymbolId(), edge.type().value()) > 0;
    }

    public void addReference(ReferenceRecord reference) {
        jdbc.update("INSERT OR IGNORE INTO symbol_references (src_symbol_id, dst_name, edge_type) VALUES (?, ?, ?)",
                reference.srcSymbolId(), reference.dstName(), reference.type().value());
    }

    public List<ReferenceRecord> listReferences() {
        return jdbc.query("SELECT * FROM symbol_references ORDER BY id", (rs, row) -> new ReferenceRecord(
                rs.getLong("src_symbol_id"), rs.getString("dst_name"), EdgeType.fromValue(rs.getString("edge_type"))));
    }

    public List<EdgeRecord> edgesForSymbol(long symbolId) {
        return jdbc.query("SELECT * FROM edges WHERE src_symbol_id = ? OR dst_symbol_id = ? ORDER BY id",
                EDGE_MAPPER, symbolId, symbolId);
    }

    public List<EdgeRecord> edgesForSymbol(long symbolId, EdgeType type) {
        return jdbc.query("SELECT * FROM edges WHERE (src_symbol_id = ? OR dst_symbol_id = ?) AND edge_type = ? ORDER BY id",
                EDGE_MAPPER, symbolId, symbolId, type.value());
    }

    public List<EdgeRecord> edgesOfType(EdgeType type) {
        return jdbc.query("SELECT * FROM edges WHERE edge_type = ? ORDER BY id", EDGE_MAPPER, type.value());
    }

    public long addPackage(String path, String name) {
        jdbc.update("INSERT INTO packages (path, name) VALUES (?, ?)", path, name);
        return lastInsertId();
    }

    public Optional<Long> findPackageId(String path) {
        return first(jdbc.queryForList("SELECT id FROM packages WHERE path = ?", Long.class, path));
    }

    public long addModule(Long packageId, String path, String name) {
        jdbc.update("INSERT INTO modules (package_id, path, name) VALUES (?, ?, ?)", packageId, path, name);
        return lastInsertId();
    }

    public Optional<Long> findModuleId(String path) {
        return first(jdbc.queryForList("SELECT id FROM modules WHERE path = ?", Long.class, path));
    }

    public void linkModuleFile(long moduleId, long fileId) {
        jdbc.update("INSERT OR IGNORE INTO module_files (module_id, file_id) VALUES (?, ?)", moduleId, fileId);
    }

    public List<Long> moduleFileIds(long moduleId) {
        return jdbc.queryForList("SELECT file_id FROM module_files WHERE module_id = ? ORDER BY file_id", Long.class, moduleId);
    }

    public long addSummary(SummaryRecord summary) {
        jdbc.update("INSERT INTO summaries (level, target_id, text, confidence, created_at) VALUES (?, ?, ?, ?, ?)",
                summary.level().value(), summary.targetId(), summary.text(), summary.confidence(), summary.createdAt().toString());
        return lastInsertId();
    }

    public void updateSummaryText(long summaryId, String text) {
        jdbc.update("UPDATE summaries SET text = ? WHERE id = ?", text, summaryId);
    }

    public List<SummaryRecord> summariesFor(SummaryLevel level, long targetId) {
        return jdbc.query("SELECT * FROM summaries WHERE level = ? AND target_id = ? ORDER BY id",
                SUMMARY_MAPPER, level.value(), targetId);
    }

    public List<SummaryRecord> listSummaries(SummaryLevel level) {
        if (level == null) {
            return jdbc.query("SELECT * FROM summaries ORDER BY id", SUMMARY_MAPPER);
        }
        return jdbc.query("SELECT * FROM summaries WHERE level = ? ORDER BY id", SUMMARY_MAPPER, level.value());
    }

    public List<SummaryRecord> searchSummaries(Collection<String> terms, int limit) {
        String match = matchExpression(terms);
        if (match.isEmpty() || limit <= 0) {
            return List.of();
        }
        return jdbc.query("""
                SELECT s.* FROM summaries s
                JOIN (SELECT rowid AS rid, rank AS score FROM summaries_fts WHERE summaries_fts MATCH ? ORDER BY rank LIMIT ?) m
                  ON s.id = m.rid
                ORDER BY m.score, s.id""", SUMMARY_MAPPER, match, limit);
    }

    public ReportVersionRecord addReportVersion(String content) {
        ReportVersionRecord draft = ReportVersionRecord.draft(content);
        jdbc.update("""
                INSERT INTO report_versions (content, created_at, coverage_score, citation_score, issues_high, issues_med, issues_low)
                VALUES (?, ?, 0, 0, 0, 0, 0)""", content, draft.createdAt().toString());
        return draft.withId(lastInsertId());
    }

    public void updateReportVersion(ReportVersionRecord version) {
        jdbc.update("""
                UPDATE report_versions SET content = ?, coverage_score = ?, citation_score = ?,
                    issues_high = ?, issues_med = ?, issues_low = ?
                WHERE id = ?""",
                version.content(), version.coverageScore(), version.citationScore(),
                version.issuesHigh(), version.issuesMed(), version.issuesLow(), version.id());
    }

    public Optional<ReportVersionRecord> findReportVersion(long id) {
        return first(jdbc.query("SELECT * FROM report_versions WHERE id = ?", REPORT_MAPPER, id));
    }

    public List<ReportVersionRecord> listReportVersions() {
        return jdbc.query("SELECT * FROM report_versions ORDER BY id", REPORT_MAPPER);
    }

    /**
     * Discards every claim stored for the version and writes the new set, atomically.
     */
    public List<ClaimRecord> replaceClaims(long reportVersionId, List<ClaimRecord> claims) {
        return inTransaction(() -> {
            jdbc.update("DELETE FROM claims WHERE report_version = ?", reportVersionId);
            List<ClaimRecord> stored = new ArrayList<>(claims.size());
            for (ClaimRecord claim : claims) {
                jdbc.update("""
                        INSERT INTO claims (report_version, text, citation_refs, status, severity, rationale)
                        VALUES (?, ?, ?, ?, ?, ?)""",
                        reportVersionId, claim.text(), toJson(claim.citationRefs()), claim.status().value(),
                        claim.severity().value(), claim.rationale());
                stored.add(new ClaimRecord(lastInsertId(), reportVersionId, claim.text(), claim.citationRefs(),
                        claim.status(), claim.severity(), claim.rationale()));
            }
            return stored;
        });
    }

    public List<ClaimRecord> claimsFor(long reportVersionId) {
        return jdbc.query("SELECT * FROM claims WHERE report_version = ? ORDER BY id", claimMapper(), reportVersionId);
    }

    public void putChunkEmbedding(long chunkId, float[] vector) {
        jdbc.update("INSERT OR REPLACE INTO chunk_embeddings (chunk_id, dimension, vector) VALUES (?, ?, ?)",
                chunkId, vector.length, encode(vector));
    }

    public void putSymbolEmbedding(long symbolId, float[] vector) {
        jdbc.update("INSERT OR REPLACE INTO symbol_embeddings (symbol_id, dimension, vector) VALUES (?, ?, ?)",
                symbolId, vector.length, encode(vector));
    }

    public boolean hasChunkEmbeddings() {
        return count("SELECT COUNT(*) FROM chunk_embeddings") > 0;
    }

    public Map<Long, float[]> chunkEmbeddings() {
        Map<Long, float[]> out = new LinkedHashMap<>();
        jdbc.query("SELECT chunk_id, dimension, vector FROM chunk_embeddings ORDER BY chunk_id",
                (RowCallbackHandler) rs -> out.put(rs.getLong("chunk_id"),
                        decode(rs.getBytes("vector"), rs.getInt("dimension"))));
        return out;
    }

    public Map<Long, float[]> symbolEmbeddings() {
        Map<Long, float[]> out = new LinkedHashMap<>();
        jdbc.query("SELECT symbol_id, dimension, vector FROM symbol_embeddings ORDER BY symbol_id",
                (RowCallbackHandler) rs -> out.put(rs.getLong("symbol_id"),
                        decode(rs.getBytes("vector"), rs.getInt("dimension"))));
        return out;
    }

    public void logRetrievalEvent(long reportVersionId, int iteration, String prompt,
            List<?> chunks, List<?> summaries, List<?> symbols, List<?> edges) {
        jdbc.update("""
                INSERT INTO retrieval_events
                    (report_version, iteration, prompt, chunks_json, summaries_json, symbols_json, edges_json, created_at)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?)""",
                reportVersionId, iteration, prompt, toJson(chunks), toJson(summaries), toJson(symbols), toJson(edges),
                Instant.now().toString());
    }

    public void logIterationStatus(IterationStatusRecord status) {
        jdbc.update("""
                INSERT INTO iteration_status (report_version, iteration, coverage, support_rate, citation_rate,
                    issues_high, issues_med, issues_low, missing_citations, created_at)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)""",
                status.reportVersionId(), status.iteration(), status.coverage(), status.supportRate(),
                status.citationRate(), status.issuesHigh(), status.issuesMed(), status.issuesLow(),
                status.missingCitations(), status.createdAt().toString());
    }

    public void logIterationIssues(long reportVersionId, int iteration, List<Issue> issues) {
        String now = Instant.now().toString();
        runInTransaction(() -> {
            for (Issue issue : issues) {
                jdbc.update("""
                        INSERT INTO iteration_issues (report_version, iteration, severity, description, fix_hint, created_at)
                        VALUES (?, ?, ?, ?, ?, ?)""",
                        reportVersionId, iteration, issue.severity().value(), issue.description(), issue.fixHint(), now);
            }
        });
    }

    public List<RetrievalEventRecord> listRetrievalEvents(Long reportVersionId) {
        return byReport("retrieval_events", reportVersionId, RETRIEVAL_EVENT_MAPPER);
    }

    public List<IterationStatusRecord> listIterationStatus(Long reportVersionId) {
        return byReport("iteration_status", reportVersionId, ITERATION_STATUS_MAPPER);
    }

    public List<IterationIssueRecord> listIterationIssues(Long reportVersionId) {
        return byReport("iteration_issues", reportVersionId, ITERATION_ISSUE_MAPPER);
    }

    private <T> List<T> byReport(String table, Long reportVersionId, RowMapper<T> mapper) {
        if (reportVersionId == null) {
            return jdbc.query("SELECT * FROM " + table + " ORDER BY id", mapper);
        }
        return jdbc.query("SELECT * FROM " + table + " WHERE report_version = ? ORDER BY id", mapper, reportVersionId);
    }

    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        dataSource.destroy();
        if (deleteOnClose) {
            Files.deleteIfExists(file);
            Files.deleteIfExists(Path.of(file + "-wal"));
            Files.deleteIfExists(Path.of(file + "-shm"));
            Files.deleteIfExists(Path.of(file + "-journal"));
            log.debug("store.deleted path={}", file);
        }
    }

    static List<String> queryTerms(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        List<String> terms = new ArrayList<>();
        for (String token : text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+")) {
            if (!token.isBlank()) {
                terms.add(token);
            }
        }
        return terms;
    }

    static String matchExpression(Collection<String> terms) {
        Set<String> unique = new LinkedHashSet<>();
        for (String term : terms) {
            for (String token : queryTerms(term)) {
                unique.add('"' + token + '"');
            }
        }
        return String.join(" OR ", unique);
    }

    private static String escapeLike(String value) {
        return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }

    private long lastInsertId() {
        Long id = jdbc.queryForObject("SELECT last_insert_rowid()", Long.class);
        return id == null ? 0L : id;
    }

    private int count(String sql) {
        Integer value = jdbc.queryForObject(sql, Integer.class);
        return value == null ? 0 : value;
    }

    private static <T> Optional<T> first(List<T> rows) {
        return rows.isEmpty() ? Optional.empty() : Optional.ofNullable(rows.get(0));
    }

    private String toJson(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize audit payload", e);
        }
    }

    private List<String> readStringList(String json) {
        try {
            return mapper.readValue(json, STRING_LIST);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt citation list: " + json, e);
        }
    }

    static byte[] encode(float[] vector) {
        ByteBuffer buffer = ByteBuffer.allocate(vector.length * Float.BYTES).order(ByteOrder.LITTLE_ENDIAN);
        for (float value : vector) {
            buffer.putFloat(value);
        }
        return buffer.array();
    }

    static float[] decode(byte[] bytes, int dimension) {
        ByteBuffer buffer = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
        float[] vector = new float[dimension];
        for (int i = 0; i < dimension; i++) {
            vector[i] = buffer.getFloat();
        }
        return vector;
    }

    private static Long nullableLong(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }

    private static final RowMapper<FileRecord> FILE_MAPPER = (rs, row) -> new FileRecord(
            rs.getLong("id"),
            rs.getString("path"),
            rs.getString("hash"),
            rs.getString("lang"),
            rs.getLong("size"),
            Instant.parse(rs.getString("mtime")),
            rs.getInt("parsed") != 0);

    private static final RowMapper<ChunkRecord> CHUNK_MAPPER = (rs, row) -> new ChunkRecord(
            rs.getLong("id"),
            rs.getLong("file_id"),
            rs.getInt("start_line"),
            rs.getInt("end_line"),
            rs.getString("kind"),
            rs.getString("text"),
            rs.getString("hash"),
            nullableLong(rs, "symbol_id"));

    private static final RowMapper<SymbolRecord> SYMBOL_MAPPER = (rs, row) -> new SymbolRecord(
            rs.getLong("id"),
            rs.getLong("file_id"),
            rs.getString("name"),
            rs.getString("kind"),
            rs.getString("signature"),
            rs.getInt("start_line"),
            rs.getInt("end_line"),
            rs.getString("doc"),
            nullableLong(rs, "parent_symbol_id"));

    private static final RowMapper<EdgeRecord> EDGE_MAPPER = (rs, row) -> new EdgeRecord(
            rs.getLong("src_symbol_id"),
            rs.getLong("dst_symbol_id"),
            EdgeType.fromValue(rs.getString("edge_type")));

    private static final RowMapper<SummaryRecord> SUMMARY_MAPPER = (rs, row) -> new SummaryRecord(
            rs.getLong("id"),
            SummaryLevel.fromValue(rs.getString("level")),
            rs.getLong("target_id"),
            rs.getString("text"),
            rs.getDouble("confidence"),
            Instant.parse(rs.getString("created_at")));

    private static final RowMapper<ReportVersionRecord> REPORT_MAPPER = (rs, row) -> new ReportVersionRecord(
            rs.getLong("id"),
            rs.getString("content"),
            Instant.parse(rs.getString("created_at")),
            rs.getDouble("coverage_score"),
            rs.getDouble("citation_score"),
            rs.getInt("issues_high"),
            rs.getInt("issues_med"),
            rs.getInt("issues_low"));

    private RowMapper<ClaimRecord> claimMapper() {
        return (rs, row) -> new ClaimRecord(
                rs.getLong("id"),
                rs.getLong("report_version"),
                rs.getString("text"),
                readStringList(rs.getString("citation_refs")),
                ClaimStatus.fromValue(rs.getString("status")),
                Severity.fromValue(rs.getString("severity")),
                rs.getString("rationale"));
    }

    private static final RowMapper<RetrievalEventRecord> RETRIEVAL_EVENT_MAPPER = (rs, row) -> new RetrievalEventRecord(
            rs.getLong("id"),
            rs.getLong("report_version"),
            rs.getInt("iteration"),
            rs.getString("prompt"),
            rs.getString("chunks_json"),
            rs.getString("summaries_json"),
            rs.getString("symbols_json"),
            rs.getString("edges_json"),
            Instant.parse(rs.getString("created_at")));

    private static final RowMapper<IterationStatusRecord> ITERATION_STATUS_MAPPER = (rs, row) -> new IterationStatusRecord(
            rs.getLong("id"),
            rs.getLong("report_version"),
            rs.getInt("iteration"),
            rs.getDouble("coverage"),
            rs.getDouble("support_rate"),
            rs.getDouble("citation_rate"),
            rs.getInt("issues_high"),
            rs.getInt("issues_med"),
            rs.getInt("issues_low"),
            rs.getInt("missing_citations"),
            Instant.parse(rs.getString("created_at")));

    private static final RowMapper<IterationIssueRecord> ITERATION_ISSUE_MAPPER = (rs, row) -> new IterationIssueRecord(
            rs.getLong("id"),
            rs.getLong("report_version"),
            rs.getInt("iteration"),
            Severity.fromValue(rs.getString("severity")),
            rs.getString("description"),
            rs.getString("fix_hint"),
            Instant.parse(rs.getString("created_at")));
}
