package com.techwriter.store;

import java.util.List;

final class StoreSchema {
    private StoreSchema() {
    }

    static final List<String> STATEMENTS = List.of(
            """
            CREATE TABLE IF NOT EXISTS files (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                path TEXT NOT NULL UNIQUE,
                hash TEXT NOT NULL,
                lang TEXT NOT NULL,
                size INTEGER NOT NULL,
                mtime TEXT NOT NULL,
                parsed INTEGER NOT NULL DEFAULT 0
            )""",
            """
            CREATE TABLE IF NOT EXISTS symbols (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                file_id INTEGER NOT NULL REFERENCES files(id) ON DELETE CASCADE,
                name TEXT NOT NULL,
                kind TEXT NOT NULL,
                signature TEXT,
                start_line INTEGER NOT NULL CHECK (start_line >= 1),
                end_line INTEGER NOT NULL CHECK (end_line >= start_line),
                doc TEXT,
                parent_symbol_id INTEGER REFERENCES symbols(id) ON DELETE SET NULL
            )""",
            """
            CREATE TABLE IF NOT EXISTS chunks (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                file_id INTEGER NOT NULL REFERENCES files(id) ON DELETE CASCADE,
                start_line INTEGER NOT NULL CHECK (start_line >= 1),
                end_line INTEGER NOT NULL CHECK (end_line >= start_line),
                kind TEXT NOT NULL,
                text TEXT NOT NULL,
                hash TEXT NOT NULL,
                symbol_id INTEGER REFERENCES symbols(id) ON DELETE SET NULL
            )""",
            """
            CREATE TABLE IF NOT EXISTS edges (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                src_symbol_id INTEGER NOT NULL REFERENCES symbols(id) ON DELETE CASCADE,
                dst_symbol_id INTEGER NOT NULL REFERENCES symbols(id) ON DELETE CASCADE,
                edge_type TEXT NOT NULL CHECK (edge_type IN
                    ('imports', 'imports-resolved', 'calls', 'inherits', 'member-of', 'implements', 'exports')),
                UNIQUE (src_symbol_id, dst_symbol_id, edge_type)
            )""",
            """
            CREATE TABLE IF NOT EXISTS symbol_references (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                src_symbol_id INTEGER NOT NULL REFERENCES symbols(id) ON DELETE CASCADE,
                dst_name TEXT NOT NULL,
                edge_type TEXT NOT NULL CHECK (edge_type IN ('calls', 'inherits', 'implements', 'exports')),
                UNIQUE (src_symbol_id, dst_name, edge_type)
            )""",
            """
            CREATE TABLE IF NOT EXISTS packages (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                path TEXT NOT NULL UNIQUE,
                name TEXT NOT NULL
            )""",
            """
            CREATE TABLE IF NOT EXISTS modules (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                package_id INTEGER REFERENCES packages(id) ON DELETE CASCADE,
                path TEXT NOT NULL UNIQUE,
                name TEXT NOT NULL
            )""",
            """
            CREATE TABLE IF NOT EXISTS module_files (
                module_id INTEGER NOT NULL REFERENCES modules(id) ON DELETE CASCADE,
                file_id INTEGER NOT NULL REFERENCES files(id) ON DELETE CASCADE,
                PRIMARY KEY (module_id, file_id)
            )""",
            """
            CREATE TABLE IF NOT EXISTS summaries (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                level TEXT NOT NULL CHECK (level IN ('chunk', 'file', 'module', 'package')),
                target_id INTEGER NOT NULL,
                text TEXT NOT NULL,
                confidence REAL NOT NULL CHECK (confidence >= 0.0 AND confidence <= 1.0),
                created_at TEXT NOT NULL
            )""",
            """
            CREATE TRIGGER IF NOT EXISTS summaries_target_insert BEFORE INSERT ON summaries
            BEGIN
                SELECT RAISE(ABORT, 'summary target does not exist')
                WHERE (NEW.level = 'chunk' AND NOT EXISTS (SELECT 1 FROM chunks WHERE id = NEW.target_id))
                   OR (NEW.level = 'file' AND NOT EXISTS (SELECT 1 FROM files WHERE id = NEW.target_id))
                   OR (NEW.level = 'module' AND NOT EXISTS (SELECT 1 FROM modules WHERE id = NEW.target_id))
                   OR (NEW.level = 'package' AND NOT EXISTS (SELECT 1 FROM packages WHERE id = NEW.target_id));
            END""",
            """
            CREATE TRIGGER IF NOT EXISTS summaries_target_update BEFORE UPDATE OF level, target_id ON summaries
            BEGIN
                SELECT RAISE(ABORT, 'summary target does not exist')
                WHERE (NEW.level = 'chunk' AND NOT EXISTS (SELECT 1 FROM chunks WHERE id = NEW.target_id))
                   OR (NEW.level = 'file' AND NOT EXISTS (SELECT 1 FROM files WHERE id = NEW.target_id))
                   OR (NEW.level = 'module' AND NOT EXISTS (SELECT 1 FROM modules WHERE id = NEW.target_id))
                   OR (NEW.level = 'package' AND NOT EXISTS (SELECT 1 FROM packages WHERE id = NEW.target_id));
            END""",
            """
            CREATE TRIGGER IF NOT EXISTS chunks_drop_summaries AFTER DELETE ON chunks
            BEGIN
                DELETE FROM summaries WHERE level = 'chunk' AND target_id = OLD.id;
            END""",
            """
            CREATE TRIGGER IF NOT EXISTS files_drop_summaries AFTER DELETE ON files
            BEGIN
                DELETE FROM summaries WHERE level = 'file' AND target_id = OLD.id;
            END""",
            """
            CREATE TABLE IF NOT EXISTS report_versions (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                content TEXT NOT NULL,
                created_at TEXT NOT NULL,
                coverage_score REAL NOT NULL DEFAULT 0,
                citation_score REAL NOT NULL DEFAULT 0,
                issues_high INTEGER NOT NULL DEFAULT 0,
                issues_med INTEGER NOT NULL DEFAULT 0,
                issues_low INTEGER NOT NULL DEFAULT 0
            )""",
            """
            CREATE TABLE IF NOT EXISTS claims (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                report_version INTEGER NOT NULL REFERENCES report_versions(id) ON DELETE CASCADE,
                text TEXT NOT NULL,
                citation_refs TEXT NOT NULL,
                status TEXT NOT NULL CHECK (status IN ('supported', 'contradicted', 'uncertain', 'missing')),
                severity TEXT NOT NULL CHECK (severity IN ('high', 'medium', 'low')),
                rationale TEXT NOT NULL
            )""",
            """
            CREATE TABLE IF NOT EXISTS chunk_embeddings (
                chunk_id INTEGER PRIMARY KEY REFERENCES chunks(id) ON DELETE CASCADE,
                dimension INTEGER NOT NULL,
                vector BLOB NOT NULL
            )""",
            """
            CREATE TABLE IF NOT EXISTS symbol_embeddings (
                symbol_id INTEGER PRIMARY KEY REFERENCES symbols(id) ON DELETE CASCADE,
                dimension INTEGER NOT NULL,
                vector BLOB NOT NULL
            )""",
            """
            CREATE TABLE IF NOT EXISTS retrieval_events (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                report_version INTEGER NOT NULL REFERENCES report_versions(id) ON DELETE CASCADE,
                iteration INTEGER NOT NULL,
                prompt TEXT NOT NULL,
                chunks_json TEXT NOT NULL,
                summaries_json TEXT NOT NULL,
                symbols_json TEXT NOT NULL,
                edges_json TEXT NOT NULL,
                created_at TEXT NOT NULL
            )""",
            """
            CREATE TABLE IF NOT EXISTS iteration_status (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                report_version INTEGER NOT NULL REFERENCES report_versions(id) ON DELETE CASCADE,
                iteration INTEGER NOT NULL,
                coverage REAL NOT NULL,
                support_rate REAL NOT NULL,
                citation_rate REAL NOT NULL,
                issues_high INTEGER NOT NULL,
                issues_med INTEGER NOT NULL,
                issues_low INTEGER NOT NULL,
                missing_citations INTEGER NOT NULL,
                created_at TEXT NOT NULL
            )""",
            """
            CREATE TABLE IF NOT EXISTS iteration_issues (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                report_version INTEGER NOT NULL REFERENCES report_versions(id) ON DELETE CASCADE,
                iteration INTEGER NOT NULL,
                severity TEXT NOT NULL,
                description TEXT NOT NULL,
                fix_hint TEXT,
                created_at TEXT NOT NULL
            )""",
            "CREATE INDEX IF NOT EXISTS idx_chunks_file ON chunks(file_id, start_line)",
            "CREATE INDEX IF NOT EXISTS idx_symbols_file ON symbols(file_id)",
            "CREATE INDEX IF NOT EXISTS idx_symbols_name ON symbols(name)",
            "CREATE INDEX IF NOT EXISTS idx_edges_dst ON edges(dst_symbol_id)",
            "CREATE INDEX IF NOT EXISTS idx_summaries_target ON summaries(level, target_id)",
            "CREATE INDEX IF NOT EXISTS idx_claims_report ON claims(report_version)",
            "CREATE VIRTUAL TABLE IF NOT EXISTS chunks_fts USING fts5(text, content='chunks', content_rowid='id')",
            """
            CREATE TRIGGER IF NOT EXISTS chunks_fts_ai AFTER INSERT ON chunks BEGIN
                INSERT INTO chunks_fts(rowid, text) VALUES (new.id, new.text);
            END""",
            """
            CREATE TRIGGER IF NOT EXISTS chunks_fts_ad AFTER DELETE ON chunks BEGIN
                INSERT INTO chunks_fts(chunks_fts, rowid, text) VALUES ('delete', old.id, old.text);
            END""",
            """
            CREATE TRIGGER IF NOT EXISTS chunks_fts_au AFTER UPDATE OF text ON chunks BEGIN
                INSERT INTO chunks_fts(chunks_fts, rowid, text) VALUES ('delete', old.id, old.text);
                INSERT INTO chunks_fts(rowid, text) VALUES (new.id, new.text);
            END""",
            "CREATE VIRTUAL TABLE IF NOT EXISTS summaries_fts USING fts5(text, content='summaries', content_rowid='id')",
            """
            CREATE TRIGGER IF NOT EXISTS summaries_fts_ai AFTER INSERT ON summaries BEGIN
                INSERT INTO summaries_fts(rowid, text) VALUES (new.id, new.text);
            END""",
            """
            CREATE TRIGGER IF NOT EXISTS summaries_fts_ad AFTER DELETE ON summaries BEGIN
                INSERT INTO summaries_fts(summaries_fts, rowid, text) VALUES ('delete', old.id, old.text);
            END""",
            """
            CREATE TRIGGER IF NOT EXISTS summaries_fts_au AFTER UPDATE OF text ON summaries BEGIN
                INSERT INTO summaries_fts(summaries_fts, rowid, text) VALUES ('delete', old.id, old.text);
                INSERT INTO summaries_fts(rowid, text) VALUES (new.id, new.text);
            END""");
}
