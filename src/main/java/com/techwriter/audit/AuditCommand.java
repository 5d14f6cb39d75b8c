package com.techwriter.audit;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

import com.techwriter.citation.Citation;
import com.techwriter.store.ChunkRecord;
import com.techwriter.store.ClaimRecord;
import com.techwriter.store.EdgeRecord;
import com.techwriter.store.EdgeType;
import com.techwriter.store.FileRecord;
import com.techwriter.store.IterationIssueRecord;
import com.techwriter.store.IterationStatusRecord;
import com.techwriter.store.KnowledgeStore;
import com.techwriter.store.ReportVersionRecord;
import com.techwriter.store.RetrievalEventRecord;
import com.techwriter.store.StoreOptions;
import com.techwriter.store.SummaryLevel;
import com.techwriter.store.SummaryRecord;
import com.techwriter.store.SymbolRecord;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

/**
 * Read-only queries over a persisted store. Rows are printed tab separated, one per line.
 */
@Command(
        name = "audit",
        mixinStandardHelpOptions = true,
        description = "Inspect a persisted knowledge store without modifying it.")
public class AuditCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Parameters(index = "0", description = "Path to the store file")
    Path storePath;

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getErr());
        return 2;
    }

    @Command(name = "list-files", description = "List ingested files")
    int listFiles() throws IOException {
        try (KnowledgeStore store = open()) {
            for (FileRecord file : store.listFiles()) {
                out().printf("%d\t%s\t%s\t%d\t%s%n", file.id(), file.path(), file.lang(), file.size(),
                        file.parsed() ? "parsed" : "unparsed");
            }
        }
        return 0;
    }

    @Command(name = "list-reports", description = "List report versions with their scores")
    int listReports() throws IOException {
        try (KnowledgeStore store = open()) {
            for (ReportVersionRecord version : store.listReportVersions()) {
                out().printf("%d\t%s\tcoverage=%.2f\tcitations=%.2f\thigh=%d\tmedium=%d\tlow=%d%n",
                        version.id(), version.createdAt(), version.coverageScore(), version.citationScore(),
                        version.issuesHigh(), version.issuesMed(), version.issuesLow());
            }
        }
        return 0;
    }

    @Command(name = "show-report", description = "Print the content of a report version")
    int showReport(@Option(names = "--id", required = true) long id) throws IOException {
        try (KnowledgeStore store = open()) {
            Optional<ReportVersionRecord> version = store.findReportVersion(id);
            if (version.isEmpty()) {
                return missing("report version " + id);
            }
            out().println(version.get().content());
        }
        return 0;
    }

    @Command(name = "export-report", description = "Write the content of a report version to a file")
    int exportReport(
            @Option(names = "--id", required = true) long id,
            @Option(names = "--out", required = true) Path output) throws IOException {
        try (KnowledgeStore store = open()) {
            Optional<ReportVersionRecord> version = store.findReportVersion(id);
            if (version.isEmpty()) {
                return missing("report version " + id);
            }
            if (output.toAbsolutePath().getParent() != null) {
                Files.createDirectories(output.toAbsolutePath().getParent());
            }
            Files.writeString(output, version.get().content(), StandardCharsets.UTF_8);
            out().println("Exported report " + id + " to " + output);
        }
        return 0;
    }

    @Command(name = "list-claims", description = "List the claims of a report version")
    int listClaims(@Option(names = "--report-id", required = true) long reportId) throws IOException {
        try (KnowledgeStore store = open()) {
            for (ClaimRecord claim : store.claimsFor(reportId)) {
                out().printf("%d\t%s\t%s\t%s\t%s%n", claim.id(), claim.status().value(), claim.severity().value(),
                        String.join(",", claim.citationRefs()), claim.text());
            }
        }
        return 0;
    }

    @Command(name = "list-symbols", description = "List declared and imported symbols")
    int listSymbols(@Option(names = "--file-id") Long fileId) throws IOException {
        try (KnowledgeStore store = open()) {
            List<SymbolRecord> symbols = fileId == null ? store.listSymbols() : store.symbolsForFile(fileId);
            for (SymbolRecord symbol : symbols) {
                out().printf("%d\t%d\t%s\t%s\t%d-%d%n", symbol.id(), symbol.fileId(), symbol.kind(), symbol.name(),
                        symbol.startLine(), symbol.endLine());
            }
        }
        return 0;
    }

    @Command(name = "list-summaries", description = "List summaries, optionally at one level")
    int listSummaries(@Option(names = "--level", description = "chunk, file, module or package") String level)
            throws IOException {
        SummaryLevel filter = level == null ? null : SummaryLevel.fromValue(level);
        try (KnowledgeStore store = open()) {
            for (SummaryRecord summary : store.listSummaries(filter)) {
                out().printf("%d\t%s\t%d\t%.2f\t%s%n", summary.id(), summary.level().value(), summary.targetId(),
                        summary.confidence(), summary.text());
            }
        }
        return 0;
    }

    @Command(name = "search-chunks", description = "Full-text search over chunk text")
    int searchChunks(
            @Option(names = "--query", required = true) String query,
            @Option(names = "--limit", defaultValue = "10") int limit) throws IOException {
        try (KnowledgeStore store = open()) {
            for (ChunkRecord chunk : store.searchChunks(query, limit)) {
                String path = store.findFile(chunk.fileId()).map(FileRecord::path).orElse("?");
                out().printf("%d\t%s\t%s\t%s%n", chunk.id(), Citation.format(path, chunk.startLine(), chunk.endLine()),
                        chunk.kind(), firstLine(chunk.text()));
            }
        }
        return 0;
    }

    @Command(name = "symbol-neighbors", description = "List the symbols one edge away from a symbol")
    int symbolNeighbors(
            @Option(names = "--symbol-id", required = true) long symbolId,
            @Option(names = "--edge-type", description = "imports, imports-resolved, calls, inherits, member-of, implements or exports")
            String edgeType) throws IOException {
        try (KnowledgeStore store = open()) {
            List<EdgeRecord> edges = edgeType == null
                    ? store.edgesForSymbol(symbolId)
                    : store.edgesForSymbol(symbolId, EdgeType.fromValue(edgeType));
            for (EdgeRecord edge : edges) {
                long other = edge.otherEnd(symbolId);
                String direction = edge.srcSymbolId() == symbolId ? "->" : "<-";
                String name = store.findSymbol(other).map(SymbolRecord::name).orElse("?");
                out().printf("%s\t%s\t%d\t%s%n", direction, edge.type().value(), other, name);
            }
        }
        return 0;
    }

    @Command(name = "list-retrieval-events", description = "List logged retrieval events")
    int listRetrievalEvents(@Option(names = "--report-id") Long reportId) throws IOException {
        try (KnowledgeStore store = open()) {
            for (RetrievalEventRecord event : store.listRetrievalEvents(reportId)) {
                out().printf("%d\t%d\t%d\t%s\t%s%n", event.id(), event.reportVersionId(), event.iteration(),
                        firstLine(event.prompt()), event.chunksJson());
            }
        }
        return 0;
    }

    @Command(name = "list-iteration-status", description = "List per-iteration gate metrics")
    int listIterationStatus(@Option(names = "--report-id") Long reportId) throws IOException {
        try (KnowledgeStore store = open()) {
            for (IterationStatusRecord status : store.listIterationStatus(reportId)) {
                out().printf("%d\t%d\tcoverage=%.2f\tsupport=%.2f\tcitations=%.2f\thigh=%d\tmedium=%d\tlow=%d\tmissing=%d%n",
                        status.reportVersionId(), status.iteration(), status.coverage(), status.supportRate(),
                        status.citationRate(), status.issuesHigh(), status.issuesMed(), status.issuesLow(),
                        status.missingCitations());
            }
        }
        return 0;
    }

    @Command(name = "list-iteration-issues", description = "List per-iteration issues")
    int listIterationIssues(@Option(names = "--report-id") Long reportId) throws IOException {
        try (KnowledgeStore store = open()) {
            for (IterationIssueRecord issue : store.listIterationIssues(reportId)) {
                out().printf("%d\t%d\t%s\t%s\t%s%n", issue.reportVersionId(), issue.iteration(),
                        issue.severity().value(), issue.description(), issue.fixHint() == null ? "" : issue.fixHint());
            }
        }
        return 0;
    }

    private KnowledgeStore open() throws IOException {
        return KnowledgeStore.open(StoreOptions.audit(storePath));
    }

    private PrintWriter out() {
        return spec.commandLine().getOut();
    }

    private int missing(String what) {
        spec.commandLine().getErr().println("Not found: " + what);
        return 1;
    }

    private static String firstLine(String text) {
        if (text == null) {
            return "";
        }
        int newline = text.indexOf('\n');
        return newline < 0 ? text.strip() : text.substring(0, newline).strip();
    }

    public static void main(String[] args) {
        System.exit(new CommandLine(new AuditCommand()).execute(args));
    }
}
