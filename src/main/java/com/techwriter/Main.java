package com.techwriter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.techwriter.audit.AuditCommand;
import com.techwriter.citation.UnverifiableCitationException;
import com.techwriter.gate.CoverageGate;
import com.techwriter.ingest.EmbeddingService;
import com.techwriter.ingest.EmbeddingServices;
import com.techwriter.ingest.IngestionReport;
import com.techwriter.ingest.IngestionService;
import com.techwriter.llm.OpenAiChatClient;
import com.techwriter.parse.TreeSitterParserAdapter;
import com.techwriter.pipeline.EvidenceStarvationException;
import com.techwriter.pipeline.GateExhaustedException;
import com.techwriter.pipeline.PipelineResult;
import com.techwriter.pipeline.ReportOrchestrator;
import com.techwriter.pipeline.SummaryService;
import com.techwriter.retrieval.EvidenceBundle;
import com.techwriter.retrieval.RetrievalEngine;
import com.techwriter.retrieval.ScoredChunk;
import com.techwriter.runtime.AppConfig;
import com.techwriter.store.KnowledgeStore;
import com.techwriter.store.StoreOptions;

import okhttp3.OkHttpClient;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(
        name = "tech-writer",
        mixinStandardHelpOptions = true,
        version = "tech-writer 0.1.0",
        description = "Ingests a source tree and writes a report whose every claim is checked against cited code.",
        subcommands = AuditCommand.class)
public class Main implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    @Option(names = { "-c", "--config" }, description = "Path to YAML config file", defaultValue = "src/main/resources/application.yml")
    String configPath;

    @Option(names = "--mode", description = "Execution mode: ${COMPLETION-CANDIDATES}", defaultValue = "run")
    Mode mode;

    @Parameters(index = "0", arity = "0..1", description = "Directory to ingest")
    Path directory;

    @Option(names = "--prompt", description = "Brief for the report")
    String prompt;

    @Option(names = "--prompt-file", description = "File holding the brief for the report")
    Path promptFile;

    @Option(names = "--store-path", description = "Store file; an ephemeral store is used when omitted")
    Path storePath;

    @Option(names = "--persist-store", description = "Keep the store file after the run")
    Boolean persistStore;

    @Option(names = "--allow-existing", description = "Reuse an existing store file")
    Boolean allowExisting;

    @Option(names = "--output", description = "Where the verified report is written")
    Path output;

    @Option(names = "--max-iters", description = "Maximum drafting attempts")
    Integer maxIters;

    @Option(names = "--query", description = "Query text used in retrieve mode")
    String query;

    @Option(names = "--top-k", description = "Top results to return", defaultValue = "5")
    int topK;

    private final OkHttpClient httpClient = new OkHttpClient();

    enum Mode {
        run,
        ingest,
        retrieve
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        AppConfig config = loadConfig(Path.of(configPath));
        applyOverrides(config);

        if (directory == null || !Files.isDirectory(directory)) {
            log.error("A directory to ingest is required, got {}", directory);
            return 2;
        }
        String brief = null;
        if (mode == Mode.run) {
            brief = readPrompt();
            if (brief == null || brief.isBlank()) {
                log.error("--prompt or --prompt-file is required in run mode");
                return 2;
            }
        }
        if (mode == Mode.retrieve && (query == null || query.isBlank())) {
            log.error("--query is required in retrieve mode");
            return 2;
        }

        log.info("Starting tech-writer in {} mode", mode);
        log.info("Using config file: {}", configPath);

        EmbeddingService embeddingService = config.getIngest().isEmbeddings()
                ? EmbeddingServices.fromEnvironment(httpClient)
                : null;
        try (KnowledgeStore store = KnowledgeStore.open(storeOptions(config.getStore()))) {
            IngestionService ingestion = new IngestionService(store, new TreeSitterParserAdapter(), config.getIngest(),
                    embeddingService);
            RetrievalEngine retrieval = new RetrievalEngine(store, config.getRetrieval(), embeddingService);

            if (mode == Mode.ingest) {
                IngestionReport report = ingestion.ingest(directory);
                log.info("Indexed directory: processed={}, skipped={}, removed={}, total={}, chunks={}, symbols={}, edges={}",
                        report.processedFiles(), report.skippedFiles(), report.removedFiles(), report.totalFiles(),
                        report.chunks(), report.symbols(), report.edges());
                return 0;
            }
            if (mode == Mode.retrieve) {
                ingestion.ingest(directory);
                EvidenceBundle bundle = retrieval.retrieve(query, topK);
                for (int i = 0; i < bundle.chunks().size(); i++) {
                    ScoredChunk result = bundle.chunks().get(i);
                    log.info("Result #{} score={} kind={} citation={}",
                            i + 1, String.format("%.4f", result.score()), result.chunk().kind(), result.citation());
                }
                log.info("Bundle symbols={} summaries={} edges={}",
                        bundle.symbols().size(), bundle.summaries().size(), bundle.edges().size());
                return 0;
            }

            OpenAiChatClient llm = OpenAiChatClient.fromConfig(config.getLlm());
            ReportOrchestrator orchestrator = new ReportOrchestrator(store, ingestion, retrieval, llm, llm,
                    new SummaryService(store, llm), CoverageGate.from(config.getGate()), config.getPipeline());
            PipelineResult result = orchestrator.run(directory, brief);
            Path target = Path.of(config.getPipeline().getOutputPath());
            if (target.toAbsolutePath().getParent() != null) {
                Files.createDirectories(target.toAbsolutePath().getParent());
            }
            Files.writeString(target, result.report(), StandardCharsets.UTF_8);
            log.info("Report written to {} version={} {}", target, result.reportVersionId(), result.metrics());
            return 0;
        } catch (FileAlreadyExistsException e) {
            log.error("Store {} already exists; pass --allow-existing to reuse it", e.getFile());
            return 2;
        } catch (GateExhaustedException e) {
            log.error("Quality gate not met: {}", e.lastMetrics());
            return 1;
        } catch (EvidenceStarvationException | UnverifiableCitationException | CancellationException e) {
            log.error("Pipeline failed: {}", e.getMessage());
            return 1;
        }
    }

    static AppConfig loadConfig(Path config) throws IOException {
        if (!Files.exists(config)) {
            return new AppConfig();
        }
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        return mapper.readValue(config.toFile(), AppConfig.class);
    }

    private void applyOverrides(AppConfig config) {
        if (storePath != null) {
            config.getStore().setPath(storePath.toString());
        }
        if (persistStore != null) {
            config.getStore().setPersist(persistStore);
        }
        if (allowExisting != null) {
            config.getStore().setAllowExisting(allowExisting);
        }
        if (maxIters != null) {
            config.getPipeline().setMaxIters(maxIters);
        }
        if (output != null) {
            config.getPipeline().setOutputPath(output.toString());
        }
    }

    static StoreOptions storeOptions(AppConfig.StoreConfig store) {
        if (store.getPath() == null || store.getPath().isBlank()) {
            return StoreOptions.ephemeral();
        }
        return new StoreOptions(Path.of(store.getPath()), store.isPersist(), store.isAllowExisting(), false);
    }

    private String readPrompt() throws IOException {
        if (promptFile != null) {
            return Files.readString(promptFile, StandardCharsets.UTF_8);
        }
        return prompt;
    }
}
