package com.techwriter.runtime;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {
    private StoreConfig store = new StoreConfig();
    private IngestConfig ingest = new IngestConfig();
    private RetrievalConfig retrieval = new RetrievalConfig();
    private GateConfig gate = new GateConfig();
    private PipelineConfig pipeline = new PipelineConfig();
    private LlmConfig llm = new LlmConfig();

    public StoreConfig getStore() {
        return store;
    }

    public void setStore(StoreConfig store) {
        this.store = store == null ? new StoreConfig() : store;
    }

    public IngestConfig getIngest() {
        return ingest;
    }

    public void setIngest(IngestConfig ingest) {
        this.ingest = ingest == null ? new IngestConfig() : ingest;
    }

    public RetrievalConfig getRetrieval() {
        return retrieval;
    }

    public void setRetrieval(RetrievalConfig retrieval) {
        this.retrieval = retrieval == null ? new RetrievalConfig() : retrieval;
    }

    public GateConfig getGate() {
        return gate;
    }

    public void setGate(GateConfig gate) {
        this.gate = gate == null ? new GateConfig() : gate;
    }

    public PipelineConfig getPipeline() {
        return pipeline;
    }

    public void setPipeline(PipelineConfig pipeline) {
        this.pipeline = pipeline == null ? new PipelineConfig() : pipeline;
    }

    public LlmConfig getLlm() {
        return llm;
    }

    public void setLlm(LlmConfig llm) {
        this.llm = llm == null ? new LlmConfig() : llm;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class StoreConfig {
        private String path;
        private boolean persist;
        private boolean allowExisting;

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }

        public boolean isPersist() {
            return persist;
        }

        public void setPersist(boolean persist) {
            this.persist = persist;
        }

        public boolean isAllowExisting() {
            return allowExisting;
        }

        public void setAllowExisting(boolean allowExisting) {
            this.allowExisting = allowExisting;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class IngestConfig {
        private int workers = Math.max(1, Runtime.getRuntime().availableProcessors());
        private int maxFiles;
        private long maxFileBytes = 1024L * 1024L;
        private List<String> exclude = new ArrayList<>(List.of(
                ".git/**", "node_modules/**", "target/**", "build/**", "__pycache__/**", ".venv/**", ".idea/**"));
        private boolean respectGitignore = true;
        private boolean embeddings;

        public int getWorkers() {
            return workers;
        }

        public void setWorkers(int workers) {
            this.workers = Math.max(1, workers);
        }

        public int getMaxFiles() {
            return maxFiles;
        }

        public void setMaxFiles(int maxFiles) {
            this.maxFiles = Math.max(0, maxFiles);
        }

        public long getMaxFileBytes() {
            return maxFileBytes;
        }

        public void setMaxFileBytes(long maxFileBytes) {
            this.maxFileBytes = maxFileBytes;
        }

        public List<String> getExclude() {
            return exclude;
        }

        public void setExclude(List<String> exclude) {
            this.exclude = exclude == null ? new ArrayList<>() : new ArrayList<>(exclude);
        }

        public boolean isRespectGitignore() {
            return respectGitignore;
        }

        public void setRespectGitignore(boolean respectGitignore) {
            this.respectGitignore = respectGitignore;
        }

        public boolean isEmbeddings() {
            return embeddings;
        }

        public void setEmbeddings(boolean embeddings) {
            this.embeddings = embeddings;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RetrievalConfig {
        private int limit = 20;
        private int neighborRadius = 1;
        private int ftsLimit = 50;

        public int getLimit() {
            return limit;
        }

        public void setLimit(int limit) {
            this.limit = limit;
        }

        public int getNeighborRadius() {
            return neighborRadius;
        }

        public void setNeighborRadius(int neighborRadius) {
            this.neighborRadius = Math.max(0, neighborRadius);
        }

        public int getFtsLimit() {
            return ftsLimit;
        }

        public void setFtsLimit(int ftsLimit) {
            this.ftsLimit = ftsLimit;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class GateConfig {
        private double minSupportRate = 0.8;
        private double minCoverage = 0.8;
        private double minCitationRate = 0.8;
        private int maxHighIssues = 0;
        private int maxMediumIssues = 5;

        public double getMinSupportRate() {
            return minSupportRate;
        }

        public void setMinSupportRate(double minSupportRate) {
            this.minSupportRate = minSupportRate;
        }

        public double getMinCoverage() {
            return minCoverage;
        }

        public void setMinCoverage(double minCoverage) {
            this.minCoverage = minCoverage;
        }

        public double getMinCitationRate() {
            return minCitationRate;
        }

        public void setMinCitationRate(double minCitationRate) {
            this.minCitationRate = minCitationRate;
        }

        public int getMaxHighIssues() {
            return maxHighIssues;
        }

        public void setMaxHighIssues(int maxHighIssues) {
            this.maxHighIssues = maxHighIssues;
        }

        public int getMaxMediumIssues() {
            return maxMediumIssues;
        }

        public void setMaxMediumIssues(int maxMediumIssues) {
            this.maxMediumIssues = maxMediumIssues;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PipelineConfig {
        private int maxIters = 3;
        private int expectedItems;
        private boolean summarize = true;
        private boolean summarizeChunks;
        private String outputPath = "output/report.md";

        public int getMaxIters() {
            return maxIters;
        }

        public void setMaxIters(int maxIters) {
            this.maxIters = Math.max(1, maxIters);
        }

        public int getExpectedItems() {
            return expectedItems;
        }

        public void setExpectedItems(int expectedItems) {
            this.expectedItems = Math.max(0, expectedItems);
        }

        public boolean isSummarize() {
            return summarize;
        }

        public void setSummarize(boolean summarize) {
            this.summarize = summarize;
        }

        public boolean isSummarizeChunks() {
            return summarizeChunks;
        }

        public void setSummarizeChunks(boolean summarizeChunks) {
            this.summarizeChunks = summarizeChunks;
        }

        public String getOutputPath() {
            return outputPath;
        }

        public void setOutputPath(String outputPath) {
            this.outputPath = outputPath;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class LlmConfig {
        private String endpoint = "https://api.openai.com/v1/chat/completions";
        private String model = "gpt-4o-mini";
        private String apiKeyEnv = "OPENAI_API_KEY";
        private int timeoutMs = 60000;
        private double temperature = 0.0;

        public String getEndpoint() {
            return endpoint;
        }

        public void setEndpoint(String endpoint) {
            this.endpoint = endpoint;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public String getApiKeyEnv() {
            return apiKeyEnv;
        }

        public void setApiKeyEnv(String apiKeyEnv) {
            this.apiKeyEnv = apiKeyEnv;
        }

        public int getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(int timeoutMs) {
            this.timeoutMs = timeoutMs;
        }

        public double getTemperature() {
            return temperature;
        }

        public void setTemperature(double temperature) {
            this.temperature = temperature;
        }
    }
}
