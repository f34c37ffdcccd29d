package ch.so.arp.rag.engine.config;

import java.nio.file.Path;

import org.springframework.boot.context.properties.ConfigurationProperties;

import ch.so.arp.rag.engine.backend.memory.DistanceMetric;
import ch.so.arp.rag.engine.retrieval.ContextBudgetFilter;

/**
 * Tunables of the retrieval engine, bound from {@code rag.engine.*}.
 */
@ConfigurationProperties(prefix = "rag.engine")
public class RagEngineProperties {

    /**
     * Vector backend, {@code in-memory} or {@code qdrant}.
     */
    private String backend = "in-memory";

    /**
     * Root directory for index snapshots and the index registry.
     */
    private Path persistDir = Path.of("storage");

    /**
     * Reload every index listed in the registry when the engine starts.
     */
    private boolean restoreOnStartup = true;

    /**
     * Write a snapshot after every batch that changed an in-memory index.
     */
    private boolean autoPersist = true;

    private final Embedding embedding = new Embedding();

    private final Chunking chunking = new Chunking();

    private final Retrieval retrieval = new Retrieval();

    private final Context context = new Context();

    private final Qdrant qdrant = new Qdrant();

    private final Indexing indexing = new Indexing();

    public String getBackend() {
        return backend;
    }

    public void setBackend(String backend) {
        this.backend = backend;
    }

    public Path getPersistDir() {
        return persistDir;
    }

    public void setPersistDir(Path persistDir) {
        this.persistDir = persistDir;
    }

    public boolean isRestoreOnStartup() {
        return restoreOnStartup;
    }

    public void setRestoreOnStartup(boolean restoreOnStartup) {
        this.restoreOnStartup = restoreOnStartup;
    }

    public boolean isAutoPersist() {
        return autoPersist;
    }

    public void setAutoPersist(boolean autoPersist) {
        this.autoPersist = autoPersist;
    }

    public Embedding getEmbedding() {
        return embedding;
    }

    public Chunking getChunking() {
        return chunking;
    }

    public Retrieval getRetrieval() {
        return retrieval;
    }

    public Context getContext() {
        return context;
    }

    public Qdrant getQdrant() {
        return qdrant;
    }

    public Indexing getIndexing() {
        return indexing;
    }

    public static class Embedding {

        /**
         * {@code deterministic} (offline hashing) or {@code remote}.
         */
        private String provider = "deterministic";

        private int dimensions = 384;

        /**
         * Metric of the in-memory backend.
         */
        private DistanceMetric metric = DistanceMetric.COSINE;

        /**
         * Base URL of an OpenAI compatible embeddings API.
         */
        private String baseUrl = "https://api.openai.com/v1";

        private String model = "text-embedding-3-small";

        private String apiKey;

        public String getProvider() {
            return provider;
        }

        public void setProvider(String provider) {
            this.provider = provider;
        }

        public int getDimensions() {
            return dimensions;
        }

        public void setDimensions(int dimensions) {
            this.dimensions = dimensions;
        }

        public DistanceMetric getMetric() {
            return metric;
        }

        public void setMetric(DistanceMetric metric) {
            this.metric = metric;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }
    }

    public static class Chunking {

        /**
         * Maximum prose chunk length in characters.
         */
        private int chunkSize = 1000;

        private int chunkOverlap = 100;

        private int codeChunkLines = 40;

        private int codeMaxChars = 1500;

        public int getChunkSize() {
            return chunkSize;
        }

        public void setChunkSize(int chunkSize) {
            this.chunkSize = chunkSize;
        }

        public int getChunkOverlap() {
            return chunkOverlap;
        }

        public void setChunkOverlap(int chunkOverlap) {
            this.chunkOverlap = chunkOverlap;
        }

        public int getCodeChunkLines() {
            return codeChunkLines;
        }

        public void setCodeChunkLines(int codeChunkLines) {
            this.codeChunkLines = codeChunkLines;
        }

        public int getCodeMaxChars() {
            return codeMaxChars;
        }

        public void setCodeMaxChars(int codeMaxChars) {
            this.codeMaxChars = codeMaxChars;
        }
    }

    public static class Retrieval {

        /**
         * Factor by which both retrieval passes widen their candidate pool.
         * Values below one are treated as one.
         */
        private double candidateMultiplier = 2.0d;

        private double vectorWeight = 0.7d;

        private double textWeight = 0.3d;

        private int defaultTopK = 10;

        public double getCandidateMultiplier() {
            return candidateMultiplier;
        }

        public void setCandidateMultiplier(double candidateMultiplier) {
            this.candidateMultiplier = candidateMultiplier;
        }

        public double getVectorWeight() {
            return vectorWeight;
        }

        public void setVectorWeight(double vectorWeight) {
            this.vectorWeight = vectorWeight;
        }

        public double getTextWeight() {
            return textWeight;
        }

        public void setTextWeight(double textWeight) {
            this.textWeight = textWeight;
        }

        public int getDefaultTopK() {
            return defaultTopK;
        }

        public void setDefaultTopK(int defaultTopK) {
            this.defaultTopK = defaultTopK;
        }
    }

    public static class Context {

        /**
         * Context window of the completion model in tokens.
         */
        private int window = 8192;

        /**
         * Characters per token used by the {@code ratio} estimator.
         */
        private double charsPerToken = 3.0d;

        private int promptOverheadTokens = ContextBudgetFilter.DEFAULT_PROMPT_OVERHEAD_TOKENS;

        private int responseTokenBuffer = ContextBudgetFilter.DEFAULT_RESPONSE_TOKEN_BUFFER;

        /**
         * {@code ratio} or {@code tiktoken}.
         */
        private String tokenEstimator = "ratio";

        /**
         * Results less relevant than this score are left out of the context.
         */
        private Double similarityThreshold;

        public int getWindow() {
            return window;
        }

        public void setWindow(int window) {
            this.window = window;
        }

        public double getCharsPerToken() {
            return charsPerToken;
        }

        public void setCharsPerToken(double charsPerToken) {
            this.charsPerToken = charsPerToken;
        }

        public int getPromptOverheadTokens() {
            return promptOverheadTokens;
        }

        public void setPromptOverheadTokens(int promptOverheadTokens) {
            this.promptOverheadTokens = promptOverheadTokens;
        }

        public int getResponseTokenBuffer() {
            return responseTokenBuffer;
        }

        public void setResponseTokenBuffer(int responseTokenBuffer) {
            this.responseTokenBuffer = responseTokenBuffer;
        }

        public String getTokenEstimator() {
            return tokenEstimator;
        }

        public void setTokenEstimator(String tokenEstimator) {
            this.tokenEstimator = tokenEstimator;
        }

        public Double getSimilarityThreshold() {
            return similarityThreshold;
        }

        public void setSimilarityThreshold(Double similarityThreshold) {
            this.similarityThreshold = similarityThreshold;
        }
    }

    public static class Qdrant {

        private String url = "http://localhost:6333";

        private String apiKey;

        /**
         * Points fetched per scroll request while recovering collections.
         */
        private int scrollBatchSize = 256;

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public int getScrollBatchSize() {
            return scrollBatchSize;
        }

        public void setScrollBatchSize(int scrollBatchSize) {
            this.scrollBatchSize = scrollBatchSize;
        }
    }

    public static class Indexing {

        /**
         * Worker threads that split and embed documents of a batch.
         */
        private int parallelism = 4;

        public int getParallelism() {
            return parallelism;
        }

        public void setParallelism(int parallelism) {
            this.parallelism = parallelism;
        }
    }
}
