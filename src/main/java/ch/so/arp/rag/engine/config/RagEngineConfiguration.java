package ch.so.arp.rag.engine.config;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;

import com.fasterxml.jackson.databind.ObjectMapper;

import ch.so.arp.rag.engine.RetrievalEngine;
import ch.so.arp.rag.engine.backend.VectorIndexBackend;
import ch.so.arp.rag.engine.backend.memory.InMemoryVectorIndexBackend;
import ch.so.arp.rag.engine.backend.qdrant.QdrantClient;
import ch.so.arp.rag.engine.backend.qdrant.QdrantVectorIndexBackend;
import ch.so.arp.rag.engine.backend.qdrant.RestQdrantClient;
import ch.so.arp.rag.engine.chunking.ChunkingTransformer;
import ch.so.arp.rag.engine.chunking.ProseSplitter;
import ch.so.arp.rag.engine.embedding.DeterministicEmbeddingProvider;
import ch.so.arp.rag.engine.embedding.EmbeddingProvider;
import ch.so.arp.rag.engine.embedding.RemoteEmbeddingProvider;
import ch.so.arp.rag.engine.llm.LlmClient;
import ch.so.arp.rag.engine.llm.MockLlmClient;
import ch.so.arp.rag.engine.llm.OpenAiClientProperties;
import ch.so.arp.rag.engine.llm.OpenAiLlmClient;
import ch.so.arp.rag.engine.query.QueryService;
import ch.so.arp.rag.engine.retrieval.ContextBudgetFilter;
import ch.so.arp.rag.engine.retrieval.Reranker;
import ch.so.arp.rag.engine.retrieval.TiktokenEstimator;
import ch.so.arp.rag.engine.retrieval.TokenEstimator;
import ch.so.arp.rag.engine.retrieval.TokenOverlapReranker;

/**
 * Central configuration wiring the engine together. Toggles decide which
 * vector backend, embedding provider and completion client are used.
 */
@Configuration
@EnableConfigurationProperties({ RagEngineProperties.class, OpenAiClientProperties.class })
public class RagEngineConfiguration {

    @Bean(destroyMethod = "shutdown")
    @ConditionalOnMissingBean(name = "indexingExecutor")
    public ExecutorService indexingExecutor(RagEngineProperties properties) {
        int parallelism = Math.max(1, properties.getIndexing().getParallelism());
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "rag-indexing-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newFixedThreadPool(parallelism, threadFactory);
    }

    @Bean
    @ConditionalOnProperty(name = "rag.engine.embedding.provider", havingValue = "deterministic", matchIfMissing = true)
    public EmbeddingProvider deterministicEmbeddingProvider(RagEngineProperties properties) {
        return new DeterministicEmbeddingProvider(properties.getEmbedding().getDimensions());
    }

    @Bean
    @ConditionalOnProperty(name = "rag.engine.embedding.provider", havingValue = "remote")
    public EmbeddingProvider remoteEmbeddingProvider(RagEngineProperties properties,
            ObjectProvider<RestClient.Builder> builders) {
        RagEngineProperties.Embedding embedding = properties.getEmbedding();
        RestClient.Builder builder = builders.getIfAvailable(RestClient::builder).baseUrl(embedding.getBaseUrl());
        if (StringUtils.hasText(embedding.getApiKey())) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + embedding.getApiKey());
        }
        return new RemoteEmbeddingProvider(builder.build(), embedding.getModel(), embedding.getDimensions());
    }

    @Bean
    @ConditionalOnMissingBean
    public ChunkingTransformer chunkingTransformer(RagEngineProperties properties) {
        RagEngineProperties.Chunking chunking = properties.getChunking();
        return new ChunkingTransformer(new ProseSplitter(chunking.getChunkSize(), chunking.getChunkOverlap()),
                chunking.getCodeChunkLines(), chunking.getCodeMaxChars());
    }

    @Bean
    @ConditionalOnProperty(name = "rag.engine.backend", havingValue = "in-memory", matchIfMissing = true)
    public VectorIndexBackend inMemoryVectorIndexBackend(RagEngineProperties properties,
            EmbeddingProvider embeddingProvider, ObjectMapper objectMapper) {
        return new InMemoryVectorIndexBackend(embeddingProvider.dimensions(), properties.getEmbedding().getMetric(),
                objectMapper);
    }

    @Bean
    @ConditionalOnProperty(name = "rag.engine.backend", havingValue = "qdrant")
    @ConditionalOnMissingBean
    public QdrantClient qdrantClient(RagEngineProperties properties, ObjectProvider<RestClient.Builder> builders,
            ObjectMapper objectMapper) {
        RagEngineProperties.Qdrant qdrant = properties.getQdrant();
        RestClient.Builder builder = builders.getIfAvailable(RestClient::builder)
                .baseUrl(qdrant.getUrl())
                .requestFactory(new SimpleClientHttpRequestFactory());
        if (StringUtils.hasText(qdrant.getApiKey())) {
            builder.defaultHeader("api-key", qdrant.getApiKey());
        }
        return new RestQdrantClient(builder.build(), objectMapper);
    }

    @Bean
    @ConditionalOnProperty(name = "rag.engine.backend", havingValue = "qdrant")
    public VectorIndexBackend qdrantVectorIndexBackend(RagEngineProperties properties, QdrantClient qdrantClient,
            EmbeddingProvider embeddingProvider) {
        return new QdrantVectorIndexBackend(qdrantClient, embeddingProvider.dimensions(),
                properties.getQdrant().getScrollBatchSize());
    }

    @Bean
    public RetrievalEngine retrievalEngine(RagEngineProperties properties, VectorIndexBackend backend,
            EmbeddingProvider embeddingProvider, ChunkingTransformer chunkingTransformer,
            ExecutorService indexingExecutor, ObjectMapper objectMapper) {
        RagEngineProperties.Retrieval retrieval = properties.getRetrieval();
        RetrievalEngine.Settings settings = new RetrievalEngine.Settings(properties.getPersistDir(),
                properties.isRestoreOnStartup(), properties.isAutoPersist(), retrieval.getDefaultTopK(),
                retrieval.getVectorWeight(), retrieval.getTextWeight(), retrieval.getCandidateMultiplier());
        RetrievalEngine engine = new RetrievalEngine(backend, embeddingProvider, chunkingTransformer,
                indexingExecutor, objectMapper, settings);
        engine.start();
        return engine;
    }

    @Bean
    @ConditionalOnMissingBean
    public TokenEstimator tokenEstimator(RagEngineProperties properties) {
        RagEngineProperties.Context context = properties.getContext();
        if ("tiktoken".equalsIgnoreCase(context.getTokenEstimator())) {
            return new TiktokenEstimator();
        }
        return TokenEstimator.charactersPerToken(context.getCharsPerToken());
    }

    @Bean
    @ConditionalOnMissingBean
    public ContextBudgetFilter contextBudgetFilter(RagEngineProperties properties, TokenEstimator tokenEstimator) {
        RagEngineProperties.Context context = properties.getContext();
        return new ContextBudgetFilter(context.getWindow(), context.getPromptOverheadTokens(), tokenEstimator);
    }

    @Bean
    @ConditionalOnMissingBean
    public Reranker reranker() {
        return new TokenOverlapReranker();
    }

    @Bean
    @ConditionalOnProperty(name = "rag.chat.mock-openai", havingValue = "true", matchIfMissing = true)
    public LlmClient mockLlmClient() {
        return new MockLlmClient();
    }

    @Bean
    @ConditionalOnProperty(name = "rag.chat.mock-openai", havingValue = "false")
    public LlmClient openAiLlmClient(OpenAiClientProperties properties, ObjectProvider<RestClient.Builder> builders) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setReadTimeout(properties.getTimeout());
        RestClient.Builder builder = builders.getIfAvailable(RestClient::builder)
                .baseUrl(properties.getBaseUrl())
                .requestFactory(requestFactory);
        if (StringUtils.hasText(properties.getApiKey())) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + properties.getApiKey());
        }
        return new OpenAiLlmClient(builder.build(), properties);
    }

    @Bean
    public QueryService queryService(RetrievalEngine retrievalEngine, Reranker reranker,
            ContextBudgetFilter contextBudgetFilter, LlmClient llmClient, RagEngineProperties properties) {
        RagEngineProperties.Context context = properties.getContext();
        return new QueryService(retrievalEngine, reranker, contextBudgetFilter, llmClient,
                context.getResponseTokenBuffer(), context.getSimilarityThreshold());
    }
}
