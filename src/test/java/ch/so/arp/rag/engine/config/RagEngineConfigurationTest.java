package ch.so.arp.rag.engine.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import ch.so.arp.rag.engine.RetrievalEngine;
import ch.so.arp.rag.engine.backend.BackendType;
import ch.so.arp.rag.engine.backend.VectorIndexBackend;
import ch.so.arp.rag.engine.backend.memory.InMemoryVectorIndexBackend;
import ch.so.arp.rag.engine.backend.qdrant.InMemoryQdrantClient;
import ch.so.arp.rag.engine.backend.qdrant.QdrantClient;
import ch.so.arp.rag.engine.backend.qdrant.QdrantVectorIndexBackend;
import ch.so.arp.rag.engine.embedding.DeterministicEmbeddingProvider;
import ch.so.arp.rag.engine.embedding.EmbeddingProvider;
import ch.so.arp.rag.engine.embedding.RemoteEmbeddingProvider;
import ch.so.arp.rag.engine.llm.LlmClient;
import ch.so.arp.rag.engine.llm.MockLlmClient;
import ch.so.arp.rag.engine.llm.OpenAiClientProperties;
import ch.so.arp.rag.engine.llm.OpenAiLlmClient;
import ch.so.arp.rag.engine.query.QueryService;
import ch.so.arp.rag.engine.retrieval.TiktokenEstimator;
import ch.so.arp.rag.engine.retrieval.TokenEstimator;

class RagEngineConfigurationTest {

    @TempDir
    Path persistDir;

    private ApplicationContextRunner contextRunner() {
        return new ApplicationContextRunner()
                .withConfiguration(AutoConfigurations.of(JacksonAutoConfiguration.class))
                .withUserConfiguration(RagEngineConfiguration.class)
                .withPropertyValues("rag.engine.persist-dir=" + persistDir);
    }

    @Test
    void usesLocalComponentsByDefault() {
        contextRunner().run(context -> {
            assertThat(context).hasSingleBean(VectorIndexBackend.class);
            assertThat(context).getBean(VectorIndexBackend.class).isInstanceOf(InMemoryVectorIndexBackend.class);
            assertThat(context).getBean(EmbeddingProvider.class).isInstanceOf(DeterministicEmbeddingProvider.class);
            assertThat(context).getBean(LlmClient.class).isInstanceOf(MockLlmClient.class);
            assertThat(context).hasSingleBean(QueryService.class);
            assertThat(context.getBean(RetrievalEngine.class).backendType()).isEqualTo(BackendType.IN_MEMORY);
            assertThat(context.getBean(EmbeddingProvider.class).dimensions()).isEqualTo(384);
        });
    }

    @Test
    void switchesToQdrant() {
        contextRunner()
                .withBean(QdrantClient.class, InMemoryQdrantClient::new)
                .withPropertyValues("rag.engine.backend=qdrant", "rag.engine.embedding.dimensions=16")
                .run(context -> {
                    assertThat(context).getBean(VectorIndexBackend.class).isInstanceOf(QdrantVectorIndexBackend.class);
                    assertThat(context.getBean(RetrievalEngine.class).backendType()).isEqualTo(BackendType.QDRANT);
                });
    }

    @Test
    void createsRealClientsWhenMocksDisabled() {
        contextRunner()
                .withPropertyValues(
                        "rag.chat.mock-openai=false",
                        "spring.ai.openai.api-key=test-key",
                        "rag.chat.openai.base-url=https://example.com/v1",
                        "rag.chat.openai.model=gpt-4o",
                        "rag.engine.embedding.provider=remote",
                        "rag.engine.embedding.base-url=https://example.com/v1")
                .run(context -> {
                    assertThat(context).getBean(LlmClient.class).isInstanceOf(OpenAiLlmClient.class);
                    OpenAiClientProperties properties = context.getBean(OpenAiClientProperties.class);
                    assertThat(properties.getApiKey()).isEqualTo("test-key");
                    assertThat(properties.getModel()).isEqualTo("gpt-4o");
                    assertThat(context).getBean(EmbeddingProvider.class).isInstanceOf(RemoteEmbeddingProvider.class);
                });
    }

    @Test
    void bindsEngineProperties() {
        contextRunner()
                .withPropertyValues("rag.engine.context.token-estimator=tiktoken",
                        "rag.engine.retrieval.default-top-k=7", "rag.engine.indexing.parallelism=2")
                .run(context -> {
                    RagEngineProperties properties = context.getBean(RagEngineProperties.class);
                    assertThat(properties.getRetrieval().getDefaultTopK()).isEqualTo(7);
                    assertThat(properties.getIndexing().getParallelism()).isEqualTo(2);
                    assertThat(properties.getPersistDir()).isEqualTo(persistDir);
                    assertThat(context).getBean(TokenEstimator.class).isInstanceOf(TiktokenEstimator.class);
                });
    }
}
