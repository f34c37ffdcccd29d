package ch.so.arp.rag.engine.embedding;

import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Calls an OpenAI compatible {@code /embeddings} endpoint.
 */
public class RemoteEmbeddingProvider implements EmbeddingProvider {

    private static final Logger LOGGER = LoggerFactory.getLogger(RemoteEmbeddingProvider.class);

    private final RestClient restClient;
    private final String model;
    private final int dimensions;

    public RemoteEmbeddingProvider(RestClient restClient, String model, int dimensions) {
        this.restClient = Objects.requireNonNull(restClient, "restClient");
        this.model = Objects.requireNonNull(model, "model");
        if (dimensions <= 0) {
            throw new IllegalArgumentException("dimensions must be positive");
        }
        this.dimensions = dimensions;
    }

    @Override
    public int dimensions() {
        return dimensions;
    }

    @Override
    public float[] embed(String text) {
        JsonNode response;
        try {
            response = restClient.post()
                    .uri("/embeddings")
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(Map.of("model", model, "input", List.of(text)))
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RestClientException ex) {
            LOGGER.error("Embedding request failed: {}", ex.getMessage());
            throw new IllegalStateException("Failed to generate embedding: " + ex.getMessage(), ex);
        }
        JsonNode embedding = response == null ? null : response.path("data").path(0).path("embedding");
        if (embedding == null || !embedding.isArray()) {
            throw new IllegalStateException("Failed to generate embedding: response without data");
        }
        if (embedding.size() != dimensions) {
            throw new IllegalStateException("Embedding service returned " + embedding.size()
                    + " dimensions, expected " + dimensions);
        }
        float[] vector = new float[dimensions];
        for (int i = 0; i < dimensions; i++) {
            vector[i] = (float) embedding.get(i).asDouble();
        }
        return vector;
    }
}
