package ch.so.arp.rag.engine.web;

import java.util.Map;

import jakarta.validation.constraints.NotBlank;

/**
 * Incoming payload for retrieval without generation.
 */
public record RetrieveRequest(@NotBlank String indexName, String query, Integer topK,
        Map<String, String> metadataFilter) {
}
