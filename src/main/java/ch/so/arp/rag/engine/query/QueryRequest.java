package ch.so.arp.rag.engine.query;

import java.util.Map;

/**
 * Question against one index, optionally with model and reranking parameters.
 *
 * @param topK         number of fused results handed to reranking and the
 *                     context filter; the engine default if {@code null}
 * @param llmParams    passed through to the completion model;
 *                     {@code temperature} must lie in [0, 1] and
 *                     {@code max_tokens} caps the reserved response budget
 * @param rerankParams enables reranking when present; {@code top_n} must not
 *                     exceed {@code topK}
 */
public record QueryRequest(
        String indexName,
        String query,
        Integer topK,
        Map<String, Object> llmParams,
        Map<String, Object> rerankParams) {

    public QueryRequest {
        llmParams = llmParams == null ? Map.of() : Map.copyOf(llmParams);
    }
}
