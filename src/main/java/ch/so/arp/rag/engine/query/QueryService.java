package ch.so.arp.rag.engine.query;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.so.arp.rag.engine.InvalidRequestException;
import ch.so.arp.rag.engine.RankedResult;
import ch.so.arp.rag.engine.RetrievalEngine;
import ch.so.arp.rag.engine.llm.LlmClient;
import ch.so.arp.rag.engine.retrieval.ContextBudgetFilter;
import ch.so.arp.rag.engine.retrieval.Reranker;

/**
 * Answers questions: hybrid retrieval from the engine, optional reranking, the
 * context budget filter, then the completion model.
 */
public class QueryService {

    private static final Logger LOGGER = LoggerFactory.getLogger(QueryService.class);

    static final String TEMPERATURE = "temperature";
    static final String MAX_TOKENS = "max_tokens";
    static final String TOP_N = "top_n";

    /** Reranked results kept when {@code top_n} is not given. */
    static final int DEFAULT_RERANK_TOP_N = 5;

    private final RetrievalEngine engine;
    private final Reranker reranker;
    private final ContextBudgetFilter budgetFilter;
    private final LlmClient llmClient;
    private final int responseTokenBuffer;
    private final Double similarityThreshold;

    public QueryService(RetrievalEngine engine, Reranker reranker, ContextBudgetFilter budgetFilter,
            LlmClient llmClient, int responseTokenBuffer, Double similarityThreshold) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.reranker = Objects.requireNonNull(reranker, "reranker");
        this.budgetFilter = Objects.requireNonNull(budgetFilter, "budgetFilter");
        this.llmClient = Objects.requireNonNull(llmClient, "llmClient");
        this.responseTokenBuffer = responseTokenBuffer;
        this.similarityThreshold = similarityThreshold;
    }

    public QueryResult query(QueryRequest request) {
        Objects.requireNonNull(request, "request");
        Integer topK = request.topK();
        if (topK != null && topK <= 0) {
            throw new InvalidRequestException("top_k must be positive.");
        }
        validateLlmParams(request.llmParams());
        Integer topN = rerankTopN(request.rerankParams(), topK);

        List<RankedResult> results = engine.retrieve(request.indexName(), request.query(), topK, null);
        if (topN != null) {
            results = reranker.rerank(request.query(), results, topN);
        }
        int reserved = reservedResponseTokens(request.llmParams());
        List<RankedResult> selected = budgetFilter.select(results, request.query(), reserved, similarityThreshold);
        List<String> context = selected.stream().map(RankedResult::text).toList();

        String response = llmClient.complete(request.query(), context, request.llmParams());
        Map<String, Map<String, String>> metadata = new LinkedHashMap<>();
        selected.forEach(result -> metadata.put(result.nodeId(), result.metadata()));
        LOGGER.debug("Answered query on '{}' with {} of {} retrieved nodes using model {}", request.indexName(),
                selected.size(), results.size(), llmClient.model());
        return new QueryResult(response, selected, metadata);
    }

    int reservedResponseTokens(Map<String, Object> llmParams) {
        Object maxTokens = llmParams.get(MAX_TOKENS);
        if (maxTokens instanceof Number number) {
            return Math.min(number.intValue(), responseTokenBuffer);
        }
        return responseTokenBuffer;
    }

    private static void validateLlmParams(Map<String, Object> llmParams) {
        Object temperature = llmParams.get(TEMPERATURE);
        if (temperature != null) {
            if (!(temperature instanceof Number number) || number.doubleValue() < 0.0d || number.doubleValue() > 1.0d) {
                throw new InvalidRequestException("Temperature must be between 0.0 and 1.0.");
            }
        }
        Object maxTokens = llmParams.get(MAX_TOKENS);
        if (maxTokens != null && (!(maxTokens instanceof Number number) || number.intValue() <= 0)) {
            throw new InvalidRequestException("max_tokens must be a positive number.");
        }
    }

    private static Integer rerankTopN(Map<String, Object> rerankParams, Integer topK) {
        if (rerankParams == null) {
            return null;
        }
        Object value = rerankParams.get(TOP_N);
        if (value == null) {
            return topK == null ? DEFAULT_RERANK_TOP_N : Math.min(DEFAULT_RERANK_TOP_N, topK);
        }
        if (!(value instanceof Number number) || number.intValue() <= 0) {
            throw new InvalidRequestException("'top_n' for reranking must be a positive number.");
        }
        if (topK != null && number.intValue() > topK) {
            throw new InvalidRequestException(
                    "Invalid configuration: 'top_n' for reranking cannot exceed 'top_k' from the RAG query.");
        }
        return number.intValue();
    }
}
