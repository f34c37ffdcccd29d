package ch.so.arp.rag.engine.retrieval;

import java.util.List;

import ch.so.arp.rag.engine.RankedResult;

/**
 * Second-stage scorer applied to fused candidates. Implementations may call a
 * cross-encoder model or apply lightweight heuristics.
 */
public interface Reranker {

    /**
     * Returns the {@code topN} most relevant candidates, rescored and ordered
     * best first.
     */
    List<RankedResult> rerank(String query, List<RankedResult> candidates, int topN);
}
