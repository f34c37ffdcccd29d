package ch.so.arp.rag.engine;

/**
 * Meaning of {@link RankedResult#score()}. Scores of different kinds are never
 * compared with each other.
 */
public enum ScoreKind {

    /** Raw distance reported by a vector backend, lower is better. */
    DISTANCE,

    /** Raw similarity reported by a vector backend, higher is better. */
    SIMILARITY,

    /** BM25 relevance reported by the keyword index, higher is better. */
    KEYWORD,

    /** Weighted hybrid relevance, higher is better. */
    FUSED,

    /** Reranker relevance, higher is better. */
    RERANKED;

    public boolean lowerIsBetter() {
        return this == DISTANCE;
    }
}
