package ch.so.arp.rag.engine.embedding;

/**
 * Strategy abstraction used to compute embeddings for chunks and queries.
 * Implementations can either call a remote embedding API or provide
 * deterministic vectors that are suited for tests and local development.
 */
public interface EmbeddingProvider {

    /**
     * Create an embedding vector for the provided text.
     *
     * @param text the text to embed
     * @return the embedding represented as a float array
     */
    float[] embed(String text);

    /**
     * Length of the vectors returned by {@link #embed(String)}.
     */
    int dimensions();
}
