package ch.so.arp.rag.engine.retrieval;

/**
 * Approximates how many model tokens a text occupies. Estimates are a
 * heuristic and do not bound the real tokenizer of the completion model.
 */
@FunctionalInterface
public interface TokenEstimator {

    int estimate(String text);

    /**
     * Estimator dividing the character count by a fixed ratio.
     */
    static TokenEstimator charactersPerToken(double ratio) {
        if (ratio <= 0) {
            throw new IllegalArgumentException("ratio must be positive");
        }
        return text -> text == null || text.isEmpty() ? 0 : (int) (text.length() / ratio);
    }
}
