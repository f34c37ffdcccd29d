package ch.so.arp.rag.engine.backend.memory;

import ch.so.arp.rag.engine.ScoreKind;

/**
 * Comparison used by the flat vector index.
 */
public enum DistanceMetric {

    /** Cosine similarity, higher is closer. */
    COSINE(ScoreKind.SIMILARITY) {
        @Override
        float score(float[] data, int offset, float[] query, int dimension) {
            double dot = 0.0d;
            double norm = 0.0d;
            double queryNorm = 0.0d;
            for (int i = 0; i < dimension; i++) {
                float value = data[offset + i];
                dot += value * query[i];
                norm += value * value;
                queryNorm += query[i] * query[i];
            }
            if (norm == 0.0d || queryNorm == 0.0d) {
                return 0.0f;
            }
            return (float) (dot / (Math.sqrt(norm) * Math.sqrt(queryNorm)));
        }
    },

    /** Squared euclidean distance, lower is closer. */
    L2(ScoreKind.DISTANCE) {
        @Override
        float score(float[] data, int offset, float[] query, int dimension) {
            double sum = 0.0d;
            for (int i = 0; i < dimension; i++) {
                double diff = data[offset + i] - query[i];
                sum += diff * diff;
            }
            return (float) sum;
        }
    };

    private final ScoreKind scoreKind;

    DistanceMetric(ScoreKind scoreKind) {
        this.scoreKind = scoreKind;
    }

    public ScoreKind scoreKind() {
        return scoreKind;
    }

    /**
     * Returns {@code true} if {@code candidate} is closer than {@code other}.
     */
    boolean closer(float candidate, float other) {
        return scoreKind.lowerIsBetter() ? candidate < other : candidate > other;
    }

    abstract float score(float[] data, int offset, float[] query, int dimension);
}
