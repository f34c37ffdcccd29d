package ch.so.arp.rag.engine;

import java.util.Comparator;
import java.util.Map;
import java.util.Objects;

/**
 * Output element of retrieval. The {@link ScoreKind} tells which stage
 * produced the score.
 */
public record RankedResult(
        String nodeId,
        String docId,
        String text,
        double score,
        ScoreKind scoreKind,
        Map<String, String> metadata) {

    public RankedResult {
        Objects.requireNonNull(nodeId, "nodeId");
        Objects.requireNonNull(scoreKind, "scoreKind");
        text = text == null ? "" : text;
        metadata = Metadata.copyOf(metadata);
    }

    public RankedResult withScore(double newScore, ScoreKind newKind) {
        return new RankedResult(nodeId, docId, text, newScore, newKind, metadata);
    }

    /**
     * Orders results from most to least relevant, honouring the score kind.
     */
    public static Comparator<RankedResult> mostRelevantFirst() {
        return (left, right) -> {
            if (left.scoreKind().lowerIsBetter() && right.scoreKind().lowerIsBetter()) {
                return Double.compare(left.score(), right.score());
            }
            return Double.compare(right.score(), left.score());
        };
    }
}
