package ch.so.arp.rag.engine.retrieval;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import ch.so.arp.rag.engine.MetadataFilter;
import ch.so.arp.rag.engine.RankedResult;
import ch.so.arp.rag.engine.ScoreKind;

class HybridRetrieverTest {

    @Test
    void fusesVectorSimilarityWithKeywordRank() {
        VectorRetriever vectors = (query, topK, filter) -> List.of(
                result("A", 0.9d, ScoreKind.SIMILARITY),
                result("B", 0.4d, ScoreKind.SIMILARITY));
        KeywordRetriever keywords = keywordRetriever(List.of(result("A", 7.5d, ScoreKind.KEYWORD)), 10);

        List<RankedResult> fused = new HybridRetriever(vectors, keywords, 0.7d, 0.3d, 1.0d)
                .retrieve("query", 5, MetadataFilter.none());

        assertThat(fused).extracting(RankedResult::nodeId).containsExactly("A", "B");
        assertThat(fused.get(0).score()).isCloseTo(0.93d, within(1e-9));
        assertThat(fused.get(1).score()).isCloseTo(0.28d, within(1e-9));
        assertThat(fused).allSatisfy(result -> assertThat(result.scoreKind()).isEqualTo(ScoreKind.FUSED));
    }

    @Test
    void keywordOnlyNodesScoreByTheirRank() {
        VectorRetriever vectors = (query, topK, filter) -> List.of();
        KeywordRetriever keywords = keywordRetriever(List.of(
                result("first", 3.0d, ScoreKind.KEYWORD),
                result("second", 2.0d, ScoreKind.KEYWORD),
                result("third", 1.0d, ScoreKind.KEYWORD)), 10);

        List<RankedResult> fused = new HybridRetriever(vectors, keywords, 1.0d, 1.0d, 1.0d)
                .retrieve("query", 3, MetadataFilter.none());

        assertThat(fused).extracting(RankedResult::score)
                .containsExactly(0.5d * 1.0d, 0.5d * 0.5d, 0.5d * (1.0d / 3.0d));
    }

    @Test
    void normalisesWeightsToSumToOne() {
        HybridRetriever retriever = new HybridRetriever((query, topK, filter) -> List.of(),
                keywordRetriever(List.of(), 0), 7.0d, 3.0d, 1.0d);

        assertThat(retriever.vectorWeight()).isCloseTo(0.7d, within(1e-12));
        assertThat(retriever.textWeight()).isCloseTo(0.3d, within(1e-12));
    }

    @Test
    void widensTheCandidatePoolButNotBeyondTheAvailableNodes() {
        List<Integer> requested = new ArrayList<>();
        VectorRetriever vectors = (query, topK, filter) -> {
            requested.add(topK);
            return List.of();
        };

        new HybridRetriever(vectors, keywordRetriever(List.of(), 100), 0.5d, 0.5d, 2.5d)
                .retrieve("query", 4, MetadataFilter.none());
        new HybridRetriever(vectors, keywordRetriever(List.of(), 3), 0.5d, 0.5d, 2.5d)
                .retrieve("query", 4, MetadataFilter.none());
        new HybridRetriever(vectors, keywordRetriever(List.of(), 100), 0.5d, 0.5d, 0.2d)
                .retrieve("query", 4, MetadataFilter.none());

        assertThat(requested).containsExactly(10, 3, 4);
    }

    @Test
    void truncatesToMaxResults() {
        VectorRetriever vectors = (query, topK, filter) -> List.of(
                result("a", 0.9d, ScoreKind.SIMILARITY),
                result("b", 0.8d, ScoreKind.SIMILARITY),
                result("c", 0.7d, ScoreKind.SIMILARITY));

        List<RankedResult> fused = new HybridRetriever(vectors, keywordRetriever(List.of(), 0), 0.5d, 0.5d, 1.0d)
                .retrieve("query", 2, MetadataFilter.none());

        assertThat(fused).extracting(RankedResult::nodeId).containsExactly("a", "b");
    }

    @Test
    void distancesAreTurnedIntoSimilaritiesBeforeFusion() {
        VectorRetriever vectors = (query, topK, filter) -> List.of(
                result("near", 0.0d, ScoreKind.DISTANCE),
                result("far", 3.0d, ScoreKind.DISTANCE));

        List<RankedResult> fused = new HybridRetriever(vectors, keywordRetriever(List.of(), 0), 1.0d, 0.0d, 1.0d)
                .retrieve("query", 2, MetadataFilter.none());

        assertThat(fused).extracting(RankedResult::nodeId).containsExactly("near", "far");
        assertThat(fused.get(0).score()).isCloseTo(1.0d, within(1e-12));
        assertThat(fused.get(1).score()).isCloseTo(0.25d, within(1e-12));
    }

    @Test
    void textScoreFollowsTheRankFormula() {
        assertThat(HybridRetriever.textScore(0)).isEqualTo(1.0d);
        assertThat(HybridRetriever.textScore(1)).isEqualTo(0.5d);
        assertThat(HybridRetriever.textScore(-3)).isEqualTo(1.0d);
    }

    @Test
    void rejectsWeightsThatCannotBeNormalised() {
        assertThatThrownBy(() -> new HybridRetriever((query, topK, filter) -> List.of(),
                keywordRetriever(List.of(), 0), 0.0d, 0.0d, 1.0d)).isInstanceOf(IllegalArgumentException.class);
    }

    private static KeywordRetriever keywordRetriever(List<RankedResult> results, int size) {
        return new KeywordRetriever() {
            @Override
            public List<RankedResult> retrieve(String query, int topK, MetadataFilter filter) {
                return results.subList(0, Math.min(topK, results.size()));
            }

            @Override
            public int size() {
                return size;
            }
        };
    }

    private static RankedResult result(String nodeId, double score, ScoreKind kind) {
        return new RankedResult(nodeId, "doc-" + nodeId, "text " + nodeId, score, kind, Map.of());
    }
}
