package ch.so.arp.rag.engine.retrieval;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import ch.so.arp.rag.engine.RankedResult;
import ch.so.arp.rag.engine.ScoreKind;

class ContextBudgetFilterTest {

    /** One token per character keeps the arithmetic visible. */
    private static final TokenEstimator ONE_PER_CHAR = TokenEstimator.charactersPerToken(1.0d);

    private static final String QUERY = "q".repeat(50);

    @Test
    void keepsOnlyWhatFitsIntoTheAvailableBudget() {
        ContextBudgetFilter filter = new ContextBudgetFilter(1000, 150, ONE_PER_CHAR);
        List<RankedResult> candidates = List.of(
                result("a", 250, 0.9d), result("b", 250, 0.8d), result("c", 250, 0.7d));

        List<RankedResult> selected = filter.select(candidates, QUERY, 200, null);

        assertThat(filter.availableTokens(QUERY, 200)).isEqualTo(600);
        assertThat(selected).extracting(RankedResult::nodeId).containsExactly("a", "b");
    }

    @Test
    void skipsOversizedNodesAndKeepsWalking() {
        ContextBudgetFilter filter = new ContextBudgetFilter(1000, 150, ONE_PER_CHAR);
        List<RankedResult> candidates = List.of(
                result("small", 300, 0.9d), result("huge", 400, 0.8d), result("tiny", 100, 0.7d));

        List<RankedResult> selected = filter.select(candidates, QUERY, 200, null);

        assertThat(selected).extracting(RankedResult::nodeId).containsExactly("small", "tiny");
    }

    @Test
    void walksFromMostToLeastRelevant() {
        ContextBudgetFilter filter = new ContextBudgetFilter(1000, 150, ONE_PER_CHAR);
        List<RankedResult> candidates = List.of(
                result("low", 400, 0.1d), result("high", 400, 0.9d));

        assertThat(filter.select(candidates, QUERY, 200, null)).extracting(RankedResult::nodeId)
                .containsExactly("high");
    }

    @Test
    void distancesAreOrderedAscending() {
        ContextBudgetFilter filter = new ContextBudgetFilter(1000, 150, ONE_PER_CHAR);
        List<RankedResult> candidates = List.of(
                new RankedResult("far", "d", "x".repeat(400), 3.0d, ScoreKind.DISTANCE, Map.of()),
                new RankedResult("near", "d", "x".repeat(400), 0.5d, ScoreKind.DISTANCE, Map.of()));

        assertThat(filter.select(candidates, QUERY, 200, null)).extracting(RankedResult::nodeId)
                .containsExactly("near");
    }

    @Test
    void returnsNothingWhenNoBudgetIsLeft() {
        ContextBudgetFilter filter = new ContextBudgetFilter(300, 150, ONE_PER_CHAR);

        assertThat(filter.select(List.of(result("a", 1, 0.9d)), QUERY, 100, null)).isEmpty();
    }

    @Test
    void dropsResultsBelowTheRelevanceThreshold() {
        ContextBudgetFilter filter = new ContextBudgetFilter(1000, 150, ONE_PER_CHAR);
        List<RankedResult> candidates = List.of(result("good", 10, 0.8d), result("weak", 10, 0.2d));

        assertThat(filter.select(candidates, QUERY, 200, 0.5d)).extracting(RankedResult::nodeId)
                .containsExactly("good");
    }

    @Test
    void ratioEstimatorDividesTheCharacterCount() {
        TokenEstimator estimator = TokenEstimator.charactersPerToken(3.0d);

        assertThat(estimator.estimate("x".repeat(10))).isEqualTo(3);
        assertThat(estimator.estimate("")).isZero();
    }

    @Test
    void tiktokenCountsRealTokens() {
        assertThat(new TiktokenEstimator().estimate("hello world")).isEqualTo(2);
    }

    private static RankedResult result(String nodeId, int tokens, double score) {
        return new RankedResult(nodeId, "doc", "x".repeat(tokens), score, ScoreKind.FUSED, Map.of());
    }
}
