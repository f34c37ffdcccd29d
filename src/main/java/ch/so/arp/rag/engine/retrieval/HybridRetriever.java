package ch.so.arp.rag.engine.retrieval;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.so.arp.rag.engine.MetadataFilter;
import ch.so.arp.rag.engine.RankedResult;
import ch.so.arp.rag.engine.ScoreKind;

/**
 * Weighted fusion of a vector pass and a keyword pass.
 * <ol>
 * <li>Both retrievers are asked for {@code maxResults * candidateMultiplier}
 * candidates, capped at the number of nodes the keyword retriever holds.</li>
 * <li>The keyword rank is turned into a score with
 * {@code textScore = 1 / (1 + max(0, rank))}.</li>
 * <li>{@code finalScore = vectorWeight * vectorScore + textWeight * textScore},
 * with both weights normalised to sum to one. A node missing from one pass
 * scores zero for that pass.</li>
 * <li>Nodes are sorted by final score, descending, and cut to
 * {@code maxResults}. Ties keep the order in which the passes produced
 * them.</li>
 * </ol>
 * {@code vectorScore} is the raw similarity when the backend reports one
 * (cosine, inner product). An L2 backend reports distances instead, and those
 * enter the fusion as {@code 1 / (1 + distance)} so that closer nodes still
 * score higher. Fused L2 scores are therefore not comparable with fused cosine
 * scores.
 */
public class HybridRetriever {

    private static final Logger LOGGER = LoggerFactory.getLogger(HybridRetriever.class);

    private final VectorRetriever vectorRetriever;
    private final KeywordRetriever keywordRetriever;
    private final double vectorWeight;
    private final double textWeight;
    private final double candidateMultiplier;

    public HybridRetriever(VectorRetriever vectorRetriever, KeywordRetriever keywordRetriever, double vectorWeight,
            double textWeight, double candidateMultiplier) {
        this.vectorRetriever = Objects.requireNonNull(vectorRetriever, "vectorRetriever");
        this.keywordRetriever = Objects.requireNonNull(keywordRetriever, "keywordRetriever");
        if (vectorWeight < 0 || textWeight < 0 || vectorWeight + textWeight <= 0) {
            throw new IllegalArgumentException("Weights must not be negative and must not both be zero");
        }
        double total = vectorWeight + textWeight;
        this.vectorWeight = vectorWeight / total;
        this.textWeight = textWeight / total;
        this.candidateMultiplier = Math.max(1.0d, candidateMultiplier);
    }

    public List<RankedResult> retrieve(String query, int maxResults, MetadataFilter filter) {
        if (maxResults <= 0) {
            return List.of();
        }
        int poolSize = candidatePoolSize(maxResults);
        List<RankedResult> vectorResults = vectorRetriever.retrieve(query, poolSize, filter);
        List<RankedResult> keywordResults = keywordRetriever.retrieve(query, poolSize, filter);

        Map<String, Candidate> candidates = new LinkedHashMap<>();
        for (RankedResult result : vectorResults) {
            candidates.computeIfAbsent(result.nodeId(), key -> new Candidate(result)).vectorScore =
                    asSimilarity(result);
        }
        for (int rank = 0; rank < keywordResults.size(); rank++) {
            RankedResult result = keywordResults.get(rank);
            Candidate candidate = candidates.computeIfAbsent(result.nodeId(), key -> new Candidate(result));
            if (candidate.keywordRank < 0) {
                candidate.keywordRank = rank;
            }
        }

        List<RankedResult> fused = new ArrayList<>(candidates.size());
        for (Candidate candidate : candidates.values()) {
            fused.add(candidate.result.withScore(fuse(candidate), ScoreKind.FUSED));
        }
        fused.sort(Comparator.comparingDouble(RankedResult::score).reversed());
        LOGGER.debug("Hybrid retrieval fused {} vector and {} keyword candidates (pool={}, limit={})",
                vectorResults.size(), keywordResults.size(), poolSize, maxResults);
        return fused.size() > maxResults ? List.copyOf(fused.subList(0, maxResults)) : List.copyOf(fused);
    }

    int candidatePoolSize(int maxResults) {
        int poolSize = (int) (maxResults * candidateMultiplier);
        int available = keywordRetriever.size();
        return available > 0 ? Math.min(poolSize, available) : poolSize;
    }

    double vectorWeight() {
        return vectorWeight;
    }

    double textWeight() {
        return textWeight;
    }

    static double textScore(int keywordRank) {
        return 1.0d / (1.0d + Math.max(0, keywordRank));
    }

    private double fuse(Candidate candidate) {
        double textScore = candidate.keywordRank >= 0 ? textScore(candidate.keywordRank) : 0.0d;
        return vectorWeight * candidate.vectorScore + textWeight * textScore;
    }

    /**
     * Distances are mapped onto (0, 1] so that closer nodes score higher.
     */
    private static double asSimilarity(RankedResult result) {
        if (result.scoreKind().lowerIsBetter()) {
            return 1.0d / (1.0d + Math.max(0.0d, result.score()));
        }
        return result.score();
    }

    private static final class Candidate {

        private final RankedResult result;
        private double vectorScore;
        private int keywordRank = -1;

        Candidate(RankedResult result) {
            this.result = result;
        }
    }
}
