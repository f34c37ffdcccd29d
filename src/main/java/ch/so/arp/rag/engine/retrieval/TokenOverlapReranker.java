package ch.so.arp.rag.engine.retrieval;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.so.arp.rag.engine.RankedResult;
import ch.so.arp.rag.engine.ScoreKind;

/**
 * Deterministic reranker that estimates relevance from the token overlap
 * between query and candidate, nudged by the score the candidate arrived with.
 * It stands in for a cross-encoder model in local setups and tests.
 */
public class TokenOverlapReranker implements Reranker {

    private static final Logger LOGGER = LoggerFactory.getLogger(TokenOverlapReranker.class);

    private static final double PRIOR_WEIGHT = 0.2d;

    @Override
    public List<RankedResult> rerank(String query, List<RankedResult> candidates, int topN) {
        if (topN <= 0 || candidates.isEmpty()) {
            return List.of();
        }
        Set<String> queryTokens = tokenize(query);
        List<RankedResult> rescored = new ArrayList<>(candidates.size());
        for (RankedResult candidate : candidates) {
            Set<String> passageTokens = tokenize(candidate.text());
            long overlap = passageTokens.stream().filter(queryTokens::contains).count();
            double normalizedOverlap = queryTokens.isEmpty() ? 0.0d
                    : (double) overlap / (double) queryTokens.size();
            double prior = candidate.scoreKind().lowerIsBetter() ? 0.0d : Math.max(0.0d, candidate.score());
            rescored.add(candidate.withScore(normalizedOverlap + PRIOR_WEIGHT * prior, ScoreKind.RERANKED));
        }
        rescored.sort(Comparator.comparingDouble(RankedResult::score).reversed());
        LOGGER.debug("Reranked {} candidates, keeping {}", candidates.size(), Math.min(topN, rescored.size()));
        return List.copyOf(rescored.subList(0, Math.min(topN, rescored.size())));
    }

    private Set<String> tokenize(String value) {
        String normalized = value == null ? "" : value.toLowerCase(Locale.ROOT);
        Set<String> tokens = new HashSet<>();
        for (String token : normalized.split("\\W+")) {
            if (token.length() >= 3) {
                tokens.add(token);
            }
        }
        return tokens;
    }
}
