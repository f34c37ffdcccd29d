package ch.so.arp.rag.engine.retrieval;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.so.arp.rag.engine.RankedResult;

/**
 * Keeps the most relevant results that fit into the context window of the
 * completion model. The budget is
 * {@code contextWindow - queryTokens - promptOverheadTokens - reservedResponseTokens}.
 * Results are walked from most to least relevant; a result that does not fit
 * into the remaining budget is skipped and the walk continues.
 */
public class ContextBudgetFilter {

    private static final Logger LOGGER = LoggerFactory.getLogger(ContextBudgetFilter.class);

    /** Tokens taken by the prompt template wrapped around the context. */
    public static final int DEFAULT_PROMPT_OVERHEAD_TOKENS = 150;

    /** Response reservation used when no maximum response length is known. */
    public static final int DEFAULT_RESPONSE_TOKEN_BUFFER = 1000;

    private final int contextWindow;
    private final int promptOverheadTokens;
    private final TokenEstimator tokenEstimator;

    public ContextBudgetFilter(int contextWindow, int promptOverheadTokens, TokenEstimator tokenEstimator) {
        if (contextWindow <= 0) {
            throw new IllegalArgumentException("contextWindow must be positive");
        }
        if (promptOverheadTokens < 0) {
            throw new IllegalArgumentException("promptOverheadTokens must not be negative");
        }
        this.contextWindow = contextWindow;
        this.promptOverheadTokens = promptOverheadTokens;
        this.tokenEstimator = Objects.requireNonNull(tokenEstimator, "tokenEstimator");
    }

    /**
     * @param results                ranked results, in any order
     * @param query                  the query that will accompany the context
     * @param reservedResponseTokens tokens kept free for the response
     * @param relevanceThreshold     results less relevant than this are
     *                               skipped; {@code null} disables the check
     */
    public List<RankedResult> select(List<RankedResult> results, String query, int reservedResponseTokens,
            Double relevanceThreshold) {
        if (results.isEmpty()) {
            return List.of();
        }
        int available = availableTokens(query, reservedResponseTokens);
        if (available <= 0) {
            LOGGER.debug("No context budget left (window={}, reserved={})", contextWindow, reservedResponseTokens);
            return List.of();
        }
        List<RankedResult> ranked = new ArrayList<>(results);
        ranked.sort(RankedResult.mostRelevantFirst());

        List<RankedResult> selected = new ArrayList<>();
        for (RankedResult result : ranked) {
            if (relevanceThreshold != null && lessRelevant(result, relevanceThreshold)) {
                continue;
            }
            int cost = tokenEstimator.estimate(result.text());
            if (cost > available) {
                continue;
            }
            available -= cost;
            selected.add(result);
        }
        LOGGER.debug("Selected {} of {} results for the context, {} tokens left", selected.size(), results.size(),
                available);
        return selected;
    }

    int availableTokens(String query, int reservedResponseTokens) {
        return contextWindow - tokenEstimator.estimate(query) - promptOverheadTokens - reservedResponseTokens;
    }

    private static boolean lessRelevant(RankedResult result, double threshold) {
        return result.scoreKind().lowerIsBetter() ? result.score() > threshold : result.score() < threshold;
    }
}
