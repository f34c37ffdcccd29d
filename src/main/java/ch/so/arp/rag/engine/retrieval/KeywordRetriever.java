package ch.so.arp.rag.engine.retrieval;

import java.util.List;

import ch.so.arp.rag.engine.MetadataFilter;
import ch.so.arp.rag.engine.RankedResult;

/**
 * Keyword side of hybrid retrieval. Results are ordered best first; only
 * their position is used for fusion.
 */
public interface KeywordRetriever {

    List<RankedResult> retrieve(String query, int topK, MetadataFilter filter);

    /**
     * Number of nodes the retriever can return, used to cap candidate pools.
     */
    int size();
}
