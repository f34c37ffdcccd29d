package ch.so.arp.rag.engine.retrieval;

import java.util.List;

import ch.so.arp.rag.engine.MetadataFilter;
import ch.so.arp.rag.engine.RankedResult;

/**
 * Semantic side of hybrid retrieval: embeds the query and searches a vector
 * backend.
 */
@FunctionalInterface
public interface VectorRetriever {

    List<RankedResult> retrieve(String query, int topK, MetadataFilter filter);
}
