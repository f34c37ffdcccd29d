package ch.so.arp.rag.engine.query;

import java.util.List;
import java.util.Map;

import ch.so.arp.rag.engine.RankedResult;

/**
 * Generated answer with the nodes it was grounded on. {@code metadata} maps
 * each source node id to the metadata of its document.
 */
public record QueryResult(String response, List<RankedResult> sourceNodes, Map<String, Map<String, String>> metadata) {

    public QueryResult {
        sourceNodes = List.copyOf(sourceNodes);
        metadata = Map.copyOf(metadata);
    }
}
