package ch.so.arp.rag.engine;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One page of documents across every index, grouped by index name.
 */
public record AllDocumentsPage(Map<String, List<StoredDocument>> documents, int count, Integer nextOffset) {

    public AllDocumentsPage {
        Map<String, List<StoredDocument>> copy = new LinkedHashMap<>();
        documents.forEach((name, list) -> copy.put(name, List.copyOf(list)));
        documents = Collections.unmodifiableMap(copy);
    }

    static AllDocumentsPage of(Map<String, List<StoredDocument>> documents, boolean hasMore, int offset, int limit) {
        int count = documents.values().stream().mapToInt(List::size).sum();
        return new AllDocumentsPage(documents, count, hasMore ? offset + limit : null);
    }
}
