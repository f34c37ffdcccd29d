package ch.so.arp.rag.engine;

import java.util.List;

/**
 * Per-item outcome of an update batch. {@code updated} holds the new document
 * views, the other lists hold the requested document ids.
 */
public record UpdateResult(List<StoredDocument> updated, List<String> unchanged, List<String> notFound) {

    public UpdateResult {
        updated = List.copyOf(updated);
        unchanged = List.copyOf(unchanged);
        notFound = List.copyOf(notFound);
    }
}
