package ch.so.arp.rag.engine;

import java.util.List;

/**
 * Per-item outcome of a delete batch.
 */
public record DeleteResult(List<String> deleted, List<String> notFound) {

    public DeleteResult {
        deleted = List.copyOf(deleted);
        notFound = List.copyOf(notFound);
    }
}
