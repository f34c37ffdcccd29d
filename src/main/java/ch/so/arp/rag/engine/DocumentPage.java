package ch.so.arp.rag.engine;

import java.util.List;

/**
 * One page of a document listing. {@code nextOffset} is {@code null} when no
 * further page exists.
 */
public record DocumentPage(List<StoredDocument> documents, int count, Integer nextOffset) {

    public DocumentPage {
        documents = List.copyOf(documents);
    }

    public static DocumentPage of(List<StoredDocument> fetched, int offset, int limit) {
        boolean hasMore = fetched.size() > limit;
        List<StoredDocument> page = hasMore ? fetched.subList(0, limit) : fetched;
        return new DocumentPage(page, page.size(), hasMore ? offset + limit : null);
    }
}
