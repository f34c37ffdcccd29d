package ch.so.arp.rag.engine;

import java.util.Map;
import java.util.Objects;

/**
 * Replacement content for the document currently stored under {@code docId}.
 */
public record DocumentUpdate(String docId, String text, Map<String, String> metadata) {

    public DocumentUpdate {
        Objects.requireNonNull(docId, "docId");
        Objects.requireNonNull(text, "text");
        metadata = Metadata.copyOf(metadata);
    }

    public Document toDocument() {
        return new Document(text, metadata);
    }
}
