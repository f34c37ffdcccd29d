package ch.so.arp.rag.engine;

import java.util.Map;
import java.util.Objects;

/**
 * Retrievable form of an indexed document. {@code truncated} is only ever set
 * on views produced with a maximum text length, never on the stored copy.
 */
public record StoredDocument(
        String docId,
        String text,
        String hash,
        Map<String, String> metadata,
        boolean truncated) {

    public StoredDocument {
        Objects.requireNonNull(docId, "docId");
        Objects.requireNonNull(text, "text");
        metadata = Metadata.copyOf(metadata);
    }

    public static StoredDocument of(Document document) {
        return new StoredDocument(document.docId(), document.text(),
                DocumentIds.contentHash(document.text(), document.metadata()), document.metadata(), false);
    }

    /**
     * Returns a view whose text is cut to {@code maxTextLength} characters.
     * A {@code null} limit returns this instance unchanged.
     */
    public StoredDocument view(Integer maxTextLength) {
        if (maxTextLength == null || text.length() <= maxTextLength) {
            return this;
        }
        return new StoredDocument(docId, text.substring(0, maxTextLength), hash, metadata, true);
    }
}
