package ch.so.arp.rag.engine;

import java.util.Map;
import java.util.Objects;

/**
 * Input document handed to the engine by an ingestion collaborator. Documents
 * are immutable; the metadata map is copied on construction.
 */
public record Document(String text, Map<String, String> metadata) {

    public Document {
        Objects.requireNonNull(text, "text");
        metadata = Metadata.copyOf(metadata);
    }

    public Document(String text) {
        this(text, Map.of());
    }

    /**
     * Content-derived identity of this document.
     */
    public String docId() {
        return DocumentIds.docId(text);
    }
}
