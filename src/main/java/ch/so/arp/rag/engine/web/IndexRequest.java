package ch.so.arp.rag.engine.web;

import java.util.List;
import java.util.Map;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import ch.so.arp.rag.engine.Document;

/**
 * Incoming payload for indexing requests.
 */
public record IndexRequest(@NotBlank String indexName, @NotNull List<@Valid DocumentPayload> documents) {

    List<Document> toDocuments() {
        return documents.stream().map(DocumentPayload::toDocument).toList();
    }

    public record DocumentPayload(@NotNull String text, Map<String, String> metadata) {

        Document toDocument() {
            return new Document(text, metadata);
        }
    }
}
