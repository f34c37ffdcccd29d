package ch.so.arp.rag.engine.web;

import java.util.List;
import java.util.Map;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import ch.so.arp.rag.engine.DocumentUpdate;

public record UpdateRequest(@NotNull List<@Valid UpdatedDocument> documents) {

    List<DocumentUpdate> toUpdates() {
        return documents.stream()
                .map(document -> new DocumentUpdate(document.docId(), document.text(), document.metadata()))
                .toList();
    }

    public record UpdatedDocument(@NotBlank String docId, @NotNull String text, Map<String, String> metadata) {
    }
}
