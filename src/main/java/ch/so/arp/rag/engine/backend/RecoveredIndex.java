package ch.so.arp.rag.engine.backend;

import java.util.List;

import ch.so.arp.rag.engine.StoredDocument;

/**
 * Index content rediscovered from a server-resident backend at startup.
 * Documents are listed in their original insertion order.
 */
public record RecoveredIndex(String name, List<RecoveredDocument> documents) {

    public RecoveredIndex {
        documents = List.copyOf(documents);
    }

    public record RecoveredDocument(StoredDocument document, List<IndexedNode> nodes) {

        public RecoveredDocument {
            nodes = List.copyOf(nodes);
        }
    }
}
