package ch.so.arp.rag.engine.backend;

import java.util.Map;
import java.util.Objects;

import ch.so.arp.rag.engine.Metadata;

/**
 * One chunk of a document as stored inside a vector backend.
 *
 * @param nodeId     stable id of the chunk, used as the backend handle
 * @param docId      content hash of the source document
 * @param chunkIndex position of the chunk within its document
 * @param text       chunk text
 * @param metadata   metadata of the source document
 * @param embedding  vector of the chunk; {@code null} for nodes read back
 *                   without their vectors
 * @param source     document level information carried along so that
 *                   self-describing backends can rebuild the document store;
 *                   may be {@code null}
 */
public record IndexedNode(
        String nodeId,
        String docId,
        int chunkIndex,
        String text,
        Map<String, String> metadata,
        float[] embedding,
        NodeSource source) {

    public IndexedNode {
        Objects.requireNonNull(nodeId, "nodeId");
        Objects.requireNonNull(docId, "docId");
        text = text == null ? "" : text;
        metadata = Metadata.copyOf(metadata);
    }

    public IndexedNode withoutSource() {
        return new IndexedNode(nodeId, docId, chunkIndex, text, metadata, embedding, null);
    }

    /**
     * Document level payload shared by all chunks of a document.
     *
     * @param docHash      hash over text and metadata of the document
     * @param documentText full text of the document
     * @param sequence     insertion sequence, restores the stable order
     */
    public record NodeSource(String docHash, String documentText, long sequence) {
    }
}
