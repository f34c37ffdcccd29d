package ch.so.arp.rag.engine;

/**
 * Unknown index name or unknown document id.
 */
public class NotFoundException extends RagEngineException {

    public NotFoundException(String message) {
        super(message);
    }

    public static NotFoundException index(String indexName) {
        return new NotFoundException("No such index: '" + indexName + "' exists.");
    }

    public static NotFoundException document(String indexName, String docId) {
        return new NotFoundException("Document '" + docId + "' not found in index '" + indexName + "'.");
    }
}
