package ch.so.arp.rag.engine;

/**
 * The caller supplied a request the engine cannot act upon, such as an empty
 * query or a chunking policy without its language tag.
 */
public class InvalidRequestException extends RagEngineException {

    public InvalidRequestException(String message) {
        super(message);
    }
}
