package ch.so.arp.rag.engine;

/**
 * Base type of the failures the retrieval engine reports to its callers.
 */
public abstract class RagEngineException extends RuntimeException {

    protected RagEngineException(String message) {
        super(message);
    }

    protected RagEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
