package ch.so.arp.rag.engine;

/**
 * A snapshot or a restored collection could not be parsed.
 */
public class CorruptionException extends RagEngineException {

    public CorruptionException(String message) {
        super(message);
    }

    public CorruptionException(String message, Throwable cause) {
        super(message, cause);
    }
}
