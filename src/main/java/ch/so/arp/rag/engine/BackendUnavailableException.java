package ch.so.arp.rag.engine;

/**
 * A remote service (the server-resident vector store or the completion model)
 * could not be reached. The engine does not retry; callers decide whether to
 * reissue the request.
 */
public class BackendUnavailableException extends RagEngineException {

    public BackendUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
