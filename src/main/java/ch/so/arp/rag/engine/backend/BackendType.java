package ch.so.arp.rag.engine.backend;

/**
 * Tag identifying a {@link VectorIndexBackend} variant, bound from
 * {@code rag.engine.backend}.
 */
public enum BackendType {

    IN_MEMORY("in-memory"),
    QDRANT("qdrant");

    private final String propertyValue;

    BackendType(String propertyValue) {
        this.propertyValue = propertyValue;
    }

    public String propertyValue() {
        return propertyValue;
    }
}
