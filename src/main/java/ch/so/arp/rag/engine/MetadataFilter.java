package ch.so.arp.rag.engine;

import java.util.Map;

/**
 * Exact-match key/value predicate evaluated against document metadata. All
 * entries must match.
 */
public record MetadataFilter(Map<String, String> conditions) {

    private static final MetadataFilter NONE = new MetadataFilter(Map.of());

    public MetadataFilter {
        if (conditions == null) {
            conditions = Map.of();
        }
        for (Map.Entry<String, String> entry : conditions.entrySet()) {
            if (entry.getKey() == null || entry.getKey().isBlank()) {
                throw new InvalidRequestException("Metadata filter keys must not be blank");
            }
            if (entry.getValue() == null) {
                throw new InvalidRequestException("Metadata filter value for '" + entry.getKey() + "' must not be null");
            }
        }
        conditions = Metadata.copyOf(conditions);
    }

    public static MetadataFilter none() {
        return NONE;
    }

    public static MetadataFilter of(Map<String, String> conditions) {
        return conditions == null || conditions.isEmpty() ? NONE : new MetadataFilter(conditions);
    }

    public boolean isEmpty() {
        return conditions.isEmpty();
    }

    public boolean matches(Map<String, String> metadata) {
        for (Map.Entry<String, String> entry : conditions.entrySet()) {
            if (metadata == null || !entry.getValue().equals(metadata.get(entry.getKey()))) {
                return false;
            }
        }
        return true;
    }
}
