package ch.so.arp.rag.engine;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Helpers for the string metadata maps carried by documents and nodes.
 */
public final class Metadata {

    public static final String SPLIT_TYPE = "split_type";
    public static final String LANGUAGE = "language";

    private Metadata() {
    }

    /**
     * Returns an unmodifiable, key-sorted copy. {@code null} becomes an empty map.
     */
    public static Map<String, String> copyOf(Map<String, String> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return Map.of();
        }
        TreeMap<String, String> copy = new TreeMap<>();
        metadata.forEach((key, value) -> {
            if (key == null) {
                throw new InvalidRequestException("Metadata keys must not be null");
            }
            copy.put(key, value == null ? "" : value);
        });
        return Collections.unmodifiableMap(copy);
    }
}
