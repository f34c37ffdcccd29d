package ch.so.arp.rag.engine;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Map;
import java.util.UUID;

/**
 * Derives the identifiers used throughout the engine. Document ids depend on
 * the text only so that they double as the deduplication key; the document
 * hash also covers metadata and is used to detect unchanged updates.
 */
public final class DocumentIds {

    private DocumentIds() {
    }

    public static String docId(String text) {
        return HexFormat.of().formatHex(sha256(text));
    }

    public static String contentHash(String text, Map<String, String> metadata) {
        StringBuilder builder = new StringBuilder(text);
        // metadata maps are key-sorted, see Metadata#copyOf
        Metadata.copyOf(metadata).forEach((key, value) -> builder.append('\u0000').append(key).append('=').append(value));
        return HexFormat.of().formatHex(sha256(builder.toString()));
    }

    /**
     * Node ids are name-based UUIDs so that re-chunking the same document
     * yields the same ids, and so that they are valid point ids for the
     * server-resident backend.
     */
    public static String nodeId(String docId, int chunkIndex) {
        return UUID.nameUUIDFromBytes((docId + ":" + chunkIndex).getBytes(StandardCharsets.UTF_8)).toString();
    }

    private static byte[] sha256(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return digest.digest(value.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 algorithm not available", ex);
        }
    }
}
