package ch.so.arp.rag.engine.backend.qdrant;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Operations of the Qdrant service used by {@link QdrantVectorIndexBackend}.
 * Implementations report an unreachable service with
 * {@link ch.so.arp.rag.engine.BackendUnavailableException}.
 */
public interface QdrantClient {

    List<String> listCollections();

    boolean collectionExists(String collection);

    /**
     * Creates a collection with cosine distance.
     */
    void createCollection(String collection, int dimension);

    void deleteCollection(String collection);

    void upsert(String collection, List<Point> points);

    void deletePoints(String collection, Collection<String> ids);

    /**
     * @param filter exact-match conditions on payload keys, may be empty
     */
    List<ScoredPoint> search(String collection, float[] vector, int limit, Map<String, String> filter);

    /**
     * Reads one page of points including payloads but without vectors.
     *
     * @param offset id to continue from, {@code null} for the first page
     */
    ScrollPage scroll(String collection, String offset, int limit);

    long count(String collection);

    record Point(String id, float[] vector, Map<String, Object> payload) {
    }

    record ScoredPoint(String id, double score, Map<String, Object> payload) {
    }

    /**
     * @param nextOffset id of the first point of the next page, {@code null}
     *                   after the last page
     */
    record ScrollPage(List<Point> points, String nextOffset) {
    }
}
