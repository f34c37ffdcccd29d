package ch.so.arp.rag.engine.backend.qdrant;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import ch.so.arp.rag.engine.BackendUnavailableException;
import ch.so.arp.rag.engine.NotFoundException;

/**
 * {@link QdrantClient} speaking the Qdrant REST API through Spring's
 * {@link RestClient}. The base URL and the {@code api-key} header are expected
 * to be configured on the supplied client.
 */
public class RestQdrantClient implements QdrantClient {

    private static final Logger LOGGER = LoggerFactory.getLogger(RestQdrantClient.class);

    private static final TypeReference<Map<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {
    };

    private final RestClient restClient;
    private final ObjectMapper objectMapper;

    public RestQdrantClient(RestClient restClient, ObjectMapper objectMapper) {
        this.restClient = Objects.requireNonNull(restClient, "restClient");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    @Override
    public List<String> listCollections() {
        JsonNode response = call("list collections", () -> restClient.get()
                .uri("/collections")
                .retrieve()
                .body(JsonNode.class));
        List<String> names = new ArrayList<>();
        for (JsonNode collection : result(response).path("collections")) {
            names.add(collection.path("name").asText());
        }
        return names;
    }

    @Override
    public boolean collectionExists(String collection) {
        JsonNode response = call("check collection " + collection, () -> restClient.get()
                .uri("/collections/{name}/exists", collection)
                .retrieve()
                .body(JsonNode.class));
        return result(response).path("exists").asBoolean(false);
    }

    @Override
    public void createCollection(String collection, int dimension) {
        Map<String, Object> body = Map.of("vectors", Map.of("size", dimension, "distance", "Cosine"));
        call("create collection " + collection, () -> restClient.put()
                .uri("/collections/{name}", collection)
                .contentType(MediaType.APPLICATION_JSON)
                .body(body)
                .retrieve()
                .toBodilessEntity());
        LOGGER.info("Created Qdrant collection '{}' (dim={})", collection, dimension);
    }

    @Override
    public void deleteCollection(String collection) {
        call("delete collection " + collection, () -> restClient.delete()
                .uri("/collections/{name}", collection)
                .retrieve()
                .toBodilessEntity());
    }

    @Override
    public void upsert(String collection, List<Point> points) {
        if (points.isEmpty()) {
            return;
        }
        List<Map<String, Object>> body = new ArrayList<>(points.size());
        for (Point point : points) {
            Map<String, Object> json = new LinkedHashMap<>();
            json.put("id", point.id());
            json.put("vector", point.vector());
            json.put("payload", point.payload());
            body.add(json);
        }
        call("upsert into " + collection, () -> restClient.put()
                .uri("/collections/{name}/points?wait=true", collection)
                .contentType(MediaType.APPLICATION_JSON)
                .body(Map.of("points", body))
                .retrieve()
                .toBodilessEntity());
    }

    @Override
    public void deletePoints(String collection, Collection<String> ids) {
        if (ids.isEmpty()) {
            return;
        }
        call("delete points from " + collection, () -> restClient.post()
                .uri("/collections/{name}/points/delete?wait=true", collection)
                .contentType(MediaType.APPLICATION_JSON)
                .body(Map.of("points", List.copyOf(ids)))
                .retrieve()
                .toBodilessEntity());
    }

    @Override
    public List<ScoredPoint> search(String collection, float[] vector, int limit, Map<String, String> filter) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("vector", vector);
        body.put("limit", limit);
        body.put("with_payload", true);
        if (!filter.isEmpty()) {
            body.put("filter", toFilter(filter));
        }
        JsonNode response = call("search " + collection, () -> restClient.post()
                .uri("/collections/{name}/points/search", collection)
                .contentType(MediaType.APPLICATION_JSON)
                .body(body)
                .retrieve()
                .body(JsonNode.class));
        List<ScoredPoint> points = new ArrayList<>();
        for (JsonNode point : result(response)) {
            points.add(new ScoredPoint(point.path("id").asText(), point.path("score").asDouble(),
                    payload(point)));
        }
        return points;
    }

    @Override
    public ScrollPage scroll(String collection, String offset, int limit) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("limit", limit);
        body.put("with_payload", true);
        body.put("with_vector", false);
        if (offset != null) {
            body.put("offset", offset);
        }
        JsonNode response = call("scroll " + collection, () -> restClient.post()
                .uri("/collections/{name}/points/scroll", collection)
                .contentType(MediaType.APPLICATION_JSON)
                .body(body)
                .retrieve()
                .body(JsonNode.class));
        JsonNode result = result(response);
        List<Point> points = new ArrayList<>();
        for (JsonNode point : result.path("points")) {
            points.add(new Point(point.path("id").asText(), null, payload(point)));
        }
        JsonNode next = result.path("next_page_offset");
        return new ScrollPage(points, next.isMissingNode() || next.isNull() ? null : next.asText());
    }

    @Override
    public long count(String collection) {
        JsonNode response = call("count " + collection, () -> restClient.post()
                .uri("/collections/{name}/points/count", collection)
                .contentType(MediaType.APPLICATION_JSON)
                .body(Map.of("exact", true))
                .retrieve()
                .body(JsonNode.class));
        return result(response).path("count").asLong();
    }

    static Map<String, Object> toFilter(Map<String, String> filter) {
        List<Map<String, Object>> must = new ArrayList<>();
        filter.forEach((key, value) -> must.add(Map.of("key", "metadata." + key, "match", Map.of("value", value))));
        return Map.of("must", must);
    }

    private Map<String, Object> payload(JsonNode point) {
        JsonNode payload = point.path("payload");
        if (!payload.isObject()) {
            return Map.of();
        }
        return objectMapper.convertValue(payload, PAYLOAD_TYPE);
    }

    private static JsonNode result(JsonNode response) {
        if (response == null) {
            throw new IllegalStateException("Qdrant returned an empty response");
        }
        return response.path("result");
    }

    private <T> T call(String description, Supplier<T> request) {
        try {
            return request.get();
        } catch (HttpClientErrorException.NotFound ex) {
            throw new NotFoundException("Qdrant could not " + description + ": " + ex.getStatusText());
        } catch (ResourceAccessException | HttpServerErrorException ex) {
            throw new BackendUnavailableException("Qdrant is unavailable, could not " + description, ex);
        } catch (RestClientException ex) {
            throw new IllegalStateException("Qdrant request failed, could not " + description + ": "
                    + ex.getMessage(), ex);
        }
    }
}
