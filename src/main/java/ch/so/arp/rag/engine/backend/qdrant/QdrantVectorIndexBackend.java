package ch.so.arp.rag.engine.backend.qdrant;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.so.arp.rag.engine.BackendUnavailableException;
import ch.so.arp.rag.engine.CorruptionException;
import ch.so.arp.rag.engine.DocumentIds;
import ch.so.arp.rag.engine.MetadataFilter;
import ch.so.arp.rag.engine.NotFoundException;
import ch.so.arp.rag.engine.RankedResult;
import ch.so.arp.rag.engine.ScoreKind;
import ch.so.arp.rag.engine.StoredDocument;
import ch.so.arp.rag.engine.backend.BackendType;
import ch.so.arp.rag.engine.backend.IndexLock;
import ch.so.arp.rag.engine.backend.IndexedNode;
import ch.so.arp.rag.engine.backend.RecoveredIndex;
import ch.so.arp.rag.engine.backend.RecoveredIndex.RecoveredDocument;
import ch.so.arp.rag.engine.backend.VectorIndexBackend;

/**
 * {@link VectorIndexBackend} storing vectors in a Qdrant service. Every index is
 * a collection; the service owns durability and concurrency control, so no
 * local lock is taken and {@link #persist(String, Path)} writes nothing.
 * <p>
 * Point payloads are self-describing: besides the chunk they carry the
 * document id, hash, metadata, insertion sequence and, on the first chunk, the
 * full document text. {@link #recoverIndexes()} uses them to rebuild every
 * index after a restart without any local file.
 */
public class QdrantVectorIndexBackend implements VectorIndexBackend {

    private static final Logger LOGGER = LoggerFactory.getLogger(QdrantVectorIndexBackend.class);

    static final String NODE_ID = "node_id";
    static final String DOC_ID = "doc_id";
    static final String DOC_HASH = "doc_hash";
    static final String DOC_SEQ = "doc_seq";
    static final String DOCUMENT_TEXT = "document_text";
    static final String CHUNK_INDEX = "chunk_index";
    static final String TEXT = "text";
    static final String METADATA = "metadata";

    private final QdrantClient client;
    private final int dimension;
    private final int scrollBatchSize;
    private final Set<String> collections = ConcurrentHashMap.newKeySet();

    public QdrantVectorIndexBackend(QdrantClient client, int dimension, int scrollBatchSize) {
        this.client = Objects.requireNonNull(client, "client");
        if (dimension <= 0 || scrollBatchSize <= 0) {
            throw new IllegalArgumentException("dimension and scrollBatchSize must be positive");
        }
        this.dimension = dimension;
        this.scrollBatchSize = scrollBatchSize;
    }

    @Override
    public BackendType type() {
        return BackendType.QDRANT;
    }

    @Override
    public IndexLock lock() {
        return IndexLock.none();
    }

    @Override
    public void createIndex(String name) {
        if (collections.contains(name)) {
            return;
        }
        if (!client.collectionExists(name)) {
            client.createCollection(name, dimension);
        }
        collections.add(name);
    }

    @Override
    public boolean hasIndex(String name) {
        return collections.contains(name);
    }

    @Override
    public List<String> add(String name, List<IndexedNode> nodes) {
        createIndex(name);
        List<QdrantClient.Point> points = new ArrayList<>(nodes.size());
        for (IndexedNode node : nodes) {
            if (node.embedding() == null) {
                throw new IllegalArgumentException("Node " + node.nodeId() + " has no embedding");
            }
            points.add(new QdrantClient.Point(node.nodeId(), node.embedding(), payload(node)));
        }
        client.upsert(name, points);
        return nodes.stream().map(IndexedNode::nodeId).toList();
    }

    @Override
    public void delete(String name, Collection<String> nodeHandles) {
        client.deletePoints(name, nodeHandles);
    }

    @Override
    public List<RankedResult> search(String name, float[] queryVector, int topK, MetadataFilter filter) {
        if (topK <= 0) {
            return List.of();
        }
        List<QdrantClient.ScoredPoint> points = client.search(name, queryVector, topK, filter.conditions());
        List<RankedResult> results = new ArrayList<>(points.size());
        for (QdrantClient.ScoredPoint point : points) {
            Map<String, Object> payload = point.payload();
            results.add(new RankedResult(stringValue(payload, NODE_ID, point.id()), stringValue(payload, DOC_ID, null),
                    stringValue(payload, TEXT, ""), point.score(), ScoreKind.SIMILARITY, metadata(payload)));
        }
        return results;
    }

    @Override
    public int size(String name) {
        if (!collections.contains(name)) {
            return 0;
        }
        return (int) Math.min(Integer.MAX_VALUE, client.count(name));
    }

    @Override
    public List<IndexedNode> nodes(String name) {
        return recoverIndex(name).documents().stream()
                .flatMap(document -> document.nodes().stream())
                .toList();
    }

    @Override
    public void deleteIndex(String name) {
        boolean known = collections.remove(name);
        if (!known && !client.collectionExists(name)) {
            throw NotFoundException.index(name);
        }
        client.deleteCollection(name);
        LOGGER.info("Deleted Qdrant collection '{}'", name);
    }

    /**
     * Collections known locally plus those present in the service. If the
     * service cannot be reached only the local ones are returned.
     */
    @Override
    public List<String> listIndexes() {
        Set<String> names = new TreeSet<>(collections);
        try {
            names.addAll(client.listCollections());
        } catch (BackendUnavailableException ex) {
            LOGGER.warn("Failed to list Qdrant collections: {}", ex.getMessage());
        }
        return List.copyOf(names);
    }

    @Override
    public void persist(String name, Path directory) {
        LOGGER.debug("Qdrant persists collection '{}' on its own, nothing to write to {}", name, directory);
    }

    /**
     * Reconnects to an existing collection. Documents are restored by the
     * engine from the document store snapshot.
     */
    @Override
    public void restore(String name, Path directory) {
        if (!client.collectionExists(name)) {
            throw new NotFoundException("Qdrant collection '" + name + "' does not exist");
        }
        collections.add(name);
    }

    @Override
    public List<RecoveredIndex> recoverIndexes() {
        List<String> names;
        try {
            names = client.listCollections();
        } catch (RuntimeException ex) {
            LOGGER.error("Failed to discover Qdrant collections: {}", ex.getMessage(), ex);
            return List.of();
        }
        if (names.isEmpty()) {
            LOGGER.info("No existing Qdrant collections found.");
            return List.of();
        }
        LOGGER.info("Found {} existing Qdrant collection(s): {}", names.size(), names);
        List<RecoveredIndex> recovered = new ArrayList<>(names.size());
        for (String name : names) {
            try {
                RecoveredIndex index = recoverIndex(name);
                collections.add(name);
                recovered.add(index);
                LOGGER.info("Restored index '{}' with {} document(s) from Qdrant", name, index.documents().size());
            } catch (RuntimeException ex) {
                LOGGER.error("Failed to restore index '{}': {}", name, ex.getMessage(), ex);
            }
        }
        return recovered;
    }

    RecoveredIndex recoverIndex(String name) {
        Map<String, DocumentAccumulator> documents = new LinkedHashMap<>();
        String offset = null;
        do {
            QdrantClient.ScrollPage page = client.scroll(name, offset, scrollBatchSize);
            for (QdrantClient.Point point : page.points()) {
                Map<String, Object> payload = point.payload() == null ? Map.of() : point.payload();
                String docId = stringValue(payload, DOC_ID, null);
                if (docId == null) {
                    throw new CorruptionException("Point " + point.id() + " in collection '" + name
                            + "' has no " + DOC_ID);
                }
                documents.computeIfAbsent(docId, DocumentAccumulator::new).accept(point.id(), payload);
            }
            offset = page.nextOffset();
        } while (offset != null);

        List<RecoveredDocument> result = documents.values().stream()
                .sorted(Comparator.comparingLong(DocumentAccumulator::sequence)
                        .thenComparing(DocumentAccumulator::docId))
                .map(DocumentAccumulator::toRecoveredDocument)
                .collect(Collectors.toList());
        return new RecoveredIndex(name, result);
    }

    private static Map<String, Object> payload(IndexedNode node) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(NODE_ID, node.nodeId());
        payload.put(DOC_ID, node.docId());
        payload.put(CHUNK_INDEX, node.chunkIndex());
        payload.put(TEXT, node.text());
        payload.put(METADATA, node.metadata());
        IndexedNode.NodeSource source = node.source();
        if (source != null) {
            payload.put(DOC_HASH, source.docHash());
            payload.put(DOC_SEQ, source.sequence());
            if (node.chunkIndex() == 0) {
                payload.put(DOCUMENT_TEXT, source.documentText());
            }
        }
        return payload;
    }

    private static String stringValue(Map<String, Object> payload, String key, String fallback) {
        Object value = payload.get(key);
        return value == null ? fallback : value.toString();
    }

    private static long longValue(Map<String, Object> payload, String key, long fallback) {
        Object value = payload.get(key);
        if (value instanceof Number number) {
            return number.longValue();
        }
        if (value != null) {
            try {
                return Long.parseLong(value.toString());
            } catch (NumberFormatException ex) {
                throw new CorruptionException("Payload field '" + key + "' is not a number: " + value, ex);
            }
        }
        return fallback;
    }

    private static Map<String, String> metadata(Map<String, Object> payload) {
        Object value = payload.get(METADATA);
        if (value == null) {
            return Map.of();
        }
        if (!(value instanceof Map<?, ?> raw)) {
            throw new CorruptionException("Payload field '" + METADATA + "' is not an object");
        }
        Map<String, String> metadata = new TreeMap<>();
        raw.forEach((key, entry) -> metadata.put(String.valueOf(key), entry == null ? "" : String.valueOf(entry)));
        return metadata;
    }

    private static final class DocumentAccumulator {

        private final String docId;
        private final List<IndexedNode> nodes = new ArrayList<>();
        private String documentText;
        private String hash;
        private Map<String, String> metadata = Map.of();
        private long sequence = Long.MAX_VALUE;

        DocumentAccumulator(String docId) {
            this.docId = docId;
        }

        String docId() {
            return docId;
        }

        long sequence() {
            return sequence;
        }

        void accept(String pointId, Map<String, Object> payload) {
            int chunkIndex = (int) longValue(payload, CHUNK_INDEX, nodes.size());
            Map<String, String> nodeMetadata = metadata(payload);
            nodes.add(new IndexedNode(stringValue(payload, NODE_ID, pointId), docId, chunkIndex,
                    stringValue(payload, TEXT, ""), nodeMetadata, null, null));
            if (nodes.size() == 1) {
                metadata = nodeMetadata;
            }
            if (payload.get(DOCUMENT_TEXT) != null) {
                documentText = payload.get(DOCUMENT_TEXT).toString();
            }
            if (hash == null && payload.get(DOC_HASH) != null) {
                hash = payload.get(DOC_HASH).toString();
            }
            sequence = Math.min(sequence, longValue(payload, DOC_SEQ, Long.MAX_VALUE));
        }

        RecoveredDocument toRecoveredDocument() {
            nodes.sort(Comparator.comparingInt(IndexedNode::chunkIndex));
            String text = documentText;
            if (text == null) {
                LOGGER.warn("Document '{}' has no stored full text, joining its {} chunk(s)", docId, nodes.size());
                text = nodes.stream().map(IndexedNode::text).collect(Collectors.joining("\n"));
            }
            String documentHash = hash != null ? hash : DocumentIds.contentHash(text, metadata);
            return new RecoveredDocument(new StoredDocument(docId, text, documentHash, metadata, false), nodes);
        }
    }
}
