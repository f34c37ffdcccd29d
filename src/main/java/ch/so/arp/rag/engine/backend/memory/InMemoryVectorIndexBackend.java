package ch.so.arp.rag.engine.backend.memory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JacksonException;
import com.fasterxml.jackson.databind.ObjectMapper;

import ch.so.arp.rag.engine.CorruptionException;
import ch.so.arp.rag.engine.MetadataFilter;
import ch.so.arp.rag.engine.NotFoundException;
import ch.so.arp.rag.engine.RankedResult;
import ch.so.arp.rag.engine.backend.BackendType;
import ch.so.arp.rag.engine.backend.IndexLock;
import ch.so.arp.rag.engine.backend.IndexedNode;
import ch.so.arp.rag.engine.backend.VectorIndexBackend;

/**
 * {@link VectorIndexBackend} keeping every vector inside the process. Each
 * index is an {@link IdMapVectorIndex} plus a handle table translating node ids
 * into the numeric ids of the arena. Numeric ids are drawn from a per-index
 * counter and never reused.
 * <p>
 * All state is lost on restart unless {@link #persist(String, Path)} was
 * called. One reader/writer lock guards all indexes of the process.
 */
public class InMemoryVectorIndexBackend implements VectorIndexBackend {

    private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryVectorIndexBackend.class);

    static final String VECTORS_FILE = "vectors.json";

    private final int dimension;
    private final DistanceMetric metric;
    private final ObjectMapper objectMapper;
    private final IndexLock lock = IndexLock.readWrite();
    private final Map<String, MemoryIndex> indexes = new ConcurrentHashMap<>();

    public InMemoryVectorIndexBackend(int dimension, DistanceMetric metric, ObjectMapper objectMapper) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("dimension must be positive");
        }
        this.dimension = dimension;
        this.metric = Objects.requireNonNull(metric, "metric");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    @Override
    public BackendType type() {
        return BackendType.IN_MEMORY;
    }

    @Override
    public IndexLock lock() {
        return lock;
    }

    @Override
    public void createIndex(String name) {
        lock.write(() -> indexes.computeIfAbsent(name, key -> {
            LOGGER.info("Creating in-memory vector index '{}' ({} dimensions, {})", key, dimension, metric);
            return new MemoryIndex(new IdMapVectorIndex(dimension, metric));
        }));
    }

    @Override
    public boolean hasIndex(String name) {
        return indexes.containsKey(name);
    }

    @Override
    public List<String> add(String name, List<IndexedNode> nodes) {
        return lock.write(() -> {
            createIndex(name);
            MemoryIndex index = indexes.get(name);
            List<String> handles = new ArrayList<>(nodes.size());
            for (IndexedNode node : nodes) {
                if (node.embedding() == null) {
                    throw new IllegalArgumentException("Node " + node.nodeId() + " has no embedding");
                }
                index.remove(node.nodeId());
                index.put(node.withoutSource());
                handles.add(node.nodeId());
            }
            return handles;
        });
    }

    @Override
    public void delete(String name, Collection<String> nodeHandles) {
        lock.write(() -> {
            MemoryIndex index = indexes.get(name);
            if (index == null) {
                throw NotFoundException.index(name);
            }
            int removed = 0;
            for (String handle : nodeHandles) {
                if (index.remove(handle)) {
                    removed++;
                }
            }
            LOGGER.debug("Removed {} of {} nodes from index '{}'", removed, nodeHandles.size(), name);
            return removed;
        });
    }

    @Override
    public List<RankedResult> search(String name, float[] queryVector, int topK, MetadataFilter filter) {
        return lock.read(() -> {
            MemoryIndex index = indexes.get(name);
            if (index == null) {
                throw NotFoundException.index(name);
            }
            List<IdMapVectorIndex.IdHit> hits = index.vectors.search(queryVector, topK,
                    id -> filter.matches(index.nodesById.get(id).metadata()));
            List<RankedResult> results = new ArrayList<>(hits.size());
            for (IdMapVectorIndex.IdHit hit : hits) {
                IndexedNode node = index.nodesById.get(hit.id());
                results.add(new RankedResult(node.nodeId(), node.docId(), node.text(), hit.score(),
                        metric.scoreKind(), node.metadata()));
            }
            return results;
        });
    }

    @Override
    public int size(String name) {
        return lock.read(() -> {
            MemoryIndex index = indexes.get(name);
            return index == null ? 0 : index.vectors.size();
        });
    }

    @Override
    public List<IndexedNode> nodes(String name) {
        return lock.read(() -> {
            MemoryIndex index = indexes.get(name);
            if (index == null) {
                throw NotFoundException.index(name);
            }
            return index.handles.values().stream()
                    .sorted()
                    .map(index.nodesById::get)
                    .map(node -> new IndexedNode(node.nodeId(), node.docId(), node.chunkIndex(), node.text(),
                            node.metadata(), null, null))
                    .toList();
        });
    }

    @Override
    public void deleteIndex(String name) {
        lock.write(() -> {
            if (indexes.remove(name) == null) {
                throw NotFoundException.index(name);
            }
            LOGGER.info("Deleted in-memory vector index '{}'", name);
            return null;
        });
    }

    @Override
    public List<String> listIndexes() {
        return indexes.keySet().stream().sorted().toList();
    }

    @Override
    public void persist(String name, Path directory) throws IOException {
        VectorSnapshot snapshot = lock.read(() -> {
            MemoryIndex index = indexes.get(name);
            if (index == null) {
                throw NotFoundException.index(name);
            }
            return index.snapshot();
        });
        Files.createDirectories(directory);
        Path target = directory.resolve(VECTORS_FILE);
        Path temp = Files.createTempFile(directory, VECTORS_FILE, ".tmp");
        objectMapper.writeValue(temp.toFile(), snapshot);
        Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        LOGGER.info("Persisted {} vectors of index '{}' to {}", snapshot.nodes().size(), name, target);
    }

    @Override
    public void restore(String name, Path directory) throws IOException {
        Path source = directory.resolve(VECTORS_FILE);
        if (!Files.exists(source)) {
            throw new NotFoundException("No vector snapshot for index '" + name + "' at " + source);
        }
        VectorSnapshot snapshot;
        try {
            snapshot = objectMapper.readValue(source.toFile(), VectorSnapshot.class);
        } catch (JacksonException ex) {
            throw new CorruptionException("Unable to parse vector snapshot " + source, ex);
        }
        MemoryIndex restored = MemoryIndex.fromSnapshot(snapshot, dimension, metric, source);
        lock.write(() -> indexes.put(name, restored));
        LOGGER.info("Restored {} vectors of index '{}' from {}", restored.vectors.size(), name, source);
    }

    private static final class MemoryIndex {

        private final IdMapVectorIndex vectors;
        private final Map<String, Long> handles = new HashMap<>();
        private final Map<Long, IndexedNode> nodesById = new HashMap<>();
        private long nextId;

        MemoryIndex(IdMapVectorIndex vectors) {
            this.vectors = vectors;
        }

        void put(IndexedNode node) {
            long id = nextId++;
            vectors.addWithId(id, node.embedding());
            handles.put(node.nodeId(), id);
            nodesById.put(id, node);
        }

        boolean remove(String nodeId) {
            Long id = handles.remove(nodeId);
            if (id == null) {
                return false;
            }
            vectors.remove(id);
            nodesById.remove(id);
            return true;
        }

        VectorSnapshot snapshot() {
            List<SnapshotNode> nodes = new ArrayList<>(handles.size());
            handles.forEach((nodeId, id) -> {
                IndexedNode node = nodesById.get(id);
                nodes.add(new SnapshotNode(id, node.nodeId(), node.docId(), node.chunkIndex(), node.text(),
                        node.metadata(), vectors.get(id)));
            });
            nodes.sort((left, right) -> Long.compare(left.handle(), right.handle()));
            return new VectorSnapshot(vectors.dimension(), vectors.metric(), nextId, nodes);
        }

        static MemoryIndex fromSnapshot(VectorSnapshot snapshot, int dimension, DistanceMetric metric, Path source) {
            if (snapshot == null || snapshot.nodes() == null) {
                throw new CorruptionException("Vector snapshot " + source + " is empty");
            }
            if (snapshot.dimension() != dimension) {
                throw new CorruptionException("Vector snapshot " + source + " has " + snapshot.dimension()
                        + " dimensions, expected " + dimension);
            }
            DistanceMetric snapshotMetric = snapshot.metric() == null ? metric : snapshot.metric();
            MemoryIndex index = new MemoryIndex(new IdMapVectorIndex(dimension, snapshotMetric));
            long maxId = -1L;
            for (SnapshotNode node : snapshot.nodes()) {
                if (node.nodeId() == null || node.docId() == null || node.vector() == null
                        || node.vector().length != dimension) {
                    throw new CorruptionException("Vector snapshot " + source + " contains an invalid node");
                }
                index.vectors.addWithId(node.handle(), node.vector());
                index.handles.put(node.nodeId(), node.handle());
                index.nodesById.put(node.handle(), new IndexedNode(node.nodeId(), node.docId(), node.chunkIndex(),
                        node.text(), node.metadata(), node.vector(), null));
                maxId = Math.max(maxId, node.handle());
            }
            index.nextId = Math.max(snapshot.nextId(), maxId + 1);
            return index;
        }
    }

    record VectorSnapshot(int dimension, DistanceMetric metric, long nextId, List<SnapshotNode> nodes) {
    }

    record SnapshotNode(long handle, String nodeId, String docId, int chunkIndex, String text,
            Map<String, String> metadata, float[] vector) {
    }
}
