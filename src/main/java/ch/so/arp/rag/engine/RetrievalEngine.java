package ch.so.arp.rag.engine;

import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JacksonException;
import com.fasterxml.jackson.databind.ObjectMapper;

import ch.so.arp.rag.engine.backend.BackendType;
import ch.so.arp.rag.engine.backend.IndexedNode;
import ch.so.arp.rag.engine.backend.RecoveredIndex;
import ch.so.arp.rag.engine.backend.VectorIndexBackend;
import ch.so.arp.rag.engine.chunking.ChunkingTransformer;
import ch.so.arp.rag.engine.embedding.EmbeddingProvider;
import ch.so.arp.rag.engine.retrieval.HybridRetriever;
import ch.so.arp.rag.engine.retrieval.KeywordIndex;
import ch.so.arp.rag.engine.store.DocumentStore;

/**
 * Owns every named {@link Index} and coordinates the document store, the
 * keyword index and the vector backend behind them.
 * <p>
 * An index is created on its first write and lives until
 * {@link #deleteIndex(String)}. Compound operations run inside the lock the
 * backend asks for: the in-memory backend serialises writers against readers
 * process wide, the Qdrant backend needs no local lock.
 * <p>
 * Indexing fans the splitting and embedding of a batch out to the injected
 * executor, then inserts the prepared documents one by one in input order. A
 * failure leaves the documents inserted before it in place; reissuing the
 * same batch is safe because document ids are derived from content.
 */
public class RetrievalEngine implements Closeable {

    private static final Logger LOGGER = LoggerFactory.getLogger(RetrievalEngine.class);

    static final String REGISTRY_FILE = "store.json";
    static final String DOCSTORE_FILE = "docstore.json";

    private final VectorIndexBackend backend;
    private final EmbeddingProvider embeddingProvider;
    private final ChunkingTransformer chunker;
    private final Executor executor;
    private final ObjectMapper objectMapper;
    private final Settings settings;
    private final Map<String, Index> indexes = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong(System.currentTimeMillis() * 1000L);
    private final Object registryMonitor = new Object();
    private final Map<String, Object> persistMonitors = new ConcurrentHashMap<>();

    public RetrievalEngine(VectorIndexBackend backend, EmbeddingProvider embeddingProvider,
            ChunkingTransformer chunker, Executor executor, ObjectMapper objectMapper, Settings settings) {
        this.backend = Objects.requireNonNull(backend, "backend");
        this.embeddingProvider = Objects.requireNonNull(embeddingProvider, "embeddingProvider");
        this.chunker = Objects.requireNonNull(chunker, "chunker");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    /**
     * Brings back the indexes that existed before the last shutdown: the
     * Qdrant backend rediscovers its collections, the in-memory backend
     * reloads the snapshots listed in the registry when configured to.
     * Indexes that cannot be restored are logged and skipped.
     */
    public void start() {
        if (backend.type() == BackendType.QDRANT) {
            recover();
        } else if (settings.restoreOnStartup()) {
            restoreFromRegistry();
        }
    }

    public BackendType backendType() {
        return backend.type();
    }

    /**
     * Indexes documents, skipping those whose content is already present.
     *
     * @return the documents written by this call, in input order
     * @throws InvalidRequestException if a document is empty or requests a
     *                                 chunking policy that cannot be honoured;
     *                                 nothing is written in that case
     */
    public List<StoredDocument> index(String indexName, List<Document> documents) {
        requireName(indexName);
        Objects.requireNonNull(documents, "documents");
        documents.forEach(this::validate);

        Map<String, Document> unique = new LinkedHashMap<>();
        for (Document document : documents) {
            unique.putIfAbsent(document.docId(), document);
        }
        Index index = getOrCreate(indexName);

        List<CompletableFuture<PreparedDocument>> pending = new ArrayList<>(unique.size());
        for (Document document : unique.values()) {
            if (index.store().contains(document.docId())) {
                LOGGER.debug("Document {} already indexed in '{}', skipping", document.docId(), indexName);
                continue;
            }
            long documentSequence = sequence.getAndIncrement();
            pending.add(CompletableFuture.supplyAsync(() -> prepare(document, documentSequence), executor));
        }

        List<StoredDocument> written = new ArrayList<>(pending.size());
        RuntimeException failure = null;
        for (CompletableFuture<PreparedDocument> future : pending) {
            try {
                PreparedDocument prepared = future.join();
                if (insert(index, prepared)) {
                    written.add(prepared.document());
                }
            } catch (RuntimeException ex) {
                failure = collect(failure, ex);
            }
        }
        LOGGER.info("Indexed {} new of {} submitted documents into '{}'", written.size(), documents.size(), indexName);
        if (!written.isEmpty()) {
            autoPersist(index);
        }
        if (failure != null) {
            LOGGER.error("Indexing into '{}' was partially applied: {}", indexName, failure.getMessage());
            throw failure;
        }
        return written;
    }

    /**
     * Runs hybrid retrieval over one index.
     *
     * @param topK   maximum number of results, the configured default if
     *               {@code null}
     * @param filter exact match metadata conditions, may be {@code null}
     */
    public List<RankedResult> retrieve(String indexName, String query, Integer topK, MetadataFilter filter) {
        if (query == null || query.isBlank()) {
            throw new InvalidRequestException("Query must not be empty.");
        }
        int limit = topK == null ? settings.defaultTopK() : topK;
        if (limit <= 0) {
            throw new InvalidRequestException("top_k must be positive.");
        }
        MetadataFilter effectiveFilter = filter == null ? MetadataFilter.none() : filter;
        Index index = requireIndex(indexName);
        float[] queryVector = embeddingProvider.embed(query);
        List<RankedResult> results = backend.lock().read(() -> hybridRetriever(index, queryVector)
                .retrieve(query, limit, effectiveFilter));
        LOGGER.debug("Retrieved {} results from '{}' for top_k={}", results.size(), indexName, limit);
        return results;
    }

    /**
     * Replaces the content of present documents. The new nodes are inserted
     * before the stale ones are removed, inside one write section, so a
     * concurrent reader always finds either the old or the new text.
     */
    public UpdateResult update(String indexName, List<DocumentUpdate> updates) {
        Objects.requireNonNull(updates, "updates");
        updates.forEach(update -> validate(update.toDocument()));
        Index index = requireIndex(indexName);

        List<StoredDocument> updated = new ArrayList<>();
        List<String> unchanged = new ArrayList<>();
        List<String> notFound = new ArrayList<>();
        for (DocumentUpdate update : updates) {
            Optional<StoredDocument> current = index.store().get(update.docId());
            if (current.isEmpty()) {
                notFound.add(update.docId());
                continue;
            }
            Document replacement = update.toDocument();
            StoredDocument candidate = StoredDocument.of(replacement);
            if (candidate.hash().equals(current.get().hash())) {
                unchanged.add(update.docId());
                continue;
            }
            PreparedDocument prepared = prepare(replacement, sequence.getAndIncrement());
            if (replace(index, update.docId(), prepared)) {
                updated.add(prepared.document());
            } else {
                notFound.add(update.docId());
            }
        }
        LOGGER.info("Update of '{}': {} updated, {} unchanged, {} not found", indexName, updated.size(),
                unchanged.size(), notFound.size());
        if (!updated.isEmpty()) {
            autoPersist(index);
        }
        return new UpdateResult(updated, unchanged, notFound);
    }

    /**
     * Removes documents together with every node they produced.
     */
    public DeleteResult delete(String indexName, List<String> docIds) {
        Objects.requireNonNull(docIds, "docIds");
        Index index = requireIndex(indexName);
        List<String> deleted = new ArrayList<>();
        List<String> notFound = new ArrayList<>();
        for (String docId : docIds) {
            boolean removed = backend.lock().write(() -> {
                if (!index.store().contains(docId)) {
                    return false;
                }
                List<String> nodeIds = index.store().nodeIds(docId);
                if (!nodeIds.isEmpty()) {
                    backend.delete(indexName, nodeIds);
                    index.keywords().delete(nodeIds);
                }
                index.store().delete(docId);
                return true;
            });
            (removed ? deleted : notFound).add(docId);
        }
        LOGGER.info("Deleted {} documents from '{}', {} not found", deleted.size(), indexName, notFound.size());
        if (!deleted.isEmpty()) {
            autoPersist(index);
        }
        return new DeleteResult(deleted, notFound);
    }

    public StoredDocument getDocument(String indexName, String docId, Integer maxTextLength) {
        Index index = requireIndex(indexName);
        return backend.lock().read(() -> index.store().get(docId))
                .map(document -> document.view(maxTextLength))
                .orElseThrow(() -> NotFoundException.document(indexName, docId));
    }

    /**
     * @return {@code false} for unknown indexes as well as unknown documents
     */
    public boolean documentExists(String indexName, String docId) {
        Index index = indexes.get(indexName);
        if (index == null) {
            LOGGER.warn("No such index: '{}' exists.", indexName);
            return false;
        }
        return backend.lock().read(() -> index.store().contains(docId));
    }

    public DocumentPage listDocuments(String indexName, int limit, int offset, Integer maxTextLength) {
        validatePaging(limit, offset, maxTextLength);
        Index index = requireIndex(indexName);
        List<StoredDocument> fetched = backend.lock().read(() -> index.store().list(offset, limit + 1, maxTextLength));
        return DocumentPage.of(fetched, offset, limit);
    }

    /**
     * Pages through the documents of every index. The limit and the offset are
     * split evenly across the indexes, the remainders going to the first ones,
     * so that one large index cannot crowd the others out of a page.
     */
    public AllDocumentsPage listAllDocuments(int limit, int offset, Integer maxTextLength) {
        validatePaging(limit, offset, maxTextLength);
        List<String> names = indexes.keySet().stream().sorted().toList();
        if (names.isEmpty()) {
            return AllDocumentsPage.of(Map.of(), false, offset, limit);
        }
        return backend.lock().read(() -> fairShare(names, limit, offset, maxTextLength));
    }

    /**
     * Writes the vectors and the document store of one index. Without an
     * explicit path the index is written below the configured persist
     * directory and recorded in the index registry.
     */
    public void persist(String indexName, Path path) {
        Index index = requireIndex(indexName);
        Path directory = path != null ? path : defaultDirectory(indexName);
        LOGGER.info("Persisting index '{}' to {}", indexName, directory);
        // Vectors and documents of one index are written as a pair.
        synchronized (persistMonitors.computeIfAbsent(indexName, key -> new Object())) {
            backend.lock().read(() -> {
                try {
                    backend.persist(indexName, directory);
                    index.store().writeSnapshot(directory.resolve(DOCSTORE_FILE), objectMapper);
                } catch (IOException ex) {
                    throw new UncheckedIOException("Failed to persist index '" + indexName + "'", ex);
                }
                return null;
            });
        }
        if (path == null) {
            register(indexName);
        }
        LOGGER.info("Successfully persisted index '{}'", indexName);
    }

    /**
     * Replaces the named index with the snapshot found in {@code path}, or in
     * its default directory if {@code path} is {@code null}.
     */
    public void restore(String indexName, Path path) {
        requireName(indexName);
        Path directory = path != null ? path : defaultDirectory(indexName);
        Path docstoreFile = directory.resolve(DOCSTORE_FILE);
        if (!Files.exists(docstoreFile)) {
            throw new NotFoundException("No snapshot of index '" + indexName + "' at " + directory);
        }
        Index restored = backend.lock().write(() -> {
            try {
                DocumentStore store = DocumentStore.readSnapshot(docstoreFile, objectMapper);
                backend.restore(indexName, directory);
                List<IndexedNode> nodes = backend.nodes(indexName);
                if (nodes.size() != store.nodeCount()) {
                    LOGGER.warn("Index '{}' restored {} vectors for {} recorded nodes", indexName, nodes.size(),
                            store.nodeCount());
                }
                KeywordIndex keywords = new KeywordIndex();
                keywords.add(nodes);
                Index index = new Index(indexName, store, keywords);
                Index previous = indexes.put(indexName, index);
                if (previous != null) {
                    previous.close();
                }
                return index;
            } catch (IOException ex) {
                throw new UncheckedIOException("Failed to restore index '" + indexName + "'", ex);
            }
        });
        LOGGER.info("Restored index '{}' with {} documents from {}", indexName, restored.store().size(), directory);
    }

    public void deleteIndex(String indexName) {
        Index index = requireIndex(indexName);
        backend.lock().write(() -> {
            backend.deleteIndex(indexName);
            indexes.remove(indexName);
            return null;
        });
        index.close();
        unregister(indexName);
        LOGGER.info("Deleted index '{}'", indexName);
    }

    /**
     * Names of every index the engine serves plus those the backend reports.
     */
    public List<String> listIndexes() {
        Set<String> names = new TreeSet<>(indexes.keySet());
        names.addAll(backend.listIndexes());
        return List.copyOf(names);
    }

    @Override
    public void close() {
        indexes.values().forEach(Index::close);
        indexes.clear();
    }

    void recover() {
        List<RecoveredIndex> recovered = backend.recoverIndexes();
        for (RecoveredIndex recoveredIndex : recovered) {
            try {
                DocumentStore store = new DocumentStore();
                KeywordIndex keywords = new KeywordIndex();
                for (RecoveredIndex.RecoveredDocument document : recoveredIndex.documents()) {
                    List<String> nodeIds = document.nodes().stream().map(IndexedNode::nodeId).toList();
                    store.putIfAbsent(document.document(), nodeIds);
                    keywords.add(document.nodes());
                }
                Index previous = indexes.put(recoveredIndex.name(), new Index(recoveredIndex.name(), store, keywords));
                if (previous != null) {
                    previous.close();
                }
                LOGGER.info("Recovered index '{}' with {} documents", recoveredIndex.name(), store.size());
            } catch (RuntimeException ex) {
                LOGGER.error("Failed to rebuild index '{}': {}", recoveredIndex.name(), ex.getMessage(), ex);
            }
        }
    }

    void restoreFromRegistry() {
        List<String> names = readRegistry();
        if (names.isEmpty()) {
            LOGGER.info("No persisted indexes found in {}", settings.persistDir());
            return;
        }
        for (String name : names) {
            try {
                restore(name, null);
            } catch (RuntimeException ex) {
                LOGGER.error("Failed to restore index '{}': {}", name, ex.getMessage(), ex);
            }
        }
    }

    private void validate(Document document) {
        if (document.text().isBlank()) {
            throw new InvalidRequestException("Document text must not be empty.");
        }
        chunker.validate(document);
    }

    private Index getOrCreate(String indexName) {
        return indexes.computeIfAbsent(indexName, name -> {
            backend.createIndex(name);
            LOGGER.info("Created index '{}' on the {} backend", name, backend.type().propertyValue());
            return Index.empty(name);
        });
    }

    private Index requireIndex(String indexName) {
        Index index = indexes.get(indexName);
        if (index == null) {
            throw NotFoundException.index(indexName);
        }
        return index;
    }

    private PreparedDocument prepare(Document document, long documentSequence) {
        StoredDocument stored = StoredDocument.of(document);
        List<String> chunks = chunker.split(document);
        if (chunks.isEmpty()) {
            chunks = List.of(document.text());
        }
        IndexedNode.NodeSource source = new IndexedNode.NodeSource(stored.hash(), document.text(), documentSequence);
        List<IndexedNode> nodes = new ArrayList<>(chunks.size());
        for (int i = 0; i < chunks.size(); i++) {
            String chunk = chunks.get(i);
            nodes.add(new IndexedNode(DocumentIds.nodeId(stored.docId(), i), stored.docId(), i, chunk,
                    document.metadata(), embeddingProvider.embed(chunk), source));
        }
        return new PreparedDocument(stored, nodes);
    }

    private boolean insert(Index index, PreparedDocument prepared) {
        return backend.lock().write(() -> {
            String docId = prepared.document().docId();
            if (!index.store().putIfAbsent(prepared.document(), prepared.nodeIds())) {
                return false;
            }
            try {
                backend.add(index.name(), prepared.nodes());
                index.keywords().add(prepared.nodes());
            } catch (RuntimeException ex) {
                index.store().delete(docId);
                try {
                    backend.delete(index.name(), prepared.nodeIds());
                    index.keywords().delete(prepared.nodeIds());
                } catch (RuntimeException cleanup) {
                    ex.addSuppressed(cleanup);
                }
                throw ex;
            }
            return true;
        });
    }

    private boolean replace(Index index, String oldDocId, PreparedDocument prepared) {
        return backend.lock().write(() -> {
            DocumentStore store = index.store();
            if (!store.contains(oldDocId)) {
                return false;
            }
            String newDocId = prepared.document().docId();
            Set<String> stale = new LinkedHashSet<>(store.nodeIds(oldDocId));
            if (!newDocId.equals(oldDocId)) {
                stale.addAll(store.nodeIds(newDocId));
            }
            stale.removeAll(prepared.nodeIds());

            backend.add(index.name(), prepared.nodes());
            index.keywords().add(prepared.nodes());
            if (!stale.isEmpty()) {
                backend.delete(index.name(), stale);
                index.keywords().delete(stale);
            }
            if (!newDocId.equals(oldDocId)) {
                store.delete(newDocId);
            }
            store.replace(oldDocId, prepared.document(), prepared.nodeIds());
            return true;
        });
    }

    private HybridRetriever hybridRetriever(Index index, float[] queryVector) {
        return new HybridRetriever(
                (query, topK, filter) -> backend.search(index.name(), queryVector, topK, filter),
                index.keywords(), settings.vectorWeight(), settings.textWeight(), settings.candidateMultiplier());
    }

    private AllDocumentsPage fairShare(List<String> names, int limit, int offset, Integer maxTextLength) {
        int count = names.size();
        int perIndex = limit / count;
        int remainder = limit % count;
        int offsetPerIndex = offset / count;
        int offsetRemainder = offset % count;

        Map<String, List<StoredDocument>> page = new LinkedHashMap<>();
        boolean hasMore = false;
        for (int i = 0; i < count; i++) {
            Index index = indexes.get(names.get(i));
            int indexLimit = perIndex + (i < remainder ? 1 : 0);
            int indexOffset = offsetPerIndex + (i < offsetRemainder ? 1 : 0);
            if (index == null || indexLimit <= 0) {
                continue;
            }
            // one extra document tells whether this index has a further page
            List<StoredDocument> documents = index.store().list(indexOffset, indexLimit + 1, maxTextLength);
            if (documents.size() > indexLimit) {
                hasMore = true;
                documents = documents.subList(0, indexLimit);
            }
            if (!documents.isEmpty()) {
                page.put(index.name(), documents);
            }
        }
        return AllDocumentsPage.of(page, hasMore, offset, limit);
    }

    private void autoPersist(Index index) {
        if (!settings.autoPersist() || backend.type() != BackendType.IN_MEMORY) {
            return;
        }
        persist(index.name(), null);
    }

    private Path defaultDirectory(String indexName) {
        return settings.persistDir().resolve(indexName);
    }

    private List<String> readRegistry() {
        Path file = settings.persistDir().resolve(REGISTRY_FILE);
        if (!Files.exists(file)) {
            return List.of();
        }
        try {
            IndexRegistry registry = objectMapper.readValue(file.toFile(), IndexRegistry.class);
            return registry == null || registry.indexes() == null ? List.of() : registry.indexes();
        } catch (JacksonException ex) {
            LOGGER.error("Index registry {} cannot be parsed, no index is restored: {}", file, ex.getMessage());
            return List.of();
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read index registry " + file, ex);
        }
    }

    private void register(String indexName) {
        synchronized (registryMonitor) {
            Set<String> names = new TreeSet<>(readRegistry());
            if (names.add(indexName)) {
                writeRegistry(names);
            }
        }
    }

    private void unregister(String indexName) {
        synchronized (registryMonitor) {
            Set<String> names = new TreeSet<>(readRegistry());
            if (names.remove(indexName)) {
                writeRegistry(names);
            }
        }
    }

    private void writeRegistry(Collection<String> names) {
        Path file = settings.persistDir().resolve(REGISTRY_FILE);
        try {
            Files.createDirectories(settings.persistDir());
            Path temp = Files.createTempFile(settings.persistDir(), REGISTRY_FILE, ".tmp");
            objectMapper.writeValue(temp.toFile(), new IndexRegistry(List.copyOf(names)));
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to write index registry " + file, ex);
        }
    }

    private static void requireName(String indexName) {
        if (indexName == null || indexName.isBlank()) {
            throw new InvalidRequestException("Index name must not be empty.");
        }
    }

    private static void validatePaging(int limit, int offset, Integer maxTextLength) {
        if (limit < 1) {
            throw new InvalidRequestException("limit must be at least 1.");
        }
        if (offset < 0) {
            throw new InvalidRequestException("offset must not be negative.");
        }
        if (maxTextLength != null && maxTextLength < 1) {
            throw new InvalidRequestException("max_text_length must be at least 1.");
        }
    }

    private static RuntimeException collect(RuntimeException first, RuntimeException next) {
        RuntimeException cause = next;
        if (next instanceof CompletionException && next.getCause() != null) {
            cause = next.getCause() instanceof RuntimeException runtime ? runtime
                    : new IllegalStateException(next.getCause().getMessage(), next.getCause());
        }
        if (first == null) {
            return cause;
        }
        first.addSuppressed(cause);
        return first;
    }

    /**
     * Engine level settings.
     *
     * @param persistDir       root of snapshots and the index registry
     * @param restoreOnStartup reload registered snapshots in {@link #start()}
     * @param autoPersist      persist in-memory indexes after each changing batch
     */
    public record Settings(
            Path persistDir,
            boolean restoreOnStartup,
            boolean autoPersist,
            int defaultTopK,
            double vectorWeight,
            double textWeight,
            double candidateMultiplier) {

        public Settings {
            Objects.requireNonNull(persistDir, "persistDir");
            if (defaultTopK <= 0) {
                throw new IllegalArgumentException("defaultTopK must be positive");
            }
        }
    }

    record IndexRegistry(List<String> indexes) {
    }

    private record PreparedDocument(StoredDocument document, List<IndexedNode> nodes) {

        List<String> nodeIds() {
            return nodes.stream().map(IndexedNode::nodeId).toList();
        }
    }
}
