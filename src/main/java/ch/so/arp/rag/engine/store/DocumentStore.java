package ch.so.arp.rag.engine.store;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JacksonException;
import com.fasterxml.jackson.databind.ObjectMapper;

import ch.so.arp.rag.engine.CorruptionException;
import ch.so.arp.rag.engine.Document;
import ch.so.arp.rag.engine.StoredDocument;

/**
 * Content-addressed record store of one index. Documents are kept in insertion
 * order, which is the stable order all pagination is defined over; entries are
 * never re-sorted. Each entry remembers the node ids its document produced so
 * that a delete can remove every chunk from the vector backend.
 */
public class DocumentStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(DocumentStore.class);

    private final Map<String, Entry> entries = new LinkedHashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    /**
     * Records a document without node ids. Storing the same text twice is a
     * no-op; the id of the already present document is returned.
     */
    public String put(Document document) {
        StoredDocument stored = StoredDocument.of(document);
        putIfAbsent(stored, List.of());
        return stored.docId();
    }

    /**
     * Adds the document unless its id is already present.
     *
     * @return {@code true} if the document was added by this call
     */
    public boolean putIfAbsent(StoredDocument document, List<String> nodeIds) {
        Objects.requireNonNull(document, "document");
        lock.writeLock().lock();
        try {
            if (entries.containsKey(document.docId())) {
                return false;
            }
            entries.put(document.docId(), new Entry(document, nodeIds));
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Replaces the node ids recorded for a present document.
     */
    public void attachNodes(String docId, List<String> nodeIds) {
        lock.writeLock().lock();
        try {
            Entry entry = entries.get(docId);
            if (entry != null) {
                entries.put(docId, new Entry(entry.document(), nodeIds));
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Swaps the document stored under {@code oldDocId} for {@code replacement}.
     * If the id is unchanged the entry keeps its position; otherwise the old
     * entry is removed and the replacement is appended unless it is already
     * present.
     */
    public void replace(String oldDocId, StoredDocument replacement, List<String> nodeIds) {
        lock.writeLock().lock();
        try {
            if (oldDocId.equals(replacement.docId())) {
                entries.put(oldDocId, new Entry(replacement, nodeIds));
                return;
            }
            entries.remove(oldDocId);
            entries.putIfAbsent(replacement.docId(), new Entry(replacement, nodeIds));
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Optional<StoredDocument> get(String docId) {
        lock.readLock().lock();
        try {
            Entry entry = entries.get(docId);
            return entry == null ? Optional.empty() : Optional.of(entry.document());
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean contains(String docId) {
        lock.readLock().lock();
        try {
            return entries.containsKey(docId);
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<String> nodeIds(String docId) {
        lock.readLock().lock();
        try {
            Entry entry = entries.get(docId);
            return entry == null ? List.of() : entry.nodeIds();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Removes a document.
     *
     * @return the removed entry, empty if the id was unknown
     */
    public Optional<Entry> delete(String docId) {
        lock.writeLock().lock();
        try {
            return Optional.ofNullable(entries.remove(docId));
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Returns up to {@code limit} documents starting at {@code offset} in
     * stable order. A non-null {@code maxTextLength} truncates the returned
     * views only.
     */
    public List<StoredDocument> list(int offset, int limit, Integer maxTextLength) {
        if (offset < 0 || limit < 0) {
            throw new IllegalArgumentException("offset and limit must not be negative");
        }
        lock.readLock().lock();
        try {
            List<StoredDocument> page = new ArrayList<>(Math.min(limit, entries.size()));
            Iterator<Entry> iterator = entries.values().iterator();
            int skipped = 0;
            while (iterator.hasNext() && skipped < offset) {
                iterator.next();
                skipped++;
            }
            while (iterator.hasNext() && page.size() < limit) {
                page.add(iterator.next().document().view(maxTextLength));
            }
            return page;
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public int nodeCount() {
        lock.readLock().lock();
        try {
            return entries.values().stream().mapToInt(entry -> entry.nodeIds().size()).sum();
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<Entry> entries() {
        lock.readLock().lock();
        try {
            return List.copyOf(entries.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    public void writeSnapshot(Path file, ObjectMapper objectMapper) throws IOException {
        Path directory = Files.createDirectories(file.toAbsolutePath().getParent());
        List<SnapshotEntry> snapshot = entries().stream().map(SnapshotEntry::of).toList();
        Path temp = Files.createTempFile(directory, file.getFileName().toString(), ".tmp");
        objectMapper.writeValue(temp.toFile(), new Snapshot(snapshot));
        Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        LOGGER.debug("Wrote document store snapshot with {} documents to {}", snapshot.size(), file);
    }

    public static DocumentStore readSnapshot(Path file, ObjectMapper objectMapper) throws IOException {
        Snapshot snapshot;
        try {
            snapshot = objectMapper.readValue(file.toFile(), Snapshot.class);
        } catch (JacksonException ex) {
            throw new CorruptionException("Unable to parse document store snapshot " + file, ex);
        }
        if (snapshot == null || snapshot.documents() == null) {
            throw new CorruptionException("Document store snapshot " + file + " is empty");
        }
        DocumentStore store = new DocumentStore();
        for (SnapshotEntry entry : snapshot.documents()) {
            if (entry.docId() == null || entry.text() == null) {
                throw new CorruptionException("Document store snapshot " + file + " contains an incomplete entry");
            }
            store.putIfAbsent(new StoredDocument(entry.docId(), entry.text(), entry.hash(), entry.metadata(), false),
                    entry.nodeIds() == null ? List.of() : entry.nodeIds());
        }
        return store;
    }

    /**
     * A stored document together with the node ids it was chunked into.
     */
    public record Entry(StoredDocument document, List<String> nodeIds) {

        public Entry {
            Objects.requireNonNull(document, "document");
            nodeIds = List.copyOf(nodeIds);
        }
    }

    record Snapshot(List<SnapshotEntry> documents) {
    }

    record SnapshotEntry(String docId, String text, String hash, Map<String, String> metadata, List<String> nodeIds) {

        static SnapshotEntry of(Entry entry) {
            StoredDocument document = entry.document();
            return new SnapshotEntry(document.docId(), document.text(), document.hash(), document.metadata(),
                    entry.nodeIds());
        }
    }
}
