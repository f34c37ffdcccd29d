package ch.so.arp.rag.engine.backend;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Collection;
import java.util.List;

import ch.so.arp.rag.engine.MetadataFilter;
import ch.so.arp.rag.engine.RankedResult;

/**
 * Dense vector similarity engine holding the {@link IndexedNode}s of every
 * named index. Node ids serve as handles for deletion.
 */
public interface VectorIndexBackend {

    BackendType type();

    /**
     * Creates the named index unless it already exists.
     */
    void createIndex(String name);

    boolean hasIndex(String name);

    /**
     * Adds nodes, creating the index if necessary. A node whose id is already
     * present replaces the stored one.
     *
     * @return the handles of the added nodes, in input order
     */
    List<String> add(String name, List<IndexedNode> nodes);

    /**
     * Removes the given handles. Unknown handles are ignored.
     */
    void delete(String name, Collection<String> nodeHandles);

    /**
     * Finds the nodes closest to {@code queryVector}, most relevant first.
     * Nodes whose metadata does not satisfy {@code filter} are never returned.
     */
    List<RankedResult> search(String name, float[] queryVector, int topK, MetadataFilter filter);

    /**
     * Number of nodes in the named index, zero if it does not exist.
     */
    int size(String name);

    /**
     * Reads back every node of the named index without its vector, ordered by
     * document and chunk position. Used to rebuild derived state such as the
     * keyword index after a restore.
     */
    List<IndexedNode> nodes(String name);

    void deleteIndex(String name);

    List<String> listIndexes();

    /**
     * Writes whatever the backend needs to rebuild the index into
     * {@code directory}. Backends owning their durability may do nothing.
     */
    void persist(String name, Path directory) throws IOException;

    /**
     * Rebuilds the named index from {@code directory}, replacing any in-memory
     * state.
     */
    void restore(String name, Path directory) throws IOException;

    /**
     * Rediscovers the indexes held by an external service. Indexes that cannot
     * be read are logged and left out.
     */
    default List<RecoveredIndex> recoverIndexes() {
        return List.of();
    }

    /**
     * Locking policy the engine applies around compound operations.
     */
    IndexLock lock();
}
