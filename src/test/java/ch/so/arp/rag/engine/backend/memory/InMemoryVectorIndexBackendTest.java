package ch.so.arp.rag.engine.backend.memory;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.fasterxml.jackson.databind.ObjectMapper;

import ch.so.arp.rag.engine.CorruptionException;
import ch.so.arp.rag.engine.MetadataFilter;
import ch.so.arp.rag.engine.NotFoundException;
import ch.so.arp.rag.engine.RankedResult;
import ch.so.arp.rag.engine.ScoreKind;
import ch.so.arp.rag.engine.backend.IndexedNode;

class InMemoryVectorIndexBackendTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private final InMemoryVectorIndexBackend backend = new InMemoryVectorIndexBackend(2, DistanceMetric.COSINE,
            objectMapper);

    @Test
    void addCreatesTheIndexAndSearchReturnsSimilarities() {
        backend.add("docs", List.of(node("a", "doc-1", 1f, 0f, Map.of()), node("b", "doc-2", 0f, 1f, Map.of())));

        List<RankedResult> results = backend.search("docs", new float[] { 1f, 0f }, 2, MetadataFilter.none());

        assertThat(backend.hasIndex("docs")).isTrue();
        assertThat(results).extracting(RankedResult::nodeId).containsExactly("a", "b");
        assertThat(results.get(0).scoreKind()).isEqualTo(ScoreKind.SIMILARITY);
        assertThat(results.get(0).score()).isCloseTo(1.0d, within(1e-6));
    }

    @Test
    void addingAnExistingNodeIdReplacesIt() {
        backend.add("docs", List.of(node("a", "doc-1", 1f, 0f, Map.of())));
        backend.add("docs", List.of(node("a", "doc-1", 0f, 1f, Map.of())));

        assertThat(backend.size("docs")).isEqualTo(1);
        assertThat(backend.search("docs", new float[] { 0f, 1f }, 1, MetadataFilter.none()).get(0).score())
                .isGreaterThan(0.99d);
    }

    @Test
    void deleteRemovesOnlyTheGivenHandles() {
        backend.add("docs", List.of(node("a", "doc-1", 1f, 0f, Map.of()), node("b", "doc-1", 0.5f, 0.5f, Map.of()),
                node("c", "doc-2", 0f, 1f, Map.of())));

        backend.delete("docs", List.of("a", "unknown"));

        assertThat(backend.size("docs")).isEqualTo(2);
        assertThat(backend.search("docs", new float[] { 1f, 0f }, 5, MetadataFilter.none()))
                .extracting(RankedResult::nodeId).containsExactly("b", "c");
    }

    @Test
    void searchAppliesTheMetadataFilter() {
        backend.add("docs", List.of(node("a", "doc-1", 1f, 0f, Map.of("lang", "de")),
                node("b", "doc-2", 0.9f, 0.1f, Map.of("lang", "en"))));

        List<RankedResult> results = backend.search("docs", new float[] { 1f, 0f }, 5,
                MetadataFilter.of(Map.of("lang", "en")));

        assertThat(results).extracting(RankedResult::nodeId).containsExactly("b");
    }

    @Test
    void unknownIndexesAreReported() {
        assertThatThrownBy(() -> backend.search("missing", new float[] { 1f, 0f }, 1, MetadataFilter.none()))
                .isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> backend.deleteIndex("missing")).isInstanceOf(NotFoundException.class);
        assertThat(backend.size("missing")).isZero();
    }

    @Test
    void persistAndRestoreRebuildTheIndex(@TempDir Path directory) throws IOException {
        backend.add("docs", List.of(node("a", "doc-1", 1f, 0f, Map.of("k", "v")), node("b", "doc-2", 0f, 1f, Map.of()),
                node("c", "doc-3", 0.5f, 0.5f, Map.of())));
        backend.delete("docs", List.of("a"));
        backend.persist("docs", directory);

        InMemoryVectorIndexBackend restored = new InMemoryVectorIndexBackend(2, DistanceMetric.COSINE, objectMapper);
        restored.restore("docs", directory);
        restored.add("docs", List.of(node("d", "doc-4", 1f, 0f, Map.of())));

        assertThat(restored.size("docs")).isEqualTo(3);
        assertThat(restored.nodes("docs")).extracting(IndexedNode::nodeId).containsExactly("b", "c", "d");
        assertThat(restored.search("docs", new float[] { 0f, 1f }, 1, MetadataFilter.none()))
                .extracting(RankedResult::nodeId).containsExactly("b");
    }

    @Test
    void restoreRejectsSnapshotsOfAnotherDimension(@TempDir Path directory) throws IOException {
        backend.add("docs", List.of(node("a", "doc-1", 1f, 0f, Map.of())));
        backend.persist("docs", directory);

        InMemoryVectorIndexBackend other = new InMemoryVectorIndexBackend(3, DistanceMetric.COSINE, objectMapper);

        assertThatThrownBy(() -> other.restore("docs", directory)).isInstanceOf(CorruptionException.class);
    }

    @Test
    void restoreWithoutSnapshotIsNotFound(@TempDir Path directory) {
        assertThatThrownBy(() -> backend.restore("docs", directory)).isInstanceOf(NotFoundException.class);
    }

    @Test
    void restoreOfGarbageIsCorruption(@TempDir Path directory) throws IOException {
        Files.writeString(directory.resolve(InMemoryVectorIndexBackend.VECTORS_FILE), "[1, 2");

        assertThatThrownBy(() -> backend.restore("docs", directory)).isInstanceOf(CorruptionException.class);
    }

    private static IndexedNode node(String nodeId, String docId, float x, float y, Map<String, String> metadata) {
        return new IndexedNode(nodeId, docId, 0, "text of " + nodeId, metadata, new float[] { x, y }, null);
    }
}
