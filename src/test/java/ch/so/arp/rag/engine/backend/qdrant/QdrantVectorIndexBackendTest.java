package ch.so.arp.rag.engine.backend.qdrant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import ch.so.arp.rag.engine.DocumentIds;
import ch.so.arp.rag.engine.MetadataFilter;
import ch.so.arp.rag.engine.NotFoundException;
import ch.so.arp.rag.engine.RankedResult;
import ch.so.arp.rag.engine.ScoreKind;
import ch.so.arp.rag.engine.StoredDocument;
import ch.so.arp.rag.engine.backend.IndexLock;
import ch.so.arp.rag.engine.backend.IndexedNode;
import ch.so.arp.rag.engine.backend.RecoveredIndex;

class QdrantVectorIndexBackendTest {

    private InMemoryQdrantClient client;
    private QdrantVectorIndexBackend backend;

    @BeforeEach
    void setUp() {
        client = new InMemoryQdrantClient();
        backend = new QdrantVectorIndexBackend(client, 3, 2);
    }

    @Test
    void searchReturnsSimilaritiesWithPayloadFields() {
        backend.add("plans", List.of(
                node("doc-a", 0, "zoning", new float[] { 1f, 0f, 0f }, Map.of("lang", "de"), 1L),
                node("doc-b", 0, "parking", new float[] { 0f, 1f, 0f }, Map.of("lang", "fr"), 2L)));

        List<RankedResult> results = backend.search("plans", new float[] { 0.9f, 0.1f, 0f }, 2, MetadataFilter.none());

        assertThat(results).extracting(RankedResult::docId).containsExactly("doc-a", "doc-b");
        assertThat(results.get(0).scoreKind()).isEqualTo(ScoreKind.SIMILARITY);
        assertThat(results.get(0).text()).isEqualTo("zoning");
        assertThat(results.get(0).metadata()).containsEntry("lang", "de");
        assertThat(backend.size("plans")).isEqualTo(2);
        assertThat(backend.lock()).isSameAs(IndexLock.none());
    }

    @Test
    void metadataFilterIsPassedToTheService() {
        backend.add("plans", List.of(
                node("doc-a", 0, "zoning", new float[] { 1f, 0f, 0f }, Map.of("lang", "de"), 1L),
                node("doc-b", 0, "parking", new float[] { 0f, 1f, 0f }, Map.of("lang", "fr"), 2L)));

        List<RankedResult> results = backend.search("plans", new float[] { 1f, 0f, 0f }, 5,
                MetadataFilter.of(Map.of("lang", "fr")));

        assertThat(results).extracting(RankedResult::docId).containsExactly("doc-b");
    }

    @Test
    void deleteRemovesPointsByNodeId() {
        IndexedNode first = node("doc-a", 0, "one", new float[] { 1f, 0f, 0f }, Map.of(), 1L);
        IndexedNode second = node("doc-a", 1, "two", new float[] { 0f, 1f, 0f }, Map.of(), 1L);
        backend.add("plans", List.of(first, second));

        backend.delete("plans", List.of(first.nodeId(), "unknown"));

        assertThat(client.pointCount("plans")).isEqualTo(1);
        assertThat(backend.nodes("plans")).extracting(IndexedNode::nodeId).containsExactly(second.nodeId());
    }

    @Test
    void recoversDocumentsInInsertionOrderAcrossScrollPages() {
        backend.add("plans", List.of(
                node("doc-late", 0, "late", new float[] { 1f, 0f, 0f }, Map.of(), 30L),
                node("doc-early", 1, "world", new float[] { 0f, 1f, 0f }, Map.of("kind", "memo"), 10L),
                node("doc-early", 0, "hello", new float[] { 0f, 0f, 1f }, Map.of("kind", "memo"), 10L),
                node("doc-middle", 0, "middle", new float[] { 1f, 1f, 0f }, Map.of(), 20L)));

        QdrantVectorIndexBackend restarted = new QdrantVectorIndexBackend(client, 3, 2);
        List<RecoveredIndex> recovered = restarted.recoverIndexes();

        assertThat(recovered).singleElement().satisfies(index -> {
            assertThat(index.name()).isEqualTo("plans");
            assertThat(index.documents()).extracting(document -> document.document().docId())
                    .containsExactly("doc-early", "doc-middle", "doc-late");
            RecoveredIndex.RecoveredDocument early = index.documents().get(0);
            assertThat(early.document().text()).isEqualTo("full text of doc-early");
            assertThat(early.document().hash()).isEqualTo("hash-doc-early");
            assertThat(early.document().metadata()).containsEntry("kind", "memo");
            assertThat(early.nodes()).extracting(IndexedNode::text).containsExactly("hello", "world");
        });
        assertThat(restarted.hasIndex("plans")).isTrue();
    }

    @Test
    void unreadableCollectionIsSkippedDuringRecovery() {
        backend.add("good", List.of(node("doc-a", 0, "a", new float[] { 1f, 0f, 0f }, Map.of(), 1L)));
        backend.add("bad", List.of(node("doc-b", 0, "b", new float[] { 0f, 1f, 0f }, Map.of(), 2L)));
        client.breakCollection("bad");

        QdrantVectorIndexBackend restarted = new QdrantVectorIndexBackend(client, 3, 16);

        assertThat(restarted.recoverIndexes()).extracting(RecoveredIndex::name).containsExactly("good");
        assertThat(restarted.hasIndex("bad")).isFalse();
    }

    @Test
    void missingDocumentTextFallsBackToJoinedChunks() {
        client.createCollection("legacy", 3);
        client.upsert("legacy", List.of(
                new QdrantClient.Point("p1", new float[] { 1f, 0f, 0f },
                        Map.of("doc_id", "doc-x", "chunk_index", 1, "text", "second")),
                new QdrantClient.Point("p0", new float[] { 0f, 1f, 0f },
                        Map.of("doc_id", "doc-x", "chunk_index", 0, "text", "first"))));

        RecoveredIndex index = backend.recoverIndex("legacy");

        StoredDocument document = index.documents().get(0).document();
        assertThat(document.text()).isEqualTo("first\nsecond");
        assertThat(document.hash()).isEqualTo(DocumentIds.contentHash("first\nsecond", Map.of()));
    }

    @Test
    void listIndexesFallsBackToKnownCollectionsWhenUnavailable() {
        backend.createIndex("plans");
        client.setUnavailable(true);

        assertThat(backend.listIndexes()).containsExactly("plans");
        assertThat(backend.recoverIndexes()).isEmpty();
    }

    @Test
    void deletingUnknownCollectionFails() {
        assertThatThrownBy(() -> backend.deleteIndex("missing")).isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> backend.restore("missing", null)).isInstanceOf(NotFoundException.class);
    }

    @Test
    void deleteIndexDropsTheCollection() {
        backend.createIndex("plans");

        backend.deleteIndex("plans");

        assertThat(client.collectionExists("plans")).isFalse();
        assertThat(backend.hasIndex("plans")).isFalse();
    }

    private static IndexedNode node(String docId, int chunkIndex, String text, float[] vector,
            Map<String, String> metadata, long sequence) {
        return new IndexedNode(DocumentIds.nodeId(docId, chunkIndex), docId, chunkIndex, text, metadata, vector,
                new IndexedNode.NodeSource("hash-" + docId, "full text of " + docId, sequence));
    }
}
