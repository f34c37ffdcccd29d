package ch.so.arp.rag.engine;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.fasterxml.jackson.databind.ObjectMapper;

import ch.so.arp.rag.engine.backend.memory.DistanceMetric;
import ch.so.arp.rag.engine.backend.memory.InMemoryVectorIndexBackend;
import ch.so.arp.rag.engine.chunking.ChunkingTransformer;
import ch.so.arp.rag.engine.chunking.ProseSplitter;
import ch.so.arp.rag.engine.embedding.DeterministicEmbeddingProvider;
import ch.so.arp.rag.engine.embedding.EmbeddingProvider;

class RetrievalEngineConcurrencyTest {

    private static final int DIMENSIONS = 32;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final EmbeddingProvider embeddings = new DeterministicEmbeddingProvider(DIMENSIONS);
    private final AtomicInteger threadCounter = new AtomicInteger();
    private final ExecutorService prepareExecutor = Executors.newFixedThreadPool(4,
            runnable -> new Thread(runnable, "prepare-" + threadCounter.incrementAndGet()));
    private final ExecutorService callers = Executors.newFixedThreadPool(8);
    private final List<RetrievalEngine> engines = new ArrayList<>();

    @TempDir
    Path persistDir;

    @AfterEach
    void tearDown() throws InterruptedException {
        engines.forEach(RetrievalEngine::close);
        callers.shutdownNow();
        prepareExecutor.shutdownNow();
        callers.awaitTermination(5, TimeUnit.SECONDS);
        prepareExecutor.awaitTermination(5, TimeUnit.SECONDS);
    }

    @Test
    void documentsArePreparedOnTheExecutorAndWrittenInInputOrder() {
        Set<String> embeddingThreads = ConcurrentHashMap.newKeySet();
        EmbeddingProvider recording = new EmbeddingProvider() {
            @Override
            public float[] embed(String text) {
                embeddingThreads.add(Thread.currentThread().getName());
                return embeddings.embed(text);
            }

            @Override
            public int dimensions() {
                return DIMENSIONS;
            }
        };
        InMemoryVectorIndexBackend backend = newBackend();
        RetrievalEngine engine = newEngine(backend, recording, new ProseSplitter(1000, 100), false);
        List<Document> documents = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            documents.add(new Document("building regulation paragraph " + i));
        }

        List<StoredDocument> written = engine.index("plans", documents);

        assertThat(written).extracting(StoredDocument::docId)
                .containsExactlyElementsOf(documents.stream().map(Document::docId).toList());
        assertThat(engine.listDocuments("plans", 100, 0, null).documents()).extracting(StoredDocument::docId)
                .containsExactlyElementsOf(documents.stream().map(Document::docId).toList());
        assertThat(backend.size("plans")).isEqualTo(50);
        assertThat(embeddingThreads).isNotEmpty().allSatisfy(name -> assertThat(name).startsWith("prepare-"));
    }

    @Test
    void readersSeeEitherTheOldOrTheNewTextDuringUpdates() throws Exception {
        RetrievalEngine engine = newEngine(newBackend(), embeddings, new ProseSplitter(1000, 100), false);
        String firstId = engine.index("plans", List.of(new Document("zoning plan revision 0"))).get(0).docId();
        AtomicBoolean writing = new AtomicBoolean(true);
        AtomicInteger misses = new AtomicInteger();
        AtomicInteger reads = new AtomicInteger();

        Future<?> reader = callers.submit(() -> {
            while (writing.get() || reads.get() == 0) {
                List<RankedResult> results = engine.retrieve("plans", "zoning plan revision", 5, null);
                boolean found = results.stream().anyMatch(result -> result.text().startsWith("zoning plan revision"));
                if (!found) {
                    misses.incrementAndGet();
                }
                reads.incrementAndGet();
            }
        });
        String currentId = firstId;
        try {
            for (int i = 1; i <= 200; i++) {
                UpdateResult result = engine.update("plans",
                        List.of(new DocumentUpdate(currentId, "zoning plan revision " + i, null)));
                currentId = result.updated().get(0).docId();
            }
        } finally {
            writing.set(false);
        }
        reader.get(30, TimeUnit.SECONDS);

        assertThat(reads.get()).isPositive();
        assertThat(misses.get()).isZero();
        assertThat(engine.getDocument("plans", currentId, null).text()).isEqualTo("zoning plan revision 200");
        assertThat(engine.listDocuments("plans", 10, 0, null).count()).isEqualTo(1);
    }

    @Test
    void concurrentPersistsOfOneIndexAllSucceed() throws Exception {
        RetrievalEngine engine = newEngine(newBackend(), embeddings, new ProseSplitter(1000, 100), false);
        List<Document> documents = new ArrayList<>();
        for (int i = 0; i < 300; i++) {
            documents.add(new Document("land use plan entry " + i));
        }
        engine.index("plans", documents);

        List<Future<?>> persists = new ArrayList<>();
        for (int thread = 0; thread < 8; thread++) {
            persists.add(callers.submit(() -> {
                for (int i = 0; i < 20; i++) {
                    engine.persist("plans", null);
                }
            }));
        }
        for (Future<?> persist : persists) {
            persist.get(60, TimeUnit.SECONDS);
        }

        try (Stream<Path> files = Files.list(persistDir.resolve("plans"))) {
            assertThat(files.map(path -> path.getFileName().toString()))
                    .containsExactlyInAnyOrder(RetrievalEngine.DOCSTORE_FILE, "vectors.json");
        }
        RetrievalEngine restarted = newEngine(newBackend(), embeddings, new ProseSplitter(1000, 100), false);
        restarted.start();
        assertThat(restarted.listDocuments("plans", 500, 0, null).count()).isEqualTo(300);
    }

    @Test
    void concurrentBatchesWithAutoPersistAreAllWritten() throws Exception {
        RetrievalEngine engine = newEngine(newBackend(), embeddings, new ProseSplitter(1000, 100), true);

        List<Future<List<StoredDocument>>> batches = new ArrayList<>();
        for (int batch = 0; batch < 4; batch++) {
            int batchNumber = batch;
            batches.add(callers.submit(() -> {
                List<Document> documents = new ArrayList<>();
                for (int i = 0; i < 25; i++) {
                    documents.add(new Document("batch " + batchNumber + " parcel " + i));
                }
                return engine.index("plans", documents);
            }));
        }
        int written = 0;
        for (Future<List<StoredDocument>> batch : batches) {
            written += batch.get(60, TimeUnit.SECONDS).size();
        }

        assertThat(written).isEqualTo(100);
        assertThat(engine.listDocuments("plans", 500, 0, null).count()).isEqualTo(100);
    }

    @Test
    void deletingAMultiChunkDocumentRemovesEachOfItsNodes() {
        ChunkingTransformer chunker = new ChunkingTransformer(new ProseSplitter(60, 0), 40, 1500);
        InMemoryVectorIndexBackend backend = newBackend();
        RetrievalEngine engine = newEngine(backend, embeddings, new ProseSplitter(60, 0), false);
        Document longDocument = new Document("The zoning plan sets the building zones. "
                + "Each zone limits the height of new buildings. "
                + "Riverside parcels keep a protected strip along the water. "
                + "Exceptions need a permit from the municipal council.");
        Document shortDocument = new Document("Parking rules.");
        engine.index("plans", List.of(longDocument, shortDocument));
        int chunks = chunker.split(longDocument).size();
        int before = backend.size("plans");

        engine.delete("plans", List.of(longDocument.docId()));

        assertThat(chunks).isGreaterThan(1);
        assertThat(before).isEqualTo(chunks + 1);
        assertThat(backend.size("plans")).isEqualTo(before - chunks);
        assertThat(engine.retrieve("plans", "riverside permit council zoning", 10, null))
                .extracting(RankedResult::docId).containsOnly(shortDocument.docId());
    }

    private InMemoryVectorIndexBackend newBackend() {
        return new InMemoryVectorIndexBackend(DIMENSIONS, DistanceMetric.COSINE, objectMapper);
    }

    private RetrievalEngine newEngine(InMemoryVectorIndexBackend backend, EmbeddingProvider embeddingProvider,
            ProseSplitter splitter, boolean autoPersist) {
        ChunkingTransformer chunker = new ChunkingTransformer(splitter, 40, 1500);
        RetrievalEngine.Settings settings = new RetrievalEngine.Settings(persistDir, true, autoPersist, 10, 0.7d, 0.3d,
                2.0d);
        RetrievalEngine engine = new RetrievalEngine(backend, embeddingProvider, chunker, prepareExecutor,
                objectMapper, settings);
        engines.add(engine);
        return engine;
    }
}
