package ch.so.arp.rag.engine.web;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;

import org.springframework.http.MediaType;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import ch.so.arp.rag.engine.AllDocumentsPage;
import ch.so.arp.rag.engine.DeleteResult;
import ch.so.arp.rag.engine.DocumentPage;
import ch.so.arp.rag.engine.MetadataFilter;
import ch.so.arp.rag.engine.RankedResult;
import ch.so.arp.rag.engine.RetrievalEngine;
import ch.so.arp.rag.engine.StoredDocument;
import ch.so.arp.rag.engine.UpdateResult;
import ch.so.arp.rag.engine.query.QueryRequest;
import ch.so.arp.rag.engine.query.QueryResult;
import ch.so.arp.rag.engine.query.QueryService;

/**
 * HTTP surface of the retrieval engine.
 */
@RestController
@Validated
public class RagController {

    private final RetrievalEngine engine;
    private final QueryService queryService;

    public RagController(RetrievalEngine engine, QueryService queryService) {
        this.engine = engine;
        this.queryService = queryService;
    }

    @GetMapping(path = "/health", produces = MediaType.APPLICATION_JSON_VALUE)
    public HealthStatus health() {
        return new HealthStatus("Healthy", engine.backendType().propertyValue(), engine.listIndexes().size());
    }

    @PostMapping(path = "/index", consumes = MediaType.APPLICATION_JSON_VALUE)
    public List<StoredDocument> index(@Valid @RequestBody IndexRequest request) {
        return engine.index(request.indexName(), request.toDocuments());
    }

    @PostMapping(path = "/query", consumes = MediaType.APPLICATION_JSON_VALUE)
    public QueryResult query(@RequestBody QueryRequest request) {
        return queryService.query(request);
    }

    @PostMapping(path = "/retrieve", consumes = MediaType.APPLICATION_JSON_VALUE)
    public List<RankedResult> retrieve(@Valid @RequestBody RetrieveRequest request) {
        MetadataFilter filter = request.metadataFilter() == null ? MetadataFilter.none()
                : MetadataFilter.of(request.metadataFilter());
        return engine.retrieve(request.indexName(), request.query(), request.topK(), filter);
    }

    @GetMapping("/indexes")
    public List<String> listIndexes() {
        return engine.listIndexes();
    }

    @GetMapping("/indexes/{indexName}/documents")
    public DocumentPage listDocuments(@PathVariable String indexName,
            @RequestParam(defaultValue = "10") @Min(1) @Max(100) int limit,
            @RequestParam(defaultValue = "0") @Min(0) int offset,
            @RequestParam(name = "max_text_length", required = false) @Min(1) Integer maxTextLength) {
        return engine.listDocuments(indexName, limit, offset, maxTextLength);
    }

    @GetMapping("/indexes/{indexName}/documents/{docId}")
    public StoredDocument getDocument(@PathVariable String indexName, @PathVariable String docId,
            @RequestParam(name = "max_text_length", required = false) @Min(1) Integer maxTextLength) {
        return engine.getDocument(indexName, docId, maxTextLength);
    }

    @PostMapping(path = "/indexes/{indexName}/documents", consumes = MediaType.APPLICATION_JSON_VALUE)
    public UpdateResult updateDocuments(@PathVariable String indexName, @Valid @RequestBody UpdateRequest request) {
        return engine.update(indexName, request.toUpdates());
    }

    @PostMapping(path = "/indexes/{indexName}/documents/delete", consumes = MediaType.APPLICATION_JSON_VALUE)
    public DeleteResult deleteDocuments(@PathVariable String indexName, @Valid @RequestBody DeleteRequest request) {
        return engine.delete(indexName, request.docIds());
    }

    @GetMapping("/documents")
    public AllDocumentsPage listAllDocuments(@RequestParam(defaultValue = "10") @Min(1) @Max(100) int limit,
            @RequestParam(defaultValue = "0") @Min(0) int offset,
            @RequestParam(name = "max_text_length", required = false) @Min(1) Integer maxTextLength) {
        return engine.listAllDocuments(limit, offset, maxTextLength);
    }

    @PostMapping("/persist/{indexName}")
    public Map<String, String> persist(@PathVariable String indexName,
            @RequestParam(required = false) String path) {
        engine.persist(indexName, path == null ? null : Path.of(path));
        return Map.of("message", "Successfully persisted index " + indexName);
    }

    @PostMapping("/load/{indexName}")
    public Map<String, String> load(@PathVariable String indexName, @RequestParam(required = false) String path) {
        engine.restore(indexName, path == null ? null : Path.of(path));
        return Map.of("message", "Successfully loaded index " + indexName);
    }

    @DeleteMapping("/indexes/{indexName}")
    public Map<String, String> deleteIndex(@PathVariable String indexName) {
        engine.deleteIndex(indexName);
        return Map.of("message", "Successfully deleted index " + indexName);
    }
}
