package ch.so.arp.rag.engine.retrieval;

import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.standard.StandardAnalyzer;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.StoredField;
import org.apache.lucene.document.StringField;
import org.apache.lucene.document.TextField;
import org.apache.lucene.index.IndexReader;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.index.IndexableField;
import org.apache.lucene.index.Term;
import org.apache.lucene.search.BooleanClause;
import org.apache.lucene.search.BooleanQuery;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.MatchNoDocsQuery;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.ScoreDoc;
import org.apache.lucene.search.SearcherFactory;
import org.apache.lucene.search.SearcherManager;
import org.apache.lucene.search.TermQuery;
import org.apache.lucene.search.TopDocs;
import org.apache.lucene.search.similarities.BM25Similarity;
import org.apache.lucene.store.ByteBuffersDirectory;
import org.apache.lucene.store.Directory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.so.arp.rag.engine.MetadataFilter;
import ch.so.arp.rag.engine.RankedResult;
import ch.so.arp.rag.engine.ScoreKind;
import ch.so.arp.rag.engine.backend.IndexedNode;

/**
 * BM25 keyword index over the nodes of one index, held in memory. It is
 * derived state: the engine rebuilds it from the document store or the
 * vector backend whenever an index is restored.
 */
public class KeywordIndex implements KeywordRetriever, Closeable {

    private static final Logger LOGGER = LoggerFactory.getLogger(KeywordIndex.class);

    static final String FIELD_NODE_ID = "node_id";
    static final String FIELD_DOC_ID = "doc_id";
    static final String FIELD_CONTENT = "content";
    static final String META_PREFIX = "meta_";

    private final Directory directory;
    private final Analyzer analyzer;
    private final IndexWriter writer;
    private final SearcherManager searcherManager;

    public KeywordIndex() {
        try {
            this.directory = new ByteBuffersDirectory();
            this.analyzer = new StandardAnalyzer();
            IndexWriterConfig config = new IndexWriterConfig(analyzer);
            config.setOpenMode(IndexWriterConfig.OpenMode.CREATE);
            config.setSimilarity(new BM25Similarity());
            this.writer = new IndexWriter(directory, config);
            this.searcherManager = new SearcherManager(writer, new SearcherFactory() {
                @Override
                public IndexSearcher newSearcher(IndexReader reader, IndexReader previousReader) {
                    IndexSearcher searcher = new IndexSearcher(reader);
                    searcher.setSimilarity(new BM25Similarity());
                    return searcher;
                }
            });
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to initialise keyword index", ex);
        }
    }

    public void add(Collection<IndexedNode> nodes) {
        if (nodes.isEmpty()) {
            return;
        }
        try {
            for (IndexedNode node : nodes) {
                writer.updateDocument(new Term(FIELD_NODE_ID, node.nodeId()), toLuceneDocument(node));
            }
            searcherManager.maybeRefreshBlocking();
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to add nodes to keyword index", ex);
        }
    }

    public void delete(Collection<String> nodeIds) {
        if (nodeIds.isEmpty()) {
            return;
        }
        try {
            Term[] terms = nodeIds.stream().map(id -> new Term(FIELD_NODE_ID, id)).toArray(Term[]::new);
            writer.deleteDocuments(terms);
            searcherManager.maybeRefreshBlocking();
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to delete nodes from keyword index", ex);
        }
    }

    @Override
    public int size() {
        try {
            IndexSearcher searcher = searcherManager.acquire();
            try {
                return searcher.getIndexReader().numDocs();
            } finally {
                searcherManager.release(searcher);
            }
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to read keyword index", ex);
        }
    }

    @Override
    public List<RankedResult> retrieve(String query, int topK, MetadataFilter filter) {
        if (topK <= 0) {
            return List.of();
        }
        Query luceneQuery = buildQuery(query, filter);
        try {
            IndexSearcher searcher = searcherManager.acquire();
            try {
                TopDocs topDocs = searcher.search(luceneQuery, topK);
                List<RankedResult> results = new ArrayList<>(topDocs.scoreDocs.length);
                for (ScoreDoc scoreDoc : topDocs.scoreDocs) {
                    Document doc = searcher.storedFields().document(scoreDoc.doc);
                    results.add(new RankedResult(doc.get(FIELD_NODE_ID), doc.get(FIELD_DOC_ID), doc.get(FIELD_CONTENT),
                            scoreDoc.score, ScoreKind.KEYWORD, readMetadata(doc)));
                }
                LOGGER.debug("Keyword search returned {} of {} requested hits", results.size(), topK);
                return results;
            } finally {
                searcherManager.release(searcher);
            }
        } catch (IOException ex) {
            throw new UncheckedIOException("Keyword search failed", ex);
        }
    }

    @Override
    public void close() {
        try {
            searcherManager.close();
            writer.close();
            directory.close();
        } catch (IOException ex) {
            LOGGER.warn("Error closing keyword index: {}", ex.getMessage(), ex);
        }
    }

    private Query buildQuery(String query, MetadataFilter filter) {
        Set<String> terms = analyze(query);
        int maxTerms = IndexSearcher.getMaxClauseCount() - filter.conditions().size() - 1;
        BooleanQuery.Builder textBuilder = new BooleanQuery.Builder();
        int added = 0;
        for (String term : terms) {
            if (added == maxTerms) {
                LOGGER.debug("Keyword query truncated to its first {} of {} distinct terms", maxTerms, terms.size());
                break;
            }
            textBuilder.add(new TermQuery(new Term(FIELD_CONTENT, term)), BooleanClause.Occur.SHOULD);
            added++;
        }
        Query textQuery = added == 0 ? new MatchNoDocsQuery() : textBuilder.build();
        if (filter.isEmpty()) {
            return textQuery;
        }
        BooleanQuery.Builder builder = new BooleanQuery.Builder().add(textQuery, BooleanClause.Occur.MUST);
        filter.conditions().forEach((key, value) -> builder.add(new TermQuery(new Term(META_PREFIX + key, value)),
                BooleanClause.Occur.FILTER));
        return builder.build();
    }

    /**
     * Distinct terms of the query in order of first appearance, produced by
     * the same analyzer that indexed the content.
     */
    Set<String> analyze(String text) {
        Set<String> terms = new LinkedHashSet<>();
        try (TokenStream tokenStream = analyzer.tokenStream(FIELD_CONTENT, text)) {
            CharTermAttribute attribute = tokenStream.addAttribute(CharTermAttribute.class);
            tokenStream.reset();
            while (tokenStream.incrementToken()) {
                terms.add(attribute.toString());
            }
            tokenStream.end();
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to analyze keyword query", ex);
        }
        return terms;
    }

    private static Document toLuceneDocument(IndexedNode node) {
        Document doc = new Document();
        doc.add(new StringField(FIELD_NODE_ID, node.nodeId(), Field.Store.YES));
        doc.add(new StringField(FIELD_DOC_ID, node.docId(), Field.Store.YES));
        doc.add(new StoredField("chunk_index", node.chunkIndex()));
        doc.add(new TextField(FIELD_CONTENT, node.text(), Field.Store.YES));
        node.metadata().forEach((key, value) -> doc.add(new StringField(META_PREFIX + key, value, Field.Store.YES)));
        return doc;
    }

    private static Map<String, String> readMetadata(Document doc) {
        Map<String, String> metadata = new TreeMap<>();
        for (IndexableField field : doc.getFields()) {
            if (field.name().startsWith(META_PREFIX)) {
                metadata.put(field.name().substring(META_PREFIX.length()), field.stringValue());
            }
        }
        return metadata;
    }
}
