package ch.so.arp.rag.engine.chunking;

import java.util.List;

import dev.langchain4j.data.document.Document;
import dev.langchain4j.data.document.DocumentSplitter;
import dev.langchain4j.data.document.splitter.DocumentSplitters;
import dev.langchain4j.data.segment.TextSegment;

/**
 * Paragraph and sentence aware splitter for natural language. Paragraphs are
 * kept whole where they fit; longer ones fall back to lines, sentences and
 * finally words.
 */
public class ProseSplitter implements TextSplitter {

    private final DocumentSplitter delegate;

    public ProseSplitter(int maxChunkChars, int overlapChars) {
        if (maxChunkChars <= 0) {
            throw new IllegalArgumentException("maxChunkChars must be positive");
        }
        if (overlapChars < 0 || overlapChars >= maxChunkChars) {
            throw new IllegalArgumentException("overlapChars must be in [0, maxChunkChars)");
        }
        this.delegate = DocumentSplitters.recursive(maxChunkChars, overlapChars);
    }

    @Override
    public List<String> split(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        return delegate.split(Document.from(text)).stream()
                .map(TextSegment::text)
                .filter(chunk -> !chunk.isBlank())
                .toList();
    }
}
