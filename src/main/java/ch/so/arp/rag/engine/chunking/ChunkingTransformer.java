package ch.so.arp.rag.engine.chunking;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.so.arp.rag.engine.Document;
import ch.so.arp.rag.engine.InvalidRequestException;
import ch.so.arp.rag.engine.Metadata;

/**
 * Chooses a splitting policy per document from its metadata.
 * {@code split_type=code} requires a {@code language} entry and uses a
 * {@link CodeSplitter} built once per language; every other document is split
 * as prose.
 */
public class ChunkingTransformer {

    private static final Logger LOGGER = LoggerFactory.getLogger(ChunkingTransformer.class);

    static final String CODE_SPLIT_TYPE = "code";

    private final TextSplitter proseSplitter;
    private final int codeChunkLines;
    private final int codeMaxChars;
    private final Map<CodeLanguage, CodeSplitter> codeSplitters = new ConcurrentHashMap<>();

    public ChunkingTransformer(TextSplitter proseSplitter, int codeChunkLines, int codeMaxChars) {
        this.proseSplitter = Objects.requireNonNull(proseSplitter, "proseSplitter");
        this.codeChunkLines = codeChunkLines;
        this.codeMaxChars = codeMaxChars;
    }

    /**
     * Splits a document into chunk texts.
     *
     * @throws InvalidRequestException if the code policy is requested without a
     *                                 language or with an unsupported one
     */
    public List<String> split(Document document) {
        return splitterFor(document.metadata()).split(document.text());
    }

    /**
     * Fails fast on documents whose policy cannot be honoured.
     */
    public void validate(Document document) {
        splitterFor(document.metadata());
    }

    TextSplitter splitterFor(Map<String, String> metadata) {
        String splitType = metadata.getOrDefault(Metadata.SPLIT_TYPE, "default");
        if (!CODE_SPLIT_TYPE.equals(splitType)) {
            return proseSplitter;
        }
        String languageName = metadata.get(Metadata.LANGUAGE);
        if (languageName == null || languageName.isBlank()) {
            throw new InvalidRequestException("Language not specified in metadata of a document with split_type 'code'.");
        }
        CodeLanguage language = CodeLanguage.forName(languageName)
                .orElseThrow(() -> new InvalidRequestException("Unsupported code language '" + languageName + "'."));
        return codeSplitters.computeIfAbsent(language, key -> {
            LOGGER.debug("Creating code splitter for {}", key);
            return new CodeSplitter(key, codeChunkLines, codeMaxChars);
        });
    }

    int cachedCodeSplitters() {
        return codeSplitters.size();
    }
}
