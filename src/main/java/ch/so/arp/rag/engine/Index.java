package ch.so.arp.rag.engine;

import java.io.Closeable;
import java.util.Objects;

import ch.so.arp.rag.engine.retrieval.KeywordIndex;
import ch.so.arp.rag.engine.store.DocumentStore;

/**
 * A named index: the document store and the keyword index kept next to the
 * vectors the backend holds under the same name.
 */
record Index(String name, DocumentStore store, KeywordIndex keywords) implements Closeable {

    Index {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(store, "store");
        Objects.requireNonNull(keywords, "keywords");
    }

    static Index empty(String name) {
        return new Index(name, new DocumentStore(), new KeywordIndex());
    }

    @Override
    public void close() {
        keywords.close();
    }
}
