package ch.so.arp.rag.engine.chunking;

import java.util.List;

/**
 * Splits text into the chunks that become indexed nodes.
 */
@FunctionalInterface
public interface TextSplitter {

    /**
     * @return the non-blank chunks of {@code text}, in document order
     */
    List<String> split(String text);
}
