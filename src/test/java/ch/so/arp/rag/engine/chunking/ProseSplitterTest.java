package ch.so.arp.rag.engine.chunking;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;

import org.junit.jupiter.api.Test;

class ProseSplitterTest {

    @Test
    void shortTextStaysInOneChunk() {
        String text = "Zonenplan und Baureglement.\n\nDie Bauzone umfasst das Siedlungsgebiet.";

        assertThat(new ProseSplitter(1000, 100).split(text)).containsExactly(text);
    }

    @Test
    void longTextIsSplitBelowTheLimit() {
        String sentence = "Die Gemeinde erlaesst einen Nutzungsplan fuer das ganze Gebiet. ";
        String text = sentence.repeat(20);

        List<String> chunks = new ProseSplitter(200, 20).split(text);

        assertThat(chunks).hasSizeGreaterThan(1);
        assertThat(chunks).allSatisfy(chunk -> assertThat(chunk.length()).isLessThanOrEqualTo(200));
    }

    @Test
    void blankTextHasNoChunks() {
        assertThat(new ProseSplitter(100, 10).split("   ")).isEmpty();
    }

    @Test
    void overlapMustBeSmallerThanChunk() {
        assertThatThrownBy(() -> new ProseSplitter(100, 100)).isInstanceOf(IllegalArgumentException.class);
    }
}
