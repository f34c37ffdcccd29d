package ch.so.arp.rag.engine.chunking;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Splits source code along declaration boundaries. The text is cut into
 * blocks, each starting at a declaration (together with the comment and
 * annotation lines directly above it). Consecutive blocks are packed into
 * chunks of at most {@code maxChars} characters; a single block that is too
 * large is cut into windows of {@code chunkLines} lines.
 */
public class CodeSplitter implements TextSplitter {

    private final CodeLanguage language;
    private final int chunkLines;
    private final int maxChars;

    public CodeSplitter(CodeLanguage language, int chunkLines, int maxChars) {
        this.language = Objects.requireNonNull(language, "language");
        if (chunkLines <= 0 || maxChars <= 0) {
            throw new IllegalArgumentException("chunkLines and maxChars must be positive");
        }
        this.chunkLines = chunkLines;
        this.maxChars = maxChars;
    }

    public CodeLanguage language() {
        return language;
    }

    @Override
    public List<String> split(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        List<String> lines = List.of(text.split("\\R", -1));
        List<String> chunks = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (List<String> block : blocks(lines)) {
            String blockText = String.join("\n", block);
            if (blockText.length() > maxChars) {
                flush(current, chunks);
                splitOversized(block, chunks);
                continue;
            }
            int joinedLength = current.length() + (current.length() > 0 ? 1 : 0) + blockText.length();
            if (joinedLength > maxChars) {
                flush(current, chunks);
            }
            if (current.length() > 0) {
                current.append('\n');
            }
            current.append(blockText);
        }
        flush(current, chunks);
        return chunks;
    }

    private List<List<String>> blocks(List<String> lines) {
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 1; i < lines.size(); i++) {
            if (!language.opensDeclaration(lines.get(i))) {
                continue;
            }
            int last = starts.get(starts.size() - 1);
            if (onlyPreamble(lines, last, i)) {
                // annotations or comments already opened this block
                continue;
            }
            int start = i;
            while (start - 1 > last && isPreamble(lines.get(start - 1))) {
                start--;
            }
            starts.add(start);
        }
        List<List<String>> blocks = new ArrayList<>(starts.size());
        for (int i = 0; i < starts.size(); i++) {
            int end = i + 1 < starts.size() ? starts.get(i + 1) : lines.size();
            blocks.add(lines.subList(starts.get(i), end));
        }
        return blocks;
    }

    private boolean onlyPreamble(List<String> lines, int from, int to) {
        for (int i = from; i < to; i++) {
            if (!isPreamble(lines.get(i))) {
                return false;
            }
        }
        return true;
    }

    private boolean isPreamble(String line) {
        String trimmed = line.trim();
        return trimmed.startsWith("//") || trimmed.startsWith("#") || trimmed.startsWith("/*")
                || trimmed.startsWith("*") || trimmed.startsWith("@")
                || (language == CodeLanguage.CSHARP && trimmed.startsWith("["));
    }

    private void splitOversized(List<String> block, List<String> chunks) {
        for (int from = 0; from < block.size(); from += chunkLines) {
            String window = String.join("\n", block.subList(from, Math.min(block.size(), from + chunkLines)));
            for (int offset = 0; offset < window.length(); offset += maxChars) {
                String piece = window.substring(offset, Math.min(window.length(), offset + maxChars));
                if (!piece.isBlank()) {
                    chunks.add(piece.stripTrailing());
                }
            }
        }
    }

    private static void flush(StringBuilder current, List<String> chunks) {
        String chunk = current.toString().stripTrailing();
        if (!chunk.isBlank()) {
            chunks.add(chunk);
        }
        current.setLength(0);
    }
}
