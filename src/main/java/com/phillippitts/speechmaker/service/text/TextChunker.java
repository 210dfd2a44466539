package com.phillippitts.speechmaker.service.text;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Splits text into bounded chunks for synthesis.
 *
 * <p>Text that fits is returned as a single chunk, unchanged. Longer text is walked in windows of
 * {@code maxChunkChars}; each window is cut, in order of preference:
 * <ol>
 *   <li>after the last sentence terminator ({@code .}, {@code !}, {@code ?}) followed by whitespace,</li>
 *   <li>at the last word boundary,</li>
 *   <li>at the hard character limit (a single token longer than the window).</li>
 * </ol>
 * Whitespace at a cut point is consumed. Every chunk is non-empty and at most
 * {@code maxChunkChars} long; the result is deterministic. Chunking never fails.
 *
 * <p>Stateless and thread-safe.
 */
@Component
public class TextChunker {

    /**
     * @param text source text
     * @param maxChunkChars upper bound on chunk length, at least 1
     * @return ordered, unmodifiable list of chunks
     * @throws IllegalArgumentException if maxChunkChars is below 1
     */
    public List<String> split(String text, int maxChunkChars) {
        Objects.requireNonNull(text, "text");
        if (maxChunkChars < 1) {
            throw new IllegalArgumentException("maxChunkChars must be >= 1, got " + maxChunkChars);
        }
        int len = text.length();
        if (len <= maxChunkChars) {
            return List.of(text);
        }

        List<String> chunks = new ArrayList<>();
        int pos = 0;
        while (pos < len) {
            if (pos > 0) {
                pos = skipWhitespace(text, pos);
                if (pos >= len) {
                    break;
                }
            }
            if (len - pos <= maxChunkChars) {
                chunks.add(text.substring(pos));
                break;
            }
            int end = pos + maxChunkChars;
            int cut = lastSentenceCut(text, pos, end);
            if (cut < 0) {
                cut = lastWordCut(text, pos, end);
            }
            if (cut < 0) {
                cut = end;
            }
            chunks.add(text.substring(pos, cut));
            pos = cut;
        }
        return List.copyOf(chunks);
    }

    /**
     * Index just past the last terminator in {@code [pos, end)} that is followed by whitespace.
     * The following character may sit at {@code end} (callers guarantee {@code end < length}).
     */
    private static int lastSentenceCut(String text, int pos, int end) {
        for (int i = end - 1; i >= pos; i--) {
            if (isTerminator(text.charAt(i)) && Character.isWhitespace(text.charAt(i + 1))) {
                return i + 1;
            }
        }
        return -1;
    }

    /** Last whitespace index in {@code (pos, end]} that ends a word. */
    private static int lastWordCut(String text, int pos, int end) {
        for (int w = end; w > pos; w--) {
            if (Character.isWhitespace(text.charAt(w)) && !Character.isWhitespace(text.charAt(w - 1))) {
                return w;
            }
        }
        return -1;
    }

    private static int skipWhitespace(String text, int pos) {
        int i = pos;
        while (i < text.length() && Character.isWhitespace(text.charAt(i))) {
            i++;
        }
        return i;
    }

    private static boolean isTerminator(char c) {
        return c == '.' || c == '!' || c == '?';
    }
}
