package com.draftsmith.orchestrator.text;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Splits a document into ordered, bounded-size segments.
 *
 * Paragraphs (lines) that fit within {@code maxSize} become one segment each.
 * Longer paragraphs are cut after sentence-terminal punctuation and the
 * sentences are re-packed greedily. A single sentence longer than
 * {@code maxSize} is emitted whole, so the cap is best-effort.
 *
 * Sizes are measured with {@link TextMetrics#measure}. Blank lines are
 * dropped and every emitted segment is trimmed, which makes the output a
 * fixed point: re-segmenting the joined output yields the same list.
 */
public final class Segmenter {

    // Zero-width split after each terminator keeps the punctuation on its sentence.
    private static final Pattern SENTENCE_END = Pattern.compile("(?<=[。！？；!?;.])");

    private Segmenter() {}

    public static List<String> segment(String text, int maxSize) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be positive, got " + maxSize);
        }
        List<String> segments = new ArrayList<>();
        if (text == null || text.isBlank()) return segments;

        for (String line : text.split("\n")) {
            String paragraph = line.strip();
            if (paragraph.isEmpty()) continue;

            if (TextMetrics.measure(paragraph) <= maxSize) {
                segments.add(paragraph);
            } else {
                splitParagraph(paragraph, maxSize, segments);
            }
        }
        return segments;
    }

    private static void splitParagraph(String paragraph, int maxSize, List<String> out) {
        StringBuilder current = new StringBuilder();
        for (String sentence : SENTENCE_END.split(paragraph)) {
            if (TextMetrics.measure(current + sentence) <= maxSize) {
                current.append(sentence);
            } else {
                flush(current, out);
                current.setLength(0);
                current.append(sentence);
            }
        }
        flush(current, out);
    }

    private static void flush(CharSequence buffer, List<String> out) {
        String segment = buffer.toString().strip();
        if (!segment.isEmpty()) out.add(segment);
    }
}
