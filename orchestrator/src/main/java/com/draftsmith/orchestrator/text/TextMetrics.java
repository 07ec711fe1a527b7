package com.draftsmith.orchestrator.text;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Language-sensitive length measurement used for segment sizing,
 * pass-through detection and history compression thresholds.
 *
 * A string that contains CJK ideographs is measured by its ideograph count;
 * any other string is measured by its Latin letter count. Whitespace, digits
 * and punctuation never count.
 */
public final class TextMetrics {

    private static final Pattern CJK_IDEOGRAPH = Pattern.compile("[\\u4e00-\\u9fff]");
    private static final Pattern LATIN_LETTER  = Pattern.compile("[a-zA-Z]");

    private TextMetrics() {}

    /** Measured length of {@code text}; {@code null} measures as 0. */
    public static int measure(String text) {
        if (text == null || text.isEmpty()) return 0;
        int ideographs = count(CJK_IDEOGRAPH, text);
        return ideographs > 0 ? ideographs : count(LATIN_LETTER, text);
    }

    /** Number of CJK ideographs in {@code text}. */
    public static int ideographCount(String text) {
        return text == null ? 0 : count(CJK_IDEOGRAPH, text);
    }

    private static int count(Pattern pattern, String text) {
        Matcher m = pattern.matcher(text);
        int n = 0;
        while (m.find()) n++;
        return n;
    }
}
