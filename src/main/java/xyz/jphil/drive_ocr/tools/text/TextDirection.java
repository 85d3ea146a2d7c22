package xyz.jphil.drive_ocr.tools.text;

import java.util.regex.Pattern;

/**
 * Right-to-left detection for DOCX paragraph alignment.
 */
public final class TextDirection {

    private static final Pattern ARABIC = Pattern.compile("[\\u0600-\\u06FF]");
    // letters and symbols that are neither Arabic, whitespace, ASCII digits nor punctuation
    private static final Pattern OTHER = Pattern.compile("(?U)[^\\u0600-\\u06FF\\s0-9\\p{P}]");

    private TextDirection() {}

    /**
     * True when the Arabic block characters are at least as many as the other counted
     * characters. Text with neither (empty, digits, punctuation) therefore reports true.
     */
    public static boolean isPredominantlyArabic(String text) {
        long arabic = ARABIC.matcher(text).results().count();
        long other = OTHER.matcher(text).results().count();
        return arabic >= other;
    }
}
