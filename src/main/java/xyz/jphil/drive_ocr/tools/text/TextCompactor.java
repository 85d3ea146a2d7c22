package xyz.jphil.drive_ocr.tools.text;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Shrinks an OCR page to at most {@value #MAX_EFFECTIVE_LINES} effective lines by repeatedly
 * joining the adjacent pair of lines with the smallest combined length.
 *
 * <p>A line longer than {@value #LINE_WRAP_THRESHOLD} characters counts twice, since it will
 * wrap once rendered. Short lines (fragments, bullets, stray labels) are merged first, so
 * the text stays readable. The first minimal pair wins on ties, which keeps the result
 * deterministic. Every merge removes one line, so the loop always ends.
 */
public final class TextCompactor {

    public static final int MAX_EFFECTIVE_LINES = 40;
    public static final int LINE_WRAP_THRESHOLD = 80;

    private TextCompactor() {}

    public static String compact(String text) {
        List<String> lines = new ArrayList<>(Arrays.asList(text.split("\n", -1)));

        while (lines.size() >= 2 && effectiveLineCount(lines) > MAX_EFFECTIVE_LINES) {
            int minIndex = 0;
            int minCombined = Integer.MAX_VALUE;
            for (int i = 0; i < lines.size() - 1; i++) {
                int combined = lines.get(i).length() + lines.get(i + 1).length();
                if (combined < minCombined) {
                    minCombined = combined;
                    minIndex = i;
                }
            }
            lines.set(minIndex, lines.get(minIndex) + " " + lines.get(minIndex + 1));
            lines.remove(minIndex + 1);
        }
        return String.join("\n", lines);
    }

    public static int effectiveLineCount(List<String> lines) {
        int wrapped = 0;
        for (String line : lines) {
            if (line.length() > LINE_WRAP_THRESHOLD) wrapped++;
        }
        return lines.size() + wrapped;
    }

    public static int effectiveLineCount(String text) {
        return effectiveLineCount(Arrays.asList(text.split("\n", -1)));
    }
}
