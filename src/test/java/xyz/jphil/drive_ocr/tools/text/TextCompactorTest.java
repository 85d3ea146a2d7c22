package xyz.jphil.drive_ocr.tools.text;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

public class TextCompactorTest {

    private static String lines(int count, String prefix) {
        return IntStream.rangeClosed(1, count)
            .mapToObj(i -> prefix + i)
            .collect(Collectors.joining("\n"));
    }

    @Test
    void shortTextIsUnchanged() {
        var text = lines(40, "line ");
        assertEquals(text, TextCompactor.compact(text));
        assertEquals("", TextCompactor.compact(""));
    }

    @Test
    void manyShortLinesShrinkToForty() {
        var compacted = TextCompactor.compact(lines(50, "w"));

        assertEquals(40, compacted.split("\n", -1).length);
        assertEquals(40, TextCompactor.effectiveLineCount(compacted));
    }

    @Test
    void compactionIsIdempotent() {
        var once = TextCompactor.compact(lines(75, "entry "));
        assertEquals(once, TextCompactor.compact(once));
    }

    @Test
    void wordsAndOrderArePreserved() {
        var text = lines(60, "token");
        var compacted = TextCompactor.compact(text);

        assertEquals(Arrays.asList(text.split("\\s+")), Arrays.asList(compacted.split("\\s+")));
    }

    @Test
    void firstMinimalPairIsJoinedOnTies() {
        var text = String.join("\n", Collections.nCopies(41, "ab"));
        var compacted = TextCompactor.compact(text);

        var result = compacted.split("\n", -1);
        assertEquals(40, result.length);
        assertEquals("ab ab", result[0]);
        assertEquals("ab", result[1]);
    }

    @Test
    void longLinesCountTwice() {
        var longLine = "x".repeat(100);
        var text = String.join("\n", Collections.nCopies(30, longLine));
        assertEquals(60, TextCompactor.effectiveLineCount(text));

        var compacted = TextCompactor.compact(text);
        assertTrue(TextCompactor.effectiveLineCount(compacted) <= TextCompactor.MAX_EFFECTIVE_LINES);
        assertEquals(20, compacted.split("\n", -1).length);
    }

    @Test
    void singleHugeLineIsLeftAlone() {
        var text = "y".repeat(5000);
        assertEquals(text, TextCompactor.compact(text));
    }
}
