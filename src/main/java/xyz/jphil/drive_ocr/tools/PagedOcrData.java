package xyz.jphil.drive_ocr.tools;

import java.nio.file.Path;
import java.util.Collections;
import java.util.List;

/**
 * Common data structures for multi-page OCR processing
 */
public class PagedOcrData {

    /**
     * One page image ready for OCR. {@code index} is zero-based and fixes the
     * position of the page's text in the extraction result.
     */
    public record PageImage(
        int index,
        Path imagePath,
        Path sourceFile
    ) {
        public int pageNumber() {
            return index + 1;
        }
    }

    /**
     * A page whose OCR failed; its text slot holds the empty string
     */
    public record PageError(
        int index,
        String message
    ) {}

    /**
     * Ordered OCR output of one file: {@code texts.size()} always equals the page count
     */
    public record ExtractionResult(
        List<String> texts,
        List<PageError> errors
    ) {
        public ExtractionResult {
            texts = Collections.unmodifiableList(texts);
            errors = List.copyOf(errors);
        }

        public boolean hasErrors() {
            return !errors.isEmpty();
        }
    }
}
