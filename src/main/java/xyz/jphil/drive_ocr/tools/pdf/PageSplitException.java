package xyz.jphil.drive_ocr.tools.pdf;

import java.io.IOException;
import java.io.Serial;

/**
 * A PDF could not be opened or one of its pages could not be rendered.
 * Fails the whole file; no partial page list is ever produced.
 */
public class PageSplitException extends IOException {

    @Serial
    private static final long serialVersionUID = 3345190776251288017L;

    public PageSplitException(String message) {
        super(message);
    }

    public PageSplitException(String message, Throwable cause) {
        super(message, cause);
    }
}
