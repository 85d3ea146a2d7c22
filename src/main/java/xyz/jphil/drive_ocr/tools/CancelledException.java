package xyz.jphil.drive_ocr.tools;

import java.io.Serial;

/**
 * Signals that the user cancelled the running job. Not an error: callers report it
 * as a cancelled outcome and never log it as a failure.
 */
public class CancelledException extends RuntimeException {

    @Serial
    private static final long serialVersionUID = 1L;

    public CancelledException() {
        super("Operation cancelled");
    }

    public CancelledException(String message) {
        super(message);
    }
}
