package xyz.jphil.drive_ocr.tools.drive;

import java.io.Serial;

/**
 * No usable access token. Fatal for the whole job, since every later call would fail too.
 */
public class NotAuthenticatedException extends RuntimeException {

    @Serial
    private static final long serialVersionUID = -2876043911857164521L;

    public NotAuthenticatedException() {
        super("Not authenticated: no valid access token");
    }

    public NotAuthenticatedException(String message) {
        super(message);
    }
}
