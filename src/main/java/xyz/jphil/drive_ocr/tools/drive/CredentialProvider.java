package xyz.jphil.drive_ocr.tools.drive;

/**
 * Source of bearer tokens for the remote OCR service.
 */
@FunctionalInterface
public interface CredentialProvider {

    /**
     * Returns a token that is valid right now, refreshing it first if needed.
     *
     * @return the access token, or {@code null} when the user is not authenticated
     *         and no refresh is possible
     */
    String ensureValidToken();

    /**
     * Like {@link #ensureValidToken()} but fails the job when no token is available.
     */
    default String requireToken() {
        var token = ensureValidToken();
        if (token == null || token.isBlank()) {
            throw new NotAuthenticatedException();
        }
        return token;
    }
}
