package xyz.jphil.drive_ocr.tools.drive;

import lombok.RequiredArgsConstructor;

/**
 * Fixed bearer token, e.g. from {@code --access-token}. Never refreshes.
 */
@RequiredArgsConstructor
public class StaticCredentialProvider implements CredentialProvider {

    private final String accessToken;

    @Override
    public String ensureValidToken() {
        return accessToken == null || accessToken.isBlank() ? null : accessToken;
    }
}
