package xyz.jphil.drive_ocr.tools.drive;

import okhttp3.FormBody;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.json.JSONException;
import org.json.JSONObject;
import xyz.jphil.drive_ocr.tools.LogFormatter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Access token kept in a JSON file ({@code access_token}, {@code refresh_token},
 * {@code expires_at} in epoch seconds) and renewed through the OAuth refresh-token grant
 * shortly before it expires. The renewed token is written back to the same file.
 *
 * <p>Shared by all OCR workers of a job, hence synchronized.
 */
public class StoredTokenCredentialProvider implements CredentialProvider {

    public static final HttpUrl GOOGLE_TOKEN_ENDPOINT = HttpUrl.get("https://oauth2.googleapis.com/token");
    static final Duration REFRESH_MARGIN = Duration.ofMinutes(5);

    public record StoredToken(String accessToken, String refreshToken, long expiresAt) {

        static StoredToken fromJson(String json) {
            var obj = new JSONObject(json);
            return new StoredToken(
                obj.optString("access_token", null),
                obj.optString("refresh_token", null),
                obj.optLong("expires_at", 0));
        }

        String toJson() {
            return new JSONObject()
                .put("access_token", accessToken)
                .put("refresh_token", refreshToken)
                .put("expires_at", expiresAt)
                .toString(2);
        }

        boolean hasRefreshToken() {
            return refreshToken != null && !refreshToken.isBlank();
        }
    }

    private final Path tokenFile;
    private final String clientId;
    private final String clientSecret;
    private final OkHttpClient http;
    private final HttpUrl tokenEndpoint;
    private final Clock clock;
    private final LogFormatter log;

    private StoredToken current;
    private boolean loaded;

    public StoredTokenCredentialProvider(Path tokenFile, String clientId, String clientSecret,
                                         OkHttpClient http, HttpUrl tokenEndpoint, Clock clock, LogFormatter log) {
        this.tokenFile = tokenFile;
        this.clientId = clientId;
        this.clientSecret = clientSecret;
        this.http = http;
        this.tokenEndpoint = tokenEndpoint;
        this.clock = clock;
        this.log = log;
    }

    public StoredTokenCredentialProvider(Path tokenFile, String clientId, String clientSecret, LogFormatter log) {
        this(tokenFile, clientId, clientSecret, DriveOcrClient.defaultHttpClient(),
            GOOGLE_TOKEN_ENDPOINT, Clock.systemUTC(), log);
    }

    @Override
    public synchronized String ensureValidToken() {
        if (!loaded) {
            current = load();
            loaded = true;
        }
        if (current == null) return null;
        if (!isAuthenticated() && !current.hasRefreshToken()) {
            return null;
        }
        if (needsRefresh()) {
            try {
                current = refresh(current);
                store(current);
            } catch (IOException | JSONException e) {
                log.error("AUTH", "Token refresh failed: " + e.getMessage());
                current = null;
                return null;
            }
        }
        return current.accessToken();
    }

    boolean isAuthenticated() {
        return current != null && current.accessToken() != null
            && clock.instant().isBefore(Instant.ofEpochSecond(current.expiresAt()));
    }

    boolean needsRefresh() {
        if (current == null || !current.hasRefreshToken()) return false;
        var refreshFrom = Instant.ofEpochSecond(current.expiresAt()).minus(REFRESH_MARGIN);
        return !clock.instant().isBefore(refreshFrom);
    }

    private StoredToken load() {
        if (!Files.isRegularFile(tokenFile)) {
            log.debug("AUTH", "No stored token at " + tokenFile);
            return null;
        }
        try {
            return StoredToken.fromJson(Files.readString(tokenFile, StandardCharsets.UTF_8));
        } catch (IOException | JSONException e) {
            log.error("AUTH", "Unreadable token file " + tokenFile + ": " + e.getMessage());
            return null;
        }
    }

    private StoredToken refresh(StoredToken token) throws IOException {
        if (clientId == null || clientSecret == null) {
            throw new IOException("client id and secret are required to refresh the access token");
        }
        log.step("AUTH", "Refreshing access token");
        var form = new FormBody.Builder()
            .add("refresh_token", token.refreshToken())
            .add("client_id", clientId)
            .add("client_secret", clientSecret)
            .add("grant_type", "refresh_token")
            .build();
        var request = new Request.Builder().url(tokenEndpoint).post(form).build();
        try (Response response = http.newCall(request).execute()) {
            var body = response.body() == null ? "" : response.body().string();
            if (!response.isSuccessful()) {
                throw new IOException("Token endpoint answered " + response.code() + ": " + body);
            }
            var json = new JSONObject(body);
            var expiresAt = clock.instant().getEpochSecond() + json.getLong("expires_in");
            // Google omits the refresh token on refresh; keep the one we have
            var refreshToken = json.optString("refresh_token", "");
            return new StoredToken(
                json.getString("access_token"),
                refreshToken.isBlank() ? token.refreshToken() : refreshToken,
                expiresAt);
        }
    }

    private void store(StoredToken token) throws IOException {
        var parent = tokenFile.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        Path tempFile = tokenFile.resolveSibling(tokenFile.getFileName() + ".tmp");
        try {
            Files.writeString(tempFile, token.toJson(), StandardCharsets.UTF_8);
            Files.move(tempFile, tokenFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            Files.deleteIfExists(tempFile);
            throw e;
        }
        log.success("AUTH", "Access token refreshed, valid until " + Instant.ofEpochSecond(token.expiresAt()));
    }
}
