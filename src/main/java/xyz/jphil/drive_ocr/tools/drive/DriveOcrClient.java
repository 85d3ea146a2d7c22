package xyz.jphil.drive_ocr.tools.drive;

import lombok.Getter;
import lombok.experimental.Accessors;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.MultipartBody;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.json.JSONException;
import org.json.JSONObject;
import xyz.jphil.drive_ocr.tools.LogFormatter;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * {@link RemoteOcrClient} backed by the Google Drive v3 REST API.
 *
 * <p>Uploading an image with the Google Docs target mime type makes Drive run OCR on it;
 * exporting the resulting document as {@code text/plain} returns the recognised text.
 * Every call runs under the supplied {@link Retrier}.
 */
@Getter
@Accessors(fluent = true)
public class DriveOcrClient implements RemoteOcrClient {

    public static final HttpUrl GOOGLE_APIS = HttpUrl.get("https://www.googleapis.com/");
    static final String GOOGLE_DOCS_MIME_TYPE = "application/vnd.google-apps.document";

    private static final MediaType JSON = MediaType.get("application/json; charset=UTF-8");
    private static final MediaType MULTIPART_RELATED = MediaType.get("multipart/related");

    private final OkHttpClient http;
    private final HttpUrl baseUrl;
    private final Retrier retrier;
    private final LogFormatter log;

    public DriveOcrClient(OkHttpClient http, HttpUrl baseUrl, Retrier retrier, LogFormatter log) {
        this.http = http;
        this.baseUrl = baseUrl;
        this.retrier = retrier;
        this.log = log;
    }

    public static DriveOcrClient create(Retrier retrier, LogFormatter log) {
        return new DriveOcrClient(defaultHttpClient(), GOOGLE_APIS, retrier, log);
    }

    public static OkHttpClient defaultHttpClient() {
        return new OkHttpClient.Builder()
            .connectTimeout(30, TimeUnit.SECONDS)
            .readTimeout(120, TimeUnit.SECONDS)
            .writeTimeout(120, TimeUnit.SECONDS)
            .build();
    }

    @Override
    public String upload(Path image, String accessToken) throws IOException {
        if (!Files.isRegularFile(image)) {
            throw new NoSuchFileException(image.toString());
        }
        var metadata = new JSONObject()
            .put("name", UUID.randomUUID().toString())
            .put("mimeType", GOOGLE_DOCS_MIME_TYPE);
        var media = MediaType.get(mediaTypeFor(image));

        var url = baseUrl.newBuilder()
            .addPathSegments("upload/drive/v3/files")
            .addQueryParameter("uploadType", "multipart")
            .addQueryParameter("fields", "id")
            .build();

        return retrier.call("Upload", () -> {
            var body = new MultipartBody.Builder()
                .setType(MULTIPART_RELATED)
                .addPart(RequestBody.create(metadata.toString(), JSON))
                .addPart(RequestBody.create(image.toFile(), media))
                .build();
            var request = authorized(url, accessToken).post(body).build();
            try (Response response = http.newCall(request).execute()) {
                var text = bodyOf(response);
                if (!response.isSuccessful()) {
                    throw new DriveApiException("Upload", response.code(), text);
                }
                return parseId(text);
            }
        });
    }

    @Override
    public String exportText(String remoteId, String accessToken) throws IOException {
        var url = fileUrl(remoteId).newBuilder()
            .addPathSegment("export")
            .addQueryParameter("mimeType", "text/plain")
            .build();

        var raw = retrier.call("Export", () -> {
            var request = authorized(url, accessToken).get().build();
            try (Response response = http.newCall(request).execute()) {
                var text = bodyOf(response);
                if (!response.isSuccessful()) {
                    throw new DriveApiException("Export", response.code(), text);
                }
                return text;
            }
        });
        return ExportTextCleaner.clean(raw);
    }

    @Override
    public void delete(String remoteId, String accessToken) throws IOException {
        var url = fileUrl(remoteId);
        retrier.call("Delete", () -> {
            var request = authorized(url, accessToken).delete().build();
            try (Response response = http.newCall(request).execute()) {
                // 204 No Content is the normal answer
                if (!response.isSuccessful()) {
                    throw new DriveApiException("Delete", response.code(), bodyOf(response));
                }
            }
            log.debug("DRIVE", "Deleted remote document " + remoteId);
            return null;
        });
    }

    static String mediaTypeFor(Path file) {
        var name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        int dot = name.lastIndexOf('.');
        var ext = dot < 0 ? "" : name.substring(dot + 1);
        return switch (ext) {
            case "png" -> "image/png";
            case "jpg", "jpeg" -> "image/jpeg";
            case "pdf" -> "application/pdf";
            default -> "application/octet-stream";
        };
    }

    private HttpUrl fileUrl(String remoteId) {
        return baseUrl.newBuilder()
            .addPathSegments("drive/v3/files")
            .addPathSegment(remoteId)
            .build();
    }

    private static Request.Builder authorized(HttpUrl url, String accessToken) {
        return new Request.Builder()
            .url(url)
            .header("Authorization", "Bearer " + accessToken);
    }

    private static String bodyOf(Response response) throws IOException {
        var body = response.body();
        return body == null ? "" : body.string();
    }

    private static String parseId(String json) throws IOException {
        try {
            return new JSONObject(json).getString("id");
        } catch (JSONException e) {
            throw new IOException("Malformed upload response: " + json, e);
        }
    }
}
