package xyz.jphil.drive_ocr.tools.drive;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.io.Serial;

/**
 * Non-2xx answer from the Drive REST API. Carries the HTTP status so that retry
 * classification never has to look at message text.
 */
@Getter
@Accessors(fluent = true)
public class DriveApiException extends RuntimeException {

    @Serial
    private static final long serialVersionUID = 6102399184420913751L;

    private final String operation;
    private final int statusCode;
    private final String responseBody;

    public DriveApiException(String operation, int statusCode, String responseBody) {
        super(operation + " failed (" + statusCode + "): " + abbreviate(responseBody));
        this.operation = operation;
        this.statusCode = statusCode;
        this.responseBody = responseBody;
    }

    public boolean isRateLimited() {
        return statusCode == 429;
    }

    public boolean isServerError() {
        return statusCode >= 500 && statusCode <= 599;
    }

    private static String abbreviate(String body) {
        if (body == null) return "";
        var flat = body.replaceAll("\\s+", " ").trim();
        return flat.length() > 200 ? flat.substring(0, 200) + "..." : flat;
    }
}
