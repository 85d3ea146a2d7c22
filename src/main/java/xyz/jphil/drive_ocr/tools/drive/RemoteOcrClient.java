package xyz.jphil.drive_ocr.tools.drive;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Remote service that turns an uploaded image into a text document.
 * Implementations are safe for concurrent use by the OCR workers.
 */
public interface RemoteOcrClient {

    /**
     * Uploads an image for conversion.
     *
     * @return identifier of the created remote document
     * @throws java.nio.file.NoSuchFileException if the image does not exist
     */
    String upload(Path image, String accessToken) throws IOException;

    /**
     * Exports a previously uploaded document as cleaned plain text.
     */
    String exportText(String remoteId, String accessToken) throws IOException;

    void delete(String remoteId, String accessToken) throws IOException;
}
