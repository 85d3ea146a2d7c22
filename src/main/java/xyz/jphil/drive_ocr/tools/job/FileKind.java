package xyz.jphil.drive_ocr.tools.job;

import java.nio.file.Path;

public enum FileKind {
    /** PDF: split into page images first */
    MULTI_PAGE,
    /** JPEG or PNG: the file itself is the only page */
    SINGLE_PAGE;

    public static FileKind of(Path file) {
        return ".pdf".equals(InputFiles.extensionOf(file.getFileName().toString())) ? MULTI_PAGE : SINGLE_PAGE;
    }
}
