package xyz.jphil.drive_ocr.tools.job;

import java.nio.file.Path;

/**
 * Snapshot of a file's progress within its current stage
 */
public record FileProgress(
    Path file,
    FileStage stage,
    int currentPage,
    int totalPages,
    int percentage
) {}
