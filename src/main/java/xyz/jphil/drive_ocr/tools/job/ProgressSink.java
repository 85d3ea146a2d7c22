package xyz.jphil.drive_ocr.tools.job;

import java.nio.file.Path;

/**
 * Observer of job progress. Purely observational: implementations must not throw and
 * have no influence on the pipeline. Split progress may arrive from render worker threads.
 */
@FunctionalInterface
public interface ProgressSink {

    void onProgress(FileProgress progress);

    /**
     * @param number one-based position of the file in the job
     */
    default void fileStarted(Path file, int number, int totalFiles) {}

    default void fileFinished(Path file, boolean success) {}

    ProgressSink NONE = progress -> {};
}
