package xyz.jphil.drive_ocr.tools.ocr;

/**
 * Lifecycle of one page's OCR task.
 * {@code PENDING → UPLOADING → UPLOADED → EXPORTING → EXPORTED → DELETING → DONE},
 * ending early in {@link #FAILED} or {@link #CANCELLED}.
 */
public enum OcrTaskState {
    PENDING,
    UPLOADING,
    UPLOADED,
    EXPORTING,
    EXPORTED,
    DELETING,
    DONE,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED || this == CANCELLED;
    }

    /**
     * True once a remote artifact may exist for the task
     */
    public boolean hasRemoteArtifact() {
        return ordinal() >= UPLOADED.ordinal() && ordinal() <= DELETING.ordinal();
    }
}
