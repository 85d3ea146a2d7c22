package xyz.jphil.drive_ocr.tools.job;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.nio.file.Path;

/**
 * Progress state of the file currently being converted.
 *
 * <p>Stages only move forward and the first one is always {@link FileStage#PREPARING}.
 * Staying in the current stage (to report page progress) is allowed. A PDF passes through
 * {@link FileStage#SPLITTING}; a single image never does.
 */
@Getter
@Accessors(fluent = true)
public class FileTask {

    private final Path file;
    private final FileKind kind;
    private FileStage stage;
    private int currentPage;
    private int totalPages;
    private int percentage;

    public FileTask(Path file) {
        this.file = file;
        this.kind = FileKind.of(file);
    }

    public FileTask advance(FileStage next, int currentPage, int totalPages, int percentage) {
        if (stage == null && next != FileStage.PREPARING) {
            throw new IllegalStateException(file.getFileName() + ": must start in PREPARING, not " + next);
        }
        if (stage != null && next.ordinal() < stage.ordinal()) {
            throw new IllegalStateException(file.getFileName() + ": cannot move back from " + stage + " to " + next);
        }
        if (next == FileStage.SPLITTING && kind != FileKind.MULTI_PAGE) {
            throw new IllegalStateException(file.getFileName() + ": only multi-page files are split");
        }
        this.stage = next;
        this.currentPage = currentPage;
        this.totalPages = totalPages;
        this.percentage = percentage;
        return this;
    }

    public FileProgress snapshot() {
        return new FileProgress(file, stage, currentPage, totalPages, percentage);
    }
}
