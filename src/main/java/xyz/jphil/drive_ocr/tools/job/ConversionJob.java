package xyz.jphil.drive_ocr.tools.job;

import lombok.Getter;
import lombok.experimental.Accessors;
import xyz.jphil.drive_ocr.tools.CancellationToken;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One run over a list of input files. Mutated only by the thread running the job;
 * {@link #cancel()} may be called from any thread.
 */
@Getter
@Accessors(fluent = true)
public class ConversionJob {

    public record FileError(Path file, String message) {}

    private final List<Path> files;
    /** null means next to each input */
    private final Path outputDirectory;
    private final CancellationToken token = CancellationToken.create();
    private final int totalFiles;
    private int completedFiles;
    private int failedPages;
    private final List<FileError> errors = new ArrayList<>();
    private volatile boolean running;
    private volatile boolean finished;
    private volatile boolean authenticationFailed;

    ConversionJob(List<Path> files, Path outputDirectory) {
        this.files = List.copyOf(files);
        this.outputDirectory = outputDirectory;
        this.totalFiles = this.files.size();
    }

    public List<FileError> errors() {
        return Collections.unmodifiableList(errors);
    }

    public boolean cancelled() {
        return token.isCancelled();
    }

    public boolean succeeded() {
        return finished && !cancelled() && !authenticationFailed && errors.isEmpty() && failedPages == 0;
    }

    /**
     * Whole-job progress, 0-100
     */
    public int percentage() {
        return totalFiles == 0 ? 0 : Math.round(completedFiles * 100f / totalFiles);
    }

    boolean cancel() {
        return token.cancel();
    }

    void start() {
        running = true;
    }

    void completeFile() {
        completedFiles++;
    }

    void addError(Path file, String message) {
        errors.add(new FileError(file, message));
    }

    void addFailedPages(int count) {
        failedPages += count;
    }

    void markAuthenticationFailed() {
        authenticationFailed = true;
    }

    void finish() {
        running = false;
        finished = true;
    }
}
