package xyz.jphil.drive_ocr.tools.job;

import xyz.jphil.drive_ocr.tools.CancelledException;
import xyz.jphil.drive_ocr.tools.LogFormatter;
import xyz.jphil.drive_ocr.tools.ScratchFiles;
import xyz.jphil.drive_ocr.tools.drive.NotAuthenticatedException;
import xyz.jphil.drive_ocr.tools.ocr.OcrOrchestrator;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static xyz.jphil.drive_ocr.tools.PagedOcrData.*;

/**
 * Converts a list of files one after another: PDF pages are rendered to images, every page
 * goes through remote OCR, and the ordered texts are written in the configured formats.
 *
 * <p>A failing file is recorded and the next one proceeds. Cancellation stops the job at the
 * next checkpoint without recording an error. A missing access token aborts the whole job,
 * since no later file could succeed. The scratch directory of a PDF is removed on every path.
 */
public class ConversionJobController {

    private final ConversionContext context;
    private final ProgressSink sink;
    private final LogFormatter log;
    private final OcrOrchestrator orchestrator;

    private volatile ConversionJob current;

    public ConversionJobController(ConversionContext context, ProgressSink sink) {
        this.context = context;
        this.sink = sink;
        this.log = context.log();
        this.orchestrator = new OcrOrchestrator(context.remoteClient(), context.credentials(), context.log());
    }

    /**
     * Runs a job on the calling thread and returns it once finished or stopped.
     *
     * @param outputDir where outputs go; null writes each output next to its input
     * @throws IllegalStateException if another job is still running
     */
    public ConversionJob startJob(List<Path> files, Path outputDir) {
        var job = new ConversionJob(files, outputDir);
        synchronized (this) {
            if (current != null && current.running()) {
                throw new IllegalStateException("A conversion job is already running");
            }
            current = job;
            job.start();
        }

        try {
            log.step("JOB", String.format("Converting %d file(s)", job.totalFiles()));
            for (int i = 0; i < job.totalFiles(); i++) {
                if (job.cancelled()) break;
                var file = job.files().get(i);
                sink.fileStarted(file, i + 1, job.totalFiles());
                try {
                    processFile(job, file);
                    job.completeFile();
                    sink.fileFinished(file, true);
                } catch (CancelledException e) {
                    log.info("JOB", "Cancelled while converting " + file.getFileName());
                    sink.fileFinished(file, false);
                    break;
                } catch (NotAuthenticatedException e) {
                    job.addError(file, e.getMessage());
                    job.markAuthenticationFailed();
                    job.completeFile();
                    sink.fileFinished(file, false);
                    log.error("AUTH", e.getMessage() + ", stopping job");
                    break;
                } catch (IOException | RuntimeException e) {
                    job.addError(file, describe(e));
                    job.completeFile();
                    sink.fileFinished(file, false);
                    log.error("JOB", file.getFileName() + ": " + describe(e));
                }
            }
        } finally {
            job.finish();
        }
        log.complete("JOB", String.format("%d/%d file(s) processed, %d error(s)%s",
            job.completedFiles(), job.totalFiles(), job.errors().size(), job.cancelled() ? ", cancelled" : ""));
        return job;
    }

    /**
     * Requests cooperative cancellation of the running job. Safe to call at any time and
     * any number of times.
     */
    public void cancelJob() {
        var job = current;
        if (job != null && job.running() && job.cancel()) {
            log.warning("JOB", "Cancellation requested");
        }
    }

    /**
     * Forgets the last job.
     *
     * @throws IllegalStateException while a job is running
     */
    public synchronized void reset() {
        if (current != null && current.running()) {
            throw new IllegalStateException("Cannot reset while a job is running");
        }
        current = null;
    }

    public Optional<ConversionJob> currentJob() {
        return Optional.ofNullable(current);
    }

    private void processFile(ConversionJob job, Path file) throws IOException {
        var token = job.token();
        var settings = context.settings();
        var task = new FileTask(file);
        Path scratchDir = null;
        try {
            token.throwIfCancelled();
            report(task.advance(FileStage.PREPARING, 0, 0, 0));
            log.step("JOB", "Processing " + file.getFileName());

            List<PageImage> pages;
            if (task.kind() == FileKind.MULTI_PAGE) {
                token.throwIfCancelled();
                report(task.advance(FileStage.SPLITTING, 0, 0, 0));
                // render workers call back concurrently, so progress is not routed through the task
                var split = context.splitter().split(file, settings.dpi(), token, p ->
                    sink.onProgress(new FileProgress(file, FileStage.SPLITTING, p.completed(), p.total(), p.percentage())));
                scratchDir = split.scratchDir();
                pages = split.pages();
            } else {
                pages = List.of(new PageImage(0, file, file));
            }

            token.throwIfCancelled();
            report(task.advance(FileStage.EXTRACTING, 0, pages.size(), 0));
            var result = orchestrator.extract(pages, settings.concurrency(), token, p ->
                report(task.advance(FileStage.EXTRACTING, p.completed(), p.total(), p.percentage())));
            if (result.hasErrors()) {
                job.addFailedPages(result.errors().size());
                log.warning("JOB", String.format("%s: %d of %d page(s) failed OCR and are left empty",
                    file.getFileName(), result.errors().size(), pages.size()));
            }

            token.throwIfCancelled();
            report(task.advance(FileStage.WRITING, 0, 0, 90));
            var written = context.writer().write(result.texts(), outputBase(job, file),
                settings.formats(), settings.writerOptions());
            written.forEach(path -> log.success("WRITE", path.toString()));

            report(task.advance(FileStage.DONE, pages.size(), pages.size(), 100));
        } finally {
            removeScratch(scratchDir);
        }
    }

    static Path outputBase(ConversionJob job, Path file) {
        var dir = job.outputDirectory() != null
            ? job.outputDirectory()
            : file.toAbsolutePath().getParent();
        return dir.resolve(stripExtension(file.getFileName().toString()));
    }

    static String stripExtension(String fileName) {
        return fileName.replaceFirst("\\.[^.]+$", "");
    }

    private void report(FileTask task) {
        sink.onProgress(task.snapshot());
    }

    private void removeScratch(Path scratchDir) {
        if (scratchDir == null) return;
        try {
            ScratchFiles.deleteRecursively(scratchDir);
        } catch (IOException e) {
            log.warning("JOB", "Could not remove scratch directory " + scratchDir + ": " + e.getMessage());
        }
    }

    private static String describe(Exception e) {
        var message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }
}
