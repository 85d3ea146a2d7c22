package xyz.jphil.drive_ocr.tools;

import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;
import xyz.jphil.drive_ocr.tools.job.FileProgress;
import xyz.jphil.drive_ocr.tools.job.FileStage;
import xyz.jphil.drive_ocr.tools.job.ProgressSink;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Shows one progress bar per page-level stage (rendering, OCR) of the current file.
 */
public class ConsoleProgressSink implements ProgressSink, AutoCloseable {

    private final ProgressAwareLogFormatter log;
    private final Terminal terminal;
    private ProgressTracker bar;
    private FileStage barStage;
    private String fileLabel = "";

    public ConsoleProgressSink(ProgressAwareLogFormatter log, Terminal terminal) {
        this.log = log;
        this.terminal = terminal;
    }

    public static ConsoleProgressSink create(ProgressAwareLogFormatter log) throws IOException {
        return new ConsoleProgressSink(log, TerminalBuilder.builder().system(true).dumb(true).build());
    }

    @Override
    public synchronized void fileStarted(Path file, int number, int totalFiles) {
        fileLabel = file.getFileName().toString();
        System.err.printf("[%d/%d] %s%n", number, totalFiles, fileLabel);
    }

    @Override
    public synchronized void onProgress(FileProgress progress) {
        var stage = progress.stage();
        if (stage == FileStage.SPLITTING || stage == FileStage.EXTRACTING) {
            if (barStage != stage) {
                closeBar(true);
                bar = new ProgressTracker(stage.label() + " " + fileLabel, progress.totalPages(), log.verbose(), terminal);
                barStage = stage;
                log.attach(bar);
                bar.start();
            }
            bar.update(progress.currentPage(), progress.totalPages());
        } else {
            closeBar(true);
        }
    }

    @Override
    public synchronized void fileFinished(Path file, boolean success) {
        closeBar(success);
    }

    private void closeBar(boolean completed) {
        if (bar == null) return;
        if (completed) {
            bar.done();
        } else {
            bar.abandon();
        }
        log.detach(bar);
        bar = null;
        barStage = null;
    }

    @Override
    public synchronized void close() throws IOException {
        closeBar(false);
        terminal.close();
    }
}
