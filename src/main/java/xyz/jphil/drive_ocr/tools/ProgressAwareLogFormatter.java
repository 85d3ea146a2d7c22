package xyz.jphil.drive_ocr.tools;

import java.util.concurrent.atomic.AtomicReference;

/**
 * LogFormatter that keeps log lines from tearing the active progress bar.
 * The bar is swapped as each file moves between stages, so it is held in a reference.
 */
public class ProgressAwareLogFormatter extends LogFormatter {

    private final AtomicReference<ProgressTracker> activeBar = new AtomicReference<>();

    public ProgressAwareLogFormatter(boolean verbose) {
        super(verbose);
    }

    public void attach(ProgressTracker tracker) {
        activeBar.set(tracker);
    }

    public void detach(ProgressTracker tracker) {
        activeBar.compareAndSet(tracker, null);
    }

    @Override
    public void info(String category, String message) {
        coordinated(() -> super.info(category, message));
    }

    @Override
    public void success(String category, String message) {
        coordinated(() -> super.success(category, message));
    }

    @Override
    public void warning(String category, String message) {
        coordinated(() -> super.warning(category, message));
    }

    @Override
    public void error(String category, String message) {
        coordinated(() -> super.error(category, message));
    }

    @Override
    public void debug(String category, String message) {
        coordinated(() -> super.debug(category, message));
    }

    @Override
    public void step(String category, String message) {
        coordinated(() -> super.step(category, message));
    }

    @Override
    public void complete(String category, String message) {
        coordinated(() -> super.complete(category, message));
    }

    // clear bar, print, redraw bar
    private void coordinated(Runnable logAction) {
        var bar = activeBar.get();
        if (bar == null) {
            logAction.run();
            return;
        }
        synchronized (ProgressAwareLogFormatter.class) {
            bar.clearLine();
            logAction.run();
            System.err.flush();
            bar.forceRedraw();
        }
    }

    public static ProgressAwareLogFormatter create(boolean verbose) {
        return new ProgressAwareLogFormatter(verbose);
    }
}
