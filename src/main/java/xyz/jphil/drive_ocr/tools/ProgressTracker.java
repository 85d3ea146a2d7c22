package xyz.jphil.drive_ocr.tools;

import lombok.Getter;
import lombok.Setter;
import lombok.experimental.Accessors;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Single-line terminal progress bar for one stage of one file (rendering pages, OCR of pages).
 * The total may be unknown when the tracker is created; {@link #update(int, int)} adjusts it.
 */
@Getter
@Setter
@Accessors(fluent = true)
public class ProgressTracker {
    private final String task;
    private final boolean verbose;
    private final Instant start = Instant.now();
    private final Terminal terminal;

    private final AtomicInteger total = new AtomicInteger(0);
    private final AtomicInteger completed = new AtomicInteger(0);
    private final AtomicReference<Instant> lastUpdate = new AtomicReference<>(Instant.now());
    private final AtomicLong lastCompleted = new AtomicLong(0);

    private volatile boolean paused = false;
    private volatile boolean finished = false;

    public record Stats(double pct, Duration elapsed, String eta, String rate) {}

    public ProgressTracker(String task, int total, boolean verbose, Terminal terminal) {
        this.task = task;
        this.verbose = verbose;
        this.terminal = terminal;
        this.total.set(total);
    }

    public ProgressTracker(String task, int total, boolean verbose) {
        this(task, total, verbose, systemTerminal());
    }

    private static Terminal systemTerminal() {
        try {
            return TerminalBuilder.builder().system(true).dumb(true).build();
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize terminal", e);
        }
    }

    public ProgressTracker start() {
        if (verbose) System.err.printf("▶ Starting %s%n", task);
        show();
        return this;
    }

    public ProgressTracker update(int n, int newTotal) {
        total.set(newTotal);
        completed.set(n);
        show();
        return this;
    }

    public ProgressTracker done() {
        if (finished) return this;
        finished = true;
        var elapsed = Duration.between(start, Instant.now());
        clearLine();
        System.err.printf("✓ %s completed (%d items) in %s%n", task, completed.get(), fmt(elapsed));
        return this;
    }

    /**
     * Ends the bar without the completion line, e.g. when the stage was cancelled or failed.
     */
    public ProgressTracker abandon() {
        if (finished) return this;
        finished = true;
        clearLine();
        return this;
    }

    public void clearLine() {
        if (total.get() == 0) return;
        int termWidth = getEffectiveTerminalWidth();
        if (termWidth > 50) {
            System.err.printf("\r%s\r", " ".repeat(termWidth));
            System.err.flush();
        }
    }

    public void forceRedraw() {
        if (!paused) {
            show();
        }
    }

    private synchronized void show() {
        int currentTotal = total.get();
        if (currentTotal == 0 || paused || finished) return;

        var stats = calcStats();
        int currentCompleted = completed.get();

        int termWidth = getEffectiveTerminalWidth();
        if (termWidth > 50) {
            if (verbose) {
                var bar = bar(stats.pct(), Math.min(25, termWidth - 50));
                System.err.printf("\r%s %s %5.1f%% (%d/%d) %s %s",
                    task, bar, stats.pct(), currentCompleted, currentTotal, stats.eta(), stats.rate());
            } else {
                var bar = bar(stats.pct(), Math.min(20, termWidth - 25));
                System.err.printf("\r%s %5.1f%% (%d/%d)",
                    bar, stats.pct(), currentCompleted, currentTotal);
            }
        } else if (currentCompleted % Math.max(1, currentTotal / 10) == 0 || currentCompleted == currentTotal) {
            // narrow or dumb terminal
            System.err.printf("  %s: %d/%d (%.1f%%)%n", task, currentCompleted, currentTotal, stats.pct());
        }
    }

    private int getEffectiveTerminalWidth() {
        try {
            int jlineWidth = terminal.getWidth();
            // dumb terminals report 0 or tiny widths
            return jlineWidth > 20 ? jlineWidth : 80;
        } catch (Exception e) {
            return 80;
        }
    }

    Stats calcStats() {
        int currentCompleted = completed.get();
        var pct = (double) currentCompleted / Math.max(1, total.get()) * 100;
        var elapsed = Duration.between(start, Instant.now());
        var eta = eta(elapsed, currentCompleted);
        var rate = rate(elapsed, currentCompleted);
        return new Stats(pct, elapsed, eta, rate);
    }

    private String bar(double pct, int width) {
        var filled = (int) (pct / 100 * width);
        var sb = new StringBuilder("[");

        for (int i = 0; i < width; i++) {
            sb.append(i < filled ? "█" :
                     i == filled && pct % (100.0 / width) > 0 ? "▌" : "░");
        }
        return sb.append("]").toString();
    }

    private String eta(Duration elapsed, int currentCompleted) {
        if (currentCompleted == 0) return "ETA: --:--";

        var avgSecs = elapsed.getSeconds() / currentCompleted;
        var etaSecs = (total.get() - currentCompleted) * avgSecs;
        return "ETA: " + fmt(Duration.ofSeconds(etaSecs));
    }

    private String rate(Duration elapsed, int currentCompleted) {
        if (elapsed.getSeconds() == 0) return "Rate: --/s";

        var now = Instant.now();
        var sinceLast = Duration.between(lastUpdate.get(), now);

        if (sinceLast.getSeconds() >= 2) {
            var itemsSince = currentCompleted - lastCompleted.get();
            var rate = itemsSince / (double) sinceLast.getSeconds();
            lastUpdate.set(now);
            lastCompleted.set(currentCompleted);
            return rate >= 1 ? "Rate: %.1f/s".formatted(rate) :
                               "Rate: %.1f/min".formatted(rate * 60);
        }

        var rate = currentCompleted / (double) elapsed.getSeconds();
        return rate >= 1 ? "Rate: %.1f/s".formatted(rate) :
                          "Rate: %.1f/min".formatted(rate * 60);
    }

    static String fmt(Duration d) {
        var h = d.toHours();
        var m = d.toMinutesPart();
        var s = d.toSecondsPart();

        return h > 0 ? "%dh %02dm".formatted(h, m) :
               m > 0 ? "%dm %02ds".formatted(m, s) :
                       "%ds".formatted(s);
    }
}
