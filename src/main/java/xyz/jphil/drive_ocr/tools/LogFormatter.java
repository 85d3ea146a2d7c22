package xyz.jphil.drive_ocr.tools;

import java.io.PrintStream;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Category-tagged console logging shared by the conversion pipeline and the CLI.
 * Only {@link #error} and {@link #complete} print when verbose mode is off.
 */
public class LogFormatter {

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("HH:mm:ss.SSS");

    private final boolean verbose;
    private final boolean includeTimestamp;
    private final PrintStream out;

    public LogFormatter(boolean verbose, boolean includeTimestamp, PrintStream out) {
        this.verbose = verbose;
        this.includeTimestamp = includeTimestamp;
        this.out = out;
    }

    public LogFormatter(boolean verbose, boolean includeTimestamp) {
        this(verbose, includeTimestamp, System.err);
    }

    public LogFormatter(boolean verbose) {
        this(verbose, false);
    }

    public boolean verbose() {
        return verbose;
    }

    public void info(String category, String message) {
        if (!verbose) return;
        print("%s%s %s%n", timestamp(), category(category), message);
    }

    public void success(String category, String message) {
        if (!verbose) return;
        print("%s✅ %s %s%n", timestamp(), category(category), message);
    }

    public void warning(String category, String message) {
        if (!verbose) return;
        print("%s⚠️ %s %s%n", timestamp(), category(category), message);
    }

    /**
     * Always shown regardless of verbose mode
     */
    public void error(String category, String message) {
        print("%s❌ %s %s%n", timestamp(), category(category), message);
    }

    public void debug(String category, String message) {
        if (!verbose) return;
        print("%s🔍 %s %s%n", timestamp(), category(category), message);
    }

    public void step(String category, String message) {
        if (!verbose) return;
        print("%s▶️ %s %s%n", timestamp(), category(category), message);
    }

    public void complete(String category, String message) {
        print("%s🏁 %s %s%n", timestamp(), category(category), message);
    }

    // OCR workers log concurrently; keep each line intact
    private void print(String format, Object... args) {
        synchronized (out) {
            out.printf(format, args);
        }
    }

    private String timestamp() {
        if (!includeTimestamp) return "";
        return "[" + LocalDateTime.now().format(TIME_FORMAT) + "] ";
    }

    private String category(String cat) {
        return "[" + cat + "]";
    }

    public static LogFormatter standard(boolean verbose) {
        return new LogFormatter(verbose, false);
    }
}
