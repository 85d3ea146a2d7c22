package xyz.jphil.drive_ocr.tools.job;

import lombok.Getter;
import lombok.experimental.Accessors;
import xyz.jphil.drive_ocr.tools.ocr.OcrOrchestrator;
import xyz.jphil.drive_ocr.tools.output.OutputFormat;
import xyz.jphil.drive_ocr.tools.output.WriterOptions;
import xyz.jphil.drive_ocr.tools.pdf.PageSplitter;

import java.nio.file.Path;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * User-tunable conversion settings. Out-of-range numbers are clamped rather than rejected,
 * and the format set can never become empty.
 */
@Getter
@Accessors(fluent = true)
public class ConversionSettings {

    public static final int DEFAULT_DPI = 150;
    public static final int DEFAULT_CONCURRENCY = 12;

    private int dpi = DEFAULT_DPI;
    private int concurrency = DEFAULT_CONCURRENCY;
    private final EnumSet<OutputFormat> formats = EnumSet.of(OutputFormat.TXT, OutputFormat.DOCX);
    private String pageSeparator = WriterOptions.DEFAULT_PAGE_SEPARATOR;
    /** null means next to each input */
    private Path outputDirectory;

    public ConversionSettings dpi(int dpi) {
        this.dpi = PageSplitter.clampDpi(dpi);
        return this;
    }

    public ConversionSettings concurrency(int concurrency) {
        this.concurrency = OcrOrchestrator.clampConcurrency(concurrency);
        return this;
    }

    public Set<OutputFormat> formats() {
        return Collections.unmodifiableSet(formats);
    }

    /**
     * Replaces the format set; an empty collection leaves the current set unchanged.
     */
    public ConversionSettings formats(Collection<OutputFormat> selected) {
        if (selected != null && !selected.isEmpty()) {
            formats.clear();
            formats.addAll(selected);
        }
        return this;
    }

    /**
     * Adds the format, or removes it unless it is the last one left.
     */
    public ConversionSettings toggleFormat(OutputFormat format) {
        if (formats.contains(format)) {
            if (formats.size() > 1) formats.remove(format);
        } else {
            formats.add(format);
        }
        return this;
    }

    public ConversionSettings pageSeparator(String pageSeparator) {
        this.pageSeparator = pageSeparator == null ? WriterOptions.DEFAULT_PAGE_SEPARATOR : pageSeparator;
        return this;
    }

    public ConversionSettings outputDirectory(Path outputDirectory) {
        this.outputDirectory = outputDirectory;
        return this;
    }

    public WriterOptions writerOptions() {
        return new WriterOptions(pageSeparator);
    }
}
