package xyz.jphil.drive_ocr.tools.output;

import xyz.jphil.drive_ocr.tools.LogFormatter;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * {@link OutputWriter} that dispatches each requested format to its {@link PageTextWriter}.
 * Formats are written in enum order (txt, docx, json); the first failure aborts the rest.
 */
public class PageTextWriters implements OutputWriter {

    private final Map<OutputFormat, PageTextWriter> writers = new EnumMap<>(OutputFormat.class);
    private final LogFormatter log;

    public PageTextWriters(List<PageTextWriter> writers, LogFormatter log) {
        for (var writer : writers) {
            this.writers.put(writer.format(), writer);
        }
        this.log = log;
    }

    public static PageTextWriters standard(LogFormatter log) {
        return new PageTextWriters(List.of(new TxtPageWriter(), new DocxPageWriter(), new JsonPageWriter()), log);
    }

    @Override
    public List<Path> write(List<String> texts, Path basePath, Set<OutputFormat> formats, WriterOptions options)
            throws IOException {
        var parent = basePath.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);

        var written = new ArrayList<Path>();
        for (var format : formats.isEmpty() ? EnumSet.noneOf(OutputFormat.class) : EnumSet.copyOf(formats)) {
            var writer = writers.get(format);
            if (writer == null) {
                throw new IllegalArgumentException("No writer registered for " + format);
            }
            var target = format.target(basePath);
            writer.write(texts, target, options);
            log.debug("WRITE", "Wrote " + target);
            written.add(target);
        }
        return written;
    }
}
