package xyz.jphil.drive_ocr.tools.output;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

/**
 * Persists the ordered page texts of one input file.
 */
@FunctionalInterface
public interface OutputWriter {

    /**
     * @param texts    one entry per page, in page order
     * @param basePath output path without extension; each format appends its own
     * @return the files written
     */
    List<Path> write(List<String> texts, Path basePath, Set<OutputFormat> formats, WriterOptions options)
        throws IOException;
}
