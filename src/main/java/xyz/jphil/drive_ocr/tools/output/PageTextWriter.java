package xyz.jphil.drive_ocr.tools.output;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Writer for a single output format
 */
public interface PageTextWriter {

    OutputFormat format();

    void write(List<String> texts, Path target, WriterOptions options) throws IOException;
}
