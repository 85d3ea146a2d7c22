package xyz.jphil.drive_ocr.tools.output;

import xyz.jphil.drive_ocr.tools.ScratchFiles;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Trimmed pages joined by the configured page separator
 */
public class TxtPageWriter implements PageTextWriter {

    @Override
    public OutputFormat format() {
        return OutputFormat.TXT;
    }

    @Override
    public void write(List<String> texts, Path target, WriterOptions options) throws IOException {
        ScratchFiles.atomicWrite(target, render(texts, options).getBytes(StandardCharsets.UTF_8));
    }

    static String render(List<String> texts, WriterOptions options) {
        return texts.stream()
            .map(String::trim)
            .collect(Collectors.joining(options.pageSeparator()));
    }
}
