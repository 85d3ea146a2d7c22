package xyz.jphil.drive_ocr.tools.output;

import java.nio.file.Path;
import java.util.Locale;

public enum OutputFormat {
    TXT("txt"),
    DOCX("docx"),
    JSON("json");

    private final String extension;

    OutputFormat(String extension) {
        this.extension = extension;
    }

    public String extension() {
        return extension;
    }

    /**
     * {@code <basePath>.<extension>}, e.g. {@code out/report} becomes {@code out/report.docx}
     */
    public Path target(Path basePath) {
        return basePath.resolveSibling(basePath.getFileName() + "." + extension);
    }

    public static OutputFormat fromName(String name) {
        var normalized = name.trim().toLowerCase(Locale.ROOT);
        for (var format : values()) {
            if (format.extension.equals(normalized)) return format;
        }
        throw new IllegalArgumentException("Unknown output format '" + name + "', expected txt, docx or json");
    }
}
