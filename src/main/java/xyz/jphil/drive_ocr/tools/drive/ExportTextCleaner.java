package xyz.jphil.drive_ocr.tools.drive;

import java.util.regex.Pattern;

/**
 * Drive prefixes exported OCR text with a BOM and a rule of underscores; strip those
 * and squeeze blank runs.
 */
public final class ExportTextCleaner {

    private static final Pattern BOM_UNDERSCORES = Pattern.compile("\uFEFF?_+");
    private static final Pattern BLANK_RUNS = Pattern.compile("\n{3,}");

    private ExportTextCleaner() {}

    public static String clean(String raw) {
        if (raw == null) return "";
        var text = raw.replace("\r\n", "\n");
        text = BOM_UNDERSCORES.matcher(text).replaceAll("");
        text = text.replace("\uFEFF", "");
        text = BLANK_RUNS.matcher(text).replaceAll("\n\n");
        return text.trim();
    }
}
