package xyz.jphil.drive_ocr.tools.output;

/**
 * @param pageSeparator text placed between pages in TXT output; empty or null means the default
 */
public record WriterOptions(String pageSeparator) {

    public static final String DEFAULT_PAGE_SEPARATOR = "\n\nPAGE_SEPARATOR\n\n";

    public WriterOptions {
        if (pageSeparator == null || pageSeparator.isEmpty()) {
            pageSeparator = DEFAULT_PAGE_SEPARATOR;
        }
    }

    public static WriterOptions defaults() {
        return new WriterOptions(DEFAULT_PAGE_SEPARATOR);
    }
}
