package xyz.jphil.drive_ocr.tools.pdf;

/**
 * File names for rendered page images. Page numbers are zero padded to at least four
 * digits so that lexical order of the names equals page order.
 */
public class PdfNaming {
    private static final int MIN_DIGITS = 4;

    private final String fmt;

    public PdfNaming(int totalPages) {
        int digits = totalPages <= 0 ? 1 : (int) Math.floor(Math.log10(totalPages)) + 1;
        this.fmt = String.format("page-%%0%dd.%%s", Math.max(MIN_DIGITS, digits));
    }

    /**
     * @param pageNum one-based page number
     */
    public String page(int pageNum, String ext) {
        return String.format(fmt, pageNum, ext);
    }

    public String jpeg(int pageNum) {
        return page(pageNum, "jpg");
    }
}
