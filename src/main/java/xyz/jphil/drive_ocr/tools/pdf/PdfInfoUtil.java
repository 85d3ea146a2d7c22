package xyz.jphil.drive_ocr.tools.pdf;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;

import java.io.File;
import java.io.IOException;

/**
 * Page count and render geometry of PDF pages
 */
public class PdfInfoUtil {

    /** Render width for a given DPI, in inches (US Letter rounded up) */
    public static final int PAGE_WIDTH_INCHES = 8;
    /** Render height cap for a given DPI, in inches */
    public static final int PAGE_HEIGHT_INCHES = 12;

    /**
     * @throws IOException if the file cannot be read or is not a PDF
     */
    public static int pageCount(File pdfFile) throws IOException {
        try (PDDocument document = Loader.loadPDF(pdfFile)) {
            return document.getNumberOfPages();
        }
    }

    /**
     * Page size as displayed, i.e. with /Rotate applied to the crop box
     */
    static float[] displayedSize(PDPage page) {
        var box = page.getCropBox();
        int rotation = ((page.getRotation() % 360) + 360) % 360;
        return rotation == 90 || rotation == 270
            ? new float[] {box.getHeight(), box.getWidth()}
            : new float[] {box.getWidth(), box.getHeight()};
    }

    /**
     * PDFBox render scale (1.0 = 72 DPI) that makes the page {@code dpi * 8} pixels wide,
     * reduced when the height would exceed {@code dpi * 12} pixels. Aspect ratio is preserved.
     */
    public static float renderScale(PDPage page, int dpi) {
        var size = displayedSize(page);
        float width = size[0];
        float height = size[1];
        if (width <= 0 || height <= 0) {
            return dpi / 72f;
        }
        float scale = (float) dpi * PAGE_WIDTH_INCHES / width;
        float maxHeight = (float) dpi * PAGE_HEIGHT_INCHES;
        if (height * scale > maxHeight) {
            scale = maxHeight / height;
        }
        return scale;
    }
}
