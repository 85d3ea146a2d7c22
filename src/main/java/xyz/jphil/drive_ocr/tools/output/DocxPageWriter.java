package xyz.jphil.drive_ocr.tools.output;

import org.apache.poi.xwpf.usermodel.BreakType;
import org.apache.poi.xwpf.usermodel.ParagraphAlignment;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import xyz.jphil.drive_ocr.tools.ScratchFiles;
import xyz.jphil.drive_ocr.tools.text.TextCompactor;
import xyz.jphil.drive_ocr.tools.text.TextDirection;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.regex.Pattern;

/**
 * One Word page per source page.
 *
 * <p>Each page is normalised (line endings, repeated whitespace), compacted with
 * {@link TextCompactor} and written as a single paragraph of 10 pt runs separated by line
 * breaks. Predominantly Arabic pages are right aligned and marked bidirectional, with
 * right-to-left runs. A page break follows every page except the last.
 */
public class DocxPageWriter implements PageTextWriter {

    static final int FONT_SIZE_PT = 10;

    private static final Pattern LINE_ENDINGS = Pattern.compile("\\r\\n?");
    private static final Pattern REPEATED_WHITESPACE = Pattern.compile("(?U)(\\s)\\1+");

    @Override
    public OutputFormat format() {
        return OutputFormat.DOCX;
    }

    @Override
    public void write(List<String> texts, Path target, WriterOptions options) throws IOException {
        try (var document = new XWPFDocument(); var buffer = new ByteArrayOutputStream()) {
            for (int i = 0; i < texts.size(); i++) {
                appendPage(document, prepare(texts.get(i)), i == texts.size() - 1);
            }
            document.write(buffer);
            ScratchFiles.atomicWrite(target, buffer.toByteArray());
        }
    }

    static String prepare(String pageText) {
        var text = LINE_ENDINGS.matcher(pageText).replaceAll("\n");
        text = REPEATED_WHITESPACE.matcher(text).replaceAll("$1").trim();
        return TextCompactor.compact(text);
    }

    private void appendPage(XWPFDocument document, String text, boolean lastPage) {
        XWPFParagraph paragraph = document.createParagraph();
        boolean rtl = TextDirection.isPredominantlyArabic(text);
        paragraph.setAlignment(rtl ? ParagraphAlignment.RIGHT : ParagraphAlignment.LEFT);
        if (rtl) {
            var pPr = paragraph.getCTP().isSetPPr() ? paragraph.getCTP().getPPr() : paragraph.getCTP().addNewPPr();
            pPr.addNewBidi();
        }

        var lines = text.split("\n", -1);
        for (int j = 0; j < lines.length; j++) {
            var run = paragraph.createRun();
            run.setText(lines[j]);
            run.setFontSize(FONT_SIZE_PT);
            if (rtl) {
                var rPr = run.getCTR().isSetRPr() ? run.getCTR().getRPr() : run.getCTR().addNewRPr();
                rPr.addNewRtl();
            }
            if (j < lines.length - 1) {
                run.addBreak();
            }
        }
        if (!lastPage) {
            paragraph.createRun().addBreak(BreakType.PAGE);
        }
    }
}
