package xyz.jphil.drive_ocr.tools.output;

import org.json.JSONArray;
import org.json.JSONObject;
import xyz.jphil.drive_ocr.tools.ScratchFiles;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;

/**
 * Array of {@code {"page": n, "content": "..."}} objects, pages numbered from 1
 */
public class JsonPageWriter implements PageTextWriter {

    @Override
    public OutputFormat format() {
        return OutputFormat.JSON;
    }

    @Override
    public void write(List<String> texts, Path target, WriterOptions options) throws IOException {
        ScratchFiles.atomicWrite(target, render(texts).getBytes(StandardCharsets.UTF_8));
    }

    static String render(List<String> texts) {
        var pages = new JSONArray();
        for (int i = 0; i < texts.size(); i++) {
            pages.put(new JSONObject()
                .put("page", i + 1)
                .put("content", texts.get(i).trim()));
        }
        return pages.toString(2);
    }
}
