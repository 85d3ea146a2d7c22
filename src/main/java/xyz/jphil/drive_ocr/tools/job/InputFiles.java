package xyz.jphil.drive_ocr.tools.job;

import lombok.RequiredArgsConstructor;
import xyz.jphil.drive_ocr.tools.LogFormatter;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Turns command-line inputs (files and folders) into the list of files to convert.
 * Folders are scanned recursively and their matches sorted.
 */
@RequiredArgsConstructor
public class InputFiles {

    public static final Set<String> SUPPORTED_EXTENSIONS = Set.of(".pdf", ".jpg", ".jpeg", ".png");

    private final LogFormatter log;

    /**
     * Lower-cased extension including the dot, or null when the name has none, starts with
     * its only dot (hidden file) or ends with a dot.
     */
    public static String extensionOf(String fileName) {
        int lastDot = fileName.lastIndexOf('.');
        if (lastDot <= 0 || lastDot == fileName.length() - 1) {
            return null;
        }
        return fileName.substring(lastDot).toLowerCase(Locale.ROOT);
    }

    public static boolean isSupported(Path file) {
        var ext = extensionOf(file.getFileName().toString());
        return ext != null && SUPPORTED_EXTENSIONS.contains(ext);
    }

    public List<Path> collect(List<Path> inputs) throws IOException {
        var files = new ArrayList<Path>();
        for (var input : inputs) {
            if (Files.isDirectory(input)) {
                var found = scan(input);
                log.info("INPUT", String.format("Found %d supported file(s) in %s", found.size(), input));
                files.addAll(found);
            } else if (Files.isRegularFile(input)) {
                if (!isSupported(input)) {
                    throw new IllegalArgumentException("Unsupported file type: " + input
                        + " (expected .pdf, .jpg, .jpeg or .png)");
                }
                files.add(input);
            } else {
                throw new NoSuchFileException(input.toString());
            }
        }
        return files;
    }

    public List<Path> scan(Path folder) throws IOException {
        try (Stream<Path> paths = Files.walk(folder)) {
            return paths
                .filter(Files::isRegularFile)
                .filter(InputFiles::isSupported)
                .sorted()
                .toList();
        }
    }
}
