package xyz.jphil.drive_ocr.tools;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Comparator;
import java.util.stream.Stream;

/**
 * Temp-directory and atomic-write helpers shared by the splitter, the writers and the job.
 */
public final class ScratchFiles {

    private ScratchFiles() {}

    /**
     * Deletes a directory tree, children first. A missing directory is not an error.
     */
    public static void deleteRecursively(Path dir) throws IOException {
        if (dir == null || !Files.exists(dir)) return;
        try (Stream<Path> paths = Files.walk(dir)) {
            for (Path p : paths.sorted(Comparator.reverseOrder()).toList()) {
                Files.deleteIfExists(p);
            }
        }
    }

    /**
     * Atomic file write using temp+rename pattern
     */
    public static void atomicWrite(Path outputPath, byte[] content) throws IOException {
        Path tempFile = outputPath.resolveSibling(outputPath.getFileName() + ".tmp");
        try {
            Files.write(tempFile, content);
            Files.move(tempFile, outputPath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            Files.deleteIfExists(tempFile);
            throw e;
        }
    }
}
