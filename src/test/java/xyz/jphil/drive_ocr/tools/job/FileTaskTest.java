package xyz.jphil.drive_ocr.tools.job;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class FileTaskTest {

    @Test
    void pdfWalksAllStagesInOrder() {
        var task = new FileTask(Path.of("scan.PDF"));
        assertEquals(FileKind.MULTI_PAGE, task.kind());

        task.advance(FileStage.PREPARING, 0, 0, 0)
            .advance(FileStage.SPLITTING, 0, 0, 0)
            .advance(FileStage.EXTRACTING, 0, 4, 0)
            .advance(FileStage.EXTRACTING, 2, 4, 50)
            .advance(FileStage.WRITING, 0, 0, 90)
            .advance(FileStage.DONE, 4, 4, 100);

        var snapshot = task.snapshot();
        assertEquals(FileStage.DONE, snapshot.stage());
        assertEquals(100, snapshot.percentage());
        assertEquals(Path.of("scan.PDF"), snapshot.file());
    }

    @Test
    void imageSkipsSplitting() {
        var task = new FileTask(Path.of("photo.jpg"));
        assertEquals(FileKind.SINGLE_PAGE, task.kind());

        task.advance(FileStage.PREPARING, 0, 0, 0);
        assertThrows(IllegalStateException.class, () -> task.advance(FileStage.SPLITTING, 0, 0, 0));
        task.advance(FileStage.EXTRACTING, 0, 1, 0);
        assertEquals(FileStage.EXTRACTING, task.stage());
    }

    @Test
    void firstStageMustBePreparing() {
        var task = new FileTask(Path.of("doc.pdf"));
        assertThrows(IllegalStateException.class, () -> task.advance(FileStage.EXTRACTING, 0, 1, 0));
    }

    @Test
    void stagesNeverMoveBackwards() {
        var task = new FileTask(Path.of("doc.pdf"))
            .advance(FileStage.PREPARING, 0, 0, 0)
            .advance(FileStage.WRITING, 0, 0, 90);

        assertThrows(IllegalStateException.class, () -> task.advance(FileStage.EXTRACTING, 1, 1, 100));
        assertEquals(FileStage.WRITING, task.stage());
    }
}
