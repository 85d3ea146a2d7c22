package xyz.jphil.drive_ocr.tools.job;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import xyz.jphil.drive_ocr.tools.FakeRemoteOcrClient;
import xyz.jphil.drive_ocr.tools.LogFormatter;
import xyz.jphil.drive_ocr.tools.TestPdfs;
import xyz.jphil.drive_ocr.tools.drive.CredentialProvider;
import xyz.jphil.drive_ocr.tools.output.OutputFormat;
import xyz.jphil.drive_ocr.tools.output.PageTextWriters;
import xyz.jphil.drive_ocr.tools.pdf.PageSplitter;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

public class ConversionJobControllerTest {

    @TempDir
    Path tempDir;

    private final LogFormatter log = LogFormatter.standard(false);
    private final FakeRemoteOcrClient client = new FakeRemoteOcrClient();

    /** Records the distinct stages each file went through, in order */
    static class RecordingSink implements ProgressSink {
        final Map<Path, List<FileStage>> stages = Collections.synchronizedMap(new LinkedHashMap<>());
        final List<String> finished = Collections.synchronizedList(new ArrayList<>());

        @Override
        public void onProgress(FileProgress progress) {
            var seen = stages.computeIfAbsent(progress.file(), f -> Collections.synchronizedList(new ArrayList<>()));
            synchronized (seen) {
                if (seen.isEmpty() || seen.get(seen.size() - 1) != progress.stage()) {
                    seen.add(progress.stage());
                }
            }
        }

        @Override
        public void fileFinished(Path file, boolean success) {
            finished.add(file.getFileName() + (success ? ":ok" : ":failed"));
        }
    }

    private ConversionJobController controller(CredentialProvider credentials, ProgressSink sink) {
        var settings = new ConversionSettings()
            .formats(List.of(OutputFormat.TXT, OutputFormat.JSON))
            .dpi(72)
            .concurrency(3);
        var context = new ConversionContext(credentials, settings, client, new PageSplitter(2, log),
            PageTextWriters.standard(log), log);
        return new ConversionJobController(context, sink);
    }

    private Path image(String name) throws Exception {
        return Files.writeString(tempDir.resolve(name), "image bytes");
    }

    @Test
    void convertsImagesAndPdfsIntoTheOutputDirectory() throws Exception {
        var photo = image("photo.png");
        var pdf = TestPdfs.create(tempDir.resolve("report.pdf"), 3);
        var out = tempDir.resolve("out");
        var sink = new RecordingSink();

        var job = controller(() -> "token", sink).startJob(List.of(photo, pdf), out);

        assertTrue(job.succeeded(), "errors: " + job.errors());
        assertEquals(2, job.completedFiles());
        assertEquals(100, job.percentage());
        assertFalse(job.running());

        assertEquals("text of photo.png", Files.readString(out.resolve("photo.txt")));
        var report = Files.readString(out.resolve("report.txt"));
        assertEquals(String.join("\n\nPAGE_SEPARATOR\n\n",
            "text of page-0001.jpg", "text of page-0002.jpg", "text of page-0003.jpg"), report);
        assertTrue(Files.exists(out.resolve("report.json")));
        assertFalse(Files.exists(out.resolve("report.docx")));

        assertEquals(List.of(FileStage.PREPARING, FileStage.EXTRACTING, FileStage.WRITING, FileStage.DONE),
            sink.stages.get(photo));
        assertEquals(List.of(FileStage.PREPARING, FileStage.SPLITTING, FileStage.EXTRACTING, FileStage.WRITING,
            FileStage.DONE), sink.stages.get(pdf));
        assertEquals(List.of("photo.png:ok", "report.pdf:ok"), sink.finished);
        assertTrue(client.live.isEmpty());
    }

    @Test
    void scratchPagesAreRemovedAfterTheFile() throws Exception {
        var pdf = TestPdfs.create(tempDir.resolve("two.pdf"), 2);

        controller(() -> "token", ProgressSink.NONE).startJob(List.of(pdf), null);

        assertEquals(2, client.uploadedPaths.size());
        var scratchDir = client.uploadedPaths.get(0).getParent();
        assertFalse(Files.exists(scratchDir), "scratch directory still present: " + scratchDir);
        assertTrue(Files.exists(tempDir.resolve("two.txt")), "output written next to the input");
    }

    @Test
    void brokenFileIsRecordedAndNextFileProceeds() throws Exception {
        var broken = Files.writeString(tempDir.resolve("broken.pdf"), "not a pdf");
        var photo = image("after.jpg");
        var sink = new RecordingSink();

        var job = controller(() -> "token", sink).startJob(List.of(broken, photo), tempDir);

        assertFalse(job.succeeded());
        assertEquals(1, job.errors().size());
        assertEquals(broken, job.errors().get(0).file());
        assertEquals(2, job.completedFiles());
        assertTrue(Files.exists(tempDir.resolve("after.txt")));
        assertEquals(List.of("broken.pdf:failed", "after.jpg:ok"), sink.finished);
    }

    @Test
    void failedPagesAreCountedButOutputIsStillWritten() throws Exception {
        var photo = image("blurry.png");
        client.failUploadOf("blurry.png");

        var job = controller(() -> "token", ProgressSink.NONE).startJob(List.of(photo), tempDir);

        assertEquals(1, job.failedPages());
        assertTrue(job.errors().isEmpty());
        assertFalse(job.succeeded());
        assertEquals("", Files.readString(tempDir.resolve("blurry.txt")));
    }

    @Test
    void cancellingDuringOcrStopsTheJobAndCleansUp() throws Exception {
        var pdf = TestPdfs.create(tempDir.resolve("long.pdf"), 6);
        var later = image("later.png");
        var controller = controller(() -> "token", ProgressSink.NONE);
        client.afterUpload(count -> {
            if (count == 2) controller.cancelJob();
        });

        var job = controller.startJob(List.of(pdf, later), tempDir);

        assertTrue(job.cancelled());
        assertFalse(job.succeeded());
        assertTrue(job.errors().isEmpty(), "cancellation is not an error");
        assertEquals(0, job.completedFiles());
        assertTrue(client.live.isEmpty(), "remote documents left: " + client.live);
        assertFalse(Files.exists(tempDir.resolve("long.txt")));
        assertFalse(Files.exists(tempDir.resolve("later.txt")));
        assertFalse(client.uploadedPaths.contains(later));
        assertFalse(Files.exists(client.uploadedPaths.get(0).getParent()), "scratch directory removed after cancel");
    }

    @Test
    void scratchPagesAreRemovedWhenWritingFails() throws Exception {
        var pdf = TestPdfs.create(tempDir.resolve("unwritable.pdf"), 2);
        var blocker = Files.writeString(tempDir.resolve("blocker"), "a file where the output directory should be");

        var job = controller(() -> "token", ProgressSink.NONE).startJob(List.of(pdf), blocker.resolve("out"));

        assertEquals(1, job.errors().size());
        assertEquals(pdf, job.errors().get(0).file());
        assertEquals(2, client.uploadedPaths.size());
        assertFalse(Files.exists(client.uploadedPaths.get(0).getParent()), "scratch directory removed after failure");
    }

    @Test
    void scratchPagesAreRemovedWhenAuthenticationFails() throws Exception {
        var pdf = TestPdfs.create(tempDir.resolve("locked.pdf"), 2);
        var calls = new AtomicInteger();
        // first page gets a token, every later request finds none
        CredentialProvider expiring = () -> calls.incrementAndGet() <= 1 ? "token" : null;
        var settings = new ConversionSettings().formats(List.of(OutputFormat.TXT)).dpi(72).concurrency(1);
        var context = new ConversionContext(expiring, settings, client, new PageSplitter(2, log),
            PageTextWriters.standard(log), log);

        var job = new ConversionJobController(context, ProgressSink.NONE).startJob(List.of(pdf), tempDir);

        assertTrue(job.authenticationFailed());
        assertEquals(1, client.uploadedPaths.size());
        assertFalse(Files.exists(client.uploadedPaths.get(0).getParent()), "scratch directory removed after auth failure");
        assertFalse(Files.exists(tempDir.resolve("locked.txt")));
    }

    @Test
    void missingAuthenticationAbortsRemainingFiles() throws Exception {
        var first = image("first.png");
        var second = image("second.png");

        var job = controller(() -> null, ProgressSink.NONE).startJob(List.of(first, second), tempDir);

        assertTrue(job.authenticationFailed());
        assertEquals(1, job.errors().size());
        assertEquals(first, job.errors().get(0).file());
        assertEquals(0, client.uploads.get());
        assertFalse(Files.exists(tempDir.resolve("second.txt")));
    }

    @Test
    void onlyOneJobRunsAtATime() throws Exception {
        var photo = image("one.png");
        var nestedFailure = new AtomicReference<Throwable>();
        var holder = new AtomicReference<ConversionJobController>();
        ProgressSink sink = new ProgressSink() {
            @Override
            public void onProgress(FileProgress progress) {}

            @Override
            public void fileStarted(Path file, int number, int totalFiles) {
                try {
                    holder.get().startJob(List.of(file), tempDir);
                } catch (IllegalStateException e) {
                    nestedFailure.set(e);
                }
            }
        };
        holder.set(controller(() -> "token", sink));

        var job = holder.get().startJob(List.of(photo), tempDir);

        assertInstanceOf(IllegalStateException.class, nestedFailure.get());
        assertTrue(job.succeeded());
        assertSame(job, holder.get().currentJob().orElseThrow());
    }

    @Test
    void cancelAndResetWithoutRunningJob() throws Exception {
        var controller = controller(() -> "token", ProgressSink.NONE);
        controller.cancelJob();
        controller.cancelJob();
        assertTrue(controller.currentJob().isEmpty());

        controller.startJob(List.of(image("x.png")), tempDir);
        assertTrue(controller.currentJob().isPresent());
        controller.cancelJob();
        assertFalse(controller.currentJob().orElseThrow().cancelled(), "finished jobs stay uncancelled");

        controller.reset();
        assertTrue(controller.currentJob().isEmpty());
    }

    @Test
    void outputNameDropsOnlyTheLastExtension() {
        assertEquals("archive.v2", ConversionJobController.stripExtension("archive.v2.pdf"));
        assertEquals("noext", ConversionJobController.stripExtension("noext"));
    }
}
