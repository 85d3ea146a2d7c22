package xyz.jphil.drive_ocr.tools.ocr;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import xyz.jphil.drive_ocr.tools.CancellationToken;
import xyz.jphil.drive_ocr.tools.CancelledException;
import xyz.jphil.drive_ocr.tools.FakeRemoteOcrClient;
import xyz.jphil.drive_ocr.tools.LogFormatter;
import xyz.jphil.drive_ocr.tools.drive.CredentialProvider;
import xyz.jphil.drive_ocr.tools.drive.NotAuthenticatedException;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;
import static xyz.jphil.drive_ocr.tools.PagedOcrData.*;

public class OcrOrchestratorTest {

    @TempDir
    Path tempDir;

    private final LogFormatter log = LogFormatter.standard(false);
    private final CredentialProvider credentials = () -> "token";

    private List<PageImage> pages(int count) throws Exception {
        var source = tempDir.resolve("source.pdf");
        var pages = new ArrayList<PageImage>();
        for (int i = 0; i < count; i++) {
            var image = Files.writeString(tempDir.resolve(String.format("page-%04d.jpg", i + 1)), "img" + i);
            pages.add(new PageImage(i, image, source));
        }
        return pages;
    }

    @Test
    void textsKeepPageOrderUnderRandomLatency() throws Exception {
        var client = new FakeRemoteOcrClient().withRandomLatency(15);
        var orchestrator = new OcrOrchestrator(client, credentials, log);
        var pages = pages(25);

        var result = orchestrator.extract(pages, 4, CancellationToken.create(), OcrOrchestrator.OcrListener.NONE);

        assertEquals(25, result.texts().size());
        for (int i = 0; i < pages.size(); i++) {
            assertEquals(FakeRemoteOcrClient.textFor(pages.get(i).imagePath()), result.texts().get(i));
        }
        assertFalse(result.hasErrors());
        assertTrue(client.maxConcurrentCalls() <= 4, "max concurrent " + client.maxConcurrentCalls());
        assertEquals(25, client.uploads.get());
        assertEquals(25, client.deletes.get());
        assertTrue(client.live.isEmpty(), "every remote document deleted");
    }

    @Test
    void failedPageYieldsEmptyTextAndError() throws Exception {
        var client = new FakeRemoteOcrClient().failUploadOf("page-0002.jpg");
        var orchestrator = new OcrOrchestrator(client, credentials, log);

        var result = orchestrator.extract(pages(3), 2, CancellationToken.create(), OcrOrchestrator.OcrListener.NONE);

        assertEquals(3, result.texts().size());
        assertEquals("", result.texts().get(1));
        assertEquals("text of page-0001.jpg", result.texts().get(0));
        assertEquals("text of page-0003.jpg", result.texts().get(2));
        assertEquals(1, result.errors().size());
        assertEquals(1, result.errors().get(0).index());
        assertTrue(result.errors().get(0).message().contains("400"));
    }

    @Test
    void cancellationStopsDispatchAndCleansUpUploads() throws Exception {
        var token = CancellationToken.create();
        var client = new FakeRemoteOcrClient().afterUpload(count -> {
            if (count == 2) token.cancel();
        });
        var orchestrator = new OcrOrchestrator(client, credentials, log);

        assertThrows(CancelledException.class,
            () -> orchestrator.extract(pages(5), 1, token, OcrOrchestrator.OcrListener.NONE));

        assertEquals(2, client.uploads.get(), "no page dispatched after cancel");
        assertTrue(client.deletes.get() >= 2);
        assertTrue(client.live.isEmpty(), "remote documents left behind: " + client.live);
    }

    @Test
    void missingTokenFailsTheExtraction() throws Exception {
        var client = new FakeRemoteOcrClient();
        var orchestrator = new OcrOrchestrator(client, () -> null, log);

        assertThrows(NotAuthenticatedException.class,
            () -> orchestrator.extract(pages(4), 2, CancellationToken.create(), OcrOrchestrator.OcrListener.NONE));
        assertEquals(0, client.uploads.get());
    }

    @Test
    void progressIsMonotonicAndEndsComplete() throws Exception {
        var client = new FakeRemoteOcrClient().withRandomLatency(5);
        var orchestrator = new OcrOrchestrator(client, credentials, log);
        var events = new CopyOnWriteArrayList<OcrOrchestrator.OcrProgress>();

        orchestrator.extract(pages(8), 3, CancellationToken.create(), events::add);

        assertEquals(8, events.size());
        for (int i = 1; i < events.size(); i++) {
            assertTrue(events.get(i).completed() > events.get(i - 1).completed());
            assertTrue(events.get(i).percentage() >= events.get(i - 1).percentage());
        }
        var last = events.get(events.size() - 1);
        assertEquals(8, last.completed());
        assertEquals(8, last.total());
        assertEquals(100, last.percentage());
    }

    @Test
    void emptyInputNeedsNoRemoteCalls() {
        var client = new FakeRemoteOcrClient();
        var result = new OcrOrchestrator(client, credentials, log)
            .extract(List.of(), 5, CancellationToken.create(), OcrOrchestrator.OcrListener.NONE);

        assertTrue(result.texts().isEmpty());
        assertEquals(0, client.uploads.get());
    }

    @Test
    void concurrencyIsClamped() {
        assertEquals(1, OcrOrchestrator.clampConcurrency(0));
        assertEquals(20, OcrOrchestrator.clampConcurrency(64));
        assertEquals(12, OcrOrchestrator.clampConcurrency(12));
    }

    @Test
    void onlyMidFlightStatesHoldRemoteArtifacts() {
        assertFalse(OcrTaskState.UPLOADING.hasRemoteArtifact());
        assertTrue(OcrTaskState.UPLOADED.hasRemoteArtifact());
        assertTrue(OcrTaskState.DELETING.hasRemoteArtifact());
        assertFalse(OcrTaskState.DONE.hasRemoteArtifact());
        assertTrue(OcrTaskState.CANCELLED.isTerminal());
        assertFalse(OcrTaskState.EXPORTED.isTerminal());
    }
}
