package xyz.jphil.drive_ocr.tools.ocr;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;
import xyz.jphil.drive_ocr.tools.CancellationToken;
import xyz.jphil.drive_ocr.tools.CancelledException;
import xyz.jphil.drive_ocr.tools.LogFormatter;
import xyz.jphil.drive_ocr.tools.drive.CredentialProvider;
import xyz.jphil.drive_ocr.tools.drive.NotAuthenticatedException;
import xyz.jphil.drive_ocr.tools.drive.RemoteOcrClient;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;

import static xyz.jphil.drive_ocr.tools.PagedOcrData.*;

/**
 * Runs OCR for the pages of one file with bounded concurrency.
 *
 * <p>Each page is uploaded, exported as text and its remote document deleted. At most
 * {@code concurrency} tasks are in flight; the next page is dispatched only when a running
 * task finishes. Texts land at the page's original index whatever the completion order.
 *
 * <p>Workers never touch shared state. They post {@link TaskEvent}s to a queue and the
 * calling thread, as the single writer, applies them to the texts, the error list, the
 * progress counter and the set of remote documents not yet deleted.
 *
 * <p>A failed page yields {@code ""} plus a {@link PageError} and the batch continues.
 * Cancellation (or a missing access token) stops dispatching, waits for in-flight tasks,
 * deletes every remote document still tracked and then throws.
 */
@Getter
@Accessors(fluent = true)
@RequiredArgsConstructor
public class OcrOrchestrator {

    public static final int MIN_CONCURRENCY = 1;
    public static final int MAX_CONCURRENCY = 20;

    public record OcrProgress(int completed, int total, int percentage) {}

    @FunctionalInterface
    public interface OcrListener {
        void onProgress(OcrProgress progress);

        OcrListener NONE = progress -> {};
    }

    interface TaskEvent {
        int index();
    }

    record Uploaded(int index, String remoteId) implements TaskEvent {}

    record Deleted(int index, String remoteId) implements TaskEvent {}

    record Finished(int index, OcrTaskState state, String text, Throwable error) implements TaskEvent {}

    private final RemoteOcrClient client;
    private final CredentialProvider credentials;
    private final LogFormatter log;

    public static int clampConcurrency(int concurrency) {
        return Math.max(MIN_CONCURRENCY, Math.min(MAX_CONCURRENCY, concurrency));
    }

    public ExtractionResult extract(List<PageImage> pages, int concurrency,
                                    CancellationToken token, OcrListener listener) {
        int total = pages.size();
        if (total == 0) {
            return new ExtractionResult(List.of(), List.of());
        }
        int limit = clampConcurrency(concurrency);

        var texts = new String[total];
        var errors = new ArrayList<PageError>();
        Map<String, Integer> undeleted = new LinkedHashMap<>();
        BlockingQueue<TaskEvent> events = new LinkedBlockingQueue<>();

        ExecutorService ocrExecutor = Executors.newFixedThreadPool(Math.min(limit, total));
        int next = 0;
        int inFlight = 0;
        int completed = 0;
        NotAuthenticatedException authFailure = null;
        boolean interrupted = false;

        try {
            while (next < total && inFlight < limit && !token.isCancelled()) {
                dispatch(ocrExecutor, pages.get(next++), token, events);
                inFlight++;
            }

            while (inFlight > 0) {
                TaskEvent event;
                try {
                    event = events.take();
                } catch (InterruptedException e) {
                    // keep draining so no upload is left behind; restore the flag afterwards
                    interrupted = true;
                    continue;
                }

                if (event instanceof Uploaded up) {
                    undeleted.put(up.remoteId(), up.index());
                } else if (event instanceof Deleted del) {
                    undeleted.remove(del.remoteId());
                } else if (event instanceof Finished fin) {
                    inFlight--;
                    completed++;
                    switch (fin.state()) {
                        case DONE -> texts[fin.index()] = fin.text();
                        case CANCELLED -> texts[fin.index()] = "";
                        default -> {
                            texts[fin.index()] = "";
                            if (fin.error() instanceof NotAuthenticatedException nae) {
                                if (authFailure == null) authFailure = nae;
                            } else {
                                var message = describe(fin.error());
                                errors.add(new PageError(fin.index(), message));
                                log.error("OCR", String.format("Page %d failed: %s", fin.index() + 1, message));
                            }
                        }
                    }
                    listener.onProgress(new OcrProgress(completed, total, Math.round(completed * 100f / total)));

                    boolean stop = token.isCancelled() || authFailure != null || interrupted;
                    if (!stop && next < total) {
                        dispatch(ocrExecutor, pages.get(next++), token, events);
                        inFlight++;
                    }
                }
            }
        } finally {
            ocrExecutor.shutdown();
        }

        if (token.isCancelled() || authFailure != null || interrupted) {
            deleteAll(undeleted, limit);
            if (interrupted) Thread.currentThread().interrupt();
            if (token.isCancelled() || interrupted) throw new CancelledException();
            throw authFailure;
        }

        if (!undeleted.isEmpty()) {
            log.warning("OCR", undeleted.size() + " remote document(s) could not be deleted");
        }
        errors.sort(Comparator.comparingInt(PageError::index));
        return new ExtractionResult(Arrays.asList(texts), errors);
    }

    private void dispatch(ExecutorService executor, PageImage page, CancellationToken token,
                          BlockingQueue<TaskEvent> events) {
        executor.execute(() -> {
            try {
                events.offer(runTask(page, token, events));
            } catch (Error e) {
                // the coordinator waits for exactly one Finished per task
                events.offer(new Finished(page.index(), OcrTaskState.FAILED, null, e));
                throw e;
            }
        });
    }

    /**
     * Worker side of one page. Reports the upload as soon as it exists so the coordinator can
     * clean it up whatever happens afterwards.
     */
    Finished runTask(PageImage page, CancellationToken token, BlockingQueue<TaskEvent> events) {
        int index = page.index();
        var state = OcrTaskState.PENDING;
        String remoteId = null;
        try {
            if (token.isCancelled()) {
                return new Finished(index, OcrTaskState.CANCELLED, null, null);
            }
            state = OcrTaskState.UPLOADING;
            remoteId = client.upload(page.imagePath(), credentials.requireToken());
            state = OcrTaskState.UPLOADED;
            events.offer(new Uploaded(index, remoteId));
            log.debug("OCR", String.format("Page %d uploaded as %s", page.pageNumber(), remoteId));

            if (token.isCancelled()) {
                return new Finished(index, OcrTaskState.CANCELLED, null, null);
            }
            state = OcrTaskState.EXPORTING;
            var text = client.exportText(remoteId, credentials.requireToken());
            state = OcrTaskState.EXPORTED;

            if (token.isCancelled()) {
                return new Finished(index, OcrTaskState.CANCELLED, null, null);
            }
            state = OcrTaskState.DELETING;
            if (deleteQuietly(remoteId)) {
                events.offer(new Deleted(index, remoteId));
            }
            return new Finished(index, OcrTaskState.DONE, text, null);
        } catch (NotAuthenticatedException | CancelledException e) {
            var terminal = e instanceof CancelledException ? OcrTaskState.CANCELLED : OcrTaskState.FAILED;
            return new Finished(index, terminal, null, e);
        } catch (IOException | RuntimeException e) {
            log.debug("OCR", String.format("Page %d failed while %s: %s", page.pageNumber(), state, e.getMessage()));
            if (state.hasRemoteArtifact() && deleteQuietly(remoteId)) {
                events.offer(new Deleted(index, remoteId));
            }
            return new Finished(index, OcrTaskState.FAILED, null, e);
        }
    }

    /**
     * Best effort: a failed delete is logged and never fails the page.
     */
    private boolean deleteQuietly(String remoteId) {
        var accessToken = credentials.ensureValidToken();
        if (accessToken == null) {
            log.warning("OCR", "No access token, remote document " + remoteId + " left in place");
            return false;
        }
        try {
            client.delete(remoteId, accessToken);
            return true;
        } catch (IOException | RuntimeException e) {
            log.warning("OCR", "Failed to delete remote document " + remoteId + ": " + e.getMessage());
            return false;
        }
    }

    private void deleteAll(Map<String, Integer> undeleted, int parallelism) {
        if (undeleted.isEmpty()) return;
        log.step("OCR", "Deleting " + undeleted.size() + " uploaded document(s) after stop");
        ExecutorService cleanupExecutor = Executors.newFixedThreadPool(Math.min(parallelism, undeleted.size()));
        try {
            var deletions = undeleted.keySet().stream()
                .map(remoteId -> CompletableFuture.runAsync(() -> deleteQuietly(remoteId), cleanupExecutor))
                .toArray(CompletableFuture[]::new);
            CompletableFuture.allOf(deletions).join();
        } finally {
            cleanupExecutor.shutdown();
        }
        undeleted.clear();
    }

    private static String describe(Throwable error) {
        if (error == null) return "unknown error";
        var message = error.getMessage();
        return message == null || message.isBlank() ? error.getClass().getSimpleName() : message;
    }
}
