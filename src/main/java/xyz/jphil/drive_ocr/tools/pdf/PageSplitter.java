package xyz.jphil.drive_ocr.tools.pdf;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import xyz.jphil.drive_ocr.tools.CancellationToken;
import xyz.jphil.drive_ocr.tools.CancelledException;
import xyz.jphil.drive_ocr.tools.LogFormatter;
import xyz.jphil.drive_ocr.tools.ScratchFiles;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static xyz.jphil.drive_ocr.tools.PagedOcrData.*;

/**
 * Renders every page of a PDF into a JPEG in a fresh scratch directory.
 *
 * <p>Pages are rendered in parallel by up to {@code availableProcessors} workers pulling page
 * indices from a shared queue. PDFBox documents are not safe for concurrent rendering, so each
 * worker opens its own {@link PDDocument}: memory grows with one parsed copy of the PDF per
 * worker, in exchange for lock-free rendering.
 *
 * <p>The scratch directory belongs to the caller once {@link #split} returns. If the split fails
 * or is cancelled the directory is removed before the exception propagates.
 */
@Getter
@Accessors(fluent = true)
public class PageSplitter {

    public static final int MIN_DPI = 72;
    public static final int MAX_DPI = 300;

    public record SplitProgress(int completed, int total, int percentage) {}

    public record SplitResult(Path scratchDir, List<PageImage> pages) {
        public SplitResult {
            pages = List.copyOf(pages);
        }
    }

    @FunctionalInterface
    public interface SplitListener {
        void onProgress(SplitProgress progress);

        SplitListener NONE = progress -> {};
    }

    private final int maxWorkers;
    private final LogFormatter log;

    public PageSplitter(int maxWorkers, LogFormatter log) {
        this.maxWorkers = Math.max(1, maxWorkers);
        this.log = log;
    }

    public PageSplitter(LogFormatter log) {
        this(Runtime.getRuntime().availableProcessors(), log);
    }

    public static int clampDpi(int dpi) {
        return Math.max(MIN_DPI, Math.min(MAX_DPI, dpi));
    }

    public SplitResult split(Path pdf, int dpi, CancellationToken token, SplitListener listener) throws IOException {
        token.throwIfCancelled();
        int effectiveDpi = clampDpi(dpi);

        int pageCount;
        try {
            pageCount = PdfInfoUtil.pageCount(pdf.toFile());
        } catch (IOException e) {
            throw new PageSplitException("Failed to load PDF " + pdf.getFileName() + ": " + e.getMessage(), e);
        }
        if (pageCount == 0) {
            throw new PageSplitException("PDF has no pages: " + pdf.getFileName());
        }

        Path scratchDir = Files.createTempDirectory("drive-ocr-");
        try {
            var pages = renderAll(pdf, pageCount, effectiveDpi, scratchDir, token, listener);
            return new SplitResult(scratchDir, pages);
        } catch (IOException | RuntimeException e) {
            discard(scratchDir, e);
            throw e;
        }
    }

    private List<PageImage> renderAll(Path pdf, int pageCount, int dpi, Path scratchDir,
                                      CancellationToken token, SplitListener listener) throws IOException {
        var naming = new PdfNaming(pageCount);
        var pagePaths = new Path[pageCount];
        var completed = new AtomicInteger(0);
        var abort = new AtomicBoolean(false);

        BlockingQueue<Integer> pageQueue = new LinkedBlockingQueue<>();
        for (int page = 0; page < pageCount; page++) {
            pageQueue.offer(page);
        }

        int workers = Math.min(maxWorkers, pageCount);
        log.debug("PDF", String.format("Rendering %d pages of %s at %d DPI with %d workers",
            pageCount, pdf.getFileName(), dpi, workers));

        ExecutorService renderExecutor = Executors.newFixedThreadPool(workers);
        List<Future<Void>> renderTasks = new ArrayList<>();
        try {
            for (int w = 0; w < workers; w++) {
                renderTasks.add(renderExecutor.submit(() -> {
                    // one document per worker, never shared
                    try (PDDocument document = Loader.loadPDF(pdf.toFile())) {
                        var renderer = new PDFRenderer(document);
                        Integer page;
                        while (!abort.get() && (page = pageQueue.poll()) != null) {
                            if (token.isCancelled()) {
                                abort.set(true);
                                break;
                            }
                            pagePaths[page] = renderPage(document, renderer, page, dpi,
                                scratchDir.resolve(naming.jpeg(page + 1)));
                            int count = completed.incrementAndGet();
                            listener.onProgress(new SplitProgress(count, pageCount,
                                Math.round(count * 100f / pageCount)));
                        }
                    } catch (IOException | RuntimeException e) {
                        abort.set(true);
                        throw e;
                    }
                    return null;
                }));
            }
            awaitAll(renderTasks);
        } finally {
            renderExecutor.shutdownNow();
        }

        token.throwIfCancelled();

        var pages = new ArrayList<PageImage>(pageCount);
        for (int i = 0; i < pageCount; i++) {
            if (pagePaths[i] == null) {
                throw new PageSplitException("Page " + (i + 1) + " was not rendered");
            }
            pages.add(new PageImage(i, pagePaths[i], pdf));
        }
        log.success("PDF", String.format("Rendered %d pages of %s", pageCount, pdf.getFileName()));
        return pages;
    }

    private Path renderPage(PDDocument document, PDFRenderer renderer, int page, int dpi, Path target)
            throws PageSplitException {
        try {
            float scale = PdfInfoUtil.renderScale(document.getPage(page), dpi);
            BufferedImage image = renderer.renderImage(page, scale, ImageType.RGB);
            File out = target.toFile();
            if (!ImageIO.write(image, "jpg", out)) {
                throw new IOException("No JPEG writer available");
            }
            return target;
        } catch (IOException | RuntimeException e) {
            throw new PageSplitException("Failed to render page " + (page + 1) + ": " + e.getMessage(), e);
        }
    }

    private static void awaitAll(List<Future<Void>> tasks) throws IOException {
        IOException failure = null;
        for (Future<Void> task : tasks) {
            try {
                task.get();
            } catch (ExecutionException e) {
                if (failure == null) {
                    failure = e.getCause() instanceof PageSplitException pse
                        ? pse
                        : new PageSplitException("Rendering failed: " + e.getCause().getMessage(), e.getCause());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new CancelledException("Interrupted while rendering pages");
            }
        }
        if (failure != null) throw failure;
    }

    private void discard(Path scratchDir, Exception cause) {
        try {
            ScratchFiles.deleteRecursively(scratchDir);
        } catch (IOException e) {
            cause.addSuppressed(e);
            log.warning("PDF", "Could not remove scratch directory " + scratchDir + ": " + e.getMessage());
        }
    }
}
