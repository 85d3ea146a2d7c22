package xyz.jphil.drive_ocr.tools;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.PropertiesDefaultProvider;
import xyz.jphil.drive_ocr.tools.drive.BackoffPolicy;
import xyz.jphil.drive_ocr.tools.drive.CredentialProvider;
import xyz.jphil.drive_ocr.tools.drive.DriveOcrClient;
import xyz.jphil.drive_ocr.tools.drive.Retrier;
import xyz.jphil.drive_ocr.tools.drive.StaticCredentialProvider;
import xyz.jphil.drive_ocr.tools.drive.StoredTokenCredentialProvider;
import xyz.jphil.drive_ocr.tools.job.ConversionContext;
import xyz.jphil.drive_ocr.tools.job.ConversionJob;
import xyz.jphil.drive_ocr.tools.job.ConversionJobController;
import xyz.jphil.drive_ocr.tools.job.ConversionSettings;
import xyz.jphil.drive_ocr.tools.job.InputFiles;
import xyz.jphil.drive_ocr.tools.output.OutputFormat;
import xyz.jphil.drive_ocr.tools.output.PageTextWriters;
import xyz.jphil.drive_ocr.tools.pdf.PageSplitter;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Command-line front end: converts PDFs and images to TXT, DOCX and JSON through Google Drive OCR.
 * Every option can be defaulted from {@code ~/.drive-ocr.properties}.
 */
@Command(
    name = "drive-ocr",
    mixinStandardHelpOptions = true,
    version = "1.0",
    defaultValueProvider = PropertiesDefaultProvider.class,
    description = "Extract text from PDFs and images (JPG, PNG) with Google Drive OCR"
)
public class DriveOcrTool implements Callable<Integer> {

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILED = 1;
    public static final int EXIT_NOT_AUTHENTICATED = 2;
    public static final int EXIT_CANCELLED = 130;

    @Parameters(arity = "1..*", description = "Input files or folders (folders are scanned recursively)")
    private List<Path> inputs;

    @Option(names = {"-o", "--output-dir"}, description = "Output directory (default: next to each input)")
    private Path outputDir;

    @Option(names = {"--dpi"}, description = "PDF render resolution, 72-300 (default: ${DEFAULT-VALUE})",
        defaultValue = "150")
    private int dpi;

    @Option(names = {"-c", "--concurrency"}, description = "Pages OCR'd in parallel, 1-20 (default: ${DEFAULT-VALUE})",
        defaultValue = "12")
    private int concurrency;

    @Option(names = {"-f", "--format"}, split = ",",
        description = "Output formats: ${COMPLETION-CANDIDATES} (default: txt,docx)")
    private List<OutputFormat> formats;

    @Option(names = {"--page-separator"}, description = "Text between pages in TXT output; \\n is a newline")
    private String pageSeparator;

    @Option(names = {"--access-token"}, defaultValue = "${env:DRIVE_OCR_ACCESS_TOKEN}",
        description = "OAuth access token (default: env DRIVE_OCR_ACCESS_TOKEN)")
    private String accessToken;

    @Option(names = {"--token-file"}, defaultValue = "${sys:user.home}/.cache/drive-ocr/token.json",
        description = "Stored token file used when no access token is given (default: ${DEFAULT-VALUE})")
    private Path tokenFile;

    @Option(names = {"--client-id"}, defaultValue = "${env:DRIVE_OCR_CLIENT_ID}",
        description = "OAuth client id for refreshing the stored token")
    private String clientId;

    @Option(names = {"--client-secret"}, defaultValue = "${env:DRIVE_OCR_CLIENT_SECRET}",
        description = "OAuth client secret for refreshing the stored token")
    private String clientSecret;

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output")
    private boolean verbose;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new DriveOcrTool())
            .setCaseInsensitiveEnumValuesAllowed(true)
            .execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        var log = ProgressAwareLogFormatter.create(verbose);

        List<Path> files;
        try {
            files = new InputFiles(log).collect(inputs);
        } catch (IOException | IllegalArgumentException e) {
            log.error("INPUT", e.getMessage());
            return EXIT_FAILED;
        }
        if (files.isEmpty()) {
            log.error("INPUT", "No supported files found (.pdf, .jpg, .jpeg, .png)");
            return EXIT_FAILED;
        }

        var credentials = credentials(log);
        if (credentials.ensureValidToken() == null) {
            log.error("AUTH", "Not authenticated: pass --access-token or provide a valid --token-file");
            return EXIT_NOT_AUTHENTICATED;
        }

        var settings = settings();
        if (settings.outputDirectory() != null) {
            Files.createDirectories(settings.outputDirectory());
        }
        log.debug("CONFIG", String.format("dpi=%d concurrency=%d formats=%s output=%s",
            settings.dpi(), settings.concurrency(), settings.formats(),
            settings.outputDirectory() == null ? "(next to input)" : settings.outputDirectory()));

        var client = DriveOcrClient.create(new Retrier(BackoffPolicy.defaults(), log), log);
        var context = new ConversionContext(credentials, settings, client,
            new PageSplitter(log), PageTextWriters.standard(log), log);

        ConversionJob job;
        try (var sink = ConsoleProgressSink.create(log)) {
            var controller = new ConversionJobController(context, sink);
            var finished = new CountDownLatch(1);
            var cancelHook = new Thread(() -> {
                controller.cancelJob();
                awaitQuietly(finished);
            }, "drive-ocr-cancel");
            Runtime.getRuntime().addShutdownHook(cancelHook);
            try {
                job = controller.startJob(files, settings.outputDirectory());
            } finally {
                finished.countDown();
            }
            removeHook(cancelHook);
        }

        printSummary(job);
        if (job.cancelled()) return EXIT_CANCELLED;
        if (job.authenticationFailed()) return EXIT_NOT_AUTHENTICATED;
        return job.succeeded() ? EXIT_OK : EXIT_FAILED;
    }

    private CredentialProvider credentials(LogFormatter log) {
        if (accessToken != null && !accessToken.isBlank()) {
            log.debug("AUTH", "Using access token from command line or environment");
            return new StaticCredentialProvider(accessToken);
        }
        log.debug("AUTH", "Using stored token " + tokenFile);
        return new StoredTokenCredentialProvider(tokenFile, clientId, clientSecret, log);
    }

    ConversionSettings settings() {
        var settings = new ConversionSettings()
            .dpi(dpi)
            .concurrency(concurrency)
            .outputDirectory(outputDir);
        if (formats != null) {
            settings.formats(formats);
        }
        if (pageSeparator != null) {
            settings.pageSeparator(pageSeparator.replace("\\n", "\n"));
        }
        return settings;
    }

    private static void printSummary(ConversionJob job) {
        System.out.printf("Processed %d of %d file(s)%s%n", job.completedFiles(), job.totalFiles(),
            job.cancelled() ? " (cancelled)" : "");
        if (job.failedPages() > 0) {
            System.out.printf("%d page(s) could not be recognised and were left empty%n", job.failedPages());
        }
        for (var error : job.errors()) {
            System.out.printf("  ✗ %s: %s%n", error.file(), error.message());
        }
    }

    // give the job time to stop at its next checkpoint and delete uploaded pages
    private static void awaitQuietly(CountDownLatch finished) {
        try {
            if (!finished.await(2, TimeUnit.MINUTES)) {
                System.err.println("Timed out waiting for cancellation cleanup");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            // JVM already shutting down, the hook is running
            System.err.println("Shutdown in progress: " + e.getMessage());
        }
    }
}
