package xyz.jphil.drive_ocr.tools.drive;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.io.InterruptedIOException;
import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Decides whether a failed remote call is worth repeating and how long to wait first.
 *
 * <p>Retryable: rate limiting (429), request timeout (408), any 5xx and I/O timeouts.
 * Everything else, including 4xx auth and not-found answers, is terminal.
 *
 * <p>The delay before retry {@code n} (zero-based) is {@code min(base^n * unit, cap)} plus a
 * uniform jitter in {@code [0, maxJitter)}, so no delay ever exceeds {@link #maxDelay()}.
 */
@Getter
@Accessors(fluent = true)
public class BackoffPolicy {

    public static final double DEFAULT_BASE = 1.5;
    public static final Duration DEFAULT_UNIT = Duration.ofSeconds(1);
    public static final Duration DEFAULT_CAP = Duration.ofSeconds(15);
    public static final Duration DEFAULT_MAX_JITTER = Duration.ofSeconds(1);
    public static final int DEFAULT_MAX_RETRIES = 10;

    private final double base;
    private final Duration unit;
    private final Duration cap;
    private final Duration maxJitter;
    private final int maxRetries;
    private final DoubleSupplier jitterSource;

    public BackoffPolicy(double base, Duration unit, Duration cap, Duration maxJitter, int maxRetries,
                         DoubleSupplier jitterSource) {
        if (base < 1.0) throw new IllegalArgumentException("base must be >= 1: " + base);
        if (maxRetries < 0) throw new IllegalArgumentException("maxRetries must be >= 0: " + maxRetries);
        this.base = base;
        this.unit = unit;
        this.cap = cap;
        this.maxJitter = maxJitter;
        this.maxRetries = maxRetries;
        this.jitterSource = jitterSource;
    }

    public BackoffPolicy(double base, Duration unit, Duration cap, Duration maxJitter, int maxRetries) {
        this(base, unit, cap, maxJitter, maxRetries, () -> ThreadLocalRandom.current().nextDouble());
    }

    public static BackoffPolicy defaults() {
        return new BackoffPolicy(DEFAULT_BASE, DEFAULT_UNIT, DEFAULT_CAP, DEFAULT_MAX_JITTER, DEFAULT_MAX_RETRIES);
    }

    /**
     * Same curve and retry budget, no waiting. Used where the network is simulated.
     */
    public static BackoffPolicy immediate(int maxRetries) {
        return new BackoffPolicy(1.0, Duration.ZERO, Duration.ZERO, Duration.ZERO, maxRetries, () -> 0.0);
    }

    public boolean shouldRetry(Throwable error) {
        if (error instanceof DriveApiException api) {
            return api.isRateLimited() || api.statusCode() == 408 || api.isServerError();
        }
        return error instanceof InterruptedIOException;
    }

    public Duration delayFor(int attempt) {
        double exponential = Math.pow(base, Math.max(0, attempt)) * unit.toNanos();
        long capped = (long) Math.min(exponential, (double) cap.toNanos());
        // jitter source yields [0, 1)
        long jitter = (long) (Math.min(Math.max(jitterSource.getAsDouble(), 0.0), 0.999999) * maxJitter.toNanos());
        return Duration.ofNanos(capped + jitter);
    }

    public Duration maxDelay() {
        return cap.plus(maxJitter);
    }
}
