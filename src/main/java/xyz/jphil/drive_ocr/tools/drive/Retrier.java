package xyz.jphil.drive_ocr.tools.drive;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;
import xyz.jphil.drive_ocr.tools.LogFormatter;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Duration;

/**
 * Runs one remote call under a {@link BackoffPolicy}. A retry state lives only for the
 * duration of a single {@link #call} and is dropped on success or terminal failure.
 */
@Getter
@Accessors(fluent = true)
@RequiredArgsConstructor
public class Retrier {

    @FunctionalInterface
    public interface RemoteCall<T> {
        T call() throws IOException;
    }

    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration delay) throws InterruptedException;

        Sleeper THREAD = delay -> Thread.sleep(delay.toMillis(), (int) (delay.toNanos() % 1_000_000));
    }

    /**
     * Attempt counter and the wait scheduled before the next attempt
     */
    public record RetryState(int attempt, Duration nextDelay) {
        static RetryState initial() {
            return new RetryState(0, Duration.ZERO);
        }

        RetryState next(Duration delay) {
            return new RetryState(attempt + 1, delay);
        }
    }

    private final BackoffPolicy policy;
    private final Sleeper sleeper;
    private final LogFormatter log;

    public Retrier(BackoffPolicy policy, LogFormatter log) {
        this(policy, Sleeper.THREAD, log);
    }

    public <T> T call(String operation, RemoteCall<T> remoteCall) throws IOException {
        var state = RetryState.initial();
        while (true) {
            try {
                return remoteCall.call();
            } catch (IOException | RuntimeException e) {
                if (!policy.shouldRetry(e) || state.attempt() >= policy.maxRetries()) {
                    throw e;
                }
                state = state.next(policy.delayFor(state.attempt()));
                log.warning("RETRY", String.format("%s attempt %d failed (%s), retrying in %d ms",
                    operation, state.attempt(), e.getMessage(), state.nextDelay().toMillis()));
                pause(state.nextDelay());
            }
        }
    }

    private void pause(Duration delay) throws InterruptedIOException {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            var interrupted = new InterruptedIOException("Interrupted while backing off");
            interrupted.initCause(e);
            throw interrupted;
        }
    }
}
