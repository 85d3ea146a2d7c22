package xyz.jphil.drive_ocr.tools;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative, job-scoped cancellation flag. Once cancelled it stays cancelled.
 * Long-running steps poll it at their checkpoints; no thread is ever interrupted.
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public static CancellationToken create() {
        return new CancellationToken();
    }

    /**
     * @return true if this call flipped the token, false if it was already cancelled
     */
    public boolean cancel() {
        return cancelled.compareAndSet(false, true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * @throws CancelledException if the token has been cancelled
     */
    public void throwIfCancelled() {
        if (cancelled.get()) {
            throw new CancelledException();
        }
    }
}
