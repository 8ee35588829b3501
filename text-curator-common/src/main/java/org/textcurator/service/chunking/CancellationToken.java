package org.textcurator.service.chunking;

import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation signal shared between a caller and a chunking run.
 *
 * <p>Chunkers poll the token between chunks; once cancelled, the run aborts
 * with a {@link CancellationException} and partial output is discarded.</p>
 */
public final class CancellationToken {

    private static final CancellationToken NONE = new CancellationToken(false);

    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final boolean cancellable;

    private CancellationToken(boolean cancellable) {
        this.cancellable = cancellable;
    }

    public static CancellationToken create() {
        return new CancellationToken(true);
    }

    /**
     * A token that can never be cancelled.
     */
    public static CancellationToken none() {
        return NONE;
    }

    public void cancel() {
        if (cancellable) {
            cancelled.set(true);
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void throwIfCancelled() {
        if (cancelled.get()) {
            throw new CancellationException("Chunking was cancelled");
        }
    }
}
