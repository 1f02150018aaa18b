package eu.virtualparadox.paperrank.util;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Run-level cancellation flag. Once raised, stages stop issuing new external
 * calls and finish with what they already have.
 */
public final class CancellationSignal {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
