package io.rtmmirror.sync;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative stop flag for a sync run. Runs check it between top-level nodes and between
 * pushed issues; work already in flight finishes first.
 */
public final class CancellationSignal {
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public static CancellationSignal none() {
        return new CancellationSignal();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
