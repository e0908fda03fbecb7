package org.e2immu.analyzer.incremental.common;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation. The analysis thread polls {@link #isCancellationRequested()} at the start of
 * every unit's analysis; any other thread may call {@link #cancel()}.
 */
public class CancellationToken {

    public static final CancellationToken NONE = new CancellationToken() {
        @Override
        public void cancel() {
            throw new UnsupportedOperationException("The NONE token cannot be cancelled");
        }
    };

    private final AtomicBoolean cancelled = new AtomicBoolean();

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancellationRequested() {
        return cancelled.get();
    }

    @Override
    public String toString() {
        return "CancellationToken[" + (cancelled.get() ? "cancelled" : "active") + "]";
    }
}
