package com.folderrag.runtime;

import java.util.concurrent.atomic.AtomicBoolean;

import com.folderrag.error.OperationCancelledException;

public final class CancellationToken {
    private static final CancellationToken NONE = new CancellationToken();
    private final AtomicBoolean cancelled = new AtomicBoolean();

    public static CancellationToken none() {
        return NONE;
    }

    public void cancel() {
        if (this == NONE) {
            throw new UnsupportedOperationException("The shared no-op token cannot be cancelled");
        }
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void throwIfCancelled(String operation) {
        if (cancelled.get()) {
            throw new OperationCancelledException(operation + " cancelled");
        }
    }
}
